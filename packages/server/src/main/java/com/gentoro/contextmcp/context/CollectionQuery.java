package com.gentoro.contextmcp.context;

import java.util.List;

public record CollectionQuery(boolean includePublic, List<String> tags, int limit, int offset) {}
