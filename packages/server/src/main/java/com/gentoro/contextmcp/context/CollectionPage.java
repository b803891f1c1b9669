package com.gentoro.contextmcp.context;

import java.util.List;

public record CollectionPage(
    List<ContextCollection> collections, long total, int limit, int offset) {}
