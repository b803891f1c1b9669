package com.gentoro.contextmcp.context;

import java.util.List;
import java.util.Map;

public record NewCollection(
    String name,
    String description,
    boolean isPublic,
    List<String> tags,
    Map<String, Object> metadata) {}
