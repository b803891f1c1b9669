package com.gentoro.contextmcp.context;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record NewItem(
    UUID collectionId,
    String title,
    String content,
    String contentType,
    String sourceUrl,
    SourceType sourceType,
    List<String> tags,
    Map<String, Object> metadata) {}
