package com.gentoro.contextmcp.search;

import java.util.List;
import java.util.UUID;

public record SearchRequest(
    String query, SearchType searchType, List<UUID> collectionIds, List<String> tags, int limit) {

  public static final int DEFAULT_LIMIT = 10;
  public static final int MAX_LIMIT = 100;

  public SearchRequest {
    searchType = searchType == null ? SearchType.HYBRID : searchType;
    collectionIds = collectionIds == null ? List.of() : List.copyOf(collectionIds);
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static SearchRequest of(String query) {
    return new SearchRequest(query, SearchType.HYBRID, null, null, DEFAULT_LIMIT);
  }
}
