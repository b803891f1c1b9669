package com.gentoro.contextmcp.search;

import java.util.List;

public record SearchResult(
    List<SearchHit> items, int total, String queryType, long executionTimeMs) {

  static SearchResult empty(SearchType type, long executionTimeMs) {
    return new SearchResult(List.of(), 0, type.wireName(), executionTimeMs);
  }
}
