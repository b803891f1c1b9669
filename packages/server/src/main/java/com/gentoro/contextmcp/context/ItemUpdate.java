package com.gentoro.contextmcp.context;

import java.util.List;
import java.util.Map;

/** Partial update: null fields are left untouched. The change summary alone is not a change. */
public record ItemUpdate(
    String title,
    String content,
    List<String> tags,
    Map<String, Object> metadata,
    String changeSummary) {

  public boolean isEmpty() {
    return title == null && content == null && tags == null && metadata == null;
  }
}
