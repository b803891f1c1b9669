package com.gentoro.contextmcp.audit;

import java.util.Locale;

/** Kind of data change; combined with the resource type into actions like {@code item_create}. */
public enum ChangeKind {
  CREATE,
  UPDATE,
  DELETE;

  public String actionFor(String resourceType) {
    return resourceType + "_" + name().toLowerCase(Locale.ROOT);
  }
}
