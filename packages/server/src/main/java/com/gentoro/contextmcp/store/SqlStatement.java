package com.gentoro.contextmcp.store;

import java.util.List;

/** Final SQL text with its parameters in placeholder order. */
public record SqlStatement(String sql, List<Object> params) {
  public SqlStatement {
    params = List.copyOf(params);
  }
}
