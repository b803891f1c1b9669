package com.gentoro.contextmcp.tool;

import com.gentoro.contextmcp.identity.User;

/** Executes one tool for an authenticated caller; the result is serialized as snake_case JSON. */
@FunctionalInterface
public interface ToolHandler {
  Object handle(ToolArguments arguments, User caller);
}
