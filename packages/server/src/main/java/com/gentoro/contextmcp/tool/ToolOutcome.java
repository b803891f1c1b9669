package com.gentoro.contextmcp.tool;

/** Serialized result of a tool call. {@code error} maps to the MCP {@code isError} flag. */
public record ToolOutcome(String content, boolean error, int statusCode) {}
