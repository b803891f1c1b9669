package com.gentoro.contextmcp.audit;

/** Where a call came from, as far as the transport tells us. Both fields may be null. */
public record RequestOrigin(String ipAddress, String userAgent) {
  public static final RequestOrigin UNKNOWN = new RequestOrigin(null, null);
}
