package com.gentoro.contextmcp.utility;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtility {
  private HashUtility() {}

  /** Lower-case hex SHA-256 of the UTF-8 bytes of {@code input}. */
  public static String sha256Hex(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
      StringBuilder hexString = new StringBuilder();
      for (byte b : hash) {
        String hex = Integer.toHexString(0xff & b);
        if (hex.length() == 1) {
          hexString.append('0');
        }
        hexString.append(hex);
      }
      return hexString.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /** Size in bytes of the UTF-8 encoding. */
  public static int utf8Length(String input) {
    return input == null ? 0 : input.getBytes(StandardCharsets.UTF_8).length;
  }
}
