package com.gentoro.contextmcp.utility;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HashUtilityTest {

  @Test
  void testSha256Hex() {
    assertEquals(
        "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
        HashUtility.sha256Hex(""));
    assertEquals(
        "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
        HashUtility.sha256Hex("hello"));
  }

  @Test
  void testUtf8Length() {
    assertEquals(0, HashUtility.utf8Length(null));
    assertEquals(5, HashUtility.utf8Length("hello"));
    assertEquals(2, HashUtility.utf8Length("é"));
  }
}
