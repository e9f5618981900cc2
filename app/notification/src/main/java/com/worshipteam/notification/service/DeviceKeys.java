/*
 * Where: Notification service helper
 * What: Derives the device record key from a raw push token
 * Why: Re-registering the same token must hit the same record without storing the token as key
 */
package com.worshipteam.notification.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class DeviceKeys {

  private DeviceKeys() {}

  /** Lowercase hex SHA-256 of the UTF-8 token. */
  public static String deviceId(String rawToken) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return toHex(digest.digest(rawToken.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  private static String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
