/*
 * Where: Notification service layer
 * What: Checks the shared secret sent by the external cron trigger
 * Why: Reminder endpoints carry no user identity
 */
package com.worshipteam.notification.service;

import com.worshipteam.notification.config.CronProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CronSecretVerifier {

  private final CronProperties properties;

  public String headerName() {
    return properties.headerName();
  }

  /** Throws {@link UnauthorizedException} unless a secret is configured and {@code provided} equals it. */
  public void verify(String provided) {
    final String expected = properties.secret();
    if (expected.isBlank() || provided == null || provided.isBlank()) {
      throw new UnauthorizedException("cron secret missing");
    }
    if (!MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
      throw new UnauthorizedException("cron secret mismatch");
    }
  }
}
