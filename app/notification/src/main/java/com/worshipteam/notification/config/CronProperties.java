/*
 * Where: Notification configuration binding
 * What: Shared secret expected from the external cron trigger
 * Why: Reminder endpoints are unauthenticated apart from this secret
 */
package com.worshipteam.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.cron")
public record CronProperties(String headerName, String secret) {

  public CronProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Cron-Secret" : headerName;
    // An empty secret rejects every caller.
    secret = secret == null ? "" : secret;
  }
}
