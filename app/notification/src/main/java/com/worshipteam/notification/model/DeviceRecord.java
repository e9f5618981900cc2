/*
 * Where: Notification domain model
 * What: Snapshot of a notification_devices row
 * Why: Shared by the device registry and the token collector
 */
package com.worshipteam.notification.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DeviceRecord(
    String deviceId,
    String token,
    String userId,
    String role,
    boolean enabled,
    Map<String, Boolean> preferences,
    String platform,
    Instant createdAt,
    Instant updatedAt) {

  public DeviceRecord {
    preferences = sanitize(preferences);
  }

  /** A device receives a category unless it has explicitly opted out of it. */
  public boolean allows(NotificationCategory category) {
    return !Boolean.FALSE.equals(preferences.get(category.key()));
  }

  // JSON null values carry no opt-out and are dropped.
  private static Map<String, Boolean> sanitize(Map<String, Boolean> preferences) {
    if (preferences == null) {
      return Map.of();
    }
    final Map<String, Boolean> copy = new LinkedHashMap<>();
    preferences.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            copy.put(key, value);
          }
        });
    return Collections.unmodifiableMap(copy);
  }
}
