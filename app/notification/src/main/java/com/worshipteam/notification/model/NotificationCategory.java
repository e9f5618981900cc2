/*
 * Where: Notification domain model
 * What: Closed set of notification categories and their wire keys
 * Why: The key selects the message semantics and gates per-device opt-outs
 */
package com.worshipteam.notification.model;

import java.util.Arrays;
import java.util.Optional;

public enum NotificationCategory {
  ASSIGNMENT("assignment"),
  SERVICE_SONGS("serviceSongs"),
  ANNOUNCEMENTS("announcements"),
  CATALOG("catalog"),
  MONTHLY_SCHEDULE("monthlySchedule"),
  REMINDER("reminder");

  private final String key;

  NotificationCategory(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static Optional<NotificationCategory> fromKey(String key) {
    return Arrays.stream(values()).filter(category -> category.key.equals(key)).findFirst();
  }
}
