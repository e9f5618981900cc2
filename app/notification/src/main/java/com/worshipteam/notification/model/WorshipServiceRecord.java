/*
 * Where: Notification domain model
 * What: A scheduled worship service, read from the services table
 * Why: Reminder jobs select services by date and build messages from them
 */
package com.worshipteam.notification.model;

import java.time.LocalDate;

public record WorshipServiceRecord(String serviceId, String name, LocalDate date, String startTime) {

  /** Month key of the roster covering this service, e.g. {@code 2026-03}. */
  public String monthKey() {
    return MonthKeys.of(date);
  }
}
