/*
 * Where: Notification domain model
 * What: Outcome of one reminder job run
 * Why: Jobs report counts and skip reasons instead of failing when nothing is due
 */
package com.worshipteam.notification.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReminderSummary(
    boolean ok,
    Boolean skipped,
    String reason,
    String month,
    String targetDate,
    Integer checkedServices,
    Integer notifiedServices,
    Integer recipients,
    Integer success,
    Integer failure) {

  public static final String OUTSIDE_REMINDER_WINDOW = "outside reminder window";
  public static final String SCHEDULE_ALREADY_EXISTS = "schedule already exists";

  public static ReminderSummary skipped(String reason) {
    return new ReminderSummary(true, true, reason, null, null, null, null, null, null, null);
  }

  public static ReminderSummary monthly(String month, int recipients, DispatchResult result) {
    return new ReminderSummary(
        true, null, null, month, null, null, null, recipients, result.success(), result.failure());
  }

  public static ReminderSummary services(
      String targetDate,
      int checkedServices,
      int notifiedServices,
      int recipients,
      DispatchResult result) {
    return new ReminderSummary(
        true,
        null,
        null,
        null,
        targetDate,
        checkedServices,
        notifiedServices,
        recipients,
        result.success(),
        result.failure());
  }
}
