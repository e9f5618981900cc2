/*
 * Where: Notification configuration binding
 * What: Day offsets, reminder window and calendar zone of the reminder jobs
 * Why: Congregations tune how early ministers and musicians are reminded
 */
package com.worshipteam.notification.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.reminder")
@Validated
public record ReminderProperties(
    @NotNull @PositiveOrZero Integer ministerDaysBefore,
    @NotNull @PositiveOrZero Integer musiciansDaysBefore,
    @NotNull @PositiveOrZero Integer monthlyWindowDays,
    @NotBlank String worshipLeaderPositionId,
    @NotNull ZoneId zoneId,
    @Valid Scheduler scheduler) {

  public ReminderProperties {
    ministerDaysBefore = ministerDaysBefore == null ? 3 : ministerDaysBefore;
    musiciansDaysBefore = musiciansDaysBefore == null ? 2 : musiciansDaysBefore;
    monthlyWindowDays = monthlyWindowDays == null ? 7 : monthlyWindowDays;
    zoneId = zoneId == null ? ZoneId.of("UTC") : zoneId;
    scheduler = scheduler == null ? new Scheduler(false, null, null, null) : scheduler;
  }

  /** In-process triggers; the HTTP endpoints work regardless. */
  public record Scheduler(
      boolean enabled, String monthlyScheduleCron, String songsEntryCron, String membersCron) {}
}
