/*
 * Where: Notification reminder worker
 * What: Runs the reminder jobs on in-process cron triggers
 * Why: Deployments without an external cron can still send reminders
 */
package com.worshipteam.notification.service;

import com.worshipteam.notification.model.ReminderSummary;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.reminder.scheduler.enabled", havingValue = "true")
public class ReminderWorker {

  private static final Logger logger = LoggerFactory.getLogger(ReminderWorker.class);

  private final ReminderService reminderService;

  @Scheduled(
      cron = "${notification.reminder.scheduler.monthly-schedule-cron}",
      zone = "${notification.reminder.zone-id}")
  public void remindNextMonthSchedule() {
    log("monthly_schedule", reminderService.remindNextMonthSchedule());
  }

  @Scheduled(
      cron = "${notification.reminder.scheduler.songs-entry-cron}",
      zone = "${notification.reminder.zone-id}")
  public void remindServiceSongsEntry() {
    log("songs_entry", reminderService.remindServiceSongsEntry());
  }

  @Scheduled(
      cron = "${notification.reminder.scheduler.members-cron}",
      zone = "${notification.reminder.zone-id}")
  public void remindUpcomingServiceMembers() {
    log("upcoming_members", reminderService.remindUpcomingServiceMembers());
  }

  private void log(String job, ReminderSummary summary) {
    logger.info("scheduled reminder completed job={} summary={}", job, summary);
  }
}
