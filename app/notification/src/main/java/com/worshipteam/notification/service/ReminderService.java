/*
 * Where: Notification service layer
 * What: The three reminder jobs triggered by cron (schedule, repertoire, upcoming service)
 * Why: Each run derives what is due from the store, so repeated triggers are harmless
 */
package com.worshipteam.notification.service;

import com.worshipteam.notification.config.ReminderProperties;
import com.worshipteam.notification.model.DispatchResult;
import com.worshipteam.notification.model.MonthKeys;
import com.worshipteam.notification.model.NotificationCategory;
import com.worshipteam.notification.model.RecipientTarget;
import com.worshipteam.notification.model.ReminderSummary;
import com.worshipteam.notification.model.ScheduleAssignment;
import com.worshipteam.notification.model.UserRole;
import com.worshipteam.notification.model.WorshipServiceRecord;
import com.worshipteam.notification.repository.ScheduleRepository;
import com.worshipteam.notification.repository.WorshipServiceRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Services are processed one after another. When a dispatch fails the remaining services are
 * not processed, the notifications already sent stay sent and the exception reaches the caller.
 */
@Service
@RequiredArgsConstructor
public class ReminderService {

  private static final Logger logger = LoggerFactory.getLogger(ReminderService.class);

  static final String JOB_MONTHLY_SCHEDULE = "monthly_schedule";
  static final String JOB_SONGS_ENTRY = "songs_entry";
  static final String JOB_UPCOMING_MEMBERS = "upcoming_members";

  private final ReminderProperties properties;
  private final WorshipServiceRepository serviceRepository;
  private final ScheduleRepository scheduleRepository;
  private final RecipientResolver recipientResolver;
  private final TokenCollector tokenCollector;
  private final PushDispatchService pushDispatchService;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public ReminderSummary remindNextMonthSchedule() {
    final LocalDate today = today();
    final LocalDate nextMonthStart = today.withDayOfMonth(1).plusMonths(1);
    if (today.isBefore(nextMonthStart.minusDays(properties.monthlyWindowDays()))) {
      metrics.recordReminder(JOB_MONTHLY_SCHEDULE, "skipped");
      return ReminderSummary.skipped(ReminderSummary.OUTSIDE_REMINDER_WINDOW);
    }
    final String month = MonthKeys.of(nextMonthStart);
    if (scheduleRepository.existsByMonth(month)) {
      metrics.recordReminder(JOB_MONTHLY_SCHEDULE, "skipped");
      return ReminderSummary.skipped(ReminderSummary.SCHEDULE_ALREADY_EXISTS);
    }
    final Set<String> recipients =
        recipientResolver.resolve(new RecipientTarget.ByRole(UserRole.ROOT));
    final DispatchResult result =
        notify(
            recipients,
            "Promemoria scala mensile",
            "Manca la scala di " + month + ". Generala appena possibile.",
            "/schedules/generate");
    metrics.recordReminder(JOB_MONTHLY_SCHEDULE, "notified");
    logger.info(
        "monthly schedule reminder sent month={} recipients={} success={} failure={}",
        month,
        recipients.size(),
        result.success(),
        result.failure());
    return ReminderSummary.monthly(month, recipients.size(), result);
  }

  public ReminderSummary remindServiceSongsEntry() {
    final LocalDate targetDate = today().plusDays(properties.ministerDaysBefore());
    final List<WorshipServiceRecord> services = serviceRepository.findByDate(targetDate);
    final Tally tally = new Tally(JOB_SONGS_ENTRY, targetDate);
    try {
      for (WorshipServiceRecord service : services) {
        if (serviceRepository.hasSongs(service.serviceId())) {
          continue;
        }
        Set<String> recipients = worshipLeaderUsers(service);
        if (recipients.isEmpty()) {
          recipients = recipientResolver.resolve(new RecipientTarget.ByRole(UserRole.MINISTER));
        }
        final DispatchResult result =
            notify(
                recipients,
                "Promemoria repertorio culto",
                "Mancano le canzoni per il culto " + describe(service) + ".",
                "/services/" + service.serviceId());
        tally.add(recipients.size(), result);
      }
    } catch (RuntimeException e) {
      tally.logAborted(e);
      throw e;
    }
    return tally.summary(services.size());
  }

  public ReminderSummary remindUpcomingServiceMembers() {
    final LocalDate targetDate = today().plusDays(properties.musiciansDaysBefore());
    final List<WorshipServiceRecord> services = serviceRepository.findByDate(targetDate);
    final Tally tally = new Tally(JOB_UPCOMING_MEMBERS, targetDate);
    try {
      for (WorshipServiceRecord service : services) {
        final List<String> personIds =
            scheduleRepository.findAssignments(service.monthKey(), service.serviceId()).stream()
                .map(ScheduleAssignment::personId)
                .distinct()
                .toList();
        if (personIds.isEmpty()) {
          continue;
        }
        final Set<String> recipients =
            recipientResolver.resolve(RecipientTarget.ByLinkedPersons.of(personIds));
        if (recipients.isEmpty()) {
          continue;
        }
        final DispatchResult result =
            notify(
                recipients,
                "Promemoria culto in arrivo",
                "Sei in scala per " + describe(service) + ".",
                "/services/" + service.serviceId());
        tally.add(recipients.size(), result);
      }
    } catch (RuntimeException e) {
      tally.logAborted(e);
      throw e;
    }
    return tally.summary(services.size());
  }

  private Set<String> worshipLeaderUsers(WorshipServiceRecord service) {
    final List<String> leaders =
        scheduleRepository.findAssignments(service.monthKey(), service.serviceId()).stream()
            .filter(a -> properties.worshipLeaderPositionId().equals(a.positionId()))
            .map(ScheduleAssignment::personId)
            .limit(1)
            .toList();
    if (leaders.isEmpty()) {
      return Set.of();
    }
    return recipientResolver.resolve(RecipientTarget.ByLinkedPersons.of(leaders));
  }

  private DispatchResult notify(Set<String> recipients, String title, String body, String link) {
    final Set<String> tokens = tokenCollector.collectTokens(recipients, NotificationCategory.REMINDER);
    return pushDispatchService.dispatch(tokens, title, body, link, NotificationCategory.REMINDER);
  }

  private LocalDate today() {
    return LocalDate.now(clock.withZone(properties.zoneId()));
  }

  private static String describe(WorshipServiceRecord service) {
    return service.name() + " (" + service.date() + " " + service.startTime() + ")";
  }

  /** Running counters of one service-loop job. */
  private final class Tally {
    private final String job;
    private final LocalDate targetDate;
    private int notifiedServices;
    private int recipients;
    private DispatchResult result = DispatchResult.EMPTY;

    private Tally(String job, LocalDate targetDate) {
      this.job = job;
      this.targetDate = targetDate;
    }

    void add(int serviceRecipients, DispatchResult serviceResult) {
      notifiedServices++;
      recipients += serviceRecipients;
      result = result.plus(serviceResult);
    }

    void logAborted(RuntimeException e) {
      metrics.recordReminder(job, "failed");
      logger.error(
          "reminder aborted job={} targetDate={} notifiedServices={} recipients={} success={} failure={}",
          job,
          targetDate,
          notifiedServices,
          recipients,
          result.success(),
          result.failure(),
          e);
    }

    ReminderSummary summary(int checkedServices) {
      metrics.recordReminder(job, notifiedServices > 0 ? "notified" : "idle");
      logger.info(
          "reminder finished job={} targetDate={} checkedServices={} notifiedServices={} recipients={}",
          job,
          targetDate,
          checkedServices,
          notifiedServices,
          recipients);
      return ReminderSummary.services(
          targetDate.toString(), checkedServices, notifiedServices, recipients, result);
    }
  }
}
