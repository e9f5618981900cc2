/*
 * Where: Notification API
 * What: Reminder endpoints called by the external cron trigger
 * Why: Each call runs one reminder job and reports its summary
 */
package com.worshipteam.notification.api;

import com.worshipteam.notification.model.ReminderSummary;
import com.worshipteam.notification.service.CronSecretVerifier;
import com.worshipteam.notification.service.ReminderService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
public class CronController {

  private final CronSecretVerifier cronSecretVerifier;
  private final ReminderService reminderService;

  @PostMapping("/remind-next-month-schedule")
  public ReminderSummary remindNextMonthSchedule(HttpServletRequest request) {
    verify(request);
    return reminderService.remindNextMonthSchedule();
  }

  @PostMapping("/remind-service-songs-entry")
  public ReminderSummary remindServiceSongsEntry(HttpServletRequest request) {
    verify(request);
    return reminderService.remindServiceSongsEntry();
  }

  @PostMapping("/remind-upcoming-service-members")
  public ReminderSummary remindUpcomingServiceMembers(HttpServletRequest request) {
    verify(request);
    return reminderService.remindUpcomingServiceMembers();
  }

  // Header name is configurable, so it is read from the request rather than bound.
  private void verify(HttpServletRequest request) {
    cronSecretVerifier.verify(request.getHeader(cronSecretVerifier.headerName()));
  }
}
