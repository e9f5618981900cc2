/*
 * Where: Notification service layer
 * What: Records push dispatch outcomes and reminder job results
 * Why: Delivery failure rates and reminder activity are visible from Prometheus
 */
package com.worshipteam.notification.service;

import com.worshipteam.notification.model.DispatchResult;
import com.worshipteam.notification.model.NotificationCategory;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class NotificationMetrics {

  private static final String METRIC_PUSH_TOKENS = "notification.push.tokens";
  private static final String METRIC_PUSH_MULTICAST = "notification.push.multicast.calls";
  private static final String METRIC_REMINDER_RUNS = "notification.reminder.runs";

  private final MeterRegistry meterRegistry;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordMulticast(NotificationCategory category, DispatchResult result) {
    counter(
            METRIC_PUSH_MULTICAST,
            "Multicast requests sent to the push gateway",
            Tags.of("category", category.key()))
        .increment();
    counter(
            METRIC_PUSH_TOKENS,
            "Push tokens by delivery result",
            Tags.of("category", category.key(), "result", "success"))
        .increment(result.success());
    counter(
            METRIC_PUSH_TOKENS,
            "Push tokens by delivery result",
            Tags.of("category", category.key(), "result", "failure"))
        .increment(result.failure());
  }

  public void recordReminder(String job, String outcome) {
    counter(
            METRIC_REMINDER_RUNS,
            "Reminder job runs by outcome",
            Tags.of("job", job, "outcome", outcome))
        .increment();
  }

  // Counter.builder(...).register returns the existing meter for an identical id.
  private Counter counter(String name, String description, Tags tags) {
    return Counter.builder(name).description(description).tags(tags).register(meterRegistry);
  }
}
