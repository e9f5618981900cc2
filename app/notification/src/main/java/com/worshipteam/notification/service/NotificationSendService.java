/*
 * Where: Notification service layer
 * What: Resolve recipients, collect tokens and dispatch for events and admin broadcasts
 * Why: Both entry points share the same pipeline after a plan is built
 */
package com.worshipteam.notification.service;

import com.worshipteam.notification.model.DispatchResult;
import com.worshipteam.notification.model.NotificationCategory;
import com.worshipteam.notification.model.NotificationPlan;
import com.worshipteam.notification.model.RecipientTarget;
import com.worshipteam.notification.model.UserRole;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationSendService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationSendService.class);

  private final NotificationPlanner planner;
  private final RecipientResolver recipientResolver;
  private final TokenCollector tokenCollector;
  private final PushDispatchService pushDispatchService;

  public SendOutcome emitEvent(String type, Map<String, Object> data) {
    final NotificationPlan plan = planner.plan(type, data);
    final SendOutcome outcome = send(plan);
    logger.info(
        "event notification sent type={} category={} recipients={} success={} failure={}",
        type,
        plan.category().key(),
        outcome.recipients(),
        outcome.result().success(),
        outcome.result().failure());
    return outcome;
  }

  /**
   * Broadcast composed by an administrator. {@code target} is one of {@code all}, {@code role}
   * or {@code users}; {@code role} defaults to member and {@code userIds} is only read for
   * {@code users}.
   */
  public SendOutcome adminSend(
      String target,
      String role,
      List<String> userIds,
      String title,
      String body,
      String link,
      String category) {
    if (isBlank(title) || isBlank(body)) {
      throw new ValidationException("title and body are required");
    }
    if (isBlank(category)) {
      throw new ValidationException("category is required");
    }
    final NotificationCategory resolvedCategory =
        NotificationCategory.fromKey(category)
            .orElseThrow(() -> new ValidationException("unknown category: " + category));
    final NotificationPlan plan =
        new NotificationPlan(adminTarget(target, role, userIds), resolvedCategory, title, body, link);
    final SendOutcome outcome = send(plan);
    logger.info(
        "admin notification sent target={} category={} recipients={} success={} failure={}",
        target,
        resolvedCategory.key(),
        outcome.recipients(),
        outcome.result().success(),
        outcome.result().failure());
    return outcome;
  }

  public SendOutcome send(NotificationPlan plan) {
    final Set<String> userIds = recipientResolver.resolve(plan.target());
    final Set<String> tokens = tokenCollector.collectTokens(userIds, plan.category());
    final DispatchResult result =
        pushDispatchService.dispatch(
            tokens, plan.title(), plan.body(), plan.link(), plan.category());
    return new SendOutcome(userIds.size(), result);
  }

  private RecipientTarget adminTarget(String target, String role, List<String> userIds) {
    final String mode = target == null ? "" : target.trim().toLowerCase(Locale.ROOT);
    switch (mode) {
      case "all":
        return new RecipientTarget.All();
      case "role":
        if (isBlank(role)) {
          return new RecipientTarget.ByRole(UserRole.MEMBER);
        }
        return new RecipientTarget.ByRole(
            UserRole.fromValue(role.trim())
                .orElseThrow(() -> new ValidationException("unknown role: " + role)));
      case "users":
        return new RecipientTarget.ExplicitUsers(userIds);
      default:
        throw new UnsupportedTargetException("unsupported target: " + target);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
