/*
 * Where: Notification service layer
 * What: Sends a notification to a set of tokens through the push gateway
 * Why: Single place that shapes the payload and aggregates gateway counts
 */
package com.worshipteam.notification.service;

import com.google.common.collect.Lists;
import com.worshipteam.notification.config.PushProperties;
import com.worshipteam.notification.model.DispatchResult;
import com.worshipteam.notification.model.NotificationCategory;
import com.worshipteam.notification.push.PushGateway;
import com.worshipteam.notification.push.PushMessage;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PushDispatchService {

  private static final Logger logger = LoggerFactory.getLogger(PushDispatchService.class);

  private final PushGateway pushGateway;
  private final PushProperties properties;
  private final NotificationMetrics metrics;

  /**
   * Returns {0, 0} for an empty token set without calling the gateway. Otherwise sends one
   * multicast request per gateway-sized batch, which is a single request for any set within the
   * gateway limit. Gateway failures propagate; nothing is retried and individual token failures
   * are only counted.
   */
  public DispatchResult dispatch(
      Set<String> tokens, String title, String body, String link, NotificationCategory category) {
    if (tokens.isEmpty()) {
      logger.info("push dispatch skipped, no tokens category={}", category.key());
      return DispatchResult.EMPTY;
    }
    final String resolvedLink = properties.resolveLink(link);
    DispatchResult total = DispatchResult.EMPTY;
    for (List<String> batch :
        Lists.partition(List.copyOf(tokens), properties.multicastMaxTokens())) {
      final DispatchResult result =
          pushGateway.sendMulticast(
              new PushMessage(batch, title, body, resolvedLink, category.key()));
      metrics.recordMulticast(category, result);
      total = total.plus(result);
    }
    logger.info(
        "push dispatched category={} tokens={} success={} failure={}",
        category.key(),
        tokens.size(),
        total.success(),
        total.failure());
    return total;
  }
}
