/*
 * Where: Notification service layer
 * What: Expands user ids into the push tokens allowed to receive a category
 * Why: Disabled devices and per-category opt-outs must never be targeted
 */
package com.worshipteam.notification.service;

import com.google.common.collect.Lists;
import com.worshipteam.notification.config.StoreProperties;
import com.worshipteam.notification.model.DeviceRecord;
import com.worshipteam.notification.model.NotificationCategory;
import com.worshipteam.notification.repository.DeviceRepository;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TokenCollector {

  private static final Logger logger = LoggerFactory.getLogger(TokenCollector.class);

  private final DeviceRepository deviceRepository;
  private final StoreProperties storeProperties;

  /**
   * Queries enabled devices in batches no larger than the store's IN-list limit and keeps each
   * token whose device has not opted out of {@code category}. Tokens are unique in the result.
   */
  public Set<String> collectTokens(Collection<String> userIds, NotificationCategory category) {
    final Set<String> tokens = new LinkedHashSet<>();
    if (userIds.isEmpty()) {
      return tokens;
    }
    final List<String> distinctUserIds = List.copyOf(new LinkedHashSet<>(userIds));
    int optedOut = 0;
    for (List<String> chunk : Lists.partition(distinctUserIds, storeProperties.maxInValues())) {
      for (DeviceRecord device : deviceRepository.findEnabledByUserIds(chunk)) {
        if (!device.allows(category)) {
          optedOut++;
          continue;
        }
        if (device.token() != null && !device.token().isBlank()) {
          tokens.add(device.token());
        }
      }
    }
    logger.debug(
        "tokens collected users={} category={} tokens={} optedOut={}",
        distinctUserIds.size(),
        category.key(),
        tokens.size(),
        optedOut);
    return tokens;
  }
}
