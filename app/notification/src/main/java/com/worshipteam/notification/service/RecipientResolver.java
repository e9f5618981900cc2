/*
 * Where: Notification service layer
 * What: Expands a targeting mode into a deduplicated set of user ids
 * Why: Events, admin broadcasts and reminders share one definition of "who"
 */
package com.worshipteam.notification.service;

import com.google.common.collect.Lists;
import com.worshipteam.notification.config.StoreProperties;
import com.worshipteam.notification.model.RecipientTarget;
import com.worshipteam.notification.model.UserRole;
import com.worshipteam.notification.repository.UserRepository;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RecipientResolver {

  private static final Logger logger = LoggerFactory.getLogger(RecipientResolver.class);

  private final UserRepository userRepository;
  private final StoreProperties storeProperties;

  public Set<String> resolve(RecipientTarget target) {
    if (target instanceof RecipientTarget.All) {
      return new LinkedHashSet<>(userRepository.findActiveUserIds());
    }
    if (target instanceof RecipientTarget.ByRole byRole) {
      final UserRole role = byRole.role() == null ? UserRole.MEMBER : byRole.role();
      return new LinkedHashSet<>(userRepository.findActiveUserIdsByRole(role));
    }
    if (target instanceof RecipientTarget.ExplicitUsers explicit) {
      // Used as given: the caller's authorization is the trust boundary.
      return cleanIds(explicit.userIds());
    }
    if (target instanceof RecipientTarget.ByLinkedPersons linked) {
      return resolveLinkedPersons(linked.personIds());
    }
    throw new UnsupportedTargetException("unsupported recipient target: " + target);
  }

  private Set<String> resolveLinkedPersons(List<String> personIds) {
    final Set<String> cleanIds = cleanIds(personIds);
    final Set<String> userIds = new LinkedHashSet<>();
    int lookups = 0;
    for (List<String> chunk :
        Lists.partition(List.copyOf(cleanIds), storeProperties.maxInValues())) {
      userIds.addAll(userRepository.findActiveUserIdsByLinkedPersonIds(chunk));
      lookups++;
    }
    logger.debug(
        "linked persons resolved persons={} users={} lookups={}",
        cleanIds.size(),
        userIds.size(),
        lookups);
    return userIds;
  }

  private Set<String> cleanIds(List<String> ids) {
    final Set<String> clean = new LinkedHashSet<>();
    ids.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(id -> !id.isEmpty())
        .forEach(clean::add);
    return clean;
  }
}
