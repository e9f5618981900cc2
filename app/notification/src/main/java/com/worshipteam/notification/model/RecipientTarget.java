/*
 * Where: Notification domain model
 * What: Targeting modes understood by the recipient resolver
 * Why: A closed variant keeps every caller on a mode the resolver can handle
 */
package com.worshipteam.notification.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public sealed interface RecipientTarget {

  /** Every active user. */
  record All() implements RecipientTarget {}

  /** Every active user holding {@code role}. */
  record ByRole(UserRole role) implements RecipientTarget {}

  /** Caller-supplied user ids, used as given. */
  record ExplicitUsers(List<String> userIds) implements RecipientTarget {
    public ExplicitUsers {
      userIds = copyOf(userIds);
    }
  }

  /** Active users linked to any of the given scheduling-domain persons. */
  record ByLinkedPersons(List<String> personIds) implements RecipientTarget {
    public ByLinkedPersons {
      personIds = copyOf(personIds);
    }

    public static ByLinkedPersons of(Collection<String> personIds) {
      return new ByLinkedPersons(new ArrayList<>(personIds));
    }
  }

  // Blank and null ids are tolerated here and dropped by the resolver.
  private static List<String> copyOf(Collection<String> ids) {
    return ids == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(ids));
  }
}
