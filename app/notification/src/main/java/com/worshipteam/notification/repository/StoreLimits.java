package com.worshipteam.notification.repository;

import com.worshipteam.notification.config.StoreProperties;
import java.util.Collection;

/** Caps the number of values bound into a single IN filter. */
final class StoreLimits {

  private StoreLimits() {}

  static void checkInValues(Collection<?> values, StoreProperties properties) {
    if (values.size() > properties.maxInValues()) {
      throw new IllegalArgumentException(
          "IN filter supports at most " + properties.maxInValues() + " values, got " + values.size());
    }
  }
}
