/*
 * Where: Notification domain model
 * What: Aggregated success/failure counts of one or more multicast calls
 * Why: Individual token outcomes are deliberately not retained
 */
package com.worshipteam.notification.model;

public record DispatchResult(int success, int failure) {

  public static final DispatchResult EMPTY = new DispatchResult(0, 0);

  public DispatchResult plus(DispatchResult other) {
    return new DispatchResult(success + other.success, failure + other.failure);
  }
}
