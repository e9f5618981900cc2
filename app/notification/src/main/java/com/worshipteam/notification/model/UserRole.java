/*
 * Where: Notification domain model
 * What: Closed set of user roles as stored in users.role
 * Why: Role targeting and permission tiers compare against the same values
 */
package com.worshipteam.notification.model;

import java.util.Arrays;
import java.util.Optional;

public enum UserRole {
  ROOT("root"),
  MINISTER("minister"),
  MEMBER("member");

  private final String value;

  UserRole(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<UserRole> fromValue(String value) {
    return Arrays.stream(values()).filter(role -> role.value.equals(value)).findFirst();
  }
}
