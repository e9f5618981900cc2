/*
 * Where: Notification domain model
 * What: Domain events that can be emitted by the scheduling front end
 * Why: Wire names are parsed once into a closed set before planning a notification
 */
package com.worshipteam.notification.model;

import java.util.Arrays;
import java.util.Optional;

public enum DomainEventType {
  ASSIGNMENT_CHANGED("assignment_changed"),
  SERVICE_SONGS_UPDATED("service_songs_updated"),
  ANNOUNCEMENT_CREATED("announcement_created"),
  MONTHLY_SCHEDULE_CREATED("monthly_schedule_created"),
  CATALOG_SONG_CREATED("catalog_song_created");

  private final String wireName;

  DomainEventType(String wireName) {
    this.wireName = wireName;
  }

  public static Optional<DomainEventType> fromWireName(String wireName) {
    return Arrays.stream(values()).filter(type -> type.wireName.equals(wireName)).findFirst();
  }
}
