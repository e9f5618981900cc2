/*
 * Where: Notification service layer
 * What: Maps a domain event to its audience, category and message
 * Why: The scheduling front end emits events; it does not decide who is told
 */
package com.worshipteam.notification.service;

import com.worshipteam.notification.model.DomainEventType;
import com.worshipteam.notification.model.NotificationCategory;
import com.worshipteam.notification.model.NotificationPlan;
import com.worshipteam.notification.model.RecipientTarget;
import com.worshipteam.notification.model.ScheduleAssignment;
import com.worshipteam.notification.repository.ScheduleRepository;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationPlanner {

  private final ScheduleRepository scheduleRepository;

  public NotificationPlan plan(String type, Map<String, Object> data) {
    final DomainEventType eventType =
        DomainEventType.fromWireName(type)
            .orElseThrow(() -> new UnsupportedEventException("unsupported event type: " + type));
    final Map<String, Object> payload = data == null ? Map.of() : data;
    return switch (eventType) {
      case ASSIGNMENT_CHANGED -> assignmentChanged(payload);
      case SERVICE_SONGS_UPDATED -> serviceSongsUpdated(payload);
      case ANNOUNCEMENT_CREATED ->
          new NotificationPlan(
              new RecipientTarget.All(),
              NotificationCategory.ANNOUNCEMENTS,
              "Nuovo annuncio",
              textOr(payload, "title", "Nuovo annuncio disponibile"),
              "/");
      case MONTHLY_SCHEDULE_CREATED ->
          new NotificationPlan(
              new RecipientTarget.All(),
              NotificationCategory.MONTHLY_SCHEDULE,
              "Nuova scala mensile",
              "La scala del mese " + textOr(payload, "month", "") + " è disponibile.",
              "/schedules");
      case CATALOG_SONG_CREATED ->
          new NotificationPlan(
              new RecipientTarget.All(),
              NotificationCategory.CATALOG,
              "Nuova canzone in catalogo",
              textOr(payload, "title", "È stata aggiunta una nuova canzone."),
              "/songs");
    };
  }

  private NotificationPlan assignmentChanged(Map<String, Object> payload) {
    final String personId = required(payload, "personId");
    return new NotificationPlan(
        new RecipientTarget.ByLinkedPersons(List.of(personId)),
        NotificationCategory.ASSIGNMENT,
        "Nuova assegnazione",
        "Sei stato inserito/aggiornato in una scala (" + textOr(payload, "serviceDate", "") + ").",
        "/schedules");
  }

  private NotificationPlan serviceSongsUpdated(Map<String, Object> payload) {
    final String serviceId = required(payload, "serviceId");
    final List<String> personIds =
        scheduleRepository.findAssignmentsByServiceId(serviceId).stream()
            .map(ScheduleAssignment::personId)
            .toList();
    return new NotificationPlan(
        RecipientTarget.ByLinkedPersons.of(personIds),
        NotificationCategory.SERVICE_SONGS,
        "Repertorio aggiornato",
        "Sono state aggiornate le canzoni del culto (" + textOr(payload, "songsCount", "0") + ").",
        "/services/" + serviceId);
  }

  private static String required(Map<String, Object> payload, String key) {
    final String value = textOr(payload, key, "");
    if (value.isBlank()) {
      throw new ValidationException("data." + key + " is required");
    }
    return value;
  }

  private static String textOr(Map<String, Object> payload, String key, String fallback) {
    final Object value = payload.get(key);
    if (value == null) {
      return fallback;
    }
    final String text = String.valueOf(value).trim();
    return text.isEmpty() ? fallback : text;
  }
}
