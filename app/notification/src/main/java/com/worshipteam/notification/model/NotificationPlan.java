/*
 * Where: Notification domain model
 * What: Who to notify and with which message
 * Why: Events, admin broadcasts and reminders all reduce to this shape before dispatch
 */
package com.worshipteam.notification.model;

public record NotificationPlan(
    RecipientTarget target,
    NotificationCategory category,
    String title,
    String body,
    String link) {}
