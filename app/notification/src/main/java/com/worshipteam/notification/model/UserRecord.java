/*
 * Where: Notification domain model
 * What: Read-only view of an application user
 * Why: Recipient resolution and role-tier checks only need these fields
 */
package com.worshipteam.notification.model;

public record UserRecord(String userId, boolean active, UserRole role) {}
