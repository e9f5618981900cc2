/*
 * Where: Notification domain model
 * What: One person assigned to one position for one service in a monthly schedule
 * Why: Link-based targeting starts from these person ids
 */
package com.worshipteam.notification.model;

public record ScheduleAssignment(String serviceId, String personId, String positionId) {}
