/*
 * Where: Notification service layer
 * What: A required field is missing or malformed
 * Why: Rejected before any side effect and reported to the caller as a bad request
 */
package com.worshipteam.notification.service;

public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
