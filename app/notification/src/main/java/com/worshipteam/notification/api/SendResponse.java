package com.worshipteam.notification.api;

import com.worshipteam.notification.service.SendOutcome;

/** Result of an event emission or admin broadcast. */
public record SendResponse(boolean ok, int success, int failure, int recipients) {

  public static SendResponse from(SendOutcome outcome) {
    return new SendResponse(
        true, outcome.result().success(), outcome.result().failure(), outcome.recipients());
  }
}
