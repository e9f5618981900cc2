package com.worshipteam.notification.service;

/** Missing or wrong shared secret on a trigger endpoint. */
public class UnauthorizedException extends RuntimeException {

  public UnauthorizedException(String message) {
    super(message);
  }
}
