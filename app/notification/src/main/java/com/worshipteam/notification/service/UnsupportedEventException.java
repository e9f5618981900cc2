package com.worshipteam.notification.service;

/** The emitted event kind has no notification mapping. */
public class UnsupportedEventException extends RuntimeException {

  public UnsupportedEventException(String message) {
    super(message);
  }
}
