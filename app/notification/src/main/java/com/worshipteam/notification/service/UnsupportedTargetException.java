package com.worshipteam.notification.service;

/** The targeting mode is unknown to the recipient resolver. */
public class UnsupportedTargetException extends RuntimeException {

  public UnsupportedTargetException(String message) {
    super(message);
  }
}
