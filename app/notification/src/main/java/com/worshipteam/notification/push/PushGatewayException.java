/*
 * Where: Notification push transport
 * What: Failure of the push gateway as a whole
 * Why: Surfaced to the caller unchanged; there is no retry
 */
package com.worshipteam.notification.push;

public class PushGatewayException extends RuntimeException {

  public PushGatewayException(String message, Throwable cause) {
    super(message, cause);
  }
}
