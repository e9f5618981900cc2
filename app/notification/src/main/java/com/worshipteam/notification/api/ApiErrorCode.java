/*
 * Where: Notification API
 * What: Error codes returned alongside the HTTP status
 * Why: Clients tell apart rejections that share a status code
 */
package com.worshipteam.notification.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNSUPPORTED_EVENT,
  UNSUPPORTED_TARGET,
  UNAUTHORIZED,
  GATEWAY_ERROR
}
