/*
 * Where: Notification API
 * What: Converts service exceptions into {code, message} responses
 * Why: Every endpoint reports failures in the same shape
 */
package com.worshipteam.notification.api;

import com.worshipteam.notification.push.PushGatewayException;
import com.worshipteam.notification.service.UnauthorizedException;
import com.worshipteam.notification.service.UnsupportedEventException;
import com.worshipteam.notification.service.UnsupportedTargetException;
import com.worshipteam.notification.service.ValidationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(ValidationException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(UnsupportedEventException.class)
  public ResponseEntity<ApiErrorResponse> handleUnsupportedEvent(UnsupportedEventException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.UNSUPPORTED_EVENT, ex.getMessage()));
  }

  @ExceptionHandler(UnsupportedTargetException.class)
  public ResponseEntity<ApiErrorResponse> handleUnsupportedTarget(UnsupportedTargetException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.UNSUPPORTED_TARGET, ex.getMessage()));
  }

  @ExceptionHandler(UnauthorizedException.class)
  public ResponseEntity<ApiErrorResponse> handleUnauthorized(UnauthorizedException ex) {
    logger.warn("unauthorized request rejected reason={}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse(ApiErrorCode.UNAUTHORIZED, "unauthorized"));
  }

  @ExceptionHandler(PushGatewayException.class)
  public ResponseEntity<ApiErrorResponse> handlePushGateway(PushGatewayException ex) {
    logger.error("push gateway failure", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ApiErrorResponse(ApiErrorCode.GATEWAY_ERROR, ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // Parser internals are not echoed back.
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
