/*
 * Where: Notification configuration binding
 * What: Push gateway settings (link fallback, multicast size, Firebase credentials)
 * Why: Gateway endpoints and credentials differ per environment
 */
package com.worshipteam.notification.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.push")
@Validated
public record PushProperties(
    String baseUrl, @NotNull @Positive Integer multicastMaxTokens, @Valid Firebase firebase) {

  public PushProperties {
    baseUrl = baseUrl == null ? "" : baseUrl;
    multicastMaxTokens = multicastMaxTokens == null ? 500 : multicastMaxTokens;
    firebase = firebase == null ? new Firebase(false, null, null) : firebase;
  }

  /** Link used when a notification carries none: the base URL, else the site root. */
  public String resolveLink(String link) {
    if (link != null && !link.isBlank()) {
      return link;
    }
    if (!baseUrl.isBlank()) {
      return baseUrl;
    }
    return "/";
  }

  public record Firebase(boolean enabled, String projectId, String credentialsPath) {}
}
