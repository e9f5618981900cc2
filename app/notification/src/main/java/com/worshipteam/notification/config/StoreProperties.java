/*
 * Where: Notification configuration binding
 * What: Limits imposed by the document store on multi-value queries
 * Why: Batched lookups must stay under the store's IN-list fan-out limit
 */
package com.worshipteam.notification.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.store")
@Validated
public record StoreProperties(@NotNull @Positive Integer maxInValues) {

  public StoreProperties {
    maxInValues = maxInValues == null ? 10 : maxInValues;
  }
}
