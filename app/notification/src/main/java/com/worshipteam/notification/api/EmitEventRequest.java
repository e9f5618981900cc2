package com.worshipteam.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/** {@code data} keys are event-specific and passed through unchanged, e.g. {@code personId}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmitEventRequest(
    @NotBlank(message = "type is required") String type, Map<String, Object> data) {}
