package com.worshipteam.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/** {@code preferences} replaces the stored map; {@code enabled} is true unless sent as false. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateDevicePreferencesRequest(
    @NotBlank(message = "token is required") String token,
    Map<String, Boolean> preferences,
    Boolean enabled) {}
