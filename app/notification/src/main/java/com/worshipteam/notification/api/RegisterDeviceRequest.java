package com.worshipteam.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegisterDeviceRequest(
    @NotBlank(message = "token is required") String token,
    String role,
    Map<String, Boolean> preferences,
    String platform) {}
