package com.worshipteam.notification.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdminSendRequest(
    @NotBlank(message = "target is required") String target,
    String role,
    @JsonAlias("userIds") List<String> userIds,
    @NotBlank(message = "title is required") String title,
    @NotBlank(message = "body is required") String body,
    String link,
    @NotBlank(message = "category is required") String category) {}
