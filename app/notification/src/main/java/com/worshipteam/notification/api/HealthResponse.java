package com.worshipteam.notification.api;

import java.time.Instant;

public record HealthResponse(boolean ok, Instant time) {}
