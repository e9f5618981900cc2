/*
 * Where: Notification API
 * What: Unauthenticated liveness responses on / and /health
 * Why: Load balancers and uptime checks probe these without credentials
 */
package com.worshipteam.notification.api;

import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final Clock clock;

  @GetMapping("/")
  public String home() {
    return "notification: ok";
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse(true, clock.instant());
  }
}
