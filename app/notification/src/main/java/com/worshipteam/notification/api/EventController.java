package com.worshipteam.notification.api;

import com.worshipteam.notification.service.NotificationSendService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Domain events from the scheduling front end; restricted to the manager tier. */
@RestController
@RequiredArgsConstructor
public class EventController {

  private final NotificationSendService sendService;

  @PostMapping("/api/events/emit")
  public SendResponse emit(@Valid @RequestBody EmitEventRequest request) {
    return SendResponse.from(sendService.emitEvent(request.type(), request.data()));
  }
}
