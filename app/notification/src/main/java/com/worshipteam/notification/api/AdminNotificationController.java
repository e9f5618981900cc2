package com.worshipteam.notification.api;

import com.worshipteam.notification.service.NotificationSendService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AdminNotificationController {

  private final NotificationSendService sendService;

  @PostMapping("/api/admin/send-notification")
  public SendResponse send(@Valid @RequestBody AdminSendRequest request) {
    return SendResponse.from(
        sendService.adminSend(
            request.target(),
            request.role(),
            request.userIds(),
            request.title(),
            request.body(),
            request.link(),
            request.category()));
  }
}
