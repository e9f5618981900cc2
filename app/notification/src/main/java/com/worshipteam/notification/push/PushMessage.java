/*
 * Where: Notification push transport
 * What: Payload of one multicast request
 * Why: Carries both the visible notification and the data channel fields
 */
package com.worshipteam.notification.push;

import java.util.List;

public record PushMessage(
    List<String> tokens, String title, String body, String link, String category) {

  public PushMessage {
    tokens = List.copyOf(tokens);
  }
}
