/*
 * Where: Notification push transport
 * What: Sends multicast pushes through Firebase Cloud Messaging
 * Why: FCM delivers to Android, iOS and web clients with a single token model
 */
package com.worshipteam.notification.push;

import com.google.common.annotations.VisibleForTesting;
import com.google.firebase.messaging.BatchResponse;
import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.MulticastMessage;
import com.google.firebase.messaging.Notification;
import com.google.firebase.messaging.WebpushConfig;
import com.google.firebase.messaging.WebpushFcmOptions;
import com.google.firebase.messaging.WebpushNotification;
import com.worshipteam.notification.model.DispatchResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.push.firebase.enabled", havingValue = "true")
public class FirebasePushGateway implements PushGateway {

  private static final Logger logger = LoggerFactory.getLogger(FirebasePushGateway.class);

  private final FirebaseMessaging firebaseMessaging;

  @Override
  public DispatchResult sendMulticast(PushMessage message) {
    final BatchResponse response;
    try {
      response = firebaseMessaging.sendEachForMulticast(toMulticast(message));
    } catch (FirebaseMessagingException ex) {
      final String errorCode =
          ex.getMessagingErrorCode() == null ? "unknown" : ex.getMessagingErrorCode().name();
      logger.warn(
          "fcm multicast failed tokens={} category={} errorCode={}",
          message.tokens().size(),
          message.category(),
          errorCode);
      throw new PushGatewayException("fcm multicast failed: " + errorCode, ex);
    }
    return new DispatchResult(response.getSuccessCount(), response.getFailureCount());
  }

  @VisibleForTesting
  MulticastMessage toMulticast(PushMessage message) {
    // Some web clients only surface the data channel, so the data payload repeats title/body.
    return MulticastMessage.builder()
        .addAllTokens(message.tokens())
        .setNotification(
            Notification.builder().setTitle(message.title()).setBody(message.body()).build())
        .putData("title", message.title())
        .putData("body", message.body())
        .putData("link", message.link())
        .putData("category", message.category())
        .setWebpushConfig(
            WebpushConfig.builder()
                .setFcmOptions(WebpushFcmOptions.withLink(message.link()))
                .setNotification(new WebpushNotification(message.title(), message.body()))
                .build())
        .build();
  }
}
