/*
 * Where: Notification infrastructure configuration
 * What: Initializes the Firebase Admin SDK and exposes FirebaseMessaging
 * Why: The push gateway reuses one authenticated client for every multicast call
 */
package com.worshipteam.notification.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.messaging.FirebaseMessaging;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "notification.push.firebase.enabled", havingValue = "true")
public class FirebaseConfig {

  private static final Logger logger = LoggerFactory.getLogger(FirebaseConfig.class);

  @Bean(destroyMethod = "delete")
  public FirebaseApp firebaseApp(PushProperties properties) throws IOException {
    final PushProperties.Firebase firebase = properties.firebase();
    final FirebaseOptions.Builder options =
        FirebaseOptions.builder().setCredentials(loadCredentials(firebase.credentialsPath()));
    if (firebase.projectId() != null && !firebase.projectId().isBlank()) {
      options.setProjectId(firebase.projectId());
    }
    logger.info("initializing firebase app projectId={}", firebase.projectId());
    return FirebaseApp.initializeApp(options.build());
  }

  @Bean
  public FirebaseMessaging firebaseMessaging(FirebaseApp firebaseApp) {
    return FirebaseMessaging.getInstance(firebaseApp);
  }

  // Without an explicit service-account file, fall back to GOOGLE_APPLICATION_CREDENTIALS.
  private GoogleCredentials loadCredentials(String credentialsPath) throws IOException {
    if (credentialsPath == null || credentialsPath.isBlank()) {
      return GoogleCredentials.getApplicationDefault();
    }
    try (InputStream in = new FileInputStream(credentialsPath)) {
      return GoogleCredentials.fromStream(in);
    }
  }
}
