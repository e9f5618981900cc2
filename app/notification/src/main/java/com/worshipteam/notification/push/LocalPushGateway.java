/*
 * Where: Notification push transport
 * What: Gateway that only logs, reporting every token as delivered
 * Why: Local runs and tests work without Firebase credentials
 */
package com.worshipteam.notification.push;

import com.worshipteam.notification.model.DispatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "notification.push.firebase.enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LocalPushGateway implements PushGateway {

  private static final Logger logger = LoggerFactory.getLogger(LocalPushGateway.class);

  @Override
  public DispatchResult sendMulticast(PushMessage message) {
    logger.info(
        "push simulated send tokens={} category={} title={} link={}",
        message.tokens().size(),
        message.category(),
        message.title(),
        message.link());
    return new DispatchResult(message.tokens().size(), 0);
  }
}
