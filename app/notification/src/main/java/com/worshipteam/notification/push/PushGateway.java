/*
 * Where: Notification push transport
 * What: Abstraction over the multicast push gateway
 * Why: Lets the dispatch engine run against Firebase, a local logger or a test double
 */
package com.worshipteam.notification.push;

import com.worshipteam.notification.model.DispatchResult;

public interface PushGateway {

  /**
   * Sends one multicast request.
   *
   * @throws PushGatewayException when the transport fails as a whole
   */
  DispatchResult sendMulticast(PushMessage message);
}
