package com.worshipteam.notification.api;

public record OkResponse(boolean ok) {

  public static final OkResponse OK = new OkResponse(true);
}
