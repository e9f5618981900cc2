package com.worshipteam.notification.service;

import com.worshipteam.notification.model.DispatchResult;

/** Number of resolved recipients and the aggregated gateway counts for one send. */
public record SendOutcome(int recipients, DispatchResult result) {}
