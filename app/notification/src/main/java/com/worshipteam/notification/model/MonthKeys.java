package com.worshipteam.notification.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;

/** Formats the {@code yyyy-MM} keys used by schedules. */
public final class MonthKeys {

  private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

  private MonthKeys() {}

  public static String of(LocalDate date) {
    return YearMonth.from(date).format(FORMAT);
  }
}
