package com.example.courtalert.model;

import java.time.LocalDate;
import java.util.Objects;

public record DateRange(LocalDate from, LocalDate to) {

  public DateRange {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    if (to.isBefore(from)) {
      throw new IllegalArgumentException("date range end before start from=" + from + " to=" + to);
    }
  }

  public static DateRange startingAt(LocalDate from, int days) {
    if (days < 1) {
      throw new IllegalArgumentException("days must be positive");
    }
    return new DateRange(from, from.plusDays(days - 1L));
  }
}
