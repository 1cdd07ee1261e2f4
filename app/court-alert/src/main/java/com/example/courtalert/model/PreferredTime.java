package com.example.courtalert.model;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Objects;

public record PreferredTime(DayOfWeek dayOfWeek, LocalTime startTime, LocalTime endTime) {

  public PreferredTime {
    Objects.requireNonNull(dayOfWeek, "dayOfWeek");
    Objects.requireNonNull(startTime, "startTime");
    Objects.requireNonNull(endTime, "endTime");
    if (!startTime.isBefore(endTime)) {
      throw new IllegalArgumentException(
          "preferred time start must be before end start=" + startTime + " end=" + endTime);
    }
  }
}
