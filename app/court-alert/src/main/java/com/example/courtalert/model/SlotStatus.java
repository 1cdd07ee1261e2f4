package com.example.courtalert.model;

import java.util.Locale;
import java.util.Set;

public enum SlotStatus {
  OPEN,
  BOOKED,
  UNKNOWN;

  private static final Set<String> OPEN_VALUES = Set.of("open", "free", "available");
  private static final Set<String> BOOKED_VALUES = Set.of("booked", "reserved", "taken");

  public static SlotStatus fromExternal(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (OPEN_VALUES.contains(normalized)) {
      return OPEN;
    }
    if (BOOKED_VALUES.contains(normalized)) {
      return BOOKED;
    }
    return UNKNOWN;
  }
}
