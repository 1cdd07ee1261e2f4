package com.example.courtalert.model;

public enum SubscriptionStatus {
  ACTIVE,
  PAUSED,
  EXPIRED,
  CANCELLED
}
