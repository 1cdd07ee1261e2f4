package com.example.courtalert.model;

/** A subscription paired with the part of an opened window that satisfies it. */
public record SubscriptionMatch(Subscription subscription, ConsolidatedWindow window) {

  public String subscriptionId() {
    return subscription.id();
  }
}
