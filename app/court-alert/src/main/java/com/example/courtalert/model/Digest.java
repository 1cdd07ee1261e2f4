package com.example.courtalert.model;

import java.util.List;

public record Digest(String digestId, Subscription subscription, List<DigestEntry> entries) {

  public Digest {
    entries = entries == null ? List.of() : List.copyOf(entries);
  }

  public List<ConsolidatedWindow> windows() {
    return entries.stream().map(DigestEntry::window).toList();
  }

  public String recipient() {
    return subscription.recipient();
  }
}
