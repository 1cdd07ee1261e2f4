/*
 * Where: Court alert data access
 * What: Read side of the externally owned subscription store
 * Why: The engine only lists active subscriptions and flips overdue ones to EXPIRED
 */
package com.example.courtalert.repository;

import com.example.courtalert.model.Subscription;
import java.time.LocalDate;
import java.util.List;

public interface SubscriptionRepository {

  List<Subscription> listActive();

  /** Marks ACTIVE subscriptions whose expiry date lies before {@code today} as EXPIRED. */
  int expireOverdue(LocalDate today);

  void insert(Subscription subscription);
}
