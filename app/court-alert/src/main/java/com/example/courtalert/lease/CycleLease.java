/*
 * Where: Court alert lease
 * What: Time-bounded claim that lets one engine instance run a cycle
 * Why: Replicas sharing a record store must not gate and dispatch the same windows twice
 */
package com.example.courtalert.lease;

import java.time.Instant;

public interface CycleLease {

  /** Returns true when {@code holder} owns the lease until {@code leaseUntil}. */
  boolean tryAcquire(String holder, Instant now, Instant leaseUntil);

  void release(String holder);
}
