package com.example.courtalert.lease;

import java.time.Instant;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "court-alert.engine.lease.mode",
    havingValue = "local",
    matchIfMissing = true)
public class LocalCycleLease implements CycleLease {

  @Override
  public boolean tryAcquire(String holder, Instant now, Instant leaseUntil) {
    return true;
  }

  @Override
  public void release(String holder) {
    // nothing is held outside this process
  }
}
