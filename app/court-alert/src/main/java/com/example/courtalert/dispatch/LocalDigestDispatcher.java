/*
 * Where: Court alert dispatch
 * What: Writes digests to the log instead of sending them
 * Why: Default transport for local runs where no mail server exists
 */
package com.example.courtalert.dispatch;

import com.example.courtalert.model.Digest;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "court-alert.dispatch.mode",
    havingValue = "local",
    matchIfMissing = true)
public class LocalDigestDispatcher implements DigestDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(LocalDigestDispatcher.class);

  private final DigestFormatter formatter;

  @Override
  public void sendDigest(Digest digest) {
    logger.info(
        "digest simulated send digestId={} subscriptionId={} recipient={} windows={}",
        digest.digestId(),
        digest.subscription().id(),
        digest.recipient(),
        digest.entries().size());
    for (var entry : digest.entries()) {
      logger.info(
          "digest window digestId={} source={} courtId={} window={}",
          digest.digestId(),
          entry.sourceName(),
          entry.window().courtId(),
          formatter.describe(entry.window()));
    }
  }
}
