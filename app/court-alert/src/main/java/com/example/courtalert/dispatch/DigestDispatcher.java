package com.example.courtalert.dispatch;

import com.example.courtalert.model.Digest;

public interface DigestDispatcher {

  /**
   * Delivers one digest.
   *
   * @throws DispatchException when the transport rejects the digest
   */
  void sendDigest(Digest digest);
}
