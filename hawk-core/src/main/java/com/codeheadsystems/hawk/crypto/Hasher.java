package com.codeheadsystems.hawk.crypto;

/**
 * A streaming digest. {@link #finish()} may be called once; the hasher is unusable afterward.
 */
public interface Hasher {

  /**
   * Feeds data into the digest.
   *
   * @param data the data
   */
  void update(byte[] data);

  /**
   * Completes the digest.
   *
   * @return the digest bytes
   */
  byte[] finish();
}
