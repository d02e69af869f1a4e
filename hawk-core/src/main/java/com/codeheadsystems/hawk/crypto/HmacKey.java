package com.codeheadsystems.hawk.crypto;

/**
 * An HMAC signing key bound to one digest algorithm. The raw secret is never exposed.
 */
public interface HmacKey {

  /**
   * Signs the given data.
   *
   * @param data the data
   * @return the MAC, {@link DigestAlgorithm#outputLength()} bytes long
   */
  byte[] sign(byte[] data);

  /**
   * The digest algorithm fixed at construction.
   *
   * @return the algorithm
   */
  DigestAlgorithm algorithm();
}
