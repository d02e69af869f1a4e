package com.codeheadsystems.hawk.crypto;

import java.util.Locale;

/**
 * Digest algorithms usable for Hawk MACs and payload hashes.
 */
public enum DigestAlgorithm {

  /**
   * SHA-256, the Hawk default.
   */
  SHA256("SHA-256", "HmacSHA256", 32),
  /**
   * SHA-384.
   */
  SHA384("SHA-384", "HmacSHA384", 48),
  /**
   * SHA-512.
   */
  SHA512("SHA-512", "HmacSHA512", 64);

  private final String digestName;
  private final String hmacName;
  private final int outputLength;

  DigestAlgorithm(String digestName, String hmacName, int outputLength) {
    this.digestName = digestName;
    this.hmacName = hmacName;
    this.outputLength = outputLength;
  }

  /**
   * Resolves an algorithm from a name such as {@code "sha256"}, {@code "SHA-256"} or {@code "SHA256"}.
   *
   * @param name the algorithm name
   * @return the digest algorithm
   * @throws IllegalArgumentException if the name is not recognized
   */
  public static DigestAlgorithm fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Digest algorithm name must not be null");
    }
    String normalized = name.replace("-", "").toUpperCase(Locale.ROOT);
    for (DigestAlgorithm algorithm : values()) {
      if (algorithm.name().equals(normalized)) {
        return algorithm;
      }
    }
    throw new IllegalArgumentException("Unsupported digest algorithm: " + name);
  }

  /**
   * JCA message digest name, e.g. {@code SHA-256}.
   *
   * @return the digest name
   */
  public String digestName() {
    return digestName;
  }

  /**
   * JCA MAC name, e.g. {@code HmacSHA256}.
   *
   * @return the hmac name
   */
  public String hmacName() {
    return hmacName;
  }

  /**
   * Digest and MAC output length in bytes.
   *
   * @return the output length
   */
  public int outputLength() {
    return outputLength;
  }
}
