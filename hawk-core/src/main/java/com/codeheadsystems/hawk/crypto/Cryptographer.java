package com.codeheadsystems.hawk.crypto;

/**
 * The cryptographic backend used by every Hawk operation.
 * <p>
 * An instance is chosen once through {@link com.codeheadsystems.hawk.config.HawkConfig} and then
 * shared read-only. Implementations must be safe for concurrent use without external locking.
 */
public interface Cryptographer {

  /**
   * Creates an HMAC key for the given algorithm and secret.
   *
   * @param algorithm the digest algorithm
   * @param secret    the secret bytes; copied by the implementation
   * @return the key
   */
  HmacKey newKey(DigestAlgorithm algorithm, byte[] secret);

  /**
   * Creates a new streaming digest.
   *
   * @param algorithm the digest algorithm
   * @return the hasher
   */
  Hasher newHasher(DigestAlgorithm algorithm);

  /**
   * Fills the array with cryptographically secure random bytes.
   *
   * @param output the array to fill
   */
  void randomBytes(byte[] output);

  /**
   * Compares two arrays in time independent of the position of the first difference.
   *
   * @param a the first array
   * @param b the second array
   * @return true if both arrays hold the same bytes
   */
  boolean constantTimeEquals(byte[] a, byte[] b);

  /**
   * Returns {@code length} secure random bytes.
   *
   * @param length the length
   * @return the random bytes
   */
  default byte[] randomBytes(int length) {
    byte[] bytes = new byte[length];
    randomBytes(bytes);
    return bytes;
  }
}
