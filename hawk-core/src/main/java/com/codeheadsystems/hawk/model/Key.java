package com.codeheadsystems.hawk.model;

import com.codeheadsystems.hawk.crypto.Cryptographer;
import com.codeheadsystems.hawk.crypto.DigestAlgorithm;
import com.codeheadsystems.hawk.crypto.HmacKey;
import java.util.Objects;

/**
 * A Hawk shared secret combined with its digest algorithm. Only signing is exposed.
 */
public final class Key {

  private final HmacKey hmacKey;

  /**
   * Wraps an existing backend key.
   *
   * @param hmacKey the hmac key
   */
  public Key(HmacKey hmacKey) {
    this.hmacKey = Objects.requireNonNull(hmacKey, "hmacKey");
  }

  /**
   * Creates a key for the given secret and algorithm using the given backend.
   *
   * @param secret        the shared secret
   * @param algorithm     the digest algorithm
   * @param cryptographer the cryptographer
   * @return the key
   */
  public static Key of(byte[] secret, DigestAlgorithm algorithm, Cryptographer cryptographer) {
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(algorithm, "algorithm");
    return new Key(cryptographer.newKey(algorithm, secret));
  }

  /**
   * Signs the given bytes.
   *
   * @param data the data
   * @return the MAC bytes, digest-length
   */
  public byte[] sign(byte[] data) {
    return hmacKey.sign(data);
  }

  /**
   * The digest algorithm used for every signature made with this key.
   *
   * @return the algorithm
   */
  public DigestAlgorithm algorithm() {
    return hmacKey.algorithm();
  }

  @Override
  public String toString() {
    return "Key[" + algorithm() + "]";
  }
}
