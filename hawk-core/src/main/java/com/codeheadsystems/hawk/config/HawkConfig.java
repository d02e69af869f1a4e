package com.codeheadsystems.hawk.config;

import com.codeheadsystems.hawk.crypto.Cryptographer;
import com.codeheadsystems.hawk.crypto.DigestAlgorithm;
import com.codeheadsystems.hawk.crypto.JcaCryptographer;
import com.codeheadsystems.hawk.model.Credentials;
import com.codeheadsystems.hawk.model.Key;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for Hawk signing and validation.
 * Holds the cryptographic backend, the allowed timestamp skew, the nonce entropy and the clock.
 *
 * @param cryptographer  backend for HMAC, digests, random bytes and constant-time comparison
 * @param timestampSkew  maximum allowed difference between a request timestamp and now
 * @param nonceLength    random bytes per generated nonce, before base64 encoding
 * @param clock          source of the current time
 */
public record HawkConfig(
    Cryptographer cryptographer,
    Duration timestampSkew,
    int nonceLength,
    Clock clock
) {

  // Hawk's reference implementation allows one minute of skew.
  public static final Duration DEFAULT_TIMESTAMP_SKEW = Duration.ofSeconds(60);
  public static final int MIN_NONCE_LENGTH = 10;

  /**
   * Default configuration: JCA backend, 60 second skew, 10 byte nonces, system UTC clock.
   */
  public static final HawkConfig DEFAULT = new HawkConfig(
      new JcaCryptographer(),
      DEFAULT_TIMESTAMP_SKEW,
      MIN_NONCE_LENGTH,
      Clock.systemUTC()
  );

  public HawkConfig {
    Objects.requireNonNull(cryptographer, "cryptographer");
    Objects.requireNonNull(timestampSkew, "timestampSkew");
    Objects.requireNonNull(clock, "clock");
    if (timestampSkew.isNegative()) {
      throw new IllegalArgumentException("timestampSkew must not be negative: " + timestampSkew);
    }
    if (nonceLength < MIN_NONCE_LENGTH) {
      throw new IllegalArgumentException("nonceLength must be at least " + MIN_NONCE_LENGTH + ": " + nonceLength);
    }
  }

  /**
   * Creates a test configuration with the JCA backend and a caller-supplied clock.
   *
   * @param clock the clock
   * @return the hawk config
   */
  public static HawkConfig forTesting(Clock clock) {
    return DEFAULT.withClock(clock);
  }

  /**
   * Returns a new config identical to this one but using the given {@link Cryptographer}.
   *
   * @param cryptographer the cryptographer
   * @return the hawk config
   */
  public HawkConfig withCryptographer(Cryptographer cryptographer) {
    return new HawkConfig(cryptographer, timestampSkew, nonceLength, clock);
  }

  /**
   * Returns a new config identical to this one but with the given timestamp skew.
   *
   * @param timestampSkew the timestamp skew
   * @return the hawk config
   */
  public HawkConfig withTimestampSkew(Duration timestampSkew) {
    return new HawkConfig(cryptographer, timestampSkew, nonceLength, clock);
  }

  /**
   * Returns a new config identical to this one but with the given nonce length.
   *
   * @param nonceLength the nonce length
   * @return the hawk config
   */
  public HawkConfig withNonceLength(int nonceLength) {
    return new HawkConfig(cryptographer, timestampSkew, nonceLength, clock);
  }

  /**
   * Returns a new config identical to this one but with the given clock.
   *
   * @param clock the clock
   * @return the hawk config
   */
  public HawkConfig withClock(Clock clock) {
    return new HawkConfig(cryptographer, timestampSkew, nonceLength, clock);
  }

  /**
   * Creates a {@link Key} through this config's cryptographer.
   *
   * @param secret    the shared secret
   * @param algorithm the digest algorithm
   * @return the key
   */
  public Key newKey(byte[] secret, DigestAlgorithm algorithm) {
    return Key.of(secret, algorithm, cryptographer);
  }

  /**
   * Creates {@link Credentials} through this config's cryptographer.
   *
   * @param id        the credential id
   * @param secret    the shared secret
   * @param algorithm the digest algorithm
   * @return the credentials
   */
  public Credentials newCredentials(String id, byte[] secret, DigestAlgorithm algorithm) {
    return new Credentials(id, newKey(secret, algorithm));
  }
}
