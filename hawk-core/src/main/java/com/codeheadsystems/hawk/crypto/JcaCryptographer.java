package com.codeheadsystems.hawk.crypto;

import com.codeheadsystems.hawk.exceptions.HawkError;
import com.codeheadsystems.hawk.exceptions.HawkException;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * {@link Cryptographer} backed by the JDK providers: {@link Mac}, {@link MessageDigest} and
 * {@link SecureRandom}. JCA engine instances are not thread-safe, so one is created per call.
 */
public class JcaCryptographer implements Cryptographer {

  private final SecureRandom random;

  /**
   * Instantiates a new JCA cryptographer with a default {@link SecureRandom}.
   */
  public JcaCryptographer() {
    this(new SecureRandom());
  }

  /**
   * Instantiates a new JCA cryptographer with the given random source.
   *
   * @param random the random
   */
  public JcaCryptographer(SecureRandom random) {
    this.random = random;
  }

  @Override
  public HmacKey newKey(DigestAlgorithm algorithm, byte[] secret) {
    // SecretKeySpec refuses empty keys. HMAC zero-pads the key to the block size, so one zero byte
    // yields the same inner and outer pads as an empty key.
    byte[] material = secret.length == 0 ? new byte[1] : secret;
    return new JcaHmacKey(algorithm, new SecretKeySpec(material, algorithm.hmacName()));
  }

  @Override
  public Hasher newHasher(DigestAlgorithm algorithm) {
    try {
      return new JcaHasher(MessageDigest.getInstance(algorithm.digestName()));
    } catch (GeneralSecurityException e) {
      throw new HawkException(HawkError.CRYPTO_ERROR, algorithm.digestName() + " not available", e);
    }
  }

  @Override
  public void randomBytes(byte[] output) {
    random.nextBytes(output);
  }

  @Override
  public boolean constantTimeEquals(byte[] a, byte[] b) {
    if (a == null || b == null) {
      return false;
    }
    return MessageDigest.isEqual(a, b);
  }

  private record JcaHmacKey(DigestAlgorithm algorithm, SecretKeySpec keySpec) implements HmacKey {

    @Override
    public byte[] sign(byte[] data) {
      try {
        Mac mac = Mac.getInstance(algorithm.hmacName());
        mac.init(keySpec);
        return mac.doFinal(data);
      } catch (GeneralSecurityException e) {
        throw new HawkException(HawkError.CRYPTO_ERROR, "HMAC with " + algorithm.digestName() + " failed", e);
      }
    }

    @Override
    public String toString() {
      return "JcaHmacKey[" + algorithm + "]";
    }
  }

  private static final class JcaHasher implements Hasher {

    private MessageDigest digest;

    private JcaHasher(MessageDigest digest) {
      this.digest = digest;
    }

    @Override
    public void update(byte[] data) {
      checkOpen().update(data);
    }

    @Override
    public byte[] finish() {
      byte[] result = checkOpen().digest();
      digest = null;
      return result;
    }

    private MessageDigest checkOpen() {
      if (digest == null) {
        throw new IllegalStateException("Hasher already finished");
      }
      return digest;
    }
  }
}
