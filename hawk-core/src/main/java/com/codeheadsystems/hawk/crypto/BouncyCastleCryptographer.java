package com.codeheadsystems.hawk.crypto;

import java.security.SecureRandom;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA384Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Arrays;

/**
 * {@link Cryptographer} backed by the BouncyCastle lightweight API. Produces byte-identical output to
 * {@link JcaCryptographer}; use it where the JCA providers are restricted or replaced.
 */
public class BouncyCastleCryptographer implements Cryptographer {

  private final SecureRandom random;

  /**
   * Instantiates a new BouncyCastle cryptographer with a default {@link SecureRandom}.
   */
  public BouncyCastleCryptographer() {
    this(new SecureRandom());
  }

  /**
   * Instantiates a new BouncyCastle cryptographer with the given random source.
   *
   * @param random the random
   */
  public BouncyCastleCryptographer(SecureRandom random) {
    this.random = random;
  }

  private static Digest newDigest(DigestAlgorithm algorithm) {
    return switch (algorithm) {
      case SHA256 -> new SHA256Digest();
      case SHA384 -> new SHA384Digest();
      case SHA512 -> new SHA512Digest();
    };
  }

  @Override
  public HmacKey newKey(DigestAlgorithm algorithm, byte[] secret) {
    return new BcHmacKey(algorithm, Arrays.clone(secret));
  }

  @Override
  public Hasher newHasher(DigestAlgorithm algorithm) {
    return new BcHasher(newDigest(algorithm));
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
    return Arrays.constantTimeAreEqual(a, b);
  }

  private static final class BcHmacKey implements HmacKey {

    private final DigestAlgorithm algorithm;
    private final byte[] secret;

    private BcHmacKey(DigestAlgorithm algorithm, byte[] secret) {
      this.algorithm = algorithm;
      this.secret = secret;
    }

    @Override
    public byte[] sign(byte[] data) {
      HMac hmac = new HMac(newDigest(algorithm));
      hmac.init(new KeyParameter(secret));
      hmac.update(data, 0, data.length);
      byte[] out = new byte[hmac.getMacSize()];
      hmac.doFinal(out, 0);
      return out;
    }

    @Override
    public DigestAlgorithm algorithm() {
      return algorithm;
    }

    @Override
    public String toString() {
      return "BcHmacKey[" + algorithm + "]";
    }
  }

  private static final class BcHasher implements Hasher {

    private Digest digest;

    private BcHasher(Digest digest) {
      this.digest = digest;
    }

    @Override
    public void update(byte[] data) {
      checkOpen().update(data, 0, data.length);
    }

    @Override
    public byte[] finish() {
      Digest open = checkOpen();
      byte[] out = new byte[open.getDigestSize()];
      open.doFinal(out, 0);
      digest = null;
      return out;
    }

    private Digest checkOpen() {
      if (digest == null) {
        throw new IllegalStateException("Hasher already finished");
      }
      return digest;
    }
  }
}
