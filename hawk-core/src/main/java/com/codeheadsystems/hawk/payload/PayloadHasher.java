package com.codeheadsystems.hawk.payload;

import com.codeheadsystems.hawk.crypto.Cryptographer;
import com.codeheadsystems.hawk.crypto.DigestAlgorithm;
import com.codeheadsystems.hawk.crypto.Hasher;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Streaming Hawk payload hash: {@code H("hawk.1.payload\n" + contentType + "\n" + payload + "\n")}.
 * <p>
 * Single use. After {@link #finish()} every further call throws {@link IllegalStateException}.
 * Not thread-safe.
 */
public class PayloadHasher {

  private static final byte[] PREFIX = "hawk.1.payload\n".getBytes(StandardCharsets.UTF_8);
  private static final byte[] NEWLINE = {'\n'};

  private final Hasher hasher;
  private boolean finished;

  /**
   * Starts a payload hash for the given content type.
   *
   * @param contentType   the content type, already normalized
   * @param algorithm     the digest algorithm, normally that of the credentials' key
   * @param cryptographer the cryptographer
   */
  public PayloadHasher(String contentType, DigestAlgorithm algorithm, Cryptographer cryptographer) {
    Objects.requireNonNull(contentType, "contentType");
    this.hasher = cryptographer.newHasher(Objects.requireNonNull(algorithm, "algorithm"));
    hasher.update(PREFIX);
    hasher.update(contentType.getBytes(StandardCharsets.UTF_8));
    hasher.update(NEWLINE);
  }

  /**
   * Hashes a complete payload in one call.
   *
   * @param contentType   the content type
   * @param algorithm     the digest algorithm
   * @param cryptographer the cryptographer
   * @param payload       the payload
   * @return the hash
   */
  public static byte[] hash(String contentType, DigestAlgorithm algorithm, Cryptographer cryptographer,
                            byte[] payload) {
    PayloadHasher hasher = new PayloadHasher(contentType, algorithm, cryptographer);
    hasher.update(payload);
    return hasher.finish();
  }

  /**
   * Hashes a complete UTF-8 payload in one call.
   *
   * @param contentType   the content type
   * @param algorithm     the digest algorithm
   * @param cryptographer the cryptographer
   * @param payload       the payload
   * @return the hash
   */
  public static byte[] hash(String contentType, DigestAlgorithm algorithm, Cryptographer cryptographer,
                            String payload) {
    return hash(contentType, algorithm, cryptographer, payload.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Reduces a {@code Content-Type} header to its lower-case media type, without parameters.
   * {@code null} becomes the empty string.
   *
   * @param contentType the raw header value
   * @return the normalized content type
   */
  public static String normalizeContentType(String contentType) {
    if (contentType == null) {
      return "";
    }
    int semicolon = contentType.indexOf(';');
    String mediaType = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
    return mediaType.strip().toLowerCase(Locale.ROOT);
  }

  public void update(byte[] data) {
    checkNotFinished();
    hasher.update(data);
  }

  public void update(String data) {
    update(data.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Completes the hash.
   *
   * @return the digest
   */
  public byte[] finish() {
    checkNotFinished();
    finished = true;
    hasher.update(NEWLINE);
    return hasher.finish();
  }

  private void checkNotFinished() {
    if (finished) {
      throw new IllegalStateException("PayloadHasher already finished");
    }
  }
}
