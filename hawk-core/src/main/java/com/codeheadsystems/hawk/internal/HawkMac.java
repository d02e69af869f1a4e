package com.codeheadsystems.hawk.internal;

import com.codeheadsystems.hawk.model.Key;
import com.codeheadsystems.hawk.model.Mac;
import com.codeheadsystems.hawk.model.MacType;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/**
 * Builds the Hawk canonical string and signs it.
 * <p>
 * The canonical string is nine newline-terminated lines: the kind tag, ts, nonce, method, path,
 * host, port, base64 hash and ext. Absent hash and ext are empty lines.
 */
public class HawkMac {

  private static final Base64.Encoder B64 = Base64.getEncoder();

  private HawkMac() {
  }

  /**
   * Computes a MAC over the canonical string.
   *
   * @param kind   header or response
   * @param key    the signing key
   * @param ts     the timestamp, in epoch seconds on the wire
   * @param nonce  the nonce
   * @param method the method
   * @param host   the host
   * @param port   the port
   * @param path   the path and query
   * @param hash   the payload hash, may be null
   * @param ext    the ext, may be null
   * @return the MAC
   * @throws com.codeheadsystems.hawk.exceptions.HawkException with {@code CRYPTO_ERROR} if the
   *                                                            backend fails
   */
  public static Mac compute(MacType kind, Key key, Instant ts, String nonce, String method,
                            String host, int port, String path, byte[] hash, String ext) {
    String canonical = canonicalString(kind, ts, nonce, method, host, port, path, hash, ext);
    return new Mac(key.sign(canonical.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * The canonical string that {@link #compute} signs.
   *
   * @param kind   header or response
   * @param ts     the timestamp
   * @param nonce  the nonce
   * @param method the method
   * @param host   the host
   * @param port   the port
   * @param path   the path and query
   * @param hash   the payload hash, may be null
   * @param ext    the ext, may be null
   * @return the canonical string
   */
  public static String canonicalString(MacType kind, Instant ts, String nonce, String method,
                                       String host, int port, String path, byte[] hash, String ext) {
    return kind.tag() + '\n'
        + ts.getEpochSecond() + '\n'
        + nonce + '\n'
        + method + '\n'
        + path + '\n'
        + host + '\n'
        + port + '\n'
        + (hash == null ? "" : B64.encodeToString(hash)) + '\n'
        + (ext == null ? "" : ext) + '\n';
  }
}
