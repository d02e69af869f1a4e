package com.codeheadsystems.hawk.model;

import com.codeheadsystems.hawk.internal.BewitCodec;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * A bewit: a self-contained, time-limited credential for a single GET request, carried in the
 * {@code bewit} query parameter instead of an {@code Authorization} header.
 * <p>
 * An empty ext is stored as {@code null}; both encode identically.
 *
 * @param id  the credential id
 * @param exp the absolute expiration, truncated to seconds
 * @param mac the MAC over the request with {@code exp} in place of the timestamp
 * @param ext application-specific data, may be null
 */
public record Bewit(String id, Instant exp, Mac mac, String ext) {

  public Bewit {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(exp, "exp");
    Objects.requireNonNull(mac, "mac");
    if (exp.isBefore(Instant.EPOCH)) {
      throw new IllegalArgumentException("Bewit expiration must not precede the epoch: " + exp);
    }
    if (id.indexOf('\\') >= 0) {
      throw new IllegalArgumentException("Bewit id must not contain '\\'");
    }
    if (ext != null && ext.indexOf('\\') >= 0) {
      throw new IllegalArgumentException("Bewit ext must not contain '\\'");
    }
    exp = exp.truncatedTo(ChronoUnit.SECONDS);
    ext = ext == null || ext.isEmpty() ? null : ext;
  }

  /**
   * Decodes the value of a {@code bewit} query parameter.
   *
   * @param encoded the url-safe base64 bewit
   * @return the bewit
   * @throws com.codeheadsystems.hawk.exceptions.HawkException if the value is malformed
   */
  public static Bewit decode(String encoded) {
    return BewitCodec.decode(encoded);
  }

  /**
   * Extracts the single {@code bewit} parameter from a path and query string.
   *
   * @param pathAndQuery the request path including its query
   * @return the bewit and the path without it, or empty if the path has no bewit
   * @throws com.codeheadsystems.hawk.exceptions.HawkException if the bewit is malformed or repeated
   */
  public static Optional<ExtractedBewit> fromPath(String pathAndQuery) {
    return BewitCodec.fromPath(pathAndQuery);
  }

  /**
   * Encodes this bewit for use as a query parameter value.
   *
   * @return the url-safe base64 bewit, without padding
   */
  public String encode() {
    return BewitCodec.encode(this);
  }
}
