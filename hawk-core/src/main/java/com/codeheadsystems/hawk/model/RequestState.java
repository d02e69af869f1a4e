package com.codeheadsystems.hawk.model;

import com.codeheadsystems.hawk.config.HawkConfig;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Objects;

/**
 * The per-request nonce and timestamp. Generated by the client before signing and kept to
 * validate the server's response.
 *
 * @param ts    the request timestamp, truncated to seconds
 * @param nonce the request nonce
 */
public record RequestState(Instant ts, String nonce) {

  private static final Base64.Encoder NONCE_ENCODER = Base64.getUrlEncoder().withoutPadding();

  public RequestState {
    Objects.requireNonNull(ts, "ts");
    Objects.requireNonNull(nonce, "nonce");
    ts = ts.truncatedTo(ChronoUnit.SECONDS);
  }

  /**
   * Generates a fresh state from the config's clock and cryptographer.
   *
   * @param config the config
   * @return the request state
   */
  public static RequestState generate(HawkConfig config) {
    byte[] random = config.cryptographer().randomBytes(config.nonceLength());
    return new RequestState(Instant.now(config.clock()), NONCE_ENCODER.encodeToString(random));
  }
}
