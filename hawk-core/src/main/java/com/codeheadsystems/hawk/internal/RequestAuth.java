package com.codeheadsystems.hawk.internal;

import com.codeheadsystems.hawk.config.HawkConfig;
import com.codeheadsystems.hawk.exceptions.HawkException;
import com.codeheadsystems.hawk.model.Bewit;
import com.codeheadsystems.hawk.model.Credentials;
import com.codeheadsystems.hawk.model.Header;
import com.codeheadsystems.hawk.model.Key;
import com.codeheadsystems.hawk.model.Mac;
import com.codeheadsystems.hawk.model.MacType;
import com.codeheadsystems.hawk.model.Request;
import com.codeheadsystems.hawk.model.RequestState;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signing and validation of requests, by {@code Authorization} header or by bewit.
 * Validation never throws for bad input; the failure reason is logged at debug level.
 */
public class RequestAuth {

  private static final Logger log = LoggerFactory.getLogger(RequestAuth.class);

  // Bewits are signed with an empty nonce.
  private static final String BEWIT_NONCE = "";

  private RequestAuth() {
  }

  /**
   * Signs a request.
   *
   * @param request     the request
   * @param credentials the credentials
   * @param state       the timestamp and nonce to sign with
   * @return the Authorization header
   */
  public static Header makeHeader(Request request, Credentials credentials, RequestState state) {
    byte[] hash = request.hash();
    Mac mac = HawkMac.compute(MacType.HEADER, credentials.key(), state.ts(), state.nonce(),
        request.method(), request.host(), request.port(), request.path(), hash, request.ext());
    return new Header(credentials.id(), state.ts(), state.nonce(), mac, request.ext(), hash,
        request.app(), request.dlg());
  }

  /**
   * Validates an Authorization header against a request.
   *
   * @param config  supplies the cryptographer and clock
   * @param request the request as seen by the server, with a locally computed hash if any
   * @param header  the received header
   * @param key     the key for the header's id
   * @param skew    the allowed timestamp skew
   * @return true if the MAC matches, the hash agrees and the timestamp is fresh
   */
  public static boolean validateHeader(HawkConfig config, Request request, Header header, Key key,
                                       Duration skew) {
    try {
      if (header.ts() == null || header.nonce() == null || header.mac() == null) {
        log.debug("Header is missing ts, nonce or mac");
        return false;
      }
      Mac expected = HawkMac.compute(MacType.HEADER, key, header.ts(), header.nonce(),
          request.method(), request.host(), request.port(), request.path(), header.hash(), header.ext());
      if (!config.cryptographer().constantTimeEquals(expected.bytes(), header.mac().bytes())) {
        log.debug("MAC mismatch for id {}", header.id());
        return false;
      }
      if (!hashMatches(config, request.hash(), header.hash())) {
        log.debug("Payload hash mismatch for id {}", header.id());
        return false;
      }
      Instant now = Instant.now(config.clock());
      if (Duration.between(header.ts(), now).abs().compareTo(skew) > 0) {
        log.debug("Timestamp {} outside allowed skew {} of {}", header.ts(), skew, now);
        return false;
      }
      return true;
    } catch (HawkException e) {
      log.debug("Header validation failed: {}", e.getMessage());
      return false;
    }
  }

  /**
   * Creates a bewit for a request. The request's ext is carried in the bewit.
   *
   * @param request     the request
   * @param credentials the credentials
   * @param exp         the absolute expiration
   * @return the bewit
   */
  public static Bewit makeBewit(Request request, Credentials credentials, Instant exp) {
    Mac mac = bewitMac(request, credentials.key(), exp, request.ext());
    return new Bewit(credentials.id(), exp, mac, request.ext());
  }

  /**
   * Validates a bewit against a request whose path no longer contains the bewit parameter.
   *
   * @param config  supplies the cryptographer and clock
   * @param request the request
   * @param bewit   the bewit
   * @param key     the key for the bewit's id
   * @return true if the MAC matches and the bewit has not expired
   */
  public static boolean validateBewit(HawkConfig config, Request request, Bewit bewit, Key key) {
    try {
      Mac expected = bewitMac(request, key, bewit.exp(), bewit.ext());
      if (!config.cryptographer().constantTimeEquals(expected.bytes(), bewit.mac().bytes())) {
        log.debug("Bewit MAC mismatch for id {}", bewit.id());
        return false;
      }
      Instant now = Instant.now(config.clock());
      if (now.isAfter(bewit.exp())) {
        log.debug("Bewit for id {} expired at {}", bewit.id(), bewit.exp());
        return false;
      }
      return true;
    } catch (HawkException e) {
      log.debug("Bewit validation failed: {}", e.getMessage());
      return false;
    }
  }

  private static Mac bewitMac(Request request, Key key, Instant exp, String ext) {
    return HawkMac.compute(MacType.HEADER, key, exp, BEWIT_NONCE, request.method(), request.host(),
        request.port(), request.path(), request.hash(), ext);
  }

  static boolean hashMatches(HawkConfig config, byte[] local, byte[] remote) {
    if (local == null) {
      return true;
    }
    return remote != null && config.cryptographer().constantTimeEquals(local, remote);
  }
}
