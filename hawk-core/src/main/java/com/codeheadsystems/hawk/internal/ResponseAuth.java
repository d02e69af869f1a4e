package com.codeheadsystems.hawk.internal;

import com.codeheadsystems.hawk.config.HawkConfig;
import com.codeheadsystems.hawk.exceptions.HawkException;
import com.codeheadsystems.hawk.model.Header;
import com.codeheadsystems.hawk.model.Key;
import com.codeheadsystems.hawk.model.Mac;
import com.codeheadsystems.hawk.model.MacType;
import com.codeheadsystems.hawk.model.RequestState;
import com.codeheadsystems.hawk.model.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signing and validation of {@code Server-Authorization} headers.
 */
public class ResponseAuth {

  private static final Logger log = LoggerFactory.getLogger(ResponseAuth.class);

  private ResponseAuth() {
  }

  /**
   * Signs a response with the request's timestamp and nonce.
   *
   * @param response the response
   * @param key      the key that authenticated the request
   * @return the Server-Authorization header
   */
  public static Header makeHeader(Response response, Key key) {
    byte[] hash = response.hash();
    RequestState state = response.requestState();
    Mac mac = HawkMac.compute(MacType.RESPONSE, key, state.ts(), state.nonce(), response.method(),
        response.host(), response.port(), response.path(), hash, response.ext());
    return Header.forResponse(mac, response.ext(), hash);
  }

  /**
   * Validates a Server-Authorization header. The timestamp was generated locally so it is not
   * checked for skew.
   *
   * @param config   supplies the cryptographer
   * @param response the expected response, with a locally computed hash if any
   * @param header   the received header
   * @param key      the key used to sign the request
   * @return true if the MAC matches and the hash agrees
   */
  public static boolean validateHeader(HawkConfig config, Response response, Header header, Key key) {
    try {
      if (header.mac() == null) {
        log.debug("Server-Authorization has no mac");
        return false;
      }
      RequestState state = response.requestState();
      Mac expected = HawkMac.compute(MacType.RESPONSE, key, state.ts(), state.nonce(),
          response.method(), response.host(), response.port(), response.path(), header.hash(), header.ext());
      if (!config.cryptographer().constantTimeEquals(expected.bytes(), header.mac().bytes())) {
        log.debug("Response MAC mismatch");
        return false;
      }
      if (!RequestAuth.hashMatches(config, response.hash(), header.hash())) {
        log.debug("Response payload hash mismatch");
        return false;
      }
      return true;
    } catch (HawkException e) {
      log.debug("Response validation failed: {}", e.getMessage());
      return false;
    }
  }
}
