package com.codeheadsystems.hawk;

import com.codeheadsystems.hawk.config.HawkConfig;
import com.codeheadsystems.hawk.crypto.DigestAlgorithm;
import com.codeheadsystems.hawk.exceptions.HawkError;
import com.codeheadsystems.hawk.exceptions.HawkException;
import com.codeheadsystems.hawk.internal.RequestAuth;
import com.codeheadsystems.hawk.internal.ResponseAuth;
import com.codeheadsystems.hawk.model.Bewit;
import com.codeheadsystems.hawk.model.Header;
import com.codeheadsystems.hawk.model.Key;
import com.codeheadsystems.hawk.model.Request;
import com.codeheadsystems.hawk.model.RequestState;
import com.codeheadsystems.hawk.model.Response;
import com.codeheadsystems.hawk.payload.PayloadHasher;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hawk server public API. Validates request headers and bewits and signs responses.
 * Credential lookup and nonce tracking are the caller's concern.
 */
public class Server {

  private static final Logger log = LoggerFactory.getLogger(Server.class);

  private final HawkConfig config;

  /**
   * Creates a server with the default configuration.
   */
  public Server() {
    this(HawkConfig.DEFAULT);
  }

  /**
   * Creates a server.
   *
   * @param config the config
   */
  public Server(HawkConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    log.info("Server({}, skew={})", config.cryptographer().getClass().getSimpleName(), config.timestampSkew());
  }

  public HawkConfig config() {
    return config;
  }

  /**
   * Validates an Authorization header with the configured skew.
   *
   * @param request the request, carrying a hash computed from the received payload if it is to be
   *                authenticated
   * @param header  the parsed header
   * @param key     the key for the header's id
   * @return true if the request is authentic and fresh
   */
  public boolean validateHeader(Request request, Header header, Key key) {
    return validateHeader(request, header, key, config.timestampSkew());
  }

  /**
   * Validates an Authorization header with an explicit skew.
   *
   * @param request the request
   * @param header  the parsed header
   * @param key     the key
   * @param skew    the allowed timestamp skew
   * @return true if the request is authentic and fresh
   */
  public boolean validateHeader(Request request, Header header, Key key, Duration skew) {
    log.trace("validateHeader(id={})", header.id());
    return RequestAuth.validateHeader(config, request, header, key, skew);
  }

  /**
   * Validates a bewit.
   *
   * @param request the request, whose path has had the bewit removed
   * @param bewit   the bewit
   * @param key     the key for the bewit's id
   * @return true if the bewit is authentic and unexpired
   */
  public boolean validateBewit(Request request, Bewit bewit, Key key) {
    log.trace("validateBewit(id={})", bewit.id());
    return RequestAuth.validateBewit(config, request, bewit, key);
  }

  /**
   * The response to a validated request.
   *
   * @param request the request
   * @param header  the request's Authorization header
   * @return the response, to which a hash and ext may be added
   * @throws HawkException with {@link HawkError#MISSING_ATTRIBUTES} if the header lacks ts or nonce
   */
  public Response responseFor(Request request, Header header) {
    if (header.ts() == null || header.nonce() == null) {
      throw new HawkException(HawkError.MISSING_ATTRIBUTES, "Request header requires ts and nonce");
    }
    return Response.forRequest(request, new RequestState(header.ts(), header.nonce()));
  }

  /**
   * Signs a response.
   *
   * @param response the response
   * @param key      the key that authenticated the request
   * @return the Server-Authorization header
   */
  public Header makeResponseHeader(Response response, Key key) {
    log.trace("makeResponseHeader()");
    return ResponseAuth.makeHeader(response, key);
  }

  /**
   * Hashes a payload with this server's cryptographer.
   *
   * @param contentType the content type
   * @param algorithm   the digest algorithm
   * @param payload     the payload
   * @return the payload hash
   */
  public byte[] hashPayload(String contentType, DigestAlgorithm algorithm, byte[] payload) {
    return PayloadHasher.hash(contentType, algorithm, config.cryptographer(), payload);
  }
}
