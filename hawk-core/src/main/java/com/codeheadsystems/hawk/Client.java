package com.codeheadsystems.hawk;

import com.codeheadsystems.hawk.config.HawkConfig;
import com.codeheadsystems.hawk.crypto.DigestAlgorithm;
import com.codeheadsystems.hawk.internal.RequestAuth;
import com.codeheadsystems.hawk.internal.ResponseAuth;
import com.codeheadsystems.hawk.model.Bewit;
import com.codeheadsystems.hawk.model.Credentials;
import com.codeheadsystems.hawk.model.Header;
import com.codeheadsystems.hawk.model.Key;
import com.codeheadsystems.hawk.model.Request;
import com.codeheadsystems.hawk.model.RequestState;
import com.codeheadsystems.hawk.model.Response;
import com.codeheadsystems.hawk.payload.PayloadHasher;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hawk client public API. Signs requests, creates bewits and validates server responses.
 * Stateless and thread-safe.
 */
public class Client {

  private static final Logger log = LoggerFactory.getLogger(Client.class);

  private final HawkConfig config;

  /**
   * Creates a client with the default configuration.
   */
  public Client() {
    this(HawkConfig.DEFAULT);
  }

  /**
   * Creates a client.
   *
   * @param config the config
   */
  public Client(HawkConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    log.info("Client({}, skew={})", config.cryptographer().getClass().getSimpleName(), config.timestampSkew());
  }

  public HawkConfig config() {
    return config;
  }

  /**
   * Generates a fresh timestamp and nonce. Keep it to validate the server's response.
   *
   * @return the request state
   */
  public RequestState newRequestState() {
    return RequestState.generate(config);
  }

  /**
   * Signs a request with a freshly generated state.
   *
   * @param request     the request
   * @param credentials the credentials
   * @return the Authorization header
   */
  public Header makeHeader(Request request, Credentials credentials) {
    return makeHeader(request, credentials, newRequestState());
  }

  /**
   * Signs a request with the given state.
   *
   * @param request     the request
   * @param credentials the credentials
   * @param state       the timestamp and nonce
   * @return the Authorization header
   */
  public Header makeHeader(Request request, Credentials credentials, RequestState state) {
    log.trace("makeHeader(id={}, method={})", credentials.id(), request.method());
    return RequestAuth.makeHeader(request, credentials, state);
  }

  /**
   * Creates a bewit that expires at the given instant.
   *
   * @param request     the request, with its path excluding any bewit
   * @param credentials the credentials
   * @param exp         the expiration
   * @return the bewit
   */
  public Bewit makeBewit(Request request, Credentials credentials, Instant exp) {
    log.trace("makeBewit(id={}, exp={})", credentials.id(), exp);
    return RequestAuth.makeBewit(request, credentials, exp);
  }

  /**
   * Creates a bewit that expires the given duration from now.
   *
   * @param request     the request
   * @param credentials the credentials
   * @param ttl         the time to live
   * @return the bewit
   */
  public Bewit makeBewitWithTtl(Request request, Credentials credentials, Duration ttl) {
    return makeBewit(request, credentials, Instant.now(config.clock()).plus(ttl));
  }

  /**
   * The response expected for a signed request. Add a hash with {@link Response#withHash} to
   * require the server to authenticate its payload.
   *
   * @param request the request
   * @param state   the state the request was signed with
   * @return the response
   */
  public Response responseFor(Request request, RequestState state) {
    return Response.forRequest(request, state);
  }

  /**
   * Validates a Server-Authorization header.
   *
   * @param response the expected response
   * @param header   the received header
   * @param key      the key the request was signed with
   * @return true if the response is authentic
   */
  public boolean validateResponse(Response response, Header header, Key key) {
    log.trace("validateResponse()");
    return ResponseAuth.validateHeader(config, response, header, key);
  }

  /**
   * Hashes a payload with this client's cryptographer.
   *
   * @param contentType the content type
   * @param algorithm   the digest algorithm
   * @param payload     the payload
   * @return the payload hash
   */
  public byte[] hashPayload(String contentType, DigestAlgorithm algorithm, byte[] payload) {
    return PayloadHasher.hash(contentType, algorithm, config.cryptographer(), payload);
  }

  /**
   * Starts a streaming payload hash with this client's cryptographer.
   *
   * @param contentType the content type
   * @param algorithm   the digest algorithm
   * @return the hasher
   */
  public PayloadHasher newPayloadHasher(String contentType, DigestAlgorithm algorithm) {
    return new PayloadHasher(contentType, algorithm, config.cryptographer());
  }
}
