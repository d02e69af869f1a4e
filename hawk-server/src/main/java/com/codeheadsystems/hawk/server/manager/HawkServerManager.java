package com.codeheadsystems.hawk.server.manager;

import com.codeheadsystems.hawk.Server;
import com.codeheadsystems.hawk.exceptions.HawkException;
import com.codeheadsystems.hawk.internal.HeaderCodec;
import com.codeheadsystems.hawk.model.Bewit;
import com.codeheadsystems.hawk.model.Credentials;
import com.codeheadsystems.hawk.model.ExtractedBewit;
import com.codeheadsystems.hawk.model.Header;
import com.codeheadsystems.hawk.model.Request;
import com.codeheadsystems.hawk.model.Response;
import com.codeheadsystems.hawk.payload.PayloadHasher;
import com.codeheadsystems.hawk.server.model.HawkAuthentication;
import com.codeheadsystems.hawk.server.model.IncomingRequest;
import com.codeheadsystems.hawk.server.store.CredentialStore;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service implementing the server side of Hawk authentication.
 * <p>
 * Resolves credentials through the {@link CredentialStore} and delegates the cryptographic checks
 * to {@link Server}, so that transport adapters can remain thin wrappers that only translate
 * exceptions into HTTP responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException} for a malformed Authorization header or bewit: HTTP 400</li>
 *   <li>{@link SecurityException} for any authentication failure: HTTP 401 with
 *       {@code WWW-Authenticate: Hawk}</li>
 * </ul>
 * Authentication failures all carry the same message so that callers cannot tell an unknown id
 * from a bad MAC.
 * <p>
 * Nonces are not tracked. Replay protection beyond the timestamp window is left to the caller.
 */
public class HawkServerManager {

  public static final String AUTHENTICATION_FAILED = "Authentication failed";

  private static final Logger log = LoggerFactory.getLogger(HawkServerManager.class);

  // Bewits authorize resource retrieval only; HEAD is validated as the GET it stands for.
  private static final Set<String> BEWIT_METHODS = Set.of("GET", "HEAD");
  private static final String BEWIT_SIGNED_METHOD = "GET";

  private final Server server;
  private final CredentialStore credentialStore;

  /**
   * Instantiates a new Hawk server manager.
   *
   * @param server          the server
   * @param credentialStore the credential store
   */
  public HawkServerManager(Server server, CredentialStore credentialStore) {
    this.server = server;
    this.credentialStore = credentialStore;
    log.info("HawkServerManager({})", credentialStore.getClass().getSimpleName());
  }

  /**
   * Authenticates a request by its Authorization header or, when it has none, by a bewit in its
   * query string. When the header carries a payload hash and the request carries a body, the body
   * is authenticated too.
   *
   * @param incoming the incoming request
   * @return the authentication
   * @throws IllegalArgumentException if the header or bewit is malformed
   * @throws SecurityException        if authentication fails
   */
  public HawkAuthentication authenticate(IncomingRequest incoming) {
    log.trace("authenticate(method={}, host={}, port={})", incoming.method(), incoming.host(), incoming.port());
    if (incoming.authorization() != null) {
      return authenticateHeader(incoming);
    }
    return authenticateBewit(incoming);
  }

  /**
   * Authenticates a body received after the header was validated.
   *
   * @param authentication the header authentication
   * @param contentType    the raw Content-Type
   * @param payload        the body
   * @throws SecurityException if the header carried no hash or the hash does not match
   */
  public void authenticatePayload(HawkAuthentication authentication, String contentType, byte[] payload) {
    log.trace("authenticatePayload(id={})", authentication.id());
    Header header = authentication.header();
    byte[] expected = header == null ? null : header.hash();
    if (expected == null) {
      log.debug("No payload hash to authenticate against for id {}", authentication.id());
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    byte[] actual = hashPayload(authentication.credentials(), contentType, payload);
    if (!server.config().cryptographer().constantTimeEquals(expected, actual)) {
      log.debug("Payload hash mismatch for id {}", authentication.id());
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
  }

  /**
   * Creates the {@code Server-Authorization} header value for the response to an authenticated
   * request.
   *
   * @param authentication  the header authentication of the request
   * @param contentType     the response Content-Type, used only when a payload is given
   * @param responsePayload the response body to authenticate, or null
   * @param ext             application data for the client, or null
   * @return the header value, scheme included
   * @throws IllegalArgumentException if the request was authenticated by bewit
   */
  public String serverAuthorization(HawkAuthentication authentication, String contentType,
                                    byte[] responsePayload, String ext) {
    log.trace("serverAuthorization(id={})", authentication.id());
    if (authentication.isBewit()) {
      throw new IllegalArgumentException("Server-Authorization requires header authentication");
    }
    Response response = server.responseFor(authentication.request(), authentication.header()).withExt(ext);
    if (responsePayload != null) {
      response = response.withHash(hashPayload(authentication.credentials(), contentType, responsePayload));
    }
    Header header = server.makeResponseHeader(response, authentication.credentials().key());
    return HeaderCodec.formatAuthorization(header);
  }

  private HawkAuthentication authenticateHeader(IncomingRequest incoming) {
    Header header;
    try {
      header = HeaderCodec.parseAuthorization(incoming.authorization());
    } catch (HawkException e) {
      log.debug("Rejected Authorization header: {}", e.getMessage());
      throw new IllegalArgumentException("Invalid Authorization header: " + e.error().description(), e);
    }
    Credentials credentials = loadCredentials(header.id());
    Request request = Request.of(incoming.method(), incoming.host(), incoming.port(), incoming.pathAndQuery());
    boolean payloadVerified = header.hash() != null && incoming.payload() != null;
    if (payloadVerified) {
      request = request.withHash(hashPayload(credentials, incoming.contentType(), incoming.payload()));
    }
    if (!server.validateHeader(request, header, credentials.key())) {
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    return new HawkAuthentication(credentials, request, header, null, payloadVerified);
  }

  private HawkAuthentication authenticateBewit(IncomingRequest incoming) {
    Optional<ExtractedBewit> extracted;
    try {
      extracted = Bewit.fromPath(incoming.pathAndQuery());
    } catch (HawkException e) {
      log.debug("Rejected bewit: {}", e.getMessage());
      throw new IllegalArgumentException("Invalid bewit: " + e.error().description(), e);
    }
    if (extracted.isEmpty()) {
      log.debug("No Authorization header and no bewit");
      throw new SecurityException("Authentication required");
    }
    if (!BEWIT_METHODS.contains(incoming.method())) {
      log.debug("Bewit presented with method {}", incoming.method());
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    Bewit bewit = extracted.get().bewit();
    Credentials credentials = loadCredentials(bewit.id());
    Request request = Request.of(BEWIT_SIGNED_METHOD, incoming.host(), incoming.port(), extracted.get().path());
    if (!server.validateBewit(request, bewit, credentials.key())) {
      throw new SecurityException(AUTHENTICATION_FAILED);
    }
    return new HawkAuthentication(credentials, request, null, bewit, false);
  }

  private Credentials loadCredentials(String id) {
    return credentialStore.load(id).orElseThrow(() -> {
      log.debug("Unknown credential id {}", id);
      return new SecurityException(AUTHENTICATION_FAILED);
    });
  }

  private byte[] hashPayload(Credentials credentials, String contentType, byte[] payload) {
    return server.hashPayload(PayloadHasher.normalizeContentType(contentType),
        credentials.key().algorithm(), payload);
  }
}
