package com.codeheadsystems.hawk.client.accessor;

import com.codeheadsystems.hawk.Client;
import com.codeheadsystems.hawk.client.config.HawkClientConfig;
import com.codeheadsystems.hawk.client.exceptions.HawkAccessorException;
import com.codeheadsystems.hawk.client.model.HawkResponse;
import com.codeheadsystems.hawk.exceptions.HawkException;
import com.codeheadsystems.hawk.internal.BewitCodec;
import com.codeheadsystems.hawk.internal.HeaderCodec;
import com.codeheadsystems.hawk.model.Bewit;
import com.codeheadsystems.hawk.model.Credentials;
import com.codeheadsystems.hawk.model.Header;
import com.codeheadsystems.hawk.model.Request;
import com.codeheadsystems.hawk.model.RequestState;
import com.codeheadsystems.hawk.model.Response;
import com.codeheadsystems.hawk.payload.PayloadHasher;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends Hawk-authenticated requests over {@link HttpClient} and authenticates the responses.
 */
@Singleton
public class HawkAccessor {

  public static final String AUTHORIZATION = "Authorization";
  public static final String SERVER_AUTHORIZATION = "Server-Authorization";
  public static final String CONTENT_TYPE = "Content-Type";

  private static final Logger log = LoggerFactory.getLogger(HawkAccessor.class);

  private final HawkClientConfig config;
  private final HttpClient httpClient;
  private final Client client;

  /**
   * Instantiates a new Hawk accessor.
   *
   * @param config     the client config
   * @param httpClient the http client
   */
  @Inject
  public HawkAccessor(final HawkClientConfig config, final HttpClient httpClient) {
    log.info("HawkAccessor({})", config);
    this.config = config;
    this.httpClient = httpClient;
    this.client = new Client(config.hawkConfig());
  }

  /**
   * Sends a GET request.
   *
   * @param uri the absolute uri
   * @return the response
   */
  public HawkResponse get(final URI uri) {
    return send("GET", uri, null, null, null);
  }

  /**
   * Sends a POST request whose body is covered by the MAC.
   *
   * @param uri         the absolute uri
   * @param contentType the content type
   * @param body        the body
   * @return the response
   */
  public HawkResponse post(final URI uri, final String contentType, final byte[] body) {
    return send("POST", uri, contentType, body, null);
  }

  /**
   * Signs and sends a request, then authenticates the response.
   *
   * @param method      the method
   * @param uri         the absolute uri
   * @param contentType the content type of the body, ignored without a body
   * @param body        the body, or null for none
   * @param ext         application data to send, or null
   * @return the response
   * @throws SecurityException     if the server rejects the request (401) or its response fails
   *                               authentication
   * @throws HawkAccessorException on I/O failure, interruption or an HTTP error status
   */
  public HawkResponse send(final String method, final URI uri, final String contentType,
                           final byte[] body, final String ext) {
    log.trace("send(method={}, uri={})", method, uri);
    final Credentials credentials = config.credentials();
    Request request = toRequest(method, uri).withExt(ext).withApp(config.app()).withDlg(config.dlg());
    if (body != null) {
      request = request.withHash(hash(contentType, body));
    }
    final RequestState state = client.newRequestState();
    final Header header = client.makeHeader(request, credentials, state);

    final HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri)
        .header(AUTHORIZATION, HeaderCodec.formatAuthorization(header));
    if (body == null) {
      builder.method(method, HttpRequest.BodyPublishers.noBody());
    } else {
      if (contentType != null) {
        builder.header(CONTENT_TYPE, contentType);
      }
      builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
    }

    try {
      final HttpResponse<byte[]> httpResponse = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
      checkStatus(uri, httpResponse.statusCode());
      final String responseType = httpResponse.headers().firstValue(CONTENT_TYPE).orElse(null);
      final byte[] responseBody = httpResponse.body() == null ? new byte[0] : httpResponse.body();
      final boolean authenticated = authenticateResponse(request, state,
          httpResponse.headers().firstValue(SERVER_AUTHORIZATION), responseType, responseBody);
      return new HawkResponse(httpResponse.statusCode(), responseType, responseBody, authenticated);
    } catch (IOException e) {
      throw new HawkAccessorException("HTTP request failed for: " + uri, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HawkAccessorException("HTTP request interrupted for: " + uri, e);
    }
  }

  /**
   * Returns the uri with a {@code bewit} query parameter granting GET access until the ttl elapses.
   *
   * @param uri the absolute uri, without a bewit
   * @param ttl how long the bewit stays valid
   * @return the uri carrying the bewit
   */
  public URI bewitUri(final URI uri, final Duration ttl) {
    log.trace("bewitUri(uri={}, ttl={})", uri, ttl);
    final Request request = toRequest("GET", uri);
    final Bewit bewit = client.makeBewitWithTtl(request, config.credentials(), ttl);
    final String separator = uri.getRawQuery() == null ? "?" : "&";
    final StringBuilder result = new StringBuilder()
        .append(uri.getScheme()).append("://").append(uri.getRawAuthority())
        .append(request.path()).append(separator)
        .append(BewitCodec.QUERY_PARAMETER).append('=').append(bewit.encode());
    if (uri.getRawFragment() != null) {
      result.append('#').append(uri.getRawFragment());
    }
    return URI.create(result.toString());
  }

  private boolean authenticateResponse(final Request request, final RequestState state,
                                       final Optional<String> serverAuthorization,
                                       final String contentType, final byte[] body) {
    if (serverAuthorization.isEmpty()) {
      if (config.requireServerAuthorization()) {
        throw new SecurityException("Missing " + SERVER_AUTHORIZATION + " header");
      }
      return false;
    }
    final Header header;
    try {
      header = HeaderCodec.parseServerAuthorization(serverAuthorization.get());
    } catch (HawkException e) {
      throw new SecurityException("Invalid " + SERVER_AUTHORIZATION + " header", e);
    }
    Response expected = client.responseFor(request, state);
    if (header.hash() != null || (config.requireServerAuthorization() && body.length > 0)) {
      expected = expected.withHash(hash(contentType, body));
    }
    if (!client.validateResponse(expected, header, config.credentials().key())) {
      throw new SecurityException("Server response failed authentication");
    }
    return true;
  }

  private Request toRequest(final String method, final URI uri) {
    try {
      return Request.fromUri(method, uri);
    } catch (HawkException e) {
      throw new IllegalArgumentException("Cannot sign request for: " + uri, e);
    }
  }

  private byte[] hash(final String contentType, final byte[] body) {
    return client.hashPayload(PayloadHasher.normalizeContentType(contentType),
        config.credentials().key().algorithm(), body);
  }

  private void checkStatus(final URI uri, final int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("Server rejected request (401) for: " + uri);
    }
    if (statusCode >= 400) {
      throw new HawkAccessorException("Server returned HTTP " + statusCode + " for: " + uri, null);
    }
  }
}
