package com.codeheadsystems.hawk.server.model;

import java.util.Objects;

/**
 * The parts of an incoming HTTP request needed to authenticate it, as extracted by a transport
 * adapter.
 *
 * @param method        the HTTP method
 * @param host          the host the client addressed, without port
 * @param port          the port the client addressed
 * @param pathAndQuery  the raw path including any query string
 * @param authorization the {@code Authorization} header value, or null
 * @param contentType   the {@code Content-Type} header value, or null
 * @param payload       the request body, or null if not buffered
 */
public record IncomingRequest(String method, String host, int port, String pathAndQuery,
                              String authorization, String contentType, byte[] payload) {

  public IncomingRequest {
    if (method == null || method.isBlank()) {
      throw new IllegalArgumentException("method is required");
    }
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("host is required");
    }
    if (pathAndQuery == null || pathAndQuery.isEmpty()) {
      throw new IllegalArgumentException("pathAndQuery is required");
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
  }

  /**
   * A request without body, authenticated by header or bewit.
   *
   * @param method        the method
   * @param host          the host
   * @param port          the port
   * @param pathAndQuery  the path and query
   * @param authorization the Authorization header, or null for bewit requests
   * @return the incoming request
   */
  public static IncomingRequest of(String method, String host, int port, String pathAndQuery,
                                   String authorization) {
    return new IncomingRequest(method, host, port, pathAndQuery, authorization, null, null);
  }

  /**
   * Returns a copy carrying a body.
   *
   * @param contentType the raw Content-Type
   * @param payload     the body
   * @return the incoming request
   */
  public IncomingRequest withPayload(String contentType, byte[] payload) {
    return new IncomingRequest(method, host, port, pathAndQuery, authorization, contentType,
        Objects.requireNonNull(payload, "payload"));
  }
}
