package com.codeheadsystems.hawk.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A response to an authenticated request. Used by the server to create a
 * {@code Server-Authorization} header and by the client to validate one.
 * <p>
 * The method, host, port and path are those of the request being answered; the request state is the
 * nonce and timestamp the request was signed with.
 *
 * @param method       the request method
 * @param host         the request host
 * @param port         the request port
 * @param path         the request path and query
 * @param requestState the request's timestamp and nonce
 * @param hash         the response payload hash, may be null
 * @param ext          application-specific data, may be null
 */
public record Response(String method, String host, int port, String path, RequestState requestState,
                       byte[] hash, String ext) {

  public Response {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(requestState, "requestState");
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Port out of range: " + port);
    }
    if (ext != null && ext.indexOf('"') >= 0) {
      throw new IllegalArgumentException("Response attribute 'ext' must not contain '\"'");
    }
    hash = hash == null ? null : hash.clone();
  }

  /**
   * Creates a response for the given request, with no hash or ext.
   *
   * @param request      the request
   * @param requestState the state the request was signed with
   * @return the response
   */
  public static Response forRequest(Request request, RequestState requestState) {
    return new Response(request.method(), request.host(), request.port(), request.path(),
        requestState, null, null);
  }

  @Override
  public byte[] hash() {
    return hash == null ? null : hash.clone();
  }

  /**
   * Returns a copy carrying the given response payload hash. On the client this declares that the
   * server must send a matching hash.
   *
   * @param hash the payload hash, may be null
   * @return the response
   */
  public Response withHash(byte[] hash) {
    return new Response(method, host, port, path, requestState, hash, ext);
  }

  /**
   * Returns a copy carrying the given ext. Only meaningful on the server.
   *
   * @param ext the ext, may be null
   * @return the response
   */
  public Response withExt(String ext) {
    return new Response(method, host, port, path, requestState, hash, ext);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Response other
        && port == other.port
        && method.equals(other.method)
        && host.equals(other.host)
        && path.equals(other.path)
        && requestState.equals(other.requestState)
        && Arrays.equals(hash, other.hash)
        && Objects.equals(ext, other.ext);
  }

  @Override
  public int hashCode() {
    return Objects.hash(method, host, port, path, requestState, Arrays.hashCode(hash), ext);
  }

  @Override
  public String toString() {
    return "Response[" + method + " " + host + ":" + port + path + "]";
  }
}
