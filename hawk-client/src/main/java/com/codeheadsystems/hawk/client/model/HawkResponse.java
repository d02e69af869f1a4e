package com.codeheadsystems.hawk.client.model;

/**
 * A response received through the Hawk accessor.
 *
 * @param statusCode          the HTTP status
 * @param contentType         the Content-Type header, or null
 * @param body                the body
 * @param serverAuthenticated whether a Server-Authorization header was present and valid
 */
public record HawkResponse(int statusCode, String contentType, byte[] body, boolean serverAuthenticated) {
}
