package com.codeheadsystems.hawk.server.model;

import com.codeheadsystems.hawk.model.Bewit;
import com.codeheadsystems.hawk.model.Credentials;
import com.codeheadsystems.hawk.model.Header;
import com.codeheadsystems.hawk.model.Request;

/**
 * The outcome of a successful authentication.
 * Exactly one of {@code header} and {@code bewit} is set.
 *
 * @param credentials        the credentials that authenticated the request
 * @param request            the request as validated
 * @param header             the Authorization header, for header authentication
 * @param bewit              the bewit, for bewit authentication
 * @param payloadVerified    whether the request body was checked against the header's hash
 */
public record HawkAuthentication(Credentials credentials, Request request, Header header, Bewit bewit,
                                 boolean payloadVerified) {

  public String id() {
    return credentials.id();
  }

  public boolean isBewit() {
    return bewit != null;
  }

  /**
   * The application data sent by the client.
   *
   * @return the ext, or null
   */
  public String ext() {
    return isBewit() ? bewit.ext() : header.ext();
  }
}
