package com.codeheadsystems.hawk.exceptions;

/**
 * The kinds of failure a {@link HawkException} can report.
 */
public enum HawkError {

  /**
   * The attribute list of a Hawk header is malformed, or the scheme is not {@code Hawk}.
   */
  HEADER_PARSE_ERROR("Unparseable Hawk header"),
  /**
   * A header attribute name is not one of id, ts, nonce, mac, ext, hash, app, dlg.
   */
  UNKNOWN_ATTRIBUTE("Unknown Hawk header attribute"),
  /**
   * A required header attribute is absent.
   */
  MISSING_ATTRIBUTES("Missing required Hawk header attributes"),
  /**
   * The {@code ts} attribute is not a base-10 integer.
   */
  INVALID_TIMESTAMP("Invalid Hawk timestamp"),
  /**
   * A {@code mac}, {@code hash} or bewit value is not valid base64.
   */
  BASE64_DECODE_ERROR("Invalid base64 value"),
  /**
   * A decoded bewit does not have exactly four backslash-separated parts.
   */
  INVALID_BEWIT_FORMAT("Invalid bewit format"),
  /**
   * The bewit id is not valid UTF-8.
   */
  INVALID_BEWIT_ID("Invalid bewit id"),
  /**
   * The bewit expiration is not an unsigned base-10 integer.
   */
  INVALID_BEWIT_EXP("Invalid bewit expiration"),
  /**
   * The bewit mac is not valid base64.
   */
  INVALID_BEWIT_MAC("Invalid bewit mac"),
  /**
   * The bewit ext is not valid UTF-8.
   */
  INVALID_BEWIT_EXT("Invalid bewit ext"),
  /**
   * More than one {@code bewit=} parameter was found in a path.
   */
  MULTIPLE_BEWITS("Multiple bewits in request path"),
  /**
   * Host, port or path could not be derived from a URL.
   */
  INVALID_URL("Invalid URL"),
  /**
   * The cryptographic backend failed.
   */
  CRYPTO_ERROR("Cryptographic operation failed");

  private final String description;

  HawkError(String description) {
    this.description = description;
  }

  /**
   * Human-readable description of the error kind.
   *
   * @return the description
   */
  public String description() {
    return description;
  }
}
