package com.codeheadsystems.hawk.model;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * A message authentication code. Equality is always evaluated in constant time.
 */
public final class Mac {

  private static final Base64.Encoder B64 = Base64.getEncoder();

  private final byte[] bytes;

  /**
   * Instantiates a new Mac. The bytes are copied.
   *
   * @param bytes the mac bytes
   */
  public Mac(byte[] bytes) {
    this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
  }

  /**
   * A copy of the MAC bytes.
   *
   * @return the bytes
   */
  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  /**
   * Standard, padded base64 of the MAC, as it appears in headers and bewits.
   *
   * @return the base64 string
   */
  public String toBase64() {
    return B64.encodeToString(bytes);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Mac other && MessageDigest.isEqual(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "Mac[" + toBase64() + "]";
  }
}
