package com.codeheadsystems.hawk.model;

import com.codeheadsystems.hawk.internal.HeaderCodec;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Objects;

/**
 * The attributes of a Hawk {@code Authorization} or {@code Server-Authorization} header.
 * Every attribute is optional; absent attributes are {@code null}.
 * <p>
 * The grammar has no escapes, so a {@code "} in any string attribute is rejected at construction.
 *
 * @param id    the credential id
 * @param ts    the request timestamp, truncated to seconds
 * @param nonce the request nonce
 * @param mac   the MAC
 * @param ext   application-specific data
 * @param hash  the payload hash
 * @param app   the application id
 * @param dlg   the delegated-by application id
 */
public record Header(String id, Instant ts, String nonce, Mac mac, String ext, byte[] hash,
                     String app, String dlg) {

  public Header {
    checkComponent("id", id);
    checkComponent("nonce", nonce);
    checkComponent("ext", ext);
    checkComponent("app", app);
    checkComponent("dlg", dlg);
    ts = ts == null ? null : ts.truncatedTo(ChronoUnit.SECONDS);
    hash = hash == null ? null : hash.clone();
  }

  /**
   * Creates a {@code Server-Authorization} header, which carries only mac, ext and hash.
   *
   * @param mac  the response MAC
   * @param ext  the ext, may be null
   * @param hash the response payload hash, may be null
   * @return the header
   */
  public static Header forResponse(Mac mac, String ext, byte[] hash) {
    return new Header(null, null, null, mac, ext, hash, null, null);
  }

  /**
   * Parses the attribute list of a Hawk header (the text after {@code "Hawk "}).
   * All attributes are optional here.
   *
   * @param attributes the attribute list
   * @return the header
   * @throws com.codeheadsystems.hawk.exceptions.HawkException if the text is malformed
   */
  public static Header parse(String attributes) {
    return HeaderCodec.parse(attributes);
  }

  private static void checkComponent(String name, String value) {
    if (value != null && value.indexOf('"') >= 0) {
      throw new IllegalArgumentException("Hawk header attribute '" + name + "' must not contain '\"'");
    }
  }

  @Override
  public byte[] hash() {
    return hash == null ? null : hash.clone();
  }

  /**
   * Formats the present attributes as {@code name="value"} pairs in canonical order.
   *
   * @return the attribute list
   */
  public String format() {
    return HeaderCodec.format(this);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Header other
        && Objects.equals(id, other.id)
        && Objects.equals(ts, other.ts)
        && Objects.equals(nonce, other.nonce)
        && Objects.equals(mac, other.mac)
        && Objects.equals(ext, other.ext)
        && Arrays.equals(hash, other.hash)
        && Objects.equals(app, other.app)
        && Objects.equals(dlg, other.dlg);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, ts, nonce, mac, ext, Arrays.hashCode(hash), app, dlg);
  }

  @Override
  public String toString() {
    return format();
  }
}
