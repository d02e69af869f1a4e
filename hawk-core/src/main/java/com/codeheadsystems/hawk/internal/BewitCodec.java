package com.codeheadsystems.hawk.internal;

import com.codeheadsystems.hawk.exceptions.HawkError;
import com.codeheadsystems.hawk.exceptions.HawkException;
import com.codeheadsystems.hawk.model.Bewit;
import com.codeheadsystems.hawk.model.ExtractedBewit;
import com.codeheadsystems.hawk.model.Mac;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Encodes and decodes bewits, and extracts them from request paths.
 * <p>
 * The raw form is {@code id\exp\mac\ext}, url-safe base64 encoded without padding.
 */
public class BewitCodec {

  public static final String QUERY_PARAMETER = "bewit";

  private static final String PREFIX = QUERY_PARAMETER + "=";
  private static final byte SEPARATOR = '\\';
  private static final int PARTS = 4;

  private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();
  private static final Base64.Decoder MAC_DECODER = Base64.getDecoder();

  private BewitCodec() {
  }

  /**
   * Encodes a bewit. An absent ext encodes as an empty fourth part.
   *
   * @param bewit the bewit
   * @return the url-safe base64 string
   */
  public static String encode(Bewit bewit) {
    String raw = bewit.id()
        + '\\' + bewit.exp().getEpochSecond()
        + '\\' + bewit.mac().toBase64()
        + '\\' + (bewit.ext() == null ? "" : bewit.ext());
    return URL_ENCODER.encodeToString(raw.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Decodes a bewit.
   *
   * @param encoded the url-safe base64 string
   * @return the bewit
   * @throws HawkException if the value is not base64, does not have four parts, or any part is invalid
   */
  public static Bewit decode(String encoded) {
    if (encoded == null) {
      throw new HawkException(HawkError.BASE64_DECODE_ERROR, "Bewit is null");
    }
    byte[] raw;
    try {
      raw = URL_DECODER.decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new HawkException(HawkError.BASE64_DECODE_ERROR, "Bewit is not valid base64", e);
    }

    List<byte[]> parts = split(raw);
    if (parts.size() != PARTS) {
      throw new HawkException(HawkError.INVALID_BEWIT_FORMAT,
          "Bewit has " + parts.size() + " parts, expected " + PARTS);
    }
    String id = utf8(parts.get(0), HawkError.INVALID_BEWIT_ID);
    Instant exp = parseExp(utf8(parts.get(1), HawkError.INVALID_BEWIT_EXP));
    Mac mac = parseMac(utf8(parts.get(2), HawkError.INVALID_BEWIT_MAC));
    String ext = utf8(parts.get(3), HawkError.INVALID_BEWIT_EXT);
    return new Bewit(id, exp, mac, ext);
  }

  /**
   * Finds the {@code bewit=} query component of a path and query, splitting on {@code ?} and {@code &}.
   * With exactly one match the bewit is decoded and removed from the path.
   *
   * @param pathAndQuery the path and query
   * @return the bewit with the remaining path, or empty when there is none
   * @throws HawkException with {@link HawkError#MULTIPLE_BEWITS} on more than one match, or a decode
   *                       error for a malformed bewit
   */
  public static Optional<ExtractedBewit> fromPath(String pathAndQuery) {
    List<String> bewits = new ArrayList<>();
    List<String> components = new ArrayList<>();
    String[] split = pathAndQuery.split("[&?]", -1);
    // The first component is the path itself, never a query parameter.
    components.add(split[0]);
    for (int i = 1; i < split.length; i++) {
      String component = split[i];
      if (component.startsWith(PREFIX)) {
        bewits.add(component);
      } else {
        components.add(component);
      }
    }
    if (bewits.isEmpty()) {
      return Optional.empty();
    }
    if (bewits.size() > 1) {
      throw new HawkException(HawkError.MULTIPLE_BEWITS, "Found " + bewits.size() + " bewits in path");
    }

    Bewit bewit = decode(bewits.get(0).substring(PREFIX.length()));
    String path = components.get(0);
    if (components.size() > 1) {
      path = path + "?" + String.join("&", components.subList(1, components.size()));
    }
    return Optional.of(new ExtractedBewit(bewit, path));
  }

  private static List<byte[]> split(byte[] raw) {
    List<byte[]> parts = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < raw.length; i++) {
      if (raw[i] == SEPARATOR) {
        parts.add(Arrays.copyOfRange(raw, start, i));
        start = i + 1;
      }
    }
    parts.add(Arrays.copyOfRange(raw, start, raw.length));
    return parts;
  }

  private static String utf8(byte[] bytes, HawkError error) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new HawkException(error, "Bewit part is not valid UTF-8", e);
    }
  }

  private static Instant parseExp(String value) {
    if (value.isEmpty() || !value.chars().allMatch(c -> c >= '0' && c <= '9')) {
      throw new HawkException(HawkError.INVALID_BEWIT_EXP, "Bewit exp is not an unsigned integer");
    }
    try {
      return Instant.ofEpochSecond(Long.parseLong(value));
    } catch (NumberFormatException | DateTimeException e) {
      throw new HawkException(HawkError.INVALID_BEWIT_EXP, "Bewit exp is out of range", e);
    }
  }

  private static Mac parseMac(String value) {
    try {
      return new Mac(MAC_DECODER.decode(value));
    } catch (IllegalArgumentException e) {
      throw new HawkException(HawkError.INVALID_BEWIT_MAC, "Bewit mac is not valid base64", e);
    }
  }
}
