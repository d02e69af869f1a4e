package com.codeheadsystems.hawk.internal;

import com.codeheadsystems.hawk.exceptions.HawkError;
import com.codeheadsystems.hawk.exceptions.HawkException;
import com.codeheadsystems.hawk.model.Header;
import com.codeheadsystems.hawk.model.Mac;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.StringJoiner;

/**
 * Parses and formats the attribute list of Hawk {@code Authorization} and
 * {@code Server-Authorization} headers.
 */
public class HeaderCodec {

  public static final String SCHEME = "Hawk";

  // Canonical output order. Indexes into the parsed value array.
  private static final List<String> ATTRIBUTES = List.of("id", "ts", "nonce", "mac", "ext", "hash", "app", "dlg");
  private static final int ID = 0;
  private static final int TS = 1;
  private static final int NONCE = 2;
  private static final int MAC = 3;
  private static final int EXT = 4;
  private static final int HASH = 5;
  private static final int APP = 6;
  private static final int DLG = 7;

  private static final Base64.Encoder B64_ENCODER = Base64.getEncoder();
  private static final Base64.Decoder B64_DECODER = Base64.getDecoder();

  private HeaderCodec() {
  }

  /**
   * Parses a comma or whitespace separated list of {@code name="value"} pairs. Every attribute is
   * optional and none may repeat.
   *
   * @param attributes the attribute list, without the scheme
   * @return the header
   * @throws HawkException on malformed text, unknown names, a non-integer ts or bad base64
   */
  public static Header parse(String attributes) {
    if (attributes == null) {
      throw new HawkException(HawkError.HEADER_PARSE_ERROR, "Header is null");
    }
    String[] values = new String[ATTRIBUTES.size()];
    int length = attributes.length();
    int pos = skipSeparators(attributes, 0);
    while (pos < length) {
      int nameStart = pos;
      while (pos < length && isNameChar(attributes.charAt(pos))) {
        pos++;
      }
      if (pos == nameStart) {
        throw parseError("Expected attribute name at position " + pos);
      }
      String name = attributes.substring(nameStart, pos);
      pos = skipWhitespace(attributes, pos);
      pos = expect(attributes, pos, '=');
      pos = skipWhitespace(attributes, pos);
      pos = expect(attributes, pos, '"');
      int close = attributes.indexOf('"', pos);
      if (close < 0) {
        throw parseError("Unterminated value for attribute '" + name + "'");
      }
      String value = attributes.substring(pos, close);
      pos = close + 1;
      if (pos < length && !isSeparator(attributes.charAt(pos))) {
        throw parseError("Expected separator at position " + pos);
      }

      int index = ATTRIBUTES.indexOf(name);
      if (index < 0) {
        throw new HawkException(HawkError.UNKNOWN_ATTRIBUTE, "Unknown attribute '" + name + "'");
      }
      if (values[index] != null) {
        throw parseError("Duplicate attribute '" + name + "'");
      }
      values[index] = value;
      pos = skipSeparators(attributes, pos);
    }

    return new Header(
        values[ID],
        values[TS] == null ? null : parseTimestamp(values[TS]),
        values[NONCE],
        values[MAC] == null ? null : new Mac(decodeBase64("mac", values[MAC])),
        values[EXT],
        values[HASH] == null ? null : decodeBase64("hash", values[HASH]),
        values[APP],
        values[DLG]);
  }

  /**
   * Formats the present attributes in canonical order, joined by {@code ", "}.
   *
   * @param header the header
   * @return the attribute list
   */
  public static String format(Header header) {
    StringJoiner joiner = new StringJoiner(", ");
    append(joiner, ATTRIBUTES.get(ID), header.id());
    append(joiner, ATTRIBUTES.get(TS), header.ts() == null ? null : Long.toString(header.ts().getEpochSecond()));
    append(joiner, ATTRIBUTES.get(NONCE), header.nonce());
    append(joiner, ATTRIBUTES.get(MAC), header.mac() == null ? null : header.mac().toBase64());
    append(joiner, ATTRIBUTES.get(EXT), header.ext());
    byte[] hash = header.hash();
    append(joiner, ATTRIBUTES.get(HASH), hash == null ? null : B64_ENCODER.encodeToString(hash));
    append(joiner, ATTRIBUTES.get(APP), header.app());
    append(joiner, ATTRIBUTES.get(DLG), header.dlg());
    return joiner.toString();
  }

  /**
   * Parses a full {@code Authorization} header value. The scheme must be {@code Hawk}, in any case,
   * and id, ts, nonce and mac are required.
   *
   * @param headerValue the header value
   * @return the header
   * @throws HawkException on a wrong scheme, malformed text or missing attributes
   */
  public static Header parseAuthorization(String headerValue) {
    Header header = parse(stripScheme(headerValue));
    if (header.id() == null || header.ts() == null || header.nonce() == null || header.mac() == null) {
      throw new HawkException(HawkError.MISSING_ATTRIBUTES,
          "Authorization header requires id, ts, nonce and mac");
    }
    return header;
  }

  /**
   * Parses a full {@code Server-Authorization} header value. Only mac is required.
   *
   * @param headerValue the header value
   * @return the header
   * @throws HawkException on a wrong scheme, malformed text or a missing mac
   */
  public static Header parseServerAuthorization(String headerValue) {
    Header header = parse(stripScheme(headerValue));
    if (header.mac() == null) {
      throw new HawkException(HawkError.MISSING_ATTRIBUTES, "Server-Authorization header requires mac");
    }
    return header;
  }

  /**
   * Formats a full header value, scheme included.
   *
   * @param header the header
   * @return the header value
   */
  public static String formatAuthorization(Header header) {
    return SCHEME + " " + format(header);
  }

  private static String stripScheme(String headerValue) {
    if (headerValue == null) {
      throw parseError("Header is null");
    }
    String value = headerValue.strip();
    int schemeLength = SCHEME.length();
    if (!value.regionMatches(true, 0, SCHEME, 0, schemeLength)
        || (value.length() > schemeLength && !Character.isWhitespace(value.charAt(schemeLength)))) {
      throw parseError("Not a Hawk header");
    }
    return value.substring(schemeLength);
  }

  private static Instant parseTimestamp(String value) {
    if (value.startsWith("+")) {
      throw new HawkException(HawkError.INVALID_TIMESTAMP, "Invalid ts '" + value + "'");
    }
    try {
      return Instant.ofEpochSecond(Long.parseLong(value));
    } catch (NumberFormatException | DateTimeException e) {
      throw new HawkException(HawkError.INVALID_TIMESTAMP, "Invalid ts '" + value + "'", e);
    }
  }

  private static byte[] decodeBase64(String name, String value) {
    try {
      return B64_DECODER.decode(value);
    } catch (IllegalArgumentException e) {
      throw new HawkException(HawkError.BASE64_DECODE_ERROR, "Invalid base64 in attribute '" + name + "'", e);
    }
  }

  private static void append(StringJoiner joiner, String name, String value) {
    if (value != null) {
      joiner.add(name + "=\"" + value + "\"");
    }
  }

  private static int expect(String text, int pos, char expected) {
    if (pos >= text.length() || text.charAt(pos) != expected) {
      throw parseError("Expected '" + expected + "' at position " + pos);
    }
    return pos + 1;
  }

  private static int skipWhitespace(String text, int pos) {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  private static int skipSeparators(String text, int pos) {
    while (pos < text.length() && isSeparator(text.charAt(pos))) {
      pos++;
    }
    return pos;
  }

  private static boolean isSeparator(char c) {
    return c == ',' || Character.isWhitespace(c);
  }

  private static boolean isNameChar(char c) {
    return c != '=' && c != '"' && !isSeparator(c);
  }

  private static HawkException parseError(String message) {
    return new HawkException(HawkError.HEADER_PARSE_ERROR, message);
  }
}
