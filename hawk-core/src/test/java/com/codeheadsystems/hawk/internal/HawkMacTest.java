package com.codeheadsystems.hawk.internal;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.hawk.crypto.BouncyCastleCryptographer;
import com.codeheadsystems.hawk.crypto.DigestAlgorithm;
import com.codeheadsystems.hawk.crypto.JcaCryptographer;
import com.codeheadsystems.hawk.model.Key;
import com.codeheadsystems.hawk.model.Mac;
import com.codeheadsystems.hawk.model.MacType;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class HawkMacTest {

  private static final byte[] SECRET =
      Hex.decode("0B13E4D14FBDC83BA62F56FEEBB878C54B98C94F733D6FF2DBBBAD0EE36C3CE8");
  private static final Instant TS = Instant.ofEpochSecond(1353832834);

  private final Key key = Key.of(SECRET, DigestAlgorithm.SHA256, new JcaCryptographer());

  private static byte[] bytes(int... values) {
    byte[] out = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = (byte) values[i];
    }
    return out;
  }

  private Mac mac(MacType kind, Instant ts, byte[] hash, String ext) {
    return HawkMac.compute(kind, key, ts, "nonny", "POST", "mysite.com", 443, "/v1/api", hash, ext);
  }

  // --- Canonical string ---

  @Test
  void canonicalString_hasNineNewlineTerminatedLines() {
    String canonical = HawkMac.canonicalString(MacType.HEADER, TS, "nonny", "POST", "mysite.com", 443,
        "/v1/api", new byte[]{1, 2, 3}, "ext-data");
    assertThat(canonical).isEqualTo(
        "hawk.1.header\n1353832834\nnonny\nPOST\n/v1/api\nmysite.com\n443\nAQID\next-data\n");
  }

  @Test
  void canonicalString_absentHashAndExt_areEmptyLines() {
    String canonical = HawkMac.canonicalString(MacType.RESPONSE, TS, "n", "GET", "h", 80, "/", null, null);
    assertThat(canonical).isEqualTo("hawk.1.response\n1353832834\nn\nGET\n/\nh\n80\n\n\n");
  }

  // --- Known vectors ---

  @Test
  void compute_atTs1000_matchesKnownBytes() {
    Mac mac = mac(MacType.HEADER, Instant.ofEpochSecond(1000), null, null);
    assertThat(mac.bytes()).isEqualTo(bytes(192, 227, 235, 121, 157, 185, 197, 79, 189, 214, 235, 139, 9,
        232, 99, 55, 67, 30, 68, 0, 150, 187, 192, 238, 21, 200, 209, 107, 245, 159, 243, 178));
  }

  @Test
  void compute_header_matchesKnownBase64() {
    assertThat(mac(MacType.HEADER, TS, null, null).toBase64())
        .isEqualTo("fiy4e5wBdapDNxHHeA18NrSrU1U3iS66gm0XjTJpYyU=");
  }

  @Test
  void compute_withHash_matchesKnownBase64() {
    assertThat(mac(MacType.HEADER, TS, new byte[]{1, 2, 3, 4, 5}, null).toBase64())
        .isEqualTo("zjeBRXHGufvgkKITu1TWgNA/Rcef/vYptCiT7GZw+n0=");
  }

  @Test
  void compute_withExt_matchesKnownBase64() {
    assertThat(mac(MacType.HEADER, TS, null, "ext-data").toBase64())
        .isEqualTo("snaE0VbpHf5rXYR22KRqBgr1I/vC2q2fSfNhwdfLee4=");
  }

  @Test
  void compute_response_matchesKnownBase64() {
    assertThat(mac(MacType.RESPONSE, TS, null, null).toBase64())
        .isEqualTo("0qx6trszI8omP+BG6uH8iqboqfEqJAoei/R6w+SZ524=");
  }

  @Test
  void compute_responseWithExt_matchesKnownBytes() {
    Key tok = Key.of("tok".getBytes(StandardCharsets.UTF_8), DigestAlgorithm.SHA256, new JcaCryptographer());
    Instant ts = Instant.ofEpochSecond(1353832234);
    Mac plain = HawkMac.compute(MacType.RESPONSE, tok, ts, "j4h3g2", "POST", "localhost", 9988, "/a/b",
        null, "server-ext");
    Mac hashed = HawkMac.compute(MacType.RESPONSE, tok, ts, "j4h3g2", "POST", "localhost", 9988, "/a/b",
        new byte[]{1, 2, 3, 4}, "server-ext");
    assertThat(plain.bytes()).isEqualTo(bytes(48, 133, 228, 163, 224, 197, 222, 77, 117, 81, 143, 73, 71,
        120, 68, 238, 228, 40, 55, 64, 190, 73, 102, 123, 79, 185, 199, 26, 62, 1, 137, 170));
    assertThat(hashed.bytes()).isEqualTo(bytes(33, 147, 159, 211, 184, 194, 189, 74, 53, 229, 241, 161,
        215, 145, 22, 34, 206, 207, 242, 100, 33, 193, 36, 96, 149, 133, 180, 4, 132, 87, 207, 238));
  }

  @Test
  void compute_hawkReadmeExample_interoperates() {
    Key readme = Key.of("werxhqb98rpaxn39848xrunpaw3489ruxnpa98w4rxn".getBytes(StandardCharsets.UTF_8),
        DigestAlgorithm.SHA256, new JcaCryptographer());
    Mac mac = HawkMac.compute(MacType.HEADER, readme, Instant.ofEpochSecond(1353832234), "j4h3g2", "GET",
        "example.com", 8000, "/resource/1?b=1&a=2", null, "some-app-ext-data");
    assertThat(mac.toBase64()).isEqualTo("6R4rV5iE+NPoym+WwjeHzjAGXUtLNIxmo1vpMofpLAE=");
  }

  // --- Properties ---

  @Test
  void compute_isDeterministicAndBackendIndependent() {
    Key bcKey = Key.of(SECRET, DigestAlgorithm.SHA256, new BouncyCastleCryptographer());
    Mac jca = mac(MacType.HEADER, TS, new byte[]{9}, "x");
    Mac bc = HawkMac.compute(MacType.HEADER, bcKey, TS, "nonny", "POST", "mysite.com", 443, "/v1/api",
        new byte[]{9}, "x");
    assertThat(jca).isEqualTo(mac(MacType.HEADER, TS, new byte[]{9}, "x"));
    assertThat(bc).isEqualTo(jca);
  }

  @Test
  void compute_anySingleChange_changesMac() {
    Mac base = HawkMac.compute(MacType.HEADER, key, TS, "nonny", "POST", "mysite.com", 443, "/v1/api", null, null);
    assertThat(HawkMac.compute(MacType.RESPONSE, key, TS, "nonny", "POST", "mysite.com", 443, "/v1/api", null, null))
        .isNotEqualTo(base);
    assertThat(HawkMac.compute(MacType.HEADER, key, TS.plusSeconds(1), "nonny", "POST", "mysite.com", 443, "/v1/api", null, null))
        .isNotEqualTo(base);
    assertThat(HawkMac.compute(MacType.HEADER, key, TS, "nonnz", "POST", "mysite.com", 443, "/v1/api", null, null))
        .isNotEqualTo(base);
    assertThat(HawkMac.compute(MacType.HEADER, key, TS, "nonny", "GET", "mysite.com", 443, "/v1/api", null, null))
        .isNotEqualTo(base);
    assertThat(HawkMac.compute(MacType.HEADER, key, TS, "nonny", "POST", "mysite.org", 443, "/v1/api", null, null))
        .isNotEqualTo(base);
    assertThat(HawkMac.compute(MacType.HEADER, key, TS, "nonny", "POST", "mysite.com", 444, "/v1/api", null, null))
        .isNotEqualTo(base);
    assertThat(HawkMac.compute(MacType.HEADER, key, TS, "nonny", "POST", "mysite.com", 443, "/v2/api", null, null))
        .isNotEqualTo(base);
    assertThat(HawkMac.compute(MacType.HEADER, key, TS, "nonny", "POST", "mysite.com", 443, "/v1/api", new byte[]{1}, null))
        .isNotEqualTo(base);
    assertThat(HawkMac.compute(MacType.HEADER, key, TS, "nonny", "POST", "mysite.com", 443, "/v1/api", null, "e"))
        .isNotEqualTo(base);
  }

  @Test
  void compute_sha512_isSixtyFourBytes() {
    Key sha512 = Key.of(SECRET, DigestAlgorithm.SHA512, new JcaCryptographer());
    Mac mac = HawkMac.compute(MacType.HEADER, sha512, TS, "nonny", "POST", "mysite.com", 443, "/v1/api", null, null);
    assertThat(mac.length()).isEqualTo(64);
  }
}
