package com.codeheadsystems.hawk.payload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.hawk.crypto.BouncyCastleCryptographer;
import com.codeheadsystems.hawk.crypto.Cryptographer;
import com.codeheadsystems.hawk.crypto.DigestAlgorithm;
import com.codeheadsystems.hawk.crypto.JcaCryptographer;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PayloadHasherTest {

  private final Cryptographer cryptographer = new JcaCryptographer();

  private static String b64(byte[] bytes) {
    return Base64.getEncoder().encodeToString(bytes);
  }

  @Test
  void hash_hawkReadmePayload() {
    byte[] hash = PayloadHasher.hash("text/plain", DigestAlgorithm.SHA256, cryptographer,
        "Thank you for flying Hawk");
    assertThat(b64(hash)).isEqualTo("Yi9LfIIFRtBEPt74PVmbTF/xVAwPn7ub15ePICfgnuY=");
  }

  @Test
  void hash_emptyPayload() {
    byte[] hash = PayloadHasher.hash("text/plain", DigestAlgorithm.SHA256, cryptographer, new byte[0]);
    assertThat(b64(hash)).isEqualTo("q/t+NNAkQZNlq/aAD6PlexImwQTxwgT2MahfTa9XRLA=");
  }

  @Test
  void update_inChunks_equalsOneShot() {
    PayloadHasher hasher = new PayloadHasher("text/plain", DigestAlgorithm.SHA256, cryptographer);
    hasher.update("pay");
    hasher.update("load".getBytes(StandardCharsets.UTF_8));
    assertThat(b64(hasher.finish())).isEqualTo("XhAS2NNB0dCz3E04dKJH9NYKBwOcfcqu/18qQo5zZmU=");
  }

  @Test
  void hash_backendsAgree() {
    byte[] jca = PayloadHasher.hash("application/json", DigestAlgorithm.SHA512, cryptographer, "{}");
    byte[] bc = PayloadHasher.hash("application/json", DigestAlgorithm.SHA512, new BouncyCastleCryptographer(), "{}");
    assertThat(jca).hasSize(64).isEqualTo(bc);
  }

  @Test
  void hash_contentTypeIsBound() {
    byte[] plain = PayloadHasher.hash("text/plain", DigestAlgorithm.SHA256, cryptographer, "x");
    byte[] json = PayloadHasher.hash("application/json", DigestAlgorithm.SHA256, cryptographer, "x");
    assertThat(plain).isNotEqualTo(json);
  }

  @Test
  void finish_isSingleUse() {
    PayloadHasher hasher = new PayloadHasher("text/plain", DigestAlgorithm.SHA256, cryptographer);
    hasher.finish();
    assertThatThrownBy(hasher::finish).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> hasher.update("more")).isInstanceOf(IllegalStateException.class);
  }

  @ParameterizedTest
  @CsvSource({
      "'text/plain', 'text/plain'",
      "'Text/Plain; charset=UTF-8', 'text/plain'",
      "' application/json ;q=1', 'application/json'",
      "'', ''"
  })
  void normalizeContentType(String raw, String expected) {
    assertThat(PayloadHasher.normalizeContentType(raw)).isEqualTo(expected);
  }

  @Test
  void normalizeContentType_null_isEmpty() {
    assertThat(PayloadHasher.normalizeContentType(null)).isEmpty();
  }
}
