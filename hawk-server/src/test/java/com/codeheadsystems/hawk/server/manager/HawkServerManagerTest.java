package com.codeheadsystems.hawk.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.hawk.Client;
import com.codeheadsystems.hawk.Server;
import com.codeheadsystems.hawk.config.HawkConfig;
import com.codeheadsystems.hawk.crypto.DigestAlgorithm;
import com.codeheadsystems.hawk.internal.HeaderCodec;
import com.codeheadsystems.hawk.model.Bewit;
import com.codeheadsystems.hawk.model.Credentials;
import com.codeheadsystems.hawk.model.Header;
import com.codeheadsystems.hawk.model.Request;
import com.codeheadsystems.hawk.model.RequestState;
import com.codeheadsystems.hawk.model.Response;
import com.codeheadsystems.hawk.server.model.HawkAuthentication;
import com.codeheadsystems.hawk.server.model.IncomingRequest;
import com.codeheadsystems.hawk.server.store.CredentialStore;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HawkServerManagerTest {

  private static final Instant NOW = Instant.ofEpochSecond(1353832834);
  private static final String HOST = "api.example.com";
  private static final int PORT = 443;
  private static final byte[] BODY = "{\"amount\":10}".getBytes(StandardCharsets.UTF_8);

  @Mock private CredentialStore credentialStore;

  private HawkConfig config;
  private Client client;
  private Credentials credentials;
  private HawkServerManager manager;

  @BeforeEach
  void setUp() {
    config = HawkConfig.forTesting(Clock.fixed(NOW, ZoneOffset.UTC));
    client = new Client(config);
    credentials = config.newCredentials("alice", "alice-secret".getBytes(StandardCharsets.UTF_8),
        DigestAlgorithm.SHA256);
    manager = new HawkServerManager(new Server(config), credentialStore);
  }

  private String authorization(Request request, RequestState state) {
    return HeaderCodec.formatAuthorization(client.makeHeader(request, credentials, state));
  }

  private RequestState state() {
    return new RequestState(NOW, "n0nce");
  }

  // --- Header authentication ---

  @Test
  void authenticate_validHeader() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    Request request = Request.of("GET", HOST, PORT, "/accounts?x=1").withExt("tenant=7");

    HawkAuthentication auth = manager.authenticate(
        IncomingRequest.of("GET", HOST, PORT, "/accounts?x=1", authorization(request, state())));

    assertThat(auth.id()).isEqualTo("alice");
    assertThat(auth.isBewit()).isFalse();
    assertThat(auth.ext()).isEqualTo("tenant=7");
    assertThat(auth.payloadVerified()).isFalse();
  }

  @Test
  void authenticate_unknownId_failsWithGenericMessage() {
    when(credentialStore.load("alice")).thenReturn(Optional.empty());
    Request request = Request.of("GET", HOST, PORT, "/accounts");
    IncomingRequest incoming = IncomingRequest.of("GET", HOST, PORT, "/accounts", authorization(request, state()));

    assertThatThrownBy(() -> manager.authenticate(incoming))
        .isInstanceOf(SecurityException.class)
        .hasMessage(HawkServerManager.AUTHENTICATION_FAILED);
  }

  @Test
  void authenticate_tamperedPath_fails() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    Request request = Request.of("GET", HOST, PORT, "/accounts");
    IncomingRequest incoming = IncomingRequest.of("GET", HOST, PORT, "/admin", authorization(request, state()));

    assertThatThrownBy(() -> manager.authenticate(incoming))
        .isInstanceOf(SecurityException.class)
        .hasMessage(HawkServerManager.AUTHENTICATION_FAILED);
  }

  @Test
  void authenticate_staleTimestamp_fails() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    Request request = Request.of("GET", HOST, PORT, "/accounts");
    String stale = authorization(request, new RequestState(NOW.minus(Duration.ofMinutes(5)), "n0nce"));

    assertThatThrownBy(() -> manager.authenticate(IncomingRequest.of("GET", HOST, PORT, "/accounts", stale)))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void authenticate_malformedHeader_isBadRequest() {
    IncomingRequest incoming = IncomingRequest.of("GET", HOST, PORT, "/accounts", "Hawk id=\"alice\", ts=\"soon\"");

    assertThatThrownBy(() -> manager.authenticate(incoming))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid Authorization header");
    verify(credentialStore, never()).load(anyString());
  }

  @Test
  void authenticate_otherScheme_isBadRequest() {
    assertThatThrownBy(() -> manager.authenticate(
        IncomingRequest.of("GET", HOST, PORT, "/accounts", "Bearer abc.def")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // --- Payload ---

  @Test
  void authenticate_withPayload_verifiesHash() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    byte[] hash = client.hashPayload("application/json", DigestAlgorithm.SHA256, BODY);
    Request request = Request.of("POST", HOST, PORT, "/transfers").withHash(hash);
    IncomingRequest incoming = IncomingRequest.of("POST", HOST, PORT, "/transfers", authorization(request, state()))
        .withPayload("application/json; charset=utf-8", BODY);

    HawkAuthentication auth = manager.authenticate(incoming);

    assertThat(auth.payloadVerified()).isTrue();
  }

  @Test
  void authenticate_withTamperedPayload_fails() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    byte[] hash = client.hashPayload("application/json", DigestAlgorithm.SHA256, BODY);
    Request request = Request.of("POST", HOST, PORT, "/transfers").withHash(hash);
    IncomingRequest incoming = IncomingRequest.of("POST", HOST, PORT, "/transfers", authorization(request, state()))
        .withPayload("application/json", "{\"amount\":1000}".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> manager.authenticate(incoming)).isInstanceOf(SecurityException.class);
  }

  @Test
  void authenticatePayload_afterHeader() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    byte[] hash = client.hashPayload("application/json", DigestAlgorithm.SHA256, BODY);
    Request request = Request.of("POST", HOST, PORT, "/transfers").withHash(hash);
    HawkAuthentication auth = manager.authenticate(
        IncomingRequest.of("POST", HOST, PORT, "/transfers", authorization(request, state())));
    assertThat(auth.payloadVerified()).isFalse();

    manager.authenticatePayload(auth, "application/json", BODY);
    assertThatThrownBy(() -> manager.authenticatePayload(auth, "text/plain", BODY))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void authenticatePayload_withoutHeaderHash_fails() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    Request request = Request.of("POST", HOST, PORT, "/transfers");
    HawkAuthentication auth = manager.authenticate(
        IncomingRequest.of("POST", HOST, PORT, "/transfers", authorization(request, state())));

    assertThatThrownBy(() -> manager.authenticatePayload(auth, "application/json", BODY))
        .isInstanceOf(SecurityException.class);
  }

  // --- Bewit authentication ---

  @Test
  void authenticate_validBewit() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    Request request = Request.of("GET", HOST, PORT, "/files/report.pdf?v=2");
    Bewit bewit = client.makeBewitWithTtl(request, credentials, Duration.ofMinutes(1));

    HawkAuthentication auth = manager.authenticate(
        IncomingRequest.of("GET", HOST, PORT, "/files/report.pdf?v=2&bewit=" + bewit.encode(), null));

    assertThat(auth.isBewit()).isTrue();
    assertThat(auth.request().path()).isEqualTo("/files/report.pdf?v=2");
  }

  @Test
  void authenticate_bewitWithHead_validatesAsGet() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    Bewit bewit = client.makeBewit(Request.of("GET", HOST, PORT, "/files/a"), credentials, NOW.plusSeconds(5));

    HawkAuthentication auth = manager.authenticate(
        IncomingRequest.of("HEAD", HOST, PORT, "/files/a?bewit=" + bewit.encode(), null));

    assertThat(auth.id()).isEqualTo("alice");
  }

  @Test
  void authenticate_expiredBewit_fails() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    Bewit bewit = client.makeBewit(Request.of("GET", HOST, PORT, "/files/a"), credentials, NOW.minusSeconds(1));

    assertThatThrownBy(() -> manager.authenticate(
        IncomingRequest.of("GET", HOST, PORT, "/files/a?bewit=" + bewit.encode(), null)))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void authenticate_bewitWithPost_fails() {
    Bewit bewit = client.makeBewit(Request.of("GET", HOST, PORT, "/files/a"), credentials, NOW.plusSeconds(5));

    assertThatThrownBy(() -> manager.authenticate(
        IncomingRequest.of("POST", HOST, PORT, "/files/a?bewit=" + bewit.encode(), null)))
        .isInstanceOf(SecurityException.class);
    verify(credentialStore, never()).load(anyString());
  }

  @Test
  void authenticate_noCredentials_isUnauthorized() {
    assertThatThrownBy(() -> manager.authenticate(IncomingRequest.of("GET", HOST, PORT, "/files/a", null)))
        .isInstanceOf(SecurityException.class)
        .hasMessage("Authentication required");
  }

  @Test
  void authenticate_malformedOrRepeatedBewit_isBadRequest() {
    assertThatThrownBy(() -> manager.authenticate(IncomingRequest.of("GET", HOST, PORT, "/a?bewit=x&bewit=y", null)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> manager.authenticate(IncomingRequest.of("GET", HOST, PORT, "/a?bewit=!!", null)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void authenticate_bewitInPathPosition_isUnauthorized() {
    Bewit bewit = client.makeBewit(Request.of("GET", HOST, PORT, "/files/a"), credentials, NOW.plusSeconds(5));

    assertThatThrownBy(() -> manager.authenticate(
        IncomingRequest.of("GET", HOST, PORT, "bewit=" + bewit.encode(), null)))
        .isInstanceOf(SecurityException.class)
        .hasMessage("Authentication required");
    verify(credentialStore, never()).load(anyString());
  }

  // --- Server-Authorization ---

  @Test
  void serverAuthorization_validatesOnClient() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    Request request = Request.of("GET", HOST, PORT, "/accounts");
    RequestState state = state();
    HawkAuthentication auth = manager.authenticate(
        IncomingRequest.of("GET", HOST, PORT, "/accounts", authorization(request, state)));
    byte[] responseBody = "[]".getBytes(StandardCharsets.UTF_8);

    String value = manager.serverAuthorization(auth, "application/json", responseBody, "served-by=1");

    Header header = HeaderCodec.parseServerAuthorization(value);
    assertThat(header.ext()).isEqualTo("served-by=1");
    Response expected = client.responseFor(request, state)
        .withHash(client.hashPayload("application/json", DigestAlgorithm.SHA256, responseBody));
    assertThat(client.validateResponse(expected, header, credentials.key())).isTrue();
  }

  @Test
  void serverAuthorization_withoutPayload_hasNoHash() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    Request request = Request.of("GET", HOST, PORT, "/accounts");
    HawkAuthentication auth = manager.authenticate(
        IncomingRequest.of("GET", HOST, PORT, "/accounts", authorization(request, state())));

    Header header = HeaderCodec.parseServerAuthorization(manager.serverAuthorization(auth, null, null, null));

    assertThat(header.hash()).isNull();
    assertThat(header.ext()).isNull();
  }

  @Test
  void serverAuthorization_forBewit_isRejected() {
    when(credentialStore.load("alice")).thenReturn(Optional.of(credentials));
    Bewit bewit = client.makeBewit(Request.of("GET", HOST, PORT, "/files/a"), credentials, NOW.plusSeconds(5));
    HawkAuthentication auth = manager.authenticate(
        IncomingRequest.of("GET", HOST, PORT, "/files/a?bewit=" + bewit.encode(), null));

    assertThatThrownBy(() -> manager.serverAuthorization(auth, null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // --- Incoming request ---

  @Test
  void incomingRequest_rejectsMissingFields() {
    assertThatThrownBy(() -> IncomingRequest.of(" ", HOST, PORT, "/", null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IncomingRequest.of("GET", null, PORT, "/", null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IncomingRequest.of("GET", HOST, PORT, "", null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> IncomingRequest.of("GET", HOST, 70000, "/", null)).isInstanceOf(IllegalArgumentException.class);
  }
}
