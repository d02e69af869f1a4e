package com.codeheadsystems.hawk.client.config;

import com.codeheadsystems.hawk.config.HawkConfig;
import com.codeheadsystems.hawk.model.Credentials;
import java.util.Objects;

/**
 * Client-side configuration for Hawk-authenticated HTTP calls.
 * <p>
 * A {@code Server-Authorization} header is always validated when the server sends one. With
 * {@code requireServerAuthorization} set, a response without one is rejected too.
 *
 * @param credentials                the credentials to sign with
 * @param app                        application id sent with every request, may be null
 * @param dlg                        delegated-by application id, may be null
 * @param requireServerAuthorization whether responses must be authenticated by the server
 * @param hawkConfig                 the core config
 */
public record HawkClientConfig(Credentials credentials, String app, String dlg,
                               boolean requireServerAuthorization, HawkConfig hawkConfig) {

  public HawkClientConfig {
    Objects.requireNonNull(credentials, "credentials");
    Objects.requireNonNull(hawkConfig, "hawkConfig");
  }

  /**
   * Default config for the credentials: no app, lenient about missing Server-Authorization.
   *
   * @param credentials the credentials
   * @return the hawk client config
   */
  public static HawkClientConfig of(Credentials credentials) {
    return new HawkClientConfig(credentials, null, null, false, HawkConfig.DEFAULT);
  }

  /**
   * Returns a copy that rejects responses without a valid Server-Authorization header.
   *
   * @return the hawk client config
   */
  public HawkClientConfig requiringServerAuthorization() {
    return new HawkClientConfig(credentials, app, dlg, true, hawkConfig);
  }

  public HawkClientConfig withApp(String app, String dlg) {
    return new HawkClientConfig(credentials, app, dlg, requireServerAuthorization, hawkConfig);
  }

  public HawkClientConfig withHawkConfig(HawkConfig hawkConfig) {
    return new HawkClientConfig(credentials, app, dlg, requireServerAuthorization, hawkConfig);
  }

  @Override
  public String toString() {
    return "HawkClientConfig[id=" + credentials.id() + ", app=" + app
        + ", requireServerAuthorization=" + requireServerAuthorization + "]";
  }
}
