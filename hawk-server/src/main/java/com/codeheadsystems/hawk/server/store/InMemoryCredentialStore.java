package com.codeheadsystems.hawk.server.store;

import com.codeheadsystems.hawk.model.Credentials;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Credentials are lost on restart. Suitable for development and testing only.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final ConcurrentHashMap<String, Credentials> store = new ConcurrentHashMap<>();

  public InMemoryCredentialStore() {
    log.warn("Using InMemoryCredentialStore, credentials will NOT survive restarts. "
        + "Replace with a persistent CredentialStore for production.");
  }

  @Override
  public void store(Credentials credentials) {
    store.put(credentials.id(), credentials);
    log.debug("Stored credentials for id {}", credentials.id());
  }

  @Override
  public Optional<Credentials> load(String id) {
    return Optional.ofNullable(store.get(id));
  }

  @Override
  public void delete(String id) {
    store.remove(id);
  }
}
