package com.codeheadsystems.hawk.server.store;

import com.codeheadsystems.hawk.model.Credentials;
import java.util.Optional;

/**
 * Lookup of Hawk credentials by id.
 * <p>
 * Implementations must be thread-safe. Production implementations typically back this with a
 * database or secrets manager.
 */
public interface CredentialStore {

  /**
   * Stores or replaces the credentials under their id.
   *
   * @param credentials the credentials
   */
  void store(Credentials credentials);

  /**
   * Retrieves the credentials for an id.
   *
   * @param id the credential id from a header or bewit
   * @return the credentials, or empty if the id is unknown
   */
  Optional<Credentials> load(String id);

  /**
   * Removes the credentials for an id, if present.
   *
   * @param id the credential id
   */
  void delete(String id);
}
