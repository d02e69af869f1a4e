package com.codeheadsystems.hawk.model;

import java.util.Objects;

/**
 * Hawk credentials: an id and the key associated with it.
 *
 * @param id  the credential id, sent in the clear
 * @param key the shared key, never sent
 */
public record Credentials(String id, Key key) {

  public Credentials {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(key, "key");
  }
}
