package com.codeheadsystems.hawk.model;

/**
 * The kind of MAC, selecting the first line of the canonical string.
 */
public enum MacType {

  HEADER("hawk.1.header"),
  RESPONSE("hawk.1.response");

  private final String tag;

  MacType(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }
}
