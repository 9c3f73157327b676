package com.example.pairing.model;

/** 一意制約を持つ識別キー。 */
public enum ConflictField {
  EMAIL("email"),
  NET_ID("netId");

  private final String value;

  ConflictField(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
