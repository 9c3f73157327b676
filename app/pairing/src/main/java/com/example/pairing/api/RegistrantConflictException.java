package com.example.pairing.api;

import com.example.pairing.model.ConflictField;

public class RegistrantConflictException extends RuntimeException {

  private final ConflictField field;

  public RegistrantConflictException(ConflictField field) {
    this(field, null);
  }

  public RegistrantConflictException(ConflictField field, Throwable cause) {
    super(field.value() + " is already registered", cause);
    this.field = field;
  }

  public ConflictField field() {
    return field;
  }
}
