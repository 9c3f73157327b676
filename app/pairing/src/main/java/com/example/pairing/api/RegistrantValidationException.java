/*
 * どこで: Pairing API
 * 何を: 登録入力の必須項目違反をまとめて表現する
 * なぜ: 違反した全フィールドを 400 の details として返すため
 */
package com.example.pairing.api;

import com.example.pairing.api.response.FieldViolation;
import java.util.List;

public class RegistrantValidationException extends RuntimeException {

  private final List<FieldViolation> violations;

  public RegistrantValidationException(List<FieldViolation> violations) {
    super("validation failed");
    this.violations = List.copyOf(violations);
  }

  public List<FieldViolation> violations() {
    return violations;
  }
}
