/*
 * どこで: Pairing ドメインモデル
 * 何を: Store.create へ渡す未検証の登録入力
 * なぜ: 必須項目と形式の検証を Bean Validation の制約として一か所に宣言するため
 */
package com.example.pairing.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/** graduationYear は受信したままの表記。検証を通った後に限り {@link #graduationYearValue()} で読める。 */
public record NewRegistrant(
    @NotBlank(message = "is required") String name,
    @NotBlank(message = "is required") String email,
    @NotBlank(message = "is required") String netId,
    @NotBlank(message = "is required") String major,
    @NotNull(message = "is required")
        @Pattern(regexp = "-?\\d{1,9}", message = "must be an integer")
        String graduationYear) {

  public int graduationYearValue() {
    return Integer.parseInt(graduationYear);
  }
}
