/*
 * どこで: Pairing API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 例外ハンドリング時のレスポンス形状を {code, error, details} に統一するため
 */
package com.example.pairing.api;

import com.example.pairing.api.response.FieldViolation;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String code, String error, List<FieldViolation> details) {

  public ApiErrorResponse(String code, String error) {
    this(code, error, null);
  }
}
