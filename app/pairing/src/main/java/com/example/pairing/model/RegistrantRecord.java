/*
 * どこで: Pairing ドメインモデル
 * 何を: registrants テーブル 1 行の正規化された内部表現
 * なぜ: Repository / Store / Engine 間で受け渡す構造を固定するため
 */
package com.example.pairing.model;

import java.time.Instant;

/**
 * 登録者 1 名分のレコード。
 *
 * <p>{@code netId} は学籍 ID などの二次識別キーで、{@code email} と同様に全体で一意。{@code matched} と
 * {@code matchedWith != null} は常に一致する。
 */
public record RegistrantRecord(
    String id,
    String name,
    String email,
    String netId,
    String major,
    int graduationYear,
    boolean matched,
    String matchedWith,
    Instant createdAt,
    Instant updatedAt) {

  public RegistrantRecord withMatch(String partnerId, Instant at) {
    return new RegistrantRecord(
        id, name, email, netId, major, graduationYear, partnerId != null, partnerId, createdAt, at);
  }
}
