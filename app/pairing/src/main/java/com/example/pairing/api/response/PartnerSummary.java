/*
 * どこで: Pairing API レスポンス DTO
 * 何を: マッチ相手の公開項目だけを表現する
 * なぜ: 相手のマッチ状態など内部項目を応答へ漏らさないため
 */
package com.example.pairing.api.response;

import com.example.pairing.model.RegistrantRecord;

public record PartnerSummary(String name, String email, String major, int graduationYear) {

  public static PartnerSummary of(RegistrantRecord partner) {
    return new PartnerSummary(
        partner.name(), partner.email(), partner.major(), partner.graduationYear());
  }
}
