/*
 * どこで: Pairing API レスポンス DTO
 * 何を: 登録結果（登録者本人と、成立していれば相手）を表現する
 * なぜ: 未マッチ時は match キー自体を省く契約を固定するため
 */
package com.example.pairing.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegistrationResponse(
    boolean matched, RegistrantResponse user, PartnerSummary match) {}
