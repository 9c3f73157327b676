/*
 * どこで: Pairing API リクエスト DTO
 * 何を: POST /api/users の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため（必須判定と型判定は Store 側で行う）
 */
package com.example.pairing.api.request;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * graduationYear は JSON の値をそのまま受ける。小数や文字列を Jackson の暗黙変換で丸めず、他項目の必須違反と
 * まとめて検証エラーとして返すため。
 */
public record RegisterRequest(
    String name, String email, String netId, String major, JsonNode graduationYear) {}
