/*
 * どこで: Pairing API
 * 何を: 登録者 ID の未検出を表現する
 * なぜ: マッチ照会の 404 応答へ変換するため
 */
package com.example.pairing.api;

public class RegistrantNotFoundException extends RuntimeException {
  public RegistrantNotFoundException(String registrantId) {
    super("registrant not found: " + registrantId);
  }
}
