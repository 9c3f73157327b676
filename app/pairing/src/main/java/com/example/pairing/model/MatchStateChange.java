/*
 * どこで: Pairing ドメインモデル
 * 何を: マッチ状態の部分更新（比較付き）を表現する
 * なぜ: 自己修復と照合処理が、読み取り後に他者が書き換えた状態を上書きしないようにするため
 */
package com.example.pairing.model;

/**
 * {@code expectedPartnerId} が現在の {@code matchedWith} と一致する場合のみ {@code newPartnerId} を適用する。
 * {@code newPartnerId == null} は未マッチへの遷移。
 */
public record MatchStateChange(String expectedPartnerId, String newPartnerId) {

  public static MatchStateChange release(String danglingPartnerId) {
    return new MatchStateChange(danglingPartnerId, null);
  }
}
