/*
 * どこで: Pairing 設定
 * 何を: マッチ確定の再試行回数と照合ワーカーの 1 回あたりの処理件数を保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package com.example.pairing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 照合ワーカーの有効化（{@code pairing.reconcile-enabled}）と間隔（{@code pairing.reconcile-interval}）は
 * {@code @ConditionalOnProperty} と {@code @Scheduled} のプレースホルダが直接読む。
 */
@ConfigurationProperties(prefix = "pairing")
public record PairingProperties(int claimMaxAttempts, int reconcileBatchSize) {

  public PairingProperties {
    claimMaxAttempts = claimMaxAttempts <= 0 ? 10 : claimMaxAttempts;
    reconcileBatchSize = reconcileBatchSize <= 0 ? 100 : reconcileBatchSize;
  }
}
