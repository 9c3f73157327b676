/*
 * どこで: Common 共通設定
 * 何を: UTC 固定の Clock を Bean として公開する
 * なぜ: 登録時刻や backoff 計算をテストで固定時刻へ差し替えられるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock systemUtcClock() {
    return Clock.systemUTC();
  }
}
