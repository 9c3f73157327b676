/*
 * どこで: Pairing アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: API + 照合ワーカー + ストレージ監視を単一アプリとして起動するため
 */
package com.example.pairing;

import com.example.common.config.TimeConfig;
import java.util.Map;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
@RestController
public class PairingApplication {

  public static void main(String[] args) {
    SpringApplication.run(PairingApplication.class, args);
  }

  @GetMapping("/")
  public Map<String, String> home() {
    return Map.of("status", "ok", "message", "pairing API is running");
  }
}
