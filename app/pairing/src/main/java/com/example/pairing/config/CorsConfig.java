/*
 * どこで: Pairing Web 設定
 * 何を: /api/** へ CORS 許可オリジンを適用する
 * なぜ: 登録フォームを別オリジンから配信しても API を呼べるようにするため
 */
package com.example.pairing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CorsConfig {

  @Bean
  WebMvcConfigurer pairingCorsConfigurer(PairingCorsProperties properties) {
    return new WebMvcConfigurer() {
      @Override
      public void addCorsMappings(CorsRegistry registry) {
        if (properties.allowedOrigins().isEmpty()) {
          return;
        }
        registry
            .addMapping("/api/**")
            .allowedOrigins(properties.allowedOrigins().toArray(String[]::new))
            .allowedMethods("GET", "HEAD", "PUT", "PATCH", "POST", "DELETE")
            .allowCredentials(true);
      }
    };
  }
}
