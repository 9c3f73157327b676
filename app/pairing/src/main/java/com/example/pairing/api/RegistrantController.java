/*
 * どこで: Pairing API
 * 何を: 登録（即時マッチ試行）とマッチ照会のエンドポイントを公開する
 * なぜ: Matching Engine の 2 操作を JSON で呼び出す入口を提供するため
 */
package com.example.pairing.api;

import com.example.pairing.api.request.RegisterRequest;
import com.example.pairing.api.response.MatchStatusResponse;
import com.example.pairing.api.response.RegistrationResponse;
import com.example.pairing.service.MatchingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class RegistrantController {

  private final MatchingService matchingService;

  @PostMapping
  public ResponseEntity<RegistrationResponse> register(@RequestBody RegisterRequest request) {
    return ResponseEntity.ok(matchingService.registerAndMatch(request));
  }

  @GetMapping("/{id}/match")
  public ResponseEntity<MatchStatusResponse> getMatch(@PathVariable("id") String id) {
    return ResponseEntity.ok(matchingService.queryMatch(id));
  }
}
