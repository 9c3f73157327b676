/*
 * どこで: Pairing Repository 層
 * 何を: registrants の永続化と 2 件同時マッチ確定を抽象化する
 * なぜ: 条件付き書き込みの実装詳細を Engine から切り離し、テストで差し替えられるようにするため
 */
package com.example.pairing.repository;

import com.example.pairing.model.RegistrantRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RegistrantRepository {

  Optional<RegistrantRecord> findById(String id);

  Optional<RegistrantRecord> findByEmail(String email);

  Optional<RegistrantRecord> findByNetId(String netId);

  /**
   * 役割: 新規レコードを挿入する。
   * 動作: email / net_id の一意制約違反は DataIntegrityViolationException（DuplicateKeyException）として送出する。
   * 前提: record は検証済みで matched=false。
   */
  RegistrantRecord insert(RegistrantRecord record);

  /**
   * 役割: excludeId 以外の未マッチ登録者を 1 件返す。
   * 動作: major が null でなければ同じ major に限定する。複数該当時の選択順は規定しない。
   */
  Optional<RegistrantRecord> findUnmatchedCandidate(String excludeId, String major);

  /**
   * 役割: 2 件を互いの相手として原子的に確定する。
   * 動作: 両方がまだ未マッチの場合のみ両方を更新して true を返す。片方でも確定済みなら何も書かず false。
   * 前提: registrantId と candidateId は異なる。
   */
  boolean claimPair(String registrantId, String candidateId, Instant matchedAt);

  /**
   * 役割: matched_with が expectedPartnerId と一致する場合のみマッチ状態を書き換える。
   * 動作: 更新件数（0 または 1）を返す。
   */
  int updateMatchState(String id, String expectedPartnerId, String newPartnerId, Instant updatedAt);

  /** 相手が存在しない、または相手が自分を指していないマッチ済みレコードを最大 limit 件返す。 */
  List<RegistrantRecord> findAsymmetricMatches(int limit);

  long countUnmatched();
}
