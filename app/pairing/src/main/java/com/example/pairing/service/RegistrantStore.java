package com.example.pairing.service;

import com.example.pairing.api.RegistrantConflictException;
import com.example.pairing.api.RegistrantNotFoundException;
import com.example.pairing.api.RegistrantValidationException;
import com.example.pairing.api.response.FieldViolation;
import com.example.pairing.model.ConflictField;
import com.example.pairing.model.MatchStateChange;
import com.example.pairing.model.NewRegistrant;
import com.example.pairing.model.RegistrantRecord;
import com.example.pairing.repository.RegistrantRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/** 登録者レコードの一意キー付き永続化と点検索。 */
@Service
public class RegistrantStore {

  private static final Logger logger = LoggerFactory.getLogger(RegistrantStore.class);

  // details は入力項目の並び順で返す
  private static final List<String> FIELD_ORDER =
      List.of("name", "email", "netId", "major", "graduationYear");

  private final RegistrantRepository repository;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Validator は Spring 管理の共有コンポーネントのため")
  private final Validator validator;

  private final Clock clock;

  public RegistrantStore(RegistrantRepository repository, Validator validator, Clock clock) {
    this.repository = repository;
    this.validator = validator;
    this.clock = clock;
  }

  public Optional<RegistrantRecord> findById(String id) {
    return repository.findById(id);
  }

  public Optional<RegistrantRecord> findByEmail(String email) {
    return repository.findByEmail(email);
  }

  public Optional<RegistrantRecord> findByNetId(String netId) {
    return repository.findByNetId(netId);
  }

  /**
   * 役割: 検証済みの新規登録者を永続化する。
   * 動作: 必須違反は全項目をまとめて RegistrantValidationException、email / netId の重複は事前検索でも
   * 挿入時の一意制約違反でも RegistrantConflictException として送出する。
   */
  public RegistrantRecord create(NewRegistrant registrant) {
    validate(registrant);
    if (repository.findByEmail(registrant.email()).isPresent()) {
      throw new RegistrantConflictException(ConflictField.EMAIL);
    }
    if (repository.findByNetId(registrant.netId()).isPresent()) {
      throw new RegistrantConflictException(ConflictField.NET_ID);
    }

    final Instant now = Instant.now(clock);
    final RegistrantRecord record =
        new RegistrantRecord(
            UUID.randomUUID().toString(),
            registrant.name(),
            registrant.email(),
            registrant.netId(),
            registrant.major(),
            registrant.graduationYearValue(),
            false,
            null,
            now,
            now);
    try {
      return repository.insert(record);
    } catch (DataIntegrityViolationException ex) {
      throw resolveConflict(registrant, ex);
    }
  }

  /**
   * 役割: マッチ状態を部分更新する。
   * 動作: 期待値が一致すれば適用し、一致しなければ何も書かずに現在のレコードを返す。
   * 前提: id が存在しない場合は RegistrantNotFoundException。
   */
  public RegistrantRecord update(String id, MatchStateChange change) {
    final int updated =
        repository.updateMatchState(
            id, change.expectedPartnerId(), change.newPartnerId(), Instant.now(clock));
    if (updated == 0) {
      logger.debug("match state precondition not met id={} change={}", id, change);
    }
    return repository.findById(id).orElseThrow(() -> new RegistrantNotFoundException(id));
  }

  private void validate(NewRegistrant registrant) {
    final List<FieldViolation> violations =
        validator.validate(registrant).stream()
            .map(this::toFieldViolation)
            .distinct()
            .sorted(Comparator.comparingInt(v -> FIELD_ORDER.indexOf(v.field())))
            .toList();
    if (!violations.isEmpty()) {
      throw new RegistrantValidationException(violations);
    }
  }

  private FieldViolation toFieldViolation(ConstraintViolation<NewRegistrant> violation) {
    return new FieldViolation(violation.getPropertyPath().toString(), violation.getMessage());
  }

  private RuntimeException resolveConflict(
      NewRegistrant registrant, DataIntegrityViolationException ex) {
    if (repository.findByEmail(registrant.email()).isPresent()) {
      return new RegistrantConflictException(ConflictField.EMAIL, ex);
    }
    if (repository.findByNetId(registrant.netId()).isPresent()) {
      return new RegistrantConflictException(ConflictField.NET_ID, ex);
    }
    return ex;
  }
}
