package com.example.pairing.service;

import com.example.pairing.api.RegistrantConflictException;
import com.example.pairing.api.RegistrantNotFoundException;
import com.example.pairing.api.StorageUnavailableException;
import com.example.pairing.api.request.RegisterRequest;
import com.example.pairing.api.response.MatchStatusResponse;
import com.example.pairing.api.response.PartnerSummary;
import com.example.pairing.api.response.RegistrantResponse;
import com.example.pairing.api.response.RegistrationResponse;
import com.example.pairing.config.PairingProperties;
import com.example.pairing.model.ConflictField;
import com.example.pairing.model.MatchStateChange;
import com.example.pairing.model.NewRegistrant;
import com.example.pairing.model.RegistrantRecord;
import com.example.pairing.repository.RegistrantRepository;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 登録者のペア割り当てエンジン。
 *
 * <p>新規登録者に対し、同じ major の未マッチ登録者を優先し、いなければ任意の未マッチ登録者と組む。候補の選び方は規定しない
 * （最初に見つかった候補）。確定は {@link RegistrantRepository#claimPair} による 2 行同時の条件付き書き込みで行い、競合時は再検索する。
 */
@Service
public class MatchingService {

  private static final Logger logger = LoggerFactory.getLogger(MatchingService.class);

  private final RegistrantStore store;
  private final RegistrantRepository repository;
  private final StorageGate storageGate;
  private final PairingMetrics metrics;
  private final PairingProperties properties;
  private final Clock clock;

  public MatchingService(
      RegistrantStore store,
      RegistrantRepository repository,
      StorageGate storageGate,
      PairingMetrics metrics,
      PairingProperties properties,
      Clock clock) {
    this.store = store;
    this.repository = repository;
    this.storageGate = storageGate;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  public RegistrationResponse registerAndMatch(@NonNull RegisterRequest request) {
    ensureStorageAvailable();

    final Optional<RegistrantRecord> existing = findExistingByEmail(request.email());
    if (existing.isPresent()) {
      metrics.recordRegistration("existing");
      return currentState(existing.get());
    }

    final RegistrantRecord created;
    try {
      created = store.create(toNewRegistrant(request));
    } catch (RegistrantConflictException ex) {
      // email の並行登録、または netId が既存登録者のもの。いずれも既存レコードの現状を返す
      final RegistrantRecord owner = findConflictOwner(request, ex).orElseThrow(() -> ex);
      logger.info(
          "registration resolved to existing registrant id={} conflictField={}",
          owner.id(),
          ex.field().value());
      metrics.recordRegistration("existing");
      return currentState(owner);
    }
    logger.info("registrant created id={} major={}", created.id(), created.major());
    return allocate(created);
  }

  public MatchStatusResponse queryMatch(String id) {
    ensureStorageAvailable();
    final RegistrantRecord registrant =
        store.findById(id).orElseThrow(() -> new RegistrantNotFoundException(id));
    if (!registrant.matched()) {
      return MatchStatusResponse.unmatched();
    }
    return resolvePartner(registrant)
        .map(partner -> new MatchStatusResponse(true, PartnerSummary.of(partner)))
        .orElseGet(MatchStatusResponse::unmatched);
  }

  private RegistrationResponse allocate(RegistrantRecord registrant) {
    for (int attempt = 1; attempt <= properties.claimMaxAttempts(); attempt++) {
      final Optional<RegistrantRecord> candidate = findCandidate(registrant);
      if (candidate.isEmpty()) {
        break;
      }
      final RegistrantRecord partner = candidate.get();
      final Instant matchedAt = Instant.now(clock);
      if (repository.claimPair(registrant.id(), partner.id(), matchedAt)) {
        logger.info(
            "pair committed registrantId={} partnerId={} attempt={}",
            registrant.id(),
            partner.id(),
            attempt);
        metrics.recordRegistration("matched");
        return new RegistrationResponse(
            true,
            RegistrantResponse.of(registrant.withMatch(partner.id(), matchedAt)),
            PartnerSummary.of(partner));
      }

      metrics.recordClaimConflict();
      logger.debug(
          "pair claim lost registrantId={} candidateId={} attempt={}",
          registrant.id(),
          partner.id(),
          attempt);
      final RegistrantRecord reloaded = reload(registrant);
      if (reloaded.matched()) {
        // 並行到着した登録者に先に選ばれた
        return finish(reloaded);
      }
    }
    return finish(reload(registrant));
  }

  private RegistrationResponse finish(RegistrantRecord registrant) {
    final RegistrationResponse response = currentState(registrant);
    metrics.recordRegistration(response.matched() ? "matched" : "pending");
    return response;
  }

  private Optional<RegistrantRecord> findCandidate(RegistrantRecord registrant) {
    final Optional<RegistrantRecord> sameMajor =
        repository.findUnmatchedCandidate(registrant.id(), registrant.major());
    if (sameMajor.isPresent()) {
      return sameMajor;
    }
    return repository.findUnmatchedCandidate(registrant.id(), null);
  }

  private RegistrationResponse currentState(RegistrantRecord registrant) {
    if (!registrant.matched()) {
      return new RegistrationResponse(false, RegistrantResponse.of(registrant), null);
    }
    final Optional<RegistrantRecord> partner = resolvePartner(registrant);
    if (partner.isEmpty()) {
      return new RegistrationResponse(false, RegistrantResponse.of(reload(registrant)), null);
    }
    return new RegistrationResponse(
        true, RegistrantResponse.of(registrant), PartnerSummary.of(partner.get()));
  }

  /**
   * 役割: マッチ相手を解決する。
   * 動作: 相手が存在しない、または相手が自分を指していない場合は自分を未マッチへ戻し（自己修復）、empty を返す。
   * 前提: registrant.matched() が true。
   */
  private Optional<RegistrantRecord> resolvePartner(RegistrantRecord registrant) {
    final String partnerId = registrant.matchedWith();
    final Optional<RegistrantRecord> partner = store.findById(partnerId);
    if (partner.isPresent() && registrant.id().equals(partner.get().matchedWith())) {
      return partner;
    }
    logger.warn(
        "dangling match released registrantId={} partnerId={} partnerPresent={}",
        registrant.id(),
        partnerId,
        partner.isPresent());
    store.update(registrant.id(), MatchStateChange.release(partnerId));
    metrics.recordSelfHeal("read");
    return Optional.empty();
  }

  private RegistrantRecord reload(RegistrantRecord registrant) {
    return store
        .findById(registrant.id())
        .orElseThrow(() -> new RegistrantNotFoundException(registrant.id()));
  }

  private Optional<RegistrantRecord> findExistingByEmail(String email) {
    if (email == null || email.isBlank()) {
      return Optional.empty();
    }
    return store.findByEmail(email);
  }

  private Optional<RegistrantRecord> findConflictOwner(
      RegisterRequest request, RegistrantConflictException conflict) {
    if (conflict.field() == ConflictField.EMAIL) {
      return store.findByEmail(request.email());
    }
    return store.findByNetId(request.netId());
  }

  private void ensureStorageAvailable() {
    if (!storageGate.isAvailable()) {
      metrics.recordDependencyError("storage_gate_closed");
      throw new StorageUnavailableException("storage is unavailable");
    }
  }

  private NewRegistrant toNewRegistrant(RegisterRequest request) {
    return new NewRegistrant(
        request.name(),
        request.email(),
        request.netId(),
        request.major(),
        rawGraduationYear(request.graduationYear()));
  }

  private static String rawGraduationYear(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    return value.isValueNode() ? value.asText() : value.toString();
  }
}
