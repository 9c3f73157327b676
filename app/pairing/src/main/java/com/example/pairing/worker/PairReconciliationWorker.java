package com.example.pairing.worker;

import com.example.pairing.config.PairingProperties;
import com.example.pairing.model.MatchStateChange;
import com.example.pairing.model.RegistrantRecord;
import com.example.pairing.repository.RegistrantRepository;
import com.example.pairing.service.PairingMetrics;
import com.example.pairing.service.RegistrantStore;
import com.example.pairing.service.StorageGate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * マッチの対称性を定期的に点検し、相手が消えた・相手が自分を指していない登録者を未マッチへ戻す。
 */
@Component
@ConditionalOnProperty(
    name = "pairing.reconcile-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class PairReconciliationWorker {

  private static final Logger logger = LoggerFactory.getLogger(PairReconciliationWorker.class);

  private final PairingMetrics metrics;
  private final PairingProperties properties;
  private final RegistrantRepository repository;
  private final RegistrantStore store;
  private final StorageGate storageGate;

  public PairReconciliationWorker(
      PairingMetrics metrics,
      PairingProperties properties,
      RegistrantRepository repository,
      RegistrantStore store,
      StorageGate storageGate) {
    this.metrics = metrics;
    this.properties = properties;
    this.repository = repository;
    this.store = store;
    this.storageGate = storageGate;
  }

  @Scheduled(fixedDelayString = "${pairing.reconcile-interval:30s}")
  public void run() {
    if (!storageGate.isAvailable()) {
      return;
    }
    try {
      final List<RegistrantRecord> asymmetric =
          repository.findAsymmetricMatches(properties.reconcileBatchSize());
      for (RegistrantRecord registrant : asymmetric) {
        release(registrant);
      }
      metrics.updateUnmatched(repository.countUnmatched());
    } catch (RuntimeException ex) {
      logger.warn("pair reconciliation loop failed", ex);
      metrics.recordDependencyError("reconcile_loop");
    }
  }

  private void release(RegistrantRecord registrant) {
    final RegistrantRecord after =
        store.update(registrant.id(), MatchStateChange.release(registrant.matchedWith()));
    if (after.matched()) {
      // 読み取り後に別経路で書き換わっている
      logger.debug("reconcile skipped, state changed registrantId={}", registrant.id());
      return;
    }
    logger.info(
        "reconciled dangling match registrantId={} partnerId={}",
        registrant.id(),
        registrant.matchedWith());
    metrics.recordSelfHeal("reconcile");
  }
}
