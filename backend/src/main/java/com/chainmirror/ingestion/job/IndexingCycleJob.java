package com.chainmirror.ingestion.job;

import com.chainmirror.coordination.IndexingStatusPublisher;
import com.chainmirror.coordination.JobLockHandle;
import com.chainmirror.coordination.JobLockService;
import com.chainmirror.ingestion.adapter.ChainBlock;
import com.chainmirror.ingestion.adapter.ChainClient;
import com.chainmirror.ingestion.apply.ContractClassifier;
import com.chainmirror.ingestion.config.ContractAddressProperties;
import com.chainmirror.ingestion.config.IndexingProperties;
import com.chainmirror.ingestion.index.BlockIndexer;
import com.chainmirror.ingestion.index.IndexedBlock;
import com.chainmirror.ingestion.reconcile.ChainStateException;
import com.chainmirror.ingestion.reconcile.ReconciliationEngine;
import com.chainmirror.ingestion.reconcile.ReconciliationPlan;
import com.chainmirror.ingestion.revert.RevertEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Scheduled indexing cycle: lock, publish chain tip, initialize, reconcile, revert, index, unlock.
 * At most one cycle runs per cluster; a busy lock skips the tick.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IndexingCycleJob {

    public static final String LOCK_NAME = "disc_prov_lock";

    private final JobLockService jobLockService;
    private final ChainClient chainClient;
    private final IndexingStatusPublisher indexingStatusPublisher;
    private final BlocksTableInitializer blocksTableInitializer;
    private final ReconciliationEngine reconciliationEngine;
    private final RevertEngine revertEngine;
    private final BlockIndexer blockIndexer;
    private final FatalInvariantHandler fatalInvariantHandler;
    private final IndexingProperties indexingProperties;
    private final ContractAddressProperties contractAddressProperties;

    @Scheduled(fixedDelayString = "${chainmirror.indexing.schedule-interval-ms:5000}")
    public void runScheduled() {
        if (!indexingProperties.isEnabled()) {
            return;
        }
        runCycle();
    }

    public CycleOutcome runCycle() {
        if (fatalInvariantHandler.isHalted()) {
            log.warn("Indexing is halted after a fatal error; restart required");
            return CycleOutcome.HALTED;
        }
        String cycleId = UUID.randomUUID().toString().substring(0, 8);
        Optional<JobLockHandle> lock = jobLockService.tryAcquire(LOCK_NAME, indexingProperties.getLockTtl());
        if (lock.isEmpty()) {
            log.info("Indexing cycle {} skipped: lock {} held elsewhere", cycleId, LOCK_NAME);
            return CycleOutcome.LOCK_BUSY;
        }
        try (JobLockHandle ignored = lock.get()) {
            return runLocked(cycleId);
        } catch (ChainStateException e) {
            fatalInvariantHandler.handle(e, cycleId);
            return CycleOutcome.HALTED;
        } catch (RuntimeException e) {
            log.error("Indexing cycle {} failed: {}", cycleId, e.getMessage(), e);
            return CycleOutcome.FAILED;
        }
    }

    private CycleOutcome runLocked(String cycleId) {
        ChainBlock latest = chainClient.getLatestBlock();
        indexingStatusPublisher.publishLatestChainBlock(latest.number(), latest.hash());
        blocksTableInitializer.initialize();

        ReconciliationPlan plan = reconciliationEngine.reconcile(latest.number());
        if (plan.isEmpty()) {
            log.debug("Indexing cycle {}: up to date at chain block {}", cycleId, latest.number());
            return CycleOutcome.UP_TO_DATE;
        }
        revertEngine.revert(plan.toRevert());
        List<IndexedBlock> indexed = blockIndexer.index(plan.toIndex(), ContractClassifier.from(contractAddressProperties));
        log.info("Indexing cycle {} done: reverted {}, indexed {}, chain tip {}",
                cycleId, plan.toRevert().size(), indexed.size(), latest.number());
        return CycleOutcome.PROGRESSED;
    }
}
