package com.chainmirror.ingestion.job;

import com.chainmirror.coordination.IndexingStatusPublisher;
import com.chainmirror.coordination.JobLockHandle;
import com.chainmirror.coordination.JobLockService;
import com.chainmirror.domain.Block;
import com.chainmirror.ingestion.adapter.ChainBlock;
import com.chainmirror.ingestion.adapter.ChainClient;
import com.chainmirror.ingestion.adapter.RpcException;
import com.chainmirror.ingestion.config.ContractAddressProperties;
import com.chainmirror.ingestion.config.IndexingProperties;
import com.chainmirror.ingestion.index.BlockIndexer;
import com.chainmirror.ingestion.index.IndexedBlock;
import com.chainmirror.ingestion.reconcile.ChainStateException;
import com.chainmirror.ingestion.reconcile.ReconciliationEngine;
import com.chainmirror.ingestion.reconcile.ReconciliationPlan;
import com.chainmirror.ingestion.reconcile.RevertDepthExceededException;
import com.chainmirror.ingestion.revert.RevertEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.chainmirror.ingestion.ScriptedChain.block;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IndexingCycleJobTest {

    @Mock
    private JobLockService jobLockService;
    @Mock
    private JobLockHandle lockHandle;
    @Mock
    private ChainClient chainClient;
    @Mock
    private IndexingStatusPublisher indexingStatusPublisher;
    @Mock
    private BlocksTableInitializer blocksTableInitializer;
    @Mock
    private ReconciliationEngine reconciliationEngine;
    @Mock
    private RevertEngine revertEngine;
    @Mock
    private BlockIndexer blockIndexer;
    @Mock
    private FatalInvariantHandler fatalInvariantHandler;

    private IndexingProperties properties;
    private IndexingCycleJob job;

    private final ChainBlock tip = block(12, "0xb12", "0xb11");

    @BeforeEach
    void setUp() {
        properties = new IndexingProperties();
        job = new IndexingCycleJob(jobLockService, chainClient, indexingStatusPublisher, blocksTableInitializer,
                reconciliationEngine, revertEngine, blockIndexer, fatalInvariantHandler, properties,
                new ContractAddressProperties());
    }

    @Test
    @DisplayName("lock held elsewhere: the cycle returns without touching chain or store")
    void lockBusy_skips() {
        when(jobLockService.tryAcquire(IndexingCycleJob.LOCK_NAME, properties.getLockTtl())).thenReturn(Optional.empty());

        assertThat(job.runCycle()).isEqualTo(CycleOutcome.LOCK_BUSY);

        verifyNoInteractions(chainClient, indexingStatusPublisher, blocksTableInitializer, reconciliationEngine,
                revertEngine, blockIndexer);
    }

    @Test
    void fullCycle_runsStepsInOrder_andReleasesLock() {
        Block stale = new Block("0xb11a", 11L, "0xb10", true);
        ChainBlock next = block(11, "0xb11", "0xb10");
        ReconciliationPlan plan = new ReconciliationPlan(List.of(next, tip), List.of(stale), "0xb10");
        givenLock();
        when(chainClient.getLatestBlock()).thenReturn(tip);
        when(reconciliationEngine.reconcile(12L)).thenReturn(plan);
        when(blockIndexer.index(eq(plan.toIndex()), any())).thenReturn(List.of(
                new IndexedBlock(11, "0xb11", 0, Map.of()), new IndexedBlock(12, "0xb12", 0, Map.of())));

        assertThat(job.runCycle()).isEqualTo(CycleOutcome.PROGRESSED);

        InOrder order = inOrder(indexingStatusPublisher, blocksTableInitializer, reconciliationEngine, revertEngine,
                blockIndexer, lockHandle);
        order.verify(indexingStatusPublisher).publishLatestChainBlock(12L, "0xb12");
        order.verify(blocksTableInitializer).initialize();
        order.verify(reconciliationEngine).reconcile(12L);
        order.verify(revertEngine).revert(List.of(stale));
        order.verify(blockIndexer).index(eq(plan.toIndex()), any());
        order.verify(lockHandle).close();
    }

    @Test
    void emptyPlan_isUpToDate() {
        givenLock();
        when(chainClient.getLatestBlock()).thenReturn(tip);
        when(reconciliationEngine.reconcile(12L)).thenReturn(new ReconciliationPlan(List.of(), List.of(), "0xb12"));

        assertThat(job.runCycle()).isEqualTo(CycleOutcome.UP_TO_DATE);

        verify(revertEngine, never()).revert(anyList());
        verify(blockIndexer, never()).index(anyList(), any());
        verify(lockHandle).close();
    }

    @Test
    @DisplayName("transient chain failure: cycle fails, lock released, job keeps running")
    void transientFailure_releasesLock() {
        givenLock();
        when(chainClient.getLatestBlock()).thenThrow(new RpcException("timeout"));

        assertThat(job.runCycle()).isEqualTo(CycleOutcome.FAILED);

        verify(lockHandle).close();
        verify(fatalInvariantHandler, never()).handle(any(), any());
    }

    @Test
    @DisplayName("deep reorg is fatal: handler halts indexing")
    void fatalError_isHandedToHandler() {
        givenLock();
        when(chainClient.getLatestBlock()).thenReturn(tip);
        RevertDepthExceededException fatal = new RevertDepthExceededException(501, 500);
        when(reconciliationEngine.reconcile(anyLong())).thenThrow(fatal);

        assertThat(job.runCycle()).isEqualTo(CycleOutcome.HALTED);

        verify(fatalInvariantHandler).handle(eq(fatal), any());
        verify(revertEngine, never()).revert(anyList());
        verify(lockHandle).close();
    }

    @Test
    void halted_refusesToRun() {
        when(fatalInvariantHandler.isHalted()).thenReturn(true);

        assertThat(job.runCycle()).isEqualTo(CycleOutcome.HALTED);

        verifyNoInteractions(jobLockService, chainClient);
    }

    @Test
    void initializerInvariantViolation_isFatal() {
        givenLock();
        when(chainClient.getLatestBlock()).thenReturn(tip);
        when(blocksTableInitializer.initialize()).thenThrow(new ChainStateException("Found 2 current blocks"));

        assertThat(job.runCycle()).isEqualTo(CycleOutcome.HALTED);

        verify(reconciliationEngine, never()).reconcile(anyLong());
    }

    @Test
    void disabled_scheduledTickDoesNothing() {
        properties.setEnabled(false);

        job.runScheduled();

        verifyNoInteractions(jobLockService);
    }

    private void givenLock() {
        when(jobLockService.tryAcquire(IndexingCycleJob.LOCK_NAME, properties.getLockTtl())).thenReturn(Optional.of(lockHandle));
    }
}
