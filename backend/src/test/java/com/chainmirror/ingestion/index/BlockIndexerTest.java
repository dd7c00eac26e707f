package com.chainmirror.ingestion.index;

import com.chainmirror.coordination.IndexingStatusPublisher;
import com.chainmirror.domain.EntityKind;
import com.chainmirror.ingestion.adapter.ChainBlock;
import com.chainmirror.ingestion.adapter.ChainTransaction;
import com.chainmirror.ingestion.adapter.TransactionReceipt;
import com.chainmirror.ingestion.apply.ContractClassifier;
import com.chainmirror.ingestion.apply.ContractKind;
import com.chainmirror.ingestion.cache.DirtyEntityPublisher;
import com.chainmirror.ingestion.config.ContractAddressProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.chainmirror.ingestion.ScriptedChain.block;
import static com.chainmirror.ingestion.ScriptedChain.receiptFor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlockIndexerTest {

    private static final String USER_FACTORY = "0x00000000000000000000000000000000000000u1";
    private static final String TRACK_FACTORY = "0x00000000000000000000000000000000000000t1";

    @Mock
    private ReceiptFetcher receiptFetcher;
    @Mock
    private BlockApplier blockApplier;
    @Mock
    private DirtyEntityPublisher dirtyEntityPublisher;
    @Mock
    private IndexingStatusPublisher indexingStatusPublisher;

    private BlockIndexer indexer;
    private ContractClassifier classifier;

    @BeforeEach
    void setUp() {
        indexer = new BlockIndexer(receiptFetcher, blockApplier, dirtyEntityPublisher, indexingStatusPublisher);
        ContractAddressProperties addresses = new ContractAddressProperties();
        addresses.setUserFactory(USER_FACTORY);
        addresses.setTrackFactory(TRACK_FACTORY);
        classifier = ContractClassifier.from(addresses);
    }

    @Test
    @DisplayName("receipts are bucketed by contract kind in transaction-hash order")
    @SuppressWarnings("unchecked")
    void bucketsReceiptsSortedByHash() {
        ChainTransaction tc = new ChainTransaction("0xcc", "0xa", USER_FACTORY, 0);
        ChainTransaction ta = new ChainTransaction("0xaa", "0xa", USER_FACTORY.toUpperCase().replace("0X", "0x"), 1);
        ChainTransaction tb = new ChainTransaction("0xbb", "0xa", TRACK_FACTORY, 2);
        ChainTransaction other = new ChainTransaction("0xdd", "0xa", "0xelsewhere", 3);
        ChainBlock b = block(10, "0xb10", "0xb9", tc, ta, tb, other);
        when(receiptFetcher.fetchAll(b)).thenReturn(receipts(b));
        when(blockApplier.apply(eq(b), anyMap())).thenReturn(new IndexedBlock(10, "0xb10", 0, Map.of()));

        indexer.index(List.of(b), classifier);

        ArgumentCaptor<Map<ContractKind, List<TransactionReceipt>>> captor = ArgumentCaptor.forClass(Map.class);
        verify(blockApplier).apply(eq(b), captor.capture());
        Map<ContractKind, List<TransactionReceipt>> buckets = captor.getValue();
        assertThat(buckets.get(ContractKind.USER_FACTORY)).extracting(TransactionReceipt::transactionHash)
                .containsExactly("0xaa", "0xcc");
        assertThat(buckets.get(ContractKind.TRACK_FACTORY)).extracting(TransactionReceipt::transactionHash)
                .containsExactly("0xbb");
        assertThat(buckets.get(ContractKind.PLAYLIST_FACTORY)).isEmpty();
    }

    @Test
    @DisplayName("dirty ids and indexed block are published only after the block committed")
    void publishesAfterCommit() {
        ChainBlock b = block(10, "0xb10", "0xb9");
        Map<EntityKind, Set<String>> affected = Map.of(EntityKind.TRACK, Set.of("4"));
        when(receiptFetcher.fetchAll(b)).thenReturn(Map.of());
        when(blockApplier.apply(eq(b), anyMap())).thenReturn(new IndexedBlock(10, "0xb10", 1, affected));

        List<IndexedBlock> indexed = indexer.index(List.of(b), classifier);

        assertThat(indexed).extracting(IndexedBlock::hash).containsExactly("0xb10");
        InOrder order = inOrder(blockApplier, dirtyEntityPublisher, indexingStatusPublisher);
        order.verify(blockApplier).apply(eq(b), anyMap());
        order.verify(dirtyEntityPublisher).publish(affected);
        order.verify(indexingStatusPublisher).publishIndexedBlock(10L, "0xb10");
    }

    @Test
    @DisplayName("receipt fetch failure: no applier runs and later blocks are not attempted")
    void receiptFailure_stopsBeforeApplying() {
        ChainBlock b1 = block(1, "0xb1", "0xb0", new ChainTransaction("0xt", "0xa", USER_FACTORY, 0));
        ChainBlock b2 = block(2, "0xb2", "0xb1");
        when(receiptFetcher.fetchAll(b1)).thenThrow(new ReceiptFetchException("Block 1 0xb1 has 1 transactions but only 0 receipts"));

        assertThatThrownBy(() -> indexer.index(List.of(b1, b2), classifier))
                .isInstanceOf(ReceiptFetchException.class);

        verify(blockApplier, never()).apply(any(), anyMap());
        verify(receiptFetcher, never()).fetchAll(b2);
        verify(indexingStatusPublisher, never()).publishIndexedBlock(anyLong(), anyString());
    }

    @Test
    void failingBlock_keepsEarlierBlocksPublished() {
        ChainBlock b1 = block(1, "0xb1", "0xb0");
        ChainBlock b2 = block(2, "0xb2", "0xb1");
        when(receiptFetcher.fetchAll(any())).thenReturn(Map.of());
        when(blockApplier.apply(eq(b1), anyMap())).thenReturn(new IndexedBlock(1, "0xb1", 0, Map.of()));
        when(blockApplier.apply(eq(b2), anyMap())).thenThrow(new IllegalStateException("write conflict"));

        assertThatThrownBy(() -> indexer.index(List.of(b1, b2), classifier)).hasMessageContaining("write conflict");

        verify(indexingStatusPublisher).publishIndexedBlock(1L, "0xb1");
        verify(indexingStatusPublisher, never()).publishIndexedBlock(2L, "0xb2");
    }

    private static Map<String, TransactionReceipt> receipts(ChainBlock b) {
        Map<String, TransactionReceipt> map = new HashMap<>();
        b.transactions().forEach(tx -> map.put(tx.hash(), receiptFor(b, tx, "0x")));
        return map;
    }
}
