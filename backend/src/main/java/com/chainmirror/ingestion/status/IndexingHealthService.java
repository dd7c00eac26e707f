package com.chainmirror.ingestion.status;

import com.chainmirror.coordination.IndexingStatusPublisher;
import com.chainmirror.domain.Block;
import com.chainmirror.domain.BlockRepository;
import com.chainmirror.domain.IndexingStatus;
import com.chainmirror.ingestion.adapter.ChainBlock;
import com.chainmirror.ingestion.adapter.ChainClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * How far indexing lags the chain, either from the published status or measured live.
 */
@Service
@RequiredArgsConstructor
public class IndexingHealthService {

    public static final long DEFAULT_HEALTHY_BLOCK_DIFF = 100;

    private final IndexingStatusPublisher indexingStatusPublisher;
    private final BlockRepository blockRepository;
    private final ChainClient chainClient;

    /** From the status document written by the indexing cycle; no chain call. */
    public HealthReport fromPublishedStatus(long healthyBlockDiff) {
        Optional<IndexingStatus> status = indexingStatusPublisher.current();
        if (status.isEmpty()) {
            return new HealthReport(null, null, null, null, null, false);
        }
        IndexingStatus s = status.get();
        return report(s.getLastIndexedBlockNumber(), s.getLastIndexedBlockHash(),
                s.getLatestChainBlockNumber(), s.getLatestChainBlockHash(), healthyBlockDiff);
    }

    /** Reads the current block and asks the chain for its tip. */
    public HealthReport live(long healthyBlockDiff) {
        List<Block> current = blockRepository.findByCurrentTrue();
        ChainBlock latest = chainClient.getLatestBlock();
        if (current.size() != 1) {
            return new HealthReport(null, null, latest.number(), latest.hash(), null, false);
        }
        Block block = current.get(0);
        Long dbNumber = block.getNumber() == null ? 0L : block.getNumber();
        return report(dbNumber, block.getBlockhash(), latest.number(), latest.hash(), healthyBlockDiff);
    }

    private static HealthReport report(Long dbNumber, String dbHash, Long webNumber, String webHash, long healthyBlockDiff) {
        if (webNumber == null) {
            return new HealthReport(dbNumber, dbHash, null, webHash, null, false);
        }
        long indexed = dbNumber == null ? 0L : dbNumber;
        long difference = webNumber - indexed;
        return new HealthReport(dbNumber, dbHash, webNumber, webHash, difference, difference <= healthyBlockDiff);
    }
}
