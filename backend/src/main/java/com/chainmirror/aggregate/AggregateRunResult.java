package com.chainmirror.aggregate;

/**
 * One aggregate recompute: users changed in blocks (fromBlock, toBlock] were recounted.
 *
 * @param skipped true when no block was indexed since the checkpoint
 */
public record AggregateRunResult(long fromBlock, long toBlock, int usersUpdated, boolean skipped) {

    static AggregateRunResult skipped(long checkpoint) {
        return new AggregateRunResult(checkpoint, checkpoint, 0, true);
    }
}
