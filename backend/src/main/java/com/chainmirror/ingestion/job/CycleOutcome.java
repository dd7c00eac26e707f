package com.chainmirror.ingestion.job;

public enum CycleOutcome {
    /** Another instance holds the indexing lock. */
    LOCK_BUSY,
    /** A fatal error stopped indexing earlier (or in this cycle). */
    HALTED,
    /** Chain and blocks table already agree. */
    UP_TO_DATE,
    /** Blocks were reverted and/or indexed. */
    PROGRESSED,
    /** Transient failure; the next cycle retries. */
    FAILED
}
