package com.chainmirror.ingestion.reconcile;

/**
 * The persisted chain is not in a state the indexer can safely continue from (e.g. not exactly one current block).
 * Fatal: indexing halts until an operator intervenes.
 */
public class ChainStateException extends RuntimeException {

    public ChainStateException(String message) {
        super(message);
    }
}
