package com.chainmirror.ingestion.store;

/**
 * The current-version pointer was not where this writer expected it; another writer moved it.
 * Thrown inside a transaction so that the whole block or revert batch rolls back.
 */
public class ConcurrentVersionUpdateException extends RuntimeException {

    public ConcurrentVersionUpdateException(String message) {
        super(message);
    }
}
