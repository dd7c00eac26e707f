package com.chainmirror.ingestion.reconcile;

/**
 * The chain answered the backward walk from different forks (a parent lookup returned another hash or height).
 * Transient: the cycle is abandoned and the next one starts over.
 */
public class ChainViewInconsistentException extends RuntimeException {

    public ChainViewInconsistentException(String message) {
        super(message);
    }
}
