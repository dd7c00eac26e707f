package com.chainmirror.ingestion.index;

/**
 * Receipts for a block could not all be fetched. The block is not applied; the next cycle retries it.
 */
public class ReceiptFetchException extends RuntimeException {

    public ReceiptFetchException(String message) {
        super(message);
    }

    public ReceiptFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
