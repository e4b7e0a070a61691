package com.raditha.cloneindex.store;

/**
 * A record store could not complete an operation.
 */
public class RecordStoreException extends Exception {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
