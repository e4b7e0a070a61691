package com.raditha.cloneindex.extraction;

/**
 * Source text could not be turned into code units, typically because it does
 * not parse.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
