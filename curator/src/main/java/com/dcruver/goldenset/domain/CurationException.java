package com.dcruver.goldenset.domain;

/**
 * Base type for failures of the curation pipeline.
 */
public class CurationException extends RuntimeException {

    public CurationException(String message) {
        super(message);
    }

    public CurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
