package com.dcruver.goldenset.domain;

/**
 * Raised when the synthesis collaborator cannot produce candidates for a slot.
 */
public class SynthesisException extends CurationException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
