package com.dcruver.goldenset.domain;

import java.util.List;

/**
 * Packaged dataset failed the pre-lockfile integrity checks.
 */
public class IntegrityCheckException extends CurationException {

    private final List<String> failures;

    public IntegrityCheckException(List<String> failures) {
        super("Integrity check failed: " + String.join("; ", failures));
        this.failures = List.copyOf(failures);
    }

    public List<String> getFailures() {
        return failures;
    }
}
