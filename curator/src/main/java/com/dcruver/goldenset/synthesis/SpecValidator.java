package com.dcruver.goldenset.synthesis;

import com.dcruver.goldenset.domain.SpecItem;

/**
 * Accepts or rejects a candidate item, possibly with a corrected copy.
 */
public interface SpecValidator {

    ValidationOutcome validate(SpecItem item);
}
