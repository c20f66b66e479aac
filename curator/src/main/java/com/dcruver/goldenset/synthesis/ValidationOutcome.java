package com.dcruver.goldenset.synthesis;

import com.dcruver.goldenset.domain.SpecItem;
import lombok.Value;

import java.util.List;

/**
 * Verdict for one item. {@code item} carries any corrections (e.g. the actual length band)
 * even when the item is rejected.
 */
@Value
public class ValidationOutcome {
    boolean accepted;
    SpecItem item;
    List<String> diagnostics;

    public static ValidationOutcome accept(SpecItem item) {
        return new ValidationOutcome(true, item, List.of());
    }

    public static ValidationOutcome reject(SpecItem corrected, List<String> diagnostics) {
        return new ValidationOutcome(false, corrected, List.copyOf(diagnostics));
    }
}
