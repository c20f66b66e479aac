package com.dcruver.goldenset.domain.bands;

import com.dcruver.goldenset.domain.LengthBand;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Global length-band mix against its targets. Informational only.
 */
@Value
@Builder
public class BandReport {
    Map<LengthBand, Range> bandRanges;
    Map<LengthBand, Target> globalTargets;
    Map<LengthBand, Integer> distribution;
    boolean valid;
    List<Suggestion> suggestions;

    @Value
    public static class Range {
        int min;
        int max;
    }

    @Value
    public static class Target {
        int target;
        int tolerance;
    }

    /**
     * Move {@code slotId} from an over-represented band to an under-represented one
     */
    @Value
    public static class Suggestion {
        String slotId;
        LengthBand currentBand;
        LengthBand suggestedBand;
    }
}
