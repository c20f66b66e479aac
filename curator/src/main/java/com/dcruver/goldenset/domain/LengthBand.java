package com.dcruver.goldenset.domain;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Ordered length categories over token counts.
 * Ranges are inclusive and STANDARD / EXTENDED overlap on 601-800.
 */
public enum LengthBand {
    SHORT(250, 400, 1),
    STANDARD(401, 800, 3),
    EXTENDED(601, 1500, 1);

    private final int minTokens;
    private final int maxTokens;
    private final int perStratum;  // Slots of this band in the canonical 5-item stratum

    LengthBand(int minTokens, int maxTokens, int perStratum) {
        this.minTokens = minTokens;
        this.maxTokens = maxTokens;
        this.perStratum = perStratum;
    }

    public int getMinTokens() {
        return minTokens;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getPerStratum() {
        return perStratum;
    }

    public int width() {
        return maxTokens - minTokens;
    }

    public boolean contains(int tokenCount) {
        return tokenCount >= minTokens && tokenCount <= maxTokens;
    }

    /**
     * Target band for the slot at {@code index} (0-based, slot-id order) of a stratum:
     * first slot SHORT, fifth slot EXTENDED, everything else STANDARD.
     */
    public static LengthBand forSlotIndex(int index) {
        if (index == 0) {
            return SHORT;
        }
        if (index == 4) {
            return EXTENDED;
        }
        return STANDARD;
    }

    /**
     * The canonical band sequence for a stratum of the given size.
     */
    public static List<LengthBand> slotPlan(int stratumSize) {
        return IntStream.range(0, stratumSize)
            .mapToObj(LengthBand::forSlotIndex)
            .toList();
    }
}
