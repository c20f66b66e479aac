package com.dcruver.goldenset.synthesis;

import com.dcruver.goldenset.domain.Slot;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.SynthesisException;

import java.util.List;

/**
 * Produces candidate items for a slot.
 */
public interface Synthesizer {

    /**
     * Generate {@code variantCount} candidates for {@code slot}, ids {@code {slot_id}__v{NN}} from 1.
     * The same slot, count and seed always give the same items.
     *
     * @throws SynthesisException if no candidates can be produced
     */
    List<SpecItem> synthesize(Slot slot, int variantCount, long seed);
}
