package com.dcruver.goldenset.agent.domain;

import com.dcruver.goldenset.domain.Slot;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Declared strata expanded into slots. First type in the curation chain.
 */
@Value
@Builder
public class SlotPlan {
    List<Slot> slots;
    int variantsPerSlot;

    public int getSlotCount() {
        return slots.size();
    }
}
