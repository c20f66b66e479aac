package com.dcruver.goldenset.agent.domain;

import com.dcruver.goldenset.domain.SpecItem;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw synthesized candidates, not yet validated.
 */
@Value
@Builder
public class CandidatePool {
    SlotPlan plan;
    List<SpecItem> candidates;
    int failedSlots;
}
