package com.dcruver.goldenset.agent.domain;

import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.dedup.DedupReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Near-duplicate-free survivors. Strata may be below or above quota.
 */
@Value
@Builder
public class DedupedPool {
    List<SpecItem> survivors;
    List<SpecItem> pool;
    DedupReport report;
}
