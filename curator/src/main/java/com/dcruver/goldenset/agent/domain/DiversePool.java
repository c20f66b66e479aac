package com.dcruver.goldenset.agent.domain;

import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.diversity.DiversityReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Quota pool after diversity swaps. Diversity is best effort; check the report.
 */
@Value
@Builder
public class DiversePool {
    List<SpecItem> items;
    DiversityReport report;

    public boolean isClusterDiverse() {
        return report.getClusterDiversity().isDiverse();
    }
}
