package com.dcruver.goldenset.agent.domain;

import com.dcruver.goldenset.io.Lockfile;
import lombok.Builder;
import lombok.Value;

/**
 * Verified dataset pinned by its lockfile. Last type in the curation chain.
 */
@Value
@Builder
public class LockedDataset {
    Lockfile lockfile;
    int totalItems;
}
