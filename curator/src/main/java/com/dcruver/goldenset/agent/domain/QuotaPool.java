package com.dcruver.goldenset.agent.domain;

import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.topup.TopUpResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Every stratum at exactly its quota, renumbered.
 */
@Value
@Builder
public class QuotaPool {
    List<SpecItem> items;
    List<SpecItem> pool;
    TopUpResult topUp;
}
