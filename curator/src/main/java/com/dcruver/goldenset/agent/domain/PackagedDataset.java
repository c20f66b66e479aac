package com.dcruver.goldenset.agent.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Dataset files written; counts per split plus "golden".
 */
@Value
@Builder
public class PackagedDataset {
    Map<String, Integer> counts;
}
