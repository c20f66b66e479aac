package com.dcruver.goldenset.domain.diversity;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DiversityReport {
    ClusterDiversity clusterDiversity;
    ShannonDiversity shannonDiversity;
    List<Swap> swaps;
    String diagnostic;
}
