package com.dcruver.goldenset.agent.domain;

import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.split.SplitAssignment;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SplitPool {
    List<SpecItem> items;
    SplitAssignment assignment;
}
