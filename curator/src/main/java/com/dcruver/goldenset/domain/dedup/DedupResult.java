package com.dcruver.goldenset.domain.dedup;

import com.dcruver.goldenset.domain.SpecItem;
import lombok.Value;

import java.util.List;

@Value
public class DedupResult {
    List<SpecItem> survivors;
    DedupReport report;
}
