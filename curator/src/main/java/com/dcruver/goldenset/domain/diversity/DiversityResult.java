package com.dcruver.goldenset.domain.diversity;

import com.dcruver.goldenset.domain.SpecItem;
import lombok.Value;

import java.util.List;

@Value
public class DiversityResult {
    List<SpecItem> items;
    DiversityReport report;
}
