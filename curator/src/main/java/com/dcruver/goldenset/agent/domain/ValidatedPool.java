package com.dcruver.goldenset.agent.domain;

import com.dcruver.goldenset.domain.SpecItem;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Candidates that passed structural, platform, band, PII and style checks.
 * This is the superset every later stage may draw replacements from.
 */
@Value
@Builder
public class ValidatedPool {
    List<SpecItem> items;
    int rejected;
}
