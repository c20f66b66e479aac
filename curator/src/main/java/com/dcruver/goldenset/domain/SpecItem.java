package com.dcruver.goldenset.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * The unit of curation: one candidate spec produced for a slot.
 * Immutable; stages derive new instances via @With / toBuilder.
 */
@Data
@Builder(toBuilder = true)
@With
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SpecItem {
    private final String slotId;
    private final String candidateId;

    // Provenance: the candidate this item was originally generated as
    private final String sourceCandidateId;

    // Stratum
    private final String archetype;
    private final String complexity;
    private final String locale;

    // Position within stratum / global sequence
    private final int rep;
    private final int seq;

    private final LengthBand lengthBand;
    private final Platform platform;

    // Raw text body
    private final String spec;

    @JsonIgnore
    public StratumKey getStratum() {
        return new StratumKey(archetype, complexity, locale);
    }

    @JsonIgnore
    public String getStratumKey() {
        return getStratum().toString();
    }
}
