package com.dcruver.goldenset.io;

import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.Platform;
import com.dcruver.goldenset.domain.SpecItem;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Final dataset record: identified by its slot id, tagged with its split, no candidate id.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PackagedItem {
    String id;
    String split;
    String slotId;
    String sourceCandidateId;
    String archetype;
    String complexity;
    String locale;
    int rep;
    int seq;
    LengthBand lengthBand;
    Platform platform;
    String spec;

    public static PackagedItem of(SpecItem item, String split) {
        return PackagedItem.builder()
            .id(item.getSlotId())
            .split(split)
            .slotId(item.getSlotId())
            .sourceCandidateId(item.getSourceCandidateId() != null ? item.getSourceCandidateId() : item.getCandidateId())
            .archetype(item.getArchetype())
            .complexity(item.getComplexity())
            .locale(item.getLocale())
            .rep(item.getRep())
            .seq(item.getSeq())
            .lengthBand(item.getLengthBand())
            .platform(item.getPlatform())
            .spec(item.getSpec())
            .build();
    }

    @JsonIgnore
    public String getStratumKey() {
        return archetype + "-" + complexity + "-" + locale;
    }
}
