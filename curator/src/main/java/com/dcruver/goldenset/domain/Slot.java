package com.dcruver.goldenset.domain;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * A logical request for one item of a stratum.
 */
@Data
@Builder
@Jacksonized
public class Slot {
    private final String slotId;
    private final String archetype;
    private final String complexity;
    private final String locale;
    private final String platform;
    private final int rep;
    private final int seq;

    // Band the synthesizer should aim for
    private final LengthBand lengthBand;

    public StratumKey stratum() {
        return new StratumKey(archetype, complexity, locale);
    }

    /**
     * golden_{archetype}{complexity}{locale}_{platform}_rep{rep:02}_seq{seq:03}
     */
    public static String slotId(StratumKey stratum, String platform, int rep, int seq) {
        return String.format("golden_%s_%s_rep%02d_seq%03d", stratum.compact(), platform, rep, seq);
    }

    public static Slot of(StratumKey stratum, String platform, int rep, int seq, LengthBand lengthBand) {
        return Slot.builder()
            .slotId(slotId(stratum, platform, rep, seq))
            .archetype(stratum.archetype())
            .complexity(stratum.complexity())
            .locale(stratum.locale())
            .platform(platform)
            .rep(rep)
            .seq(seq)
            .lengthBand(lengthBand)
            .build();
    }
}
