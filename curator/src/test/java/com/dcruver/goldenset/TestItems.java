package com.dcruver.goldenset;

import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.Platform;
import com.dcruver.goldenset.domain.Slot;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.StratumKey;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixture builders shared by the curation tests.
 */
public final class TestItems {

    private TestItems() {
    }

    /**
     * {@code count} pseudo-random words drawn from a large synthetic vocabulary. Different seeds give
     * texts that share almost no word trigrams.
     */
    public static String words(long seed, int count) {
        UniformRandomProvider rng = RandomSource.XO_RO_SHI_RO_128_PP.create(seed);
        List<String> words = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            words.add("w" + Integer.toString(rng.nextInt(50_000), 36));
        }
        return String.join(" ", words);
    }

    public static SpecItem item(String candidateId, String archetype, String complexity, int rep, LengthBand band, String spec) {
        StratumKey stratum = new StratumKey(archetype, complexity, "en");
        String slotId = Slot.slotId(stratum, "replit", rep, rep);
        return SpecItem.builder()
            .slotId(slotId)
            .candidateId(candidateId)
            .sourceCandidateId(candidateId)
            .archetype(archetype)
            .complexity(complexity)
            .locale("en")
            .rep(rep)
            .seq(rep)
            .lengthBand(band)
            .platform(Platform.of("replit", true))
            .spec(spec)
            .build();
    }

    public static SpecItem item(String candidateId, String spec) {
        return item(candidateId, "blog", "MVP", 1, LengthBand.STANDARD, spec);
    }
}
