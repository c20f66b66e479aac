package com.dcruver.goldenset.synthesis;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.Slot;
import com.dcruver.goldenset.domain.StratumKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands the declared strata plan into slots.
 * Strata follow the configured archetype / complexity / locale order; seq runs across all of them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SlotPlanner {

    private final CurationProperties properties;

    public List<Slot> expand() {
        List<Slot> slots = new ArrayList<>();
        int seq = 1;
        for (String archetype : properties.getArchetypes()) {
            for (String complexity : properties.getComplexities()) {
                for (String locale : properties.getLocales()) {
                    StratumKey stratum = new StratumKey(archetype, complexity, locale);
                    for (int rep = 1; rep <= properties.getQuota(); rep++) {
                        slots.add(Slot.of(stratum, properties.getPlatform(), rep, seq++, LengthBand.forSlotIndex(rep - 1)));
                    }
                }
            }
        }
        log.info("Expanded {} strata into {} slots", slots.size() / Math.max(1, properties.getQuota()), slots.size());
        return slots;
    }

    /**
     * Variants requested per slot in the initial synthesis: the oversubscription factor rounded up
     */
    public int variantsPerSlot() {
        return Math.max(1, (int) Math.ceil(properties.getOversub()));
    }
}
