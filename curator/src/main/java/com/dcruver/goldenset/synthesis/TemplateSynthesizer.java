package com.dcruver.goldenset.synthesis;

import com.dcruver.goldenset.config.ArchetypeKitCatalog;
import com.dcruver.goldenset.config.CurationProperties.Kit;
import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.Platform;
import com.dcruver.goldenset.domain.Slot;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.SynthesisException;
import com.dcruver.goldenset.domain.bands.BandClassifier;
import com.dcruver.goldenset.nlp.SeedDerivation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic template-driven spec writer.
 *
 * Each variant is assembled from the archetype kit and the wording banks,
 * one generator per section, then padded or trimmed until its token count
 * falls inside the slot's target band.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TemplateSynthesizer implements Synthesizer {

    // Trim ranks: lines with a higher rank go first, rank 0 is never trimmed
    private static final int KEEP = 0;
    private static final int TRIM_MODELS = 1;
    private static final int TRIM_FEATURES = 2;
    private static final int TRIM_PAGES = 3;
    private static final int TRIM_NFR = 4;

    private final ArchetypeKitCatalog kits;
    private final BandClassifier bands;

    @Override
    public List<SpecItem> synthesize(Slot slot, int variantCount, long seed) {
        if (variantCount <= 0) {
            throw new IllegalArgumentException("Variant count must be positive: " + variantCount);
        }
        Kit kit;
        try {
            kit = kits.kitFor(slot.stratum());
        } catch (IllegalArgumentException e) {
            throw new SynthesisException("Cannot synthesize " + slot.getSlotId(), e);
        }

        Platform platform = Platform.of(slot.getPlatform(), kit.isServer());
        LengthBand band = slot.getLengthBand() != null ? slot.getLengthBand() : LengthBand.STANDARD;

        List<SpecItem> items = new ArrayList<>(variantCount);
        for (int variant = 1; variant <= variantCount; variant++) {
            long variantSeed = SeedDerivation.variantSeed(seed, slot.getSlotId(), variant);
            Draft draft = draft(slot, kit, platform, variantSeed);
            String spec = fitToBand(draft, band, variantSeed, slot.getSlotId());

            items.add(SpecItem.builder()
                .slotId(slot.getSlotId())
                .candidateId(String.format("%s__v%02d", slot.getSlotId(), variant))
                .archetype(slot.getArchetype())
                .complexity(slot.getComplexity())
                .locale(slot.getLocale())
                .rep(slot.getRep())
                .seq(slot.getSeq())
                .lengthBand(band)
                .platform(platform)
                .spec(spec)
                .build());
        }
        log.debug("Synthesized {} variants for {} ({})", variantCount, slot.getSlotId(), band);
        return items;
    }

    Draft draft(Slot slot, Kit kit, Platform platform, long variantSeed) {
        String archetype = slot.getArchetype();
        String complexity = slot.getComplexity();
        Draft draft = new Draft();

        UniformRandomProvider rng = sectionRng(variantSeed, 1);
        Section vision = draft.section("Vision");
        vision.add(pick(rng, WordingBanks.VISION_STATEMENTS) + " for " + archetype + " management.", KEEP);
        vision.add("", KEEP);
        vision.add("This " + complexity + " " + archetype + " application will provide users with a streamlined way to "
            + WordingBanks.ARCHETYPE_PURPOSE.getOrDefault(archetype, "get their work done."), KEEP);
        vision.add("", KEEP);
        vision.add(WordingBanks.COMPLEXITY_FOCUS.getOrDefault(complexity, WordingBanks.COMPLEXITY_FOCUS.get("MVP")), KEEP);

        rng = sectionRng(variantSeed, 2);
        Section tech = draft.section("Tech Stack");
        tech.add(pick(rng, WordingBanks.TECH_STACK_INTROS), KEEP);
        tech.add("", KEEP);
        tech.add("- **Frontend**: " + pick(rng, WordingBanks.FRONTEND_OPTIONS), KEEP);
        if (platform.isServer()) {
            tech.add("- **Backend**: " + pick(rng, WordingBanks.BACKEND_OPTIONS), KEEP);
            tech.add("- **Database**: " + pick(rng, WordingBanks.DATABASE_OPTIONS), KEEP);
        }
        tech.add("- **Deployment**: " + pick(rng, WordingBanks.DEPLOYMENT_OPTIONS), KEEP);
        tech.add(platform.isServer()
            ? "- **Hosting**: Replit with server binding to " + platform.getBind()
            : "- **Hosting**: Replit static site hosting", KEEP);

        rng = sectionRng(variantSeed, 3);
        Section models = draft.section("Data Models");
        models.add(pick(rng, WordingBanks.DATA_MODEL_INTROS), KEEP);
        models.add("", KEEP);
        List<String> modelLines = kit.getModels().isEmpty()
            ? List.of("**Record**: id, title, created_at")
            : kit.getModels();
        for (int i = 0; i < modelLines.size(); i++) {
            models.add("- " + modelLines.get(i), i == 0 ? KEEP : TRIM_MODELS);
        }

        rng = sectionRng(variantSeed, 4);
        Section pages = draft.section("Pages & Routes");
        pages.add(pick(rng, WordingBanks.ROUTES_INTROS), KEEP);
        pages.add("", KEEP);
        for (int i = 0; i < kit.getPages().size(); i++) {
            pages.add(pageLine(kit.getPages().get(i)), i < 2 ? KEEP : TRIM_PAGES);
        }

        rng = sectionRng(variantSeed, 5);
        Section features = draft.section("Feature Plan");
        features.add(pick(rng, WordingBanks.FEATURE_PLAN_INTROS), KEEP);
        features.add("", KEEP);
        for (int i = 0; i < kit.getFeatures().size(); i++) {
            features.add("- " + kit.getFeatures().get(i), i < 2 ? KEEP : TRIM_FEATURES);
        }
        features.add("", KEEP);
        features.add(WordingBanks.ACL_SNIPPET, KEEP);

        rng = sectionRng(variantSeed, 6);
        Section nfr = draft.section("NFR & SLOs");
        nfr.add(pick(rng, WordingBanks.NFR_INTROS), KEEP);
        nfr.add("", KEEP);
        boolean first = true;
        for (String category : WordingBanks.NFR_ORDER) {
            List<String> options = shuffled(rng, WordingBanks.NFR_CATEGORIES.get(category));
            for (String requirement : options.subList(0, 2)) {
                nfr.add("- " + category + ": " + requirement, first ? KEEP : TRIM_NFR);
                first = false;
            }
        }
        return draft;
    }

    String fitToBand(Draft draft, LengthBand band, long variantSeed, String slotId) {
        int lower = effectiveMin(band);
        int upper = effectiveMax(band);
        int count = bands.countTokens(draft.render());

        for (int rank = TRIM_NFR; rank > KEEP && count > upper; rank--) {
            while (count > upper && draft.removeLast(rank)) {
                count = bands.countTokens(draft.render());
            }
        }
        if (count > upper) {
            throw new SynthesisException(String.format(
                "Cannot fit %s into %s: %d tokens after trimming (max %d)", slotId, band, count, upper));
        }

        UniformRandomProvider rng = sectionRng(variantSeed, 7);
        int margin = Math.min(40, (upper - lower) / 4);
        int target = lower + rng.nextInt(margin + 1);
        List<String> padding = shuffled(rng, WordingBanks.PADDING_SENTENCES);
        List<Section> padSections = draft.paddable();
        int next = 0;
        while (count < target) {
            Section section = padSections.get(next % padSections.size());
            section.add("", KEEP);
            section.add(next % 4 == 3 ? padding.get((next / 4) % padding.size()) : composedSentence(rng), KEEP);
            next++;
            count = bands.countTokens(draft.render());
        }
        if (count > upper) {
            throw new SynthesisException(String.format(
                "Padding overshot %s for %s: %d tokens", band, slotId, count));
        }
        return draft.render();
    }

    /**
     * Smallest count inside the band that classifies back to the band
     */
    int effectiveMin(LengthBand band) {
        for (int count = band.getMinTokens(); count <= band.getMaxTokens(); count++) {
            if (bands.determineBand(count).orElse(null) == band) {
                return count;
            }
        }
        throw new IllegalStateException("Band " + band + " has no classifying token count");
    }

    int effectiveMax(LengthBand band) {
        for (int count = band.getMaxTokens(); count >= band.getMinTokens(); count--) {
            if (bands.determineBand(count).orElse(null) == band) {
                return count;
            }
        }
        throw new IllegalStateException("Band " + band + " has no classifying token count");
    }

    private static String pageLine(String page) {
        if ("Home".equals(page)) {
            return "- **Home**: `/` - The main landing page";
        }
        String route = page.toLowerCase(Locale.ROOT).replace(' ', '-');
        return String.format("- **%s**: `/%s` - %s", page, route,
            WordingBanks.PAGE_DESCRIPTIONS.getOrDefault(page, page + " page"));
    }

    private static UniformRandomProvider sectionRng(long variantSeed, int section) {
        return RandomSource.XO_RO_SHI_RO_128_PP.create(variantSeed + section);
    }

    private static String composedSentence(UniformRandomProvider rng) {
        return pick(rng, WordingBanks.PADDING_LEADS) + " " + pick(rng, WordingBanks.PADDING_SUBJECTS)
            + " " + pick(rng, WordingBanks.PADDING_CLAIMS);
    }

    private static String pick(UniformRandomProvider rng, List<String> options) {
        return options.get(rng.nextInt(options.size()));
    }

    private static List<String> shuffled(UniformRandomProvider rng, List<String> options) {
        List<String> copy = new ArrayList<>(options);
        for (int i = copy.size() - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            String tmp = copy.get(i);
            copy.set(i, copy.get(j));
            copy.set(j, tmp);
        }
        return copy;
    }

    /**
     * Mutable spec under construction
     */
    static class Draft {
        private final List<Section> sections = new ArrayList<>();

        Section section(String name) {
            Section section = new Section(name);
            sections.add(section);
            return section;
        }

        /**
         * Remove the last line with this trim rank, searching from the end of the spec
         */
        boolean removeLast(int rank) {
            for (int s = sections.size() - 1; s >= 0; s--) {
                if (sections.get(s).removeLast(rank)) {
                    return true;
                }
            }
            return false;
        }

        // Feature Plan ends with the access-control block, so nothing is appended there
        List<Section> paddable() {
            return sections.stream().filter(s -> !"Feature Plan".equals(s.name)).toList();
        }

        String render() {
            List<String> blocks = new ArrayList<>();
            for (Section section : sections) {
                blocks.add(section.render());
            }
            return String.join("\n\n", blocks) + "\n";
        }
    }

    static class Section {
        private final String name;
        private final List<String> lines = new ArrayList<>();
        private final List<Integer> ranks = new ArrayList<>();

        Section(String name) {
            this.name = name;
        }

        void add(String line, int rank) {
            lines.add(line);
            ranks.add(rank);
        }

        boolean removeLast(int rank) {
            for (int i = lines.size() - 1; i >= 0; i--) {
                if (ranks.get(i) == rank) {
                    lines.remove(i);
                    ranks.remove(i);
                    return true;
                }
            }
            return false;
        }

        String render() {
            return "## " + name + "\n\n" + String.join("\n", lines);
        }
    }
}
