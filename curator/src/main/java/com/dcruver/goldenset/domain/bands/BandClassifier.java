package com.dcruver.goldenset.domain.bands;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.nlp.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Token counting and length-band membership.
 *
 * Bands overlap on 601-800; an overlapping count goes to the narrowest
 * matching band, so those counts are STANDARD.
 */
@Component
@Slf4j
public class BandClassifier {

    static final String ACCESS_CONTROL_LABEL = "### Access Control";

    private final TextNormalizer normalizer;
    private final Map<LengthBand, BandReport.Target> targets;

    @Autowired
    public BandClassifier(TextNormalizer normalizer, CurationProperties properties) {
        this(normalizer, targetsFrom(properties.getBands()));
    }

    public BandClassifier(TextNormalizer normalizer, Map<LengthBand, BandReport.Target> targets) {
        this.normalizer = normalizer;
        this.targets = new EnumMap<>(targets);
    }

    /**
     * Word tokens excluding H2 header lines and the access-control label
     */
    public int countTokens(String text) {
        if (text == null) {
            return 0;
        }
        String body = normalizer.stripH2Headers(text).replace(ACCESS_CONTROL_LABEL, "");
        return normalizer.tokenize(body).size();
    }

    public Optional<LengthBand> determineBand(int tokenCount) {
        LengthBand best = null;
        for (LengthBand band : LengthBand.values()) {
            if (band.contains(tokenCount) && (best == null || band.width() < best.width())) {
                best = band;
            }
        }
        return Optional.ofNullable(best);
    }

    public BandCheck validateBand(SpecItem item) {
        int count = countTokens(item.getSpec());
        LengthBand declared = item.getLengthBand();
        LengthBand actual = determineBand(count).orElse(null);

        if (actual == null) {
            return new BandCheck(false, count, declared, null,
                String.format("Token count %d does not fall into any band", count));
        }
        if (declared == null) {
            return new BandCheck(false, count, null, actual, "No declared length band");
        }
        if (declared != actual) {
            return new BandCheck(false, count, declared, actual,
                String.format("Declared band %s does not match actual band %s (token count: %d)", declared, actual, count));
        }
        return new BandCheck(true, count, declared, actual, null);
    }

    public Map<LengthBand, Integer> distribution(List<SpecItem> items) {
        Map<LengthBand, Integer> distribution = new EnumMap<>(LengthBand.class);
        for (LengthBand band : LengthBand.values()) {
            distribution.put(band, 0);
        }
        for (SpecItem item : items) {
            if (item.getLengthBand() != null) {
                distribution.merge(item.getLengthBand(), 1, Integer::sum);
            }
        }
        return distribution;
    }

    public boolean isMixValid(Map<LengthBand, Integer> distribution) {
        return targets.entrySet().stream().allMatch(e ->
            Math.abs(distribution.getOrDefault(e.getKey(), 0) - e.getValue().getTarget()) <= e.getValue().getTolerance());
    }

    /**
     * Band mix report with re-banding suggestions when the mix misses its targets
     */
    public BandReport report(List<SpecItem> items) {
        Map<LengthBand, Integer> distribution = distribution(items);
        boolean valid = isMixValid(distribution);

        Map<LengthBand, BandReport.Range> ranges = new EnumMap<>(LengthBand.class);
        for (LengthBand band : LengthBand.values()) {
            ranges.put(band, new BandReport.Range(band.getMinTokens(), band.getMaxTokens()));
        }

        BandReport report = BandReport.builder()
            .bandRanges(ranges)
            .globalTargets(new EnumMap<>(targets))
            .distribution(distribution)
            .valid(valid)
            .suggestions(valid ? List.of() : suggestAdjustments(items, distribution))
            .build();

        if (valid) {
            log.info("Band mix within targets: {}", distribution);
        } else {
            log.warn("Band mix misses targets: {} (targets {}), {} suggestions",
                distribution, targets, report.getSuggestions().size());
        }
        return report;
    }

    List<BandReport.Suggestion> suggestAdjustments(List<SpecItem> items, Map<LengthBand, Integer> distribution) {
        Map<LengthBand, Integer> deltas = new EnumMap<>(LengthBand.class);
        for (Map.Entry<LengthBand, BandReport.Target> e : targets.entrySet()) {
            deltas.put(e.getKey(), distribution.getOrDefault(e.getKey(), 0) - e.getValue().getTarget());
        }

        List<BandReport.Suggestion> suggestions = new ArrayList<>();
        for (LengthBand reduce : LengthBand.values()) {
            if (deltas.getOrDefault(reduce, 0) <= 0) {
                continue;
            }
            List<SpecItem> candidates = items.stream()
                .filter(item -> item.getLengthBand() == reduce)
                .sorted(Comparator.comparing(SpecItem::getSlotId))
                .toList();
            int next = 0;
            for (LengthBand increase : LengthBand.values()) {
                if (deltas.getOrDefault(increase, 0) >= 0) {
                    continue;
                }
                int moveCount = Math.min(deltas.get(reduce), -deltas.get(increase));
                if (moveCount <= 0) {
                    continue;
                }
                for (int i = 0; i < moveCount && next < candidates.size(); i++, next++) {
                    suggestions.add(new BandReport.Suggestion(candidates.get(next).getSlotId(), reduce, increase));
                }
                deltas.put(reduce, deltas.get(reduce) - moveCount);
                deltas.put(increase, deltas.get(increase) + moveCount);
            }
        }
        return suggestions;
    }

    private static Map<LengthBand, BandReport.Target> targetsFrom(CurationProperties.Bands bands) {
        Map<LengthBand, BandReport.Target> targets = new EnumMap<>(LengthBand.class);
        targets.put(LengthBand.SHORT, new BandReport.Target(bands.getShortTarget(), bands.getTolerance()));
        targets.put(LengthBand.STANDARD, new BandReport.Target(bands.getStandardTarget(), bands.getTolerance()));
        targets.put(LengthBand.EXTENDED, new BandReport.Target(bands.getExtendedTarget(), bands.getTolerance()));
        return targets;
    }
}
