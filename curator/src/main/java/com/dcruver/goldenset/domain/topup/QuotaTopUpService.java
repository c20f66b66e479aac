package com.dcruver.goldenset.domain.topup;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.Slot;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.StratumKey;
import com.dcruver.goldenset.domain.SynthesisException;
import com.dcruver.goldenset.domain.dedup.DedupReport;
import com.dcruver.goldenset.domain.dedup.DedupResult;
import com.dcruver.goldenset.domain.dedup.DuplicateResolver;
import com.dcruver.goldenset.domain.topup.TopUpTraceEntry.Reason;
import com.dcruver.goldenset.nlp.SeedDerivation;
import com.dcruver.goldenset.nlp.SimilarityEngine;
import com.dcruver.goldenset.synthesis.SpecValidator;
import com.dcruver.goldenset.synthesis.Synthesizer;
import com.dcruver.goldenset.synthesis.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Restores every stratum to exactly the quota after duplicate removal.
 *
 * Short strata are refilled from unused items of the same stratum, in the band
 * the plan is missing, least similar to what the stratum already holds first. When the pool runs dry the
 * synthesizer is asked for fresh variants, a bounded number of times. Strata
 * over quota are cut back along the band plan. Finally every item is
 * renumbered so slot ids are dense and ordered.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QuotaTopUpService {

    private final SimilarityEngine similarity;
    private final DuplicateResolver resolver;
    private final Synthesizer synthesizer;
    private final SpecValidator validator;
    private final CurationProperties properties;

    /**
     * @param kept items that survived duplicate removal
     * @param pool every previously seen item, kept or not
     * @throws QuotaUnmetException if a stratum is still short after the last regeneration attempt
     */
    public TopUpResult topUp(List<SpecItem> kept, List<SpecItem> pool) {
        int quota = properties.getQuota();
        ShingleCache shingles = new ShingleCache();

        Map<StratumKey, List<SpecItem>> keptByStratum = new TreeMap<>();
        Set<StratumKey> strata = new TreeSet<>(properties.declaredStrata());
        for (SpecItem item : kept) {
            keptByStratum.computeIfAbsent(item.getStratum(), k -> new ArrayList<>()).add(item);
            strata.add(item.getStratum());
        }
        Map<StratumKey, List<SpecItem>> poolByStratum = new TreeMap<>();
        Set<String> seenIds = new HashSet<>();
        for (SpecItem item : pool) {
            if (seenIds.add(item.getCandidateId())) {
                poolByStratum.computeIfAbsent(item.getStratum(), k -> new ArrayList<>()).add(item);
                strata.add(item.getStratum());
            }
        }

        Set<String> keptIds = kept.stream().map(SpecItem::getCandidateId).collect(Collectors.toCollection(HashSet::new));
        List<TopUpTraceEntry> trace = new ArrayList<>();
        int toppedUp = 0;
        int regenerated = 0;
        int trimmed = 0;

        for (StratumKey stratum : strata) {
            List<SpecItem> current = keptByStratum.computeIfAbsent(stratum, k -> new ArrayList<>());

            if (current.size() > quota) {
                List<SpecItem> retained = trimToPlan(current, quota);
                Set<String> retainedIds = retained.stream().map(SpecItem::getCandidateId).collect(Collectors.toSet());
                for (SpecItem item : current) {
                    if (!retainedIds.contains(item.getCandidateId())) {
                        keptIds.remove(item.getCandidateId());
                        trace.add(TopUpTraceEntry.builder()
                            .stratum(stratum.toString())
                            .candidateId(item.getCandidateId())
                            .selected(false)
                            .reason(Reason.OVER_QUOTA)
                            .build());
                        trimmed++;
                    }
                }
                log.info("Stratum {} over quota ({} > {}); trimmed to band plan", stratum, current.size(), quota);
                current.clear();
                current.addAll(retained);
                continue;
            }
            if (current.size() == quota) {
                continue;
            }

            int needed = quota - current.size();
            List<Set<String>> keptShingles = current.stream().map(shingles::of).toList();
            List<Scored> candidates = poolByStratum.getOrDefault(stratum, List.of()).stream()
                .filter(item -> !keptIds.contains(item.getCandidateId()))
                .map(item -> new Scored(item, SimilarityEngine.maxExactJaccard(shingles.of(item), keptShingles)))
                .sorted(Scored.ORDER)
                .toList();

            // Fill the first band the plan is short of, least similar first; other bands only when it has none left
            List<Scored> remaining = new ArrayList<>(candidates);
            int selected = 0;
            while (selected < needed && !remaining.isEmpty()) {
                LengthBand band = missingBand(current, quota);
                Scored pick = remaining.stream()
                    .filter(candidate -> candidate.item().getLengthBand() == band)
                    .findFirst()
                    .orElse(remaining.get(0));
                remaining.remove(pick);
                boolean fallback = pick.item().getLengthBand() != band;
                if (fallback) {
                    log.warn("Stratum {}: no {} candidate left in pool; filling with {} item {}",
                        stratum, band, pick.item().getLengthBand(), pick.item().getCandidateId());
                }
                trace.add(TopUpTraceEntry.builder()
                    .stratum(stratum.toString())
                    .candidateId(pick.item().getCandidateId())
                    .maxJaccard(SimilarityEngine.round4(pick.score()))
                    .selected(true)
                    .reason(Reason.TOP_UP)
                    .message(fallback
                        ? String.format("No %s candidate left; filled with %s", band, pick.item().getLengthBand())
                        : null)
                    .build());
                current.add(pick.item());
                keptIds.add(pick.item().getCandidateId());
                selected++;
            }
            for (Scored candidate : remaining) {
                trace.add(TopUpTraceEntry.builder()
                    .stratum(stratum.toString())
                    .candidateId(candidate.item().getCandidateId())
                    .maxJaccard(SimilarityEngine.round4(candidate.score()))
                    .selected(false)
                    .reason(Reason.NOT_NEEDED)
                    .build());
            }
            toppedUp += selected;
            log.info("Stratum {}: {} of {} missing items refilled from pool ({} candidates)",
                stratum, selected, needed, candidates.size());

            if (current.size() < quota) {
                trace.add(TopUpTraceEntry.builder()
                    .stratum(stratum.toString())
                    .reason(Reason.POOL_EMPTY)
                    .message(String.format("Need to regenerate %d items", quota - current.size()))
                    .build());
                regenerated += regenerate(stratum, current, keptByStratum, keptIds, shingles, trace);
            }

            if (current.size() < quota) {
                log.error("Stratum {} still has {} of {} items after {} regeneration attempts",
                    stratum, current.size(), quota, properties.getTopUp().getMaxAttempts());
                throw new QuotaUnmetException(stratum, current.size(), quota, trace);
            }
        }

        List<SpecItem> renumbered = renumber(keptByStratum);
        log.info("Top-up complete: {} items in {} strata ({} from pool, {} regenerated, {} trimmed)",
            renumbered.size(), keptByStratum.size(), toppedUp, regenerated, trimmed);

        return TopUpResult.builder()
            .items(renumbered)
            .trace(trace)
            .toppedUp(toppedUp)
            .regenerated(regenerated)
            .trimmed(trimmed)
            .build();
    }

    private int regenerate(StratumKey stratum, List<SpecItem> current, Map<StratumKey, List<SpecItem>> keptByStratum,
                           Set<String> keptIds, ShingleCache shingles, List<TopUpTraceEntry> trace) {
        int quota = properties.getQuota();
        int admittedTotal = 0;

        for (int attempt = 1; attempt <= properties.getTopUp().getMaxAttempts() && current.size() < quota; attempt++) {
            long seed = SeedDerivation.regenerationSeed(
                properties.getSeed(), stratum.archetype(), stratum.complexity(), attempt);
            Slot slot = regenerationSlot(stratum, attempt, missingBand(current, quota));
            log.info("Regenerating for {} (attempt {}, seed {}, target band {})",
                stratum, attempt, seed, slot.getLengthBand());

            List<SpecItem> generated;
            try {
                generated = synthesizer.synthesize(slot, properties.getTopUp().getOversub(), seed);
            } catch (SynthesisException e) {
                log.warn("Synthesis failed for {} on attempt {}: {}", stratum, attempt, e.getMessage());
                trace.add(TopUpTraceEntry.builder()
                    .stratum(stratum.toString())
                    .selected(false)
                    .reason(Reason.REGENERATED)
                    .attempt(attempt)
                    .message("Synthesis failed: " + e.getMessage())
                    .build());
                continue;
            }

            List<SpecItem> valid = new ArrayList<>();
            for (SpecItem item : generated) {
                ValidationOutcome outcome = validator.validate(item);
                if (outcome.isAccepted()) {
                    valid.add(outcome.getItem());
                } else {
                    log.debug("Regenerated candidate {} rejected: {}", item.getCandidateId(), outcome.getDiagnostics());
                    trace.add(TopUpTraceEntry.builder()
                        .stratum(stratum.toString())
                        .candidateId(item.getCandidateId())
                        .selected(false)
                        .reason(Reason.REGENERATED)
                        .attempt(attempt)
                        .message(String.join("; ", outcome.getDiagnostics()))
                        .build());
                }
            }

            List<SpecItem> allKept = keptByStratum.values().stream().flatMap(List::stream).toList();
            List<SpecItem> combined = new ArrayList<>(allKept);
            combined.addAll(valid);
            DedupResult dedup = resolver.resolve(combined);

            // A new item is admissible only if it did not collapse into anything already kept
            Set<String> admissibleIds = new HashSet<>();
            for (DedupReport.Component component : dedup.getReport().getComponents()) {
                if (component.getItems().stream().noneMatch(keptIds::contains)) {
                    admissibleIds.add(component.getKept());
                }
            }

            List<Set<String>> keptShingles = current.stream().map(shingles::of).toList();
            List<Scored> admissible = valid.stream()
                .filter(item -> admissibleIds.contains(item.getCandidateId()))
                .map(item -> new Scored(item, SimilarityEngine.maxExactJaccard(shingles.of(item), keptShingles)))
                .sorted(Scored.ORDER)
                .toList();

            Map<String, Scored> admittedById = new LinkedHashMap<>();
            for (Scored candidate : admissible) {
                if (current.size() + admittedById.size() >= quota) {
                    break;
                }
                admittedById.put(candidate.item().getCandidateId(), candidate);
            }

            for (SpecItem item : valid) {
                Scored admitted = admittedById.get(item.getCandidateId());
                trace.add(TopUpTraceEntry.builder()
                    .stratum(stratum.toString())
                    .candidateId(item.getCandidateId())
                    .maxJaccard(SimilarityEngine.round4(admitted != null
                        ? admitted.score()
                        : SimilarityEngine.maxExactJaccard(shingles.of(item), keptShingles)))
                    .selected(admitted != null)
                    .reason(Reason.REGENERATED)
                    .attempt(attempt)
                    .build());
            }
            for (Scored admitted : admittedById.values()) {
                current.add(admitted.item());
                keptIds.add(admitted.item().getCandidateId());
            }
            admittedTotal += admittedById.size();
            log.info("Attempt {} for {}: {} generated, {} valid, {} admitted",
                attempt, stratum, generated.size(), valid.size(), admittedById.size());
        }
        return admittedTotal;
    }

    /**
     * Keep {@code quota} items: band slots first (1 SHORT, 3 STANDARD, 1 EXTENDED for a quota of 5)
     * by candidate id, then any open slots from the rest by candidate id.
     */
    List<SpecItem> trimToPlan(List<SpecItem> items, int quota) {
        List<SpecItem> sorted = items.stream().sorted(Comparator.comparing(SpecItem::getCandidateId)).toList();
        Map<LengthBand, Long> plan = planCounts(quota);

        List<SpecItem> retained = new ArrayList<>();
        Set<String> retainedIds = new HashSet<>();
        for (LengthBand band : LengthBand.values()) {
            long slots = plan.getOrDefault(band, 0L);
            for (SpecItem item : sorted) {
                if (slots == 0) {
                    break;
                }
                if (item.getLengthBand() == band) {
                    retained.add(item);
                    retainedIds.add(item.getCandidateId());
                    slots--;
                }
            }
        }
        for (SpecItem item : sorted) {
            if (retained.size() >= quota) {
                break;
            }
            if (retainedIds.add(item.getCandidateId())) {
                retained.add(item);
            }
        }
        return retained;
    }

    /**
     * First band (in band order) the stratum holds fewer of than its plan calls for
     */
    LengthBand missingBand(List<SpecItem> current, int quota) {
        Map<LengthBand, Long> have = current.stream()
            .filter(item -> item.getLengthBand() != null)
            .collect(Collectors.groupingBy(SpecItem::getLengthBand, () -> new EnumMap<>(LengthBand.class), Collectors.counting()));
        for (Map.Entry<LengthBand, Long> entry : planCounts(quota).entrySet()) {
            if (have.getOrDefault(entry.getKey(), 0L) < entry.getValue()) {
                return entry.getKey();
            }
        }
        return LengthBand.STANDARD;
    }

    /**
     * Renumber strata in key order: rep 1..n by candidate id within a stratum, seq global
     */
    List<SpecItem> renumber(Map<StratumKey, List<SpecItem>> byStratum) {
        List<SpecItem> result = new ArrayList<>();
        int seq = 1;
        for (Map.Entry<StratumKey, List<SpecItem>> entry : new TreeMap<>(byStratum).entrySet()) {
            List<SpecItem> items = entry.getValue().stream()
                .sorted(Comparator.comparing(SpecItem::getCandidateId))
                .toList();
            int rep = 1;
            for (SpecItem item : items) {
                String platform = item.getPlatform() != null && item.getPlatform().getName() != null
                    ? item.getPlatform().getName()
                    : properties.getPlatform();
                result.add(item.toBuilder()
                    .rep(rep)
                    .seq(seq)
                    .slotId(Slot.slotId(entry.getKey(), platform, rep, seq))
                    .sourceCandidateId(item.getSourceCandidateId() != null
                        ? item.getSourceCandidateId()
                        : item.getCandidateId())
                    .build());
                rep++;
                seq++;
            }
        }
        return result;
    }

    private Slot regenerationSlot(StratumKey stratum, int attempt, LengthBand band) {
        return Slot.builder()
            .slotId(String.format("golden_%s_%s_regen%02d", stratum.compact(), properties.getPlatform(), attempt))
            .archetype(stratum.archetype())
            .complexity(stratum.complexity())
            .locale(stratum.locale())
            .platform(properties.getPlatform())
            .rep(1)
            .seq(1)
            .lengthBand(band)
            .build();
    }

    private static Map<LengthBand, Long> planCounts(int quota) {
        return LengthBand.slotPlan(quota).stream()
            .collect(Collectors.groupingBy(b -> b, () -> new EnumMap<>(LengthBand.class), Collectors.counting()));
    }

    private record Scored(SpecItem item, double score) {
        static final Comparator<Scored> ORDER = Comparator.comparingDouble(Scored::score)
            .thenComparing(s -> s.item().getCandidateId());
    }

    // Shingle sets are reused across strata and attempts
    private class ShingleCache {
        private final Map<String, Set<String>> byCandidate = new HashMap<>();

        Set<String> of(SpecItem item) {
            return byCandidate.computeIfAbsent(item.getCandidateId(), id -> similarity.shingleSet(item.getSpec()));
        }
    }
}
