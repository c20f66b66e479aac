package com.dcruver.goldenset.agent;

import com.dcruver.goldenset.agent.domain.*;
import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.Slot;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.SynthesisException;
import com.dcruver.goldenset.domain.bands.BandClassifier;
import com.dcruver.goldenset.domain.bands.BandReport;
import com.dcruver.goldenset.domain.dedup.DedupResult;
import com.dcruver.goldenset.domain.dedup.DuplicateResolver;
import com.dcruver.goldenset.domain.diversity.DiversityEngine;
import com.dcruver.goldenset.domain.diversity.DiversityReport;
import com.dcruver.goldenset.domain.diversity.DiversityResult;
import com.dcruver.goldenset.domain.split.SplitAssignment;
import com.dcruver.goldenset.domain.split.StratifiedSplitter;
import com.dcruver.goldenset.domain.topup.QuotaTopUpService;
import com.dcruver.goldenset.domain.topup.QuotaUnmetException;
import com.dcruver.goldenset.domain.topup.TopUpResult;
import com.dcruver.goldenset.io.ArtifactLayout;
import com.dcruver.goldenset.io.CuratorJson;
import com.dcruver.goldenset.io.DatasetPackager;
import com.dcruver.goldenset.io.IntegrityChecker;
import com.dcruver.goldenset.io.Lockfile;
import com.dcruver.goldenset.reporting.CurationReportWriter;
import com.dcruver.goldenset.reporting.CurationReportWriter.SummaryData;
import com.dcruver.goldenset.synthesis.SlotPlanner;
import com.dcruver.goldenset.synthesis.SpecValidator;
import com.dcruver.goldenset.synthesis.Synthesizer;
import com.dcruver.goldenset.synthesis.ValidationOutcome;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the golden set curation pipeline as a chain of typed actions.
 *
 * Each action consumes the previous stage's type, persists its artifacts
 * under the output directory and returns the next type:
 * 1. planSlots() -> SlotPlan (starting state)
 * 2. synthesize(SlotPlan) -> CandidatePool
 * 3. validate(CandidatePool) -> ValidatedPool
 * 4. resolveDuplicates(ValidatedPool) -> DedupedPool
 * 5. topUp(DedupedPool) -> QuotaPool
 * 6. enforceDiversity(QuotaPool) -> DiversePool
 * 7. split(DiversePool) -> SplitPool
 * 8. packageDataset(SplitPool) -> PackagedDataset
 * 9. lock(PackagedDataset) -> LockedDataset [GOAL]
 *
 * The load* methods rebuild a stage's input from disk so shell commands can run one stage at a time.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CurationAgent {

    private final SlotPlanner slotPlanner;
    private final Synthesizer synthesizer;
    private final SpecValidator validator;
    private final DuplicateResolver duplicateResolver;
    private final QuotaTopUpService topUpService;
    private final DiversityEngine diversityEngine;
    private final BandClassifier bandClassifier;
    private final StratifiedSplitter splitter;
    private final DatasetPackager packager;
    private final IntegrityChecker integrityChecker;
    private final CurationReportWriter reportWriter;
    private final CuratorJson json;
    private final ArtifactLayout layout;
    private final CurationProperties properties;

    // ============================================================================
    // Starting Action: Plan Slots
    // ============================================================================

    public SlotPlan planSlots() throws IOException {
        List<Slot> slots = slotPlanner.expand();
        Files.createDirectories(layout.root());
        json.write(layout.resolve(ArtifactLayout.SLOTS), slots);

        log.info("Planned {} slots across {} strata", slots.size(), properties.declaredStrata().size());
        return SlotPlan.builder()
            .slots(slots)
            .variantsPerSlot(slotPlanner.variantsPerSlot())
            .build();
    }

    // ============================================================================
    // Intake: Synthesize -> Validate
    // ============================================================================

    /**
     * Generate the oversubscribed candidate pool. A slot whose synthesis fails is
     * skipped; the quota stage refills its stratum later.
     */
    public CandidatePool synthesize(SlotPlan plan) throws IOException {
        log.info("Synthesizing {} variant(s) for each of {} slots", plan.getVariantsPerSlot(), plan.getSlotCount());

        List<SpecItem> candidates = new ArrayList<>();
        int failed = 0;
        for (Slot slot : plan.getSlots()) {
            try {
                candidates.addAll(synthesizer.synthesize(slot, plan.getVariantsPerSlot(), properties.getSeed()));
            } catch (SynthesisException e) {
                log.error("Synthesis failed for slot {}: {}", slot.getSlotId(), e.getMessage());
                failed++;
            }
        }

        json.writeLines(layout.resolve(ArtifactLayout.CANDIDATES), candidates);
        log.info("Synthesized {} candidates ({} slots failed)", candidates.size(), failed);

        return CandidatePool.builder()
            .plan(plan)
            .candidates(candidates)
            .failedSlots(failed)
            .build();
    }

    public ValidatedPool validate(CandidatePool pool) throws IOException {
        List<SpecItem> accepted = new ArrayList<>();
        int rejected = 0;

        for (SpecItem candidate : pool.getCandidates()) {
            ValidationOutcome outcome = validator.validate(candidate);
            if (outcome.isAccepted()) {
                accepted.add(outcome.getItem());
            } else {
                rejected++;
                log.warn("Rejected {}: {}", candidate.getCandidateId(), outcome.getDiagnostics());
            }
        }

        json.writeLines(layout.resolve(ArtifactLayout.VALIDATED), accepted);
        log.info("Validation complete: {} accepted, {} rejected", accepted.size(), rejected);

        return ValidatedPool.builder()
            .items(accepted)
            .rejected(rejected)
            .build();
    }

    // ============================================================================
    // Curation Actions: Dedup -> Quotas -> Diversity
    // ============================================================================

    public DedupedPool resolveDuplicates(ValidatedPool pool) throws IOException {
        DedupResult result = duplicateResolver.resolve(pool.getItems());

        json.writeLines(layout.resolve(ArtifactLayout.DEDUPED), result.getSurvivors());
        reportWriter.writeReport(ArtifactLayout.DEDUP_REPORT, result.getReport());

        return DedupedPool.builder()
            .survivors(result.getSurvivors())
            .pool(pool.getItems())
            .report(result.getReport())
            .build();
    }

    /**
     * Bring every stratum to exactly its quota. When a stratum cannot be filled the
     * partial trace is still written before the failure propagates.
     *
     * @throws QuotaUnmetException if a stratum stays short after regeneration
     */
    public QuotaPool topUp(DedupedPool pool) throws IOException {
        TopUpResult result;
        try {
            result = topUpService.topUp(pool.getSurvivors(), pool.getPool());
        } catch (QuotaUnmetException e) {
            reportWriter.writeReport(ArtifactLayout.TOP_UP_TRACE, e.getPartialTrace());
            throw e;
        }

        json.writeLines(layout.resolve(ArtifactLayout.TOPPED_UP), result.getItems());
        reportWriter.writeReport(ArtifactLayout.TOP_UP_TRACE, result.getTrace());

        return QuotaPool.builder()
            .items(result.getItems())
            .pool(pool.getPool())
            .topUp(result)
            .build();
    }

    public DiversePool enforceDiversity(QuotaPool pool) throws IOException {
        DiversityResult result = diversityEngine.enforce(pool.getItems(), pool.getPool());

        json.writeLines(layout.resolve(ArtifactLayout.DIVERSE), result.getItems());
        reportWriter.writeReport(ArtifactLayout.DIVERSITY_REPORT, result.getReport());

        if (!result.getReport().getClusterDiversity().isDiverse()) {
            log.warn("Diversity target missed: {}", result.getReport().getDiagnostic());
        }

        return DiversePool.builder()
            .items(result.getItems())
            .report(result.getReport())
            .build();
    }

    public BandReport reportBands(List<SpecItem> items) throws IOException {
        BandReport report = bandClassifier.report(items);
        reportWriter.writeReport(ArtifactLayout.BAND_REPORT, report);
        return report;
    }

    // ============================================================================
    // Release Actions: Split -> Package -> Lock
    // ============================================================================

    public SplitPool split(DiversePool pool) throws IOException {
        SplitAssignment assignment = splitter.split(pool.getItems());
        json.write(layout.resolve(ArtifactLayout.SPLITS), assignment);

        log.info("Split {} items: {}", assignment.total(), assignment.getCounts());
        return SplitPool.builder()
            .items(pool.getItems())
            .assignment(assignment)
            .build();
    }

    public PackagedDataset packageDataset(SplitPool pool) throws IOException {
        return PackagedDataset.builder()
            .counts(packager.packageDataset(pool.getItems(), pool.getAssignment()))
            .build();
    }

    /**
     * @throws com.dcruver.goldenset.domain.IntegrityCheckException if any count, membership or artifact check fails
     */
    public LockedDataset lock(PackagedDataset dataset) throws IOException {
        Lockfile lockfile = integrityChecker.verifyAndLock();
        return LockedDataset.builder()
            .lockfile(lockfile)
            .totalItems(dataset.getCounts().getOrDefault("golden", 0))
            .build();
    }

    // ============================================================================
    // Full run
    // ============================================================================

    /**
     * Run every stage in order and write the Markdown summary.
     */
    public SummaryData curate() throws IOException {
        SummaryData summary = new SummaryData();

        SlotPlan plan = planSlots();
        summary.setSlotsPlanned(plan.getSlotCount());

        CandidatePool candidates = synthesize(plan);
        summary.setCandidates(candidates.getCandidates().size());
        if (candidates.getFailedSlots() > 0) {
            summary.getWarnings().add(candidates.getFailedSlots() + " slot(s) failed synthesis");
        }

        ValidatedPool validated = validate(candidates);
        summary.setValidated(validated.getItems().size());
        summary.setRejected(validated.getRejected());

        DedupedPool deduped = resolveDuplicates(validated);
        summary.setDedupSurvivors(deduped.getSurvivors().size());
        summary.setDuplicatesRemoved(deduped.getReport().getDuplicatesRemoved());

        QuotaPool quota = topUp(deduped);
        summary.setFinalItems(quota.getItems().size());
        summary.setToppedUp(quota.getTopUp().getToppedUp());
        summary.setRegenerated(quota.getTopUp().getRegenerated());
        summary.setTrimmed(quota.getTopUp().getTrimmed());

        DiversePool diverse = enforceDiversity(quota);
        DiversityReport diversity = diverse.getReport();
        summary.setClusterDiverse(diversity.getClusterDiversity().isDiverse());
        summary.setGini(diversity.getClusterDiversity().getGini());
        summary.setMinClusterSize(diversity.getClusterDiversity().getMinClusterSize());
        summary.setNormalizedEntropy(diversity.getShannonDiversity().getNormalizedEntropy());
        summary.setSwaps(diversity.getSwaps().size());
        if (diversity.getDiagnostic() != null) {
            summary.getWarnings().add(diversity.getDiagnostic());
        }

        BandReport bands = reportBands(diverse.getItems());
        if (!bands.isValid()) {
            summary.getWarnings().add("Length band mix outside targets: " + bands.getDistribution());
        }

        SplitPool split = split(diverse);
        summary.setSplitCounts(split.getAssignment().getCounts());
        summary.setSplitDigest(split.getAssignment().getDigest());

        LockedDataset locked = lock(packageDataset(split));
        log.info("Curation complete: {} items locked", locked.getTotalItems());

        reportWriter.writeSummary(summary);
        return summary;
    }

    // ============================================================================
    // Loaders for single-stage runs
    // ============================================================================

    public SlotPlan loadSlotPlan() throws IOException {
        List<Slot> slots = json.read(layout.resolve(ArtifactLayout.SLOTS), new TypeReference<List<Slot>>() {});
        return SlotPlan.builder()
            .slots(slots)
            .variantsPerSlot(slotPlanner.variantsPerSlot())
            .build();
    }

    public ValidatedPool loadValidated() throws IOException {
        return ValidatedPool.builder()
            .items(readItems(ArtifactLayout.VALIDATED))
            .build();
    }

    public DedupedPool loadDeduped() throws IOException {
        return DedupedPool.builder()
            .survivors(readItems(ArtifactLayout.DEDUPED))
            .pool(readItems(ArtifactLayout.VALIDATED))
            .build();
    }

    public QuotaPool loadQuota() throws IOException {
        List<SpecItem> items = readItems(ArtifactLayout.TOPPED_UP);
        return QuotaPool.builder()
            .items(items)
            .pool(readItems(ArtifactLayout.VALIDATED))
            .topUp(TopUpResult.builder().items(items).trace(List.of()).build())
            .build();
    }

    public DiversePool loadDiverse() throws IOException {
        return DiversePool.builder()
            .items(readItems(ArtifactLayout.DIVERSE))
            .build();
    }

    public SplitPool loadSplit() throws IOException {
        return SplitPool.builder()
            .items(readItems(ArtifactLayout.DIVERSE))
            .assignment(json.read(layout.resolve(ArtifactLayout.SPLITS), SplitAssignment.class))
            .build();
    }

    public boolean hasArtifact(String name) {
        return Files.exists(layout.resolve(name));
    }

    public Path outputDir() {
        return layout.root();
    }

    private List<SpecItem> readItems(String name) throws IOException {
        return json.readLines(layout.resolve(name), SpecItem.class);
    }
}
