package com.dcruver.goldenset.app;

import com.dcruver.goldenset.agent.CurationAgent;
import com.dcruver.goldenset.agent.domain.*;
import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.bands.BandReport;
import com.dcruver.goldenset.domain.diversity.ClusterDiversity;
import com.dcruver.goldenset.domain.topup.TopUpResult;
import com.dcruver.goldenset.io.ArtifactLayout;
import com.dcruver.goldenset.reporting.CurationReportWriter;
import com.dcruver.goldenset.reporting.CurationReportWriter.SummaryData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Spring Shell commands for the golden set curator.
 *
 * Each stage command reads the previous stage's artifacts from the output directory.
 * Quota and integrity failures are not caught here; {@link CurationExceptionResolver}
 * turns them into exit codes.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class CuratorShellCommands {

    private final CurationAgent agent;
    private final CurationProperties properties;

    @ShellMethod(key = "plan", value = "Expand declared strata into slots")
    public String plan() {
        try {
            SlotPlan plan = agent.planSlots();
            return String.format("Planned %d slots for %d strata (quota %d, %d variant(s) per slot).\n",
                plan.getSlotCount(), properties.declaredStrata().size(), properties.getQuota(),
                plan.getVariantsPerSlot());
        } catch (IOException e) {
            log.error("Planning failed", e);
            return "Planning failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"synthesize", "intake"}, value = "Synthesize and validate the candidate pool")
    public String synthesize() {
        try {
            SlotPlan plan = agent.hasArtifact(ArtifactLayout.SLOTS) ? agent.loadSlotPlan() : agent.planSlots();
            CandidatePool candidates = agent.synthesize(plan);
            ValidatedPool validated = agent.validate(candidates);

            StringBuilder sb = new StringBuilder();
            sb.append("Intake completed.\n\n");
            sb.append(String.format("- Candidates: %d\n", candidates.getCandidates().size()));
            sb.append(String.format("- Failed slots: %d\n", candidates.getFailedSlots()));
            sb.append(String.format("- Validated: %d\n", validated.getItems().size()));
            sb.append(String.format("- Rejected: %d\n", validated.getRejected()));
            return sb.toString();
        } catch (IOException e) {
            log.error("Intake failed", e);
            return "Intake failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "dedup", value = "Remove near-duplicate candidates")
    public String dedup() {
        try {
            DedupedPool deduped = agent.resolveDuplicates(agent.loadValidated());
            return String.format("Dedup completed: %d survivors, %d near-duplicates removed in %d component(s).\n",
                deduped.getSurvivors().size(),
                deduped.getReport().getDuplicatesRemoved(),
                deduped.getReport().getComponents().size());
        } catch (IOException e) {
            log.error("Dedup failed", e);
            return "Dedup failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"top-up", "topup"}, value = "Bring every stratum to exactly its quota")
    public String topUp() {
        try {
            QuotaPool quota = agent.topUp(agent.loadDeduped());
            TopUpResult result = quota.getTopUp();
            StringBuilder sb = new StringBuilder();
            sb.append("Top-up completed.\n\n");
            sb.append(String.format("- Items: %d (expected %d)\n", result.getItems().size(), properties.expectedTotal()));
            sb.append(String.format("- Refilled from pool: %d\n", result.getToppedUp()));
            sb.append(String.format("- Regenerated: %d\n", result.getRegenerated()));
            sb.append(String.format("- Trimmed: %d\n", result.getTrimmed()));
            sb.append(String.format("- Trace entries: %d\n", result.getTrace().size()));
            return sb.toString();
        } catch (IOException e) {
            log.error("Top-up failed", e);
            return "Top-up failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "diversity", value = "Enforce topic diversity with cluster swaps")
    public String diversity() {
        try {
            DiversePool diverse = agent.enforceDiversity(agent.loadQuota());
            ClusterDiversity clusters = diverse.getReport().getClusterDiversity();

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Diversity %s.\n\n", clusters.isDiverse() ? "target met" : "target missed"));
            sb.append(String.format("- Clusters: %d\n", clusters.getK()));
            sb.append(String.format("- Gini: %.4f\n", clusters.getGini()));
            sb.append(String.format("- Smallest cluster: %d\n", clusters.getMinClusterSize()));
            sb.append(String.format("- Archetype entropy: %.4f\n",
                diverse.getReport().getShannonDiversity().getNormalizedEntropy()));
            sb.append(String.format("- Swaps: %d\n", diverse.getReport().getSwaps().size()));
            if (diverse.getReport().getDiagnostic() != null) {
                sb.append("\n").append(diverse.getReport().getDiagnostic()).append("\n");
            }
            return sb.toString();
        } catch (IOException e) {
            log.error("Diversity enforcement failed", e);
            return "Diversity enforcement failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "bands", value = "Report the length band distribution of the curated items")
    public String bands() {
        try {
            BandReport report = agent.reportBands(agent.loadDiverse().getItems());

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Band mix %s.\n\n", report.isValid() ? "valid" : "outside targets"));
            for (Map.Entry<LengthBand, Integer> entry : report.getDistribution().entrySet()) {
                BandReport.Target target = report.getGlobalTargets().get(entry.getKey());
                sb.append(String.format("- %s: %d (target %d +/- %d)\n",
                    entry.getKey(), entry.getValue(), target.getTarget(), target.getTolerance()));
            }
            List<BandReport.Suggestion> suggestions = report.getSuggestions();
            if (!suggestions.isEmpty()) {
                sb.append("\nSuggested adjustments:\n");
                for (BandReport.Suggestion s : suggestions) {
                    sb.append(String.format("- %s: %s -> %s\n", s.getSlotId(), s.getCurrentBand(), s.getSuggestedBand()));
                }
            }
            return sb.toString();
        } catch (IOException e) {
            log.error("Band report failed", e);
            return "Band report failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "split", value = "Assign curated items to train / val / test")
    public String split() {
        try {
            SplitPool split = agent.split(agent.loadDiverse());
            StringBuilder sb = new StringBuilder();
            sb.append("Split completed.\n\n");
            split.getAssignment().getCounts().forEach((name, count) ->
                sb.append(String.format("- %s: %d\n", name, count)));
            sb.append(String.format("- digest: %s\n", split.getAssignment().getDigest()));
            return sb.toString();
        } catch (IOException e) {
            log.error("Split failed", e);
            return "Split failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"package", "lock"}, value = "Write dataset files, verify them and write the lockfile")
    public String packageAndLock() {
        try {
            PackagedDataset dataset = agent.packageDataset(agent.loadSplit());
            LockedDataset locked = agent.lock(dataset);
            return String.format("Locked %d items in %s (%d artifact digests).\n",
                locked.getTotalItems(), agent.outputDir(),
                locked.getLockfile().getArtifacts().size());
        } catch (IOException e) {
            log.error("Packaging failed", e);
            return "Packaging failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"curate", "run"}, value = "Run the whole curation pipeline")
    public String curate() {
        log.info("Running full curation pipeline...");
        try {
            SummaryData summary = agent.curate();

            StringBuilder sb = new StringBuilder();
            sb.append("Curation completed!\n\n");
            sb.append(String.format("- Slots: %d\n", summary.getSlotsPlanned()));
            sb.append(String.format("- Candidates: %d (%d validated)\n", summary.getCandidates(), summary.getValidated()));
            sb.append(String.format("- Near-duplicates removed: %d\n", summary.getDuplicatesRemoved()));
            sb.append(String.format("- Final items: %d\n", summary.getFinalItems()));
            sb.append(String.format("- Cluster diversity: %s (gini %.4f)\n",
                summary.isClusterDiverse() ? "PASS" : "MISS", summary.getGini()));
            sb.append(String.format("- Splits: %s\n", summary.getSplitCounts()));
            for (String warning : summary.getWarnings()) {
                sb.append("! ").append(warning).append("\n");
            }
            sb.append(String.format("\nSee %s for the full summary.\n",
                agent.outputDir().resolve(CurationReportWriter.SUMMARY)));
            return sb.toString();
        } catch (IOException e) {
            log.error("Curation failed", e);
            return "Curation failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "status", value = "Show which pipeline artifacts exist")
    public String status() {
        StringBuilder sb = new StringBuilder();
        sb.append("Output directory: ").append(agent.outputDir()).append("\n\n");
        List<String> stages = List.of(
            ArtifactLayout.SLOTS, ArtifactLayout.CANDIDATES, ArtifactLayout.VALIDATED,
            ArtifactLayout.DEDUPED, ArtifactLayout.TOPPED_UP, ArtifactLayout.DIVERSE,
            ArtifactLayout.SPLITS, ArtifactLayout.GOLDEN, ArtifactLayout.LOCKFILE);
        for (String name : stages) {
            sb.append(String.format("[%s] %s\n", agent.hasArtifact(name) ? "x" : " ", name));
        }
        return sb.toString();
    }
}
