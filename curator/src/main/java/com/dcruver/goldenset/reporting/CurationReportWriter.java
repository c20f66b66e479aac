package com.dcruver.goldenset.reporting;

import com.dcruver.goldenset.io.ArtifactLayout;
import com.dcruver.goldenset.io.CuratorJson;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes stage reports as canonical JSON and a Markdown summary of the whole run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CurationReportWriter {

    public static final String SUMMARY = "curation_summary.md";

    private final CuratorJson json;
    private final ArtifactLayout layout;

    /**
     * Write {@code report} under {@code name} in the output directory
     */
    public Path writeReport(String name, Object report) throws IOException {
        Path path = layout.resolve(name);
        json.write(path, report);
        log.info("Wrote {}", path);
        return path;
    }

    public Path writeSummary(SummaryData data) throws IOException {
        Path path = layout.resolve(SUMMARY);
        Files.createDirectories(layout.root());
        Files.writeString(path, buildSummary(data), StandardCharsets.UTF_8);
        log.info("Wrote run summary: {}", path);
        return path;
    }

    String buildSummary(SummaryData data) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Golden Set Curation Summary\n\n");

        sb.append("## Pool\n\n");
        sb.append(String.format("- Slots planned: %d\n", data.getSlotsPlanned()));
        sb.append(String.format("- Candidates synthesized: %d\n", data.getCandidates()));
        sb.append(String.format("- Candidates validated: %d (%d rejected)\n", data.getValidated(), data.getRejected()));
        sb.append(String.format("- Dedup survivors: %d (%d near-duplicates removed)\n\n",
            data.getDedupSurvivors(), data.getDuplicatesRemoved()));

        sb.append("## Quotas\n\n");
        sb.append(String.format("- Items after top-up: %d\n", data.getFinalItems()));
        sb.append(String.format("- Refilled from pool: %d\n", data.getToppedUp()));
        sb.append(String.format("- Regenerated: %d\n", data.getRegenerated()));
        sb.append(String.format("- Trimmed over quota: %d\n\n", data.getTrimmed()));

        sb.append("## Diversity\n\n");
        sb.append(String.format("- Cluster diversity: %s (gini %.4f, min cluster %d)\n",
            data.isClusterDiverse() ? "PASS" : "MISS", data.getGini(), data.getMinClusterSize()));
        sb.append(String.format("- Archetype entropy: %.4f\n", data.getNormalizedEntropy()));
        sb.append(String.format("- Swaps: %d\n\n", data.getSwaps()));

        sb.append("## Splits\n\n");
        if (data.getSplitCounts() == null || data.getSplitCounts().isEmpty()) {
            sb.append("Not split.\n\n");
        } else {
            data.getSplitCounts().forEach((split, count) ->
                sb.append(String.format("- %s: %d\n", split, count)));
            sb.append(String.format("- digest: `%s`\n\n", data.getSplitDigest()));
        }

        sb.append("## Warnings\n\n");
        if (data.getWarnings().isEmpty()) {
            sb.append("No warnings.\n");
        } else {
            for (String warning : data.getWarnings()) {
                sb.append("- ").append(warning).append("\n");
            }
        }
        return sb.toString();
    }

    /**
     * Figures collected across a pipeline run
     */
    @Data
    public static class SummaryData {
        private int slotsPlanned;
        private int candidates;
        private int validated;
        private int rejected;
        private int dedupSurvivors;
        private int duplicatesRemoved;

        private int finalItems;
        private int toppedUp;
        private int regenerated;
        private int trimmed;

        private boolean clusterDiverse;
        private double gini;
        private int minClusterSize;
        private double normalizedEntropy;
        private int swaps;

        private Map<String, Integer> splitCounts;
        private String splitDigest;

        private List<String> warnings = new ArrayList<>();
    }
}
