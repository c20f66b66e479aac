package com.dcruver.goldenset.io;

import com.dcruver.goldenset.config.CurationProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * File names of every artifact under the output directory.
 */
@Component
public class ArtifactLayout {

    public static final String SLOTS = "slots.json";
    public static final String CANDIDATES = "candidates.jsonl";
    public static final String VALIDATED = "validated.jsonl";
    public static final String DEDUPED = "deduped.jsonl";
    public static final String TOPPED_UP = "topped_up.jsonl";
    public static final String DIVERSE = "diverse.jsonl";

    public static final String DEDUP_REPORT = "dedup_report.json";
    public static final String TOP_UP_TRACE = "top_up_trace.json";
    public static final String DIVERSITY_REPORT = "diversity_report.json";
    public static final String BAND_REPORT = "band_report.json";
    public static final String SPLITS = "splits.json";

    public static final String TRAIN = "train.jsonl";
    public static final String VAL = "val.jsonl";
    public static final String TEST = "test.jsonl";
    public static final String GOLDEN = "golden.jsonl";
    public static final String LOCKFILE = "golden.lock.json";

    public static final List<String> REPORTS = List.of(DEDUP_REPORT, TOP_UP_TRACE, DIVERSITY_REPORT, BAND_REPORT);
    public static final List<String> DATASET = List.of(TRAIN, VAL, TEST, GOLDEN);

    private final Path root;

    @Autowired
    public ArtifactLayout(CurationProperties properties) {
        this(Paths.get(properties.getOutputDir()));
    }

    public ArtifactLayout(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    public Path resolve(String name) {
        return root.resolve(name);
    }

    /**
     * Dataset file holding one split ("train", "val" or "test")
     */
    public Path split(String split) {
        return root.resolve(split + ".jsonl");
    }
}
