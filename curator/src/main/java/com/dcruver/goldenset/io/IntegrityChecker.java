package com.dcruver.goldenset.io;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.IntegrityCheckException;
import com.dcruver.goldenset.domain.StratumKey;
import com.dcruver.goldenset.domain.split.SplitAssignment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Verifies the packaged dataset against the strata plan and the split
 * assignment, then pins every released file in a lockfile.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IntegrityChecker {

    private final CuratorJson json;
    private final ArtifactLayout layout;
    private final CurationProperties properties;

    /**
     * @throws IntegrityCheckException listing every failed check; no lockfile is written in that case
     */
    public Lockfile verifyAndLock() throws IOException {
        List<String> failures = new ArrayList<>();
        List<String> required = new ArrayList<>(ArtifactLayout.REPORTS);
        required.add(ArtifactLayout.SPLITS);
        required.addAll(ArtifactLayout.DATASET);
        for (String name : required) {
            if (!Files.exists(layout.resolve(name))) {
                failures.add("missing artifact " + name);
            }
        }
        if (!failures.isEmpty()) {
            throw new IntegrityCheckException(failures);
        }

        List<PackagedItem> golden = json.readLines(layout.resolve(ArtifactLayout.GOLDEN), PackagedItem.class);
        verifyCounts(golden, failures);
        verifySplits(json.read(layout.resolve(ArtifactLayout.SPLITS), SplitAssignment.class), golden.size(), failures);

        if (!failures.isEmpty()) {
            failures.forEach(f -> log.error("LOCK_ERR: {}", f));
            throw new IntegrityCheckException(failures);
        }

        Lockfile lockfile = Lockfile.builder()
            .reports(digests(ArtifactLayout.REPORTS))
            .splits(digests(List.of(ArtifactLayout.SPLITS)))
            .artifacts(digests(ArtifactLayout.DATASET))
            .build();
        json.write(layout.resolve(ArtifactLayout.LOCKFILE), lockfile);
        log.info("Integrity verified for {} items; lockfile written to {}", golden.size(), layout.resolve(ArtifactLayout.LOCKFILE));
        return lockfile;
    }

    void verifyCounts(List<PackagedItem> golden, List<String> failures) {
        int expected = properties.expectedTotal();
        if (golden.size() < expected) {
            failures.add(String.format("expected at least %d items, got %d", expected, golden.size()));
        }
        Map<String, Integer> perStratum = new TreeMap<>();
        for (PackagedItem item : golden) {
            perStratum.merge(item.getStratumKey(), 1, Integer::sum);
        }
        for (StratumKey stratum : properties.declaredStrata()) {
            int count = perStratum.getOrDefault(stratum.toString(), 0);
            if (count == 0) {
                failures.add("missing stratum " + stratum);
            } else if (count < properties.getQuota()) {
                failures.add(String.format("stratum %s has %d items, expected at least %d", stratum, count, properties.getQuota()));
            }
        }
    }

    void verifySplits(SplitAssignment assignment, int goldenCount, List<String> failures) throws IOException {
        int total = 0;
        for (String split : SplitAssignment.SPLIT_NAMES) {
            List<PackagedItem> items = json.readLines(layout.split(split), PackagedItem.class);
            List<String> assigned = assignment.getSplits().getOrDefault(split, List.of());
            total += items.size();
            if (items.size() != assigned.size()) {
                failures.add(String.format("%s count mismatch: %d vs %d", split, items.size(), assigned.size()));
                continue;
            }
            Set<String> ids = new HashSet<>();
            items.forEach(item -> ids.add(item.getId()));
            if (!ids.equals(new HashSet<>(assigned))) {
                failures.add(split + " assignments mismatch");
            }
        }
        if (goldenCount != total) {
            failures.add(String.format("golden count mismatch: %d vs %d", goldenCount, total));
        }
    }

    private Map<String, String> digests(List<String> names) throws IOException {
        Map<String, String> digests = new TreeMap<>();
        for (String name : names) {
            digests.put(name, sha256(layout.resolve(name)));
        }
        return digests;
    }

    public static String sha256(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return DigestUtils.sha256Hex(in);
        }
    }
}
