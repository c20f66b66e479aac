package com.dcruver.goldenset.io;

import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.IntegrityCheckException;
import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.split.SplitAssignment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.dcruver.goldenset.TestItems.item;
import static org.junit.jupiter.api.Assertions.*;

class IntegrityCheckerTest {

    @TempDir
    Path tempDir;

    private CuratorJson json;
    private ArtifactLayout layout;
    private CurationProperties properties;
    private DatasetPackager packager;
    private List<SpecItem> items;

    @BeforeEach
    void setUp() {
        json = new CuratorJson();
        layout = new ArtifactLayout(tempDir);
        properties = new CurationProperties();
        properties.setArchetypes(new ArrayList<>(List.of("blog", "notes")));
        properties.setComplexities(new ArrayList<>(List.of("MVP")));
        properties.setQuota(2);
        packager = new DatasetPackager(json, layout);

        items = List.of(
            item("b1", "blog", "MVP", 1, LengthBand.SHORT, "first blog spec"),
            item("b2", "blog", "MVP", 2, LengthBand.STANDARD, "second blog spec"),
            item("n1", "notes", "MVP", 1, LengthBand.SHORT, "first notes spec"),
            item("n2", "notes", "MVP", 2, LengthBand.STANDARD, "second notes spec"));
    }

    private SplitAssignment assignment() {
        Map<String, List<String>> splits = new LinkedHashMap<>();
        splits.put("train", List.of(items.get(2).getSlotId(), items.get(0).getSlotId()));
        splits.put("val", List.of(items.get(1).getSlotId()));
        splits.put("test", List.of(items.get(3).getSlotId()));
        Map<String, Integer> counts = new LinkedHashMap<>();
        splits.forEach((name, ids) -> counts.put(name, ids.size()));
        return SplitAssignment.builder().splits(splits).counts(counts).digest("d").build();
    }

    private void writeReports(SplitAssignment assignment) throws Exception {
        for (String report : ArtifactLayout.REPORTS) {
            json.write(layout.resolve(report), Map.of("stage", report));
        }
        json.write(layout.resolve(ArtifactLayout.SPLITS), assignment);
    }

    @Test
    void testPackageSortsEachSplitById() throws Exception {
        Map<String, Integer> counts = packager.packageDataset(items, assignment());

        assertEquals(Map.of("train", 2, "val", 1, "test", 1, "golden", 4), counts);
        List<PackagedItem> train = json.readLines(layout.split("train"), PackagedItem.class);
        assertEquals(List.of(items.get(0).getSlotId(), items.get(2).getSlotId()),
            train.stream().map(PackagedItem::getId).toList());
        assertEquals("train", train.get(0).getSplit());
        assertEquals("b1", train.get(0).getSourceCandidateId());

        List<PackagedItem> golden = json.readLines(layout.resolve(ArtifactLayout.GOLDEN), PackagedItem.class);
        assertEquals(4, golden.size());
        for (int i = 1; i < golden.size(); i++) {
            assertTrue(golden.get(i - 1).getId().compareTo(golden.get(i).getId()) < 0);
        }
    }

    @Test
    void testPackageRejectsUnknownSlot() {
        assertThrows(IntegrityCheckException.class, () -> packager.packageDataset(items.subList(0, 3), assignment()));
        assertFalse(Files.exists(layout.resolve(ArtifactLayout.GOLDEN)));
    }

    @Test
    void testLockfilePinsEveryArtifact() throws Exception {
        SplitAssignment assignment = assignment();
        writeReports(assignment);
        packager.packageDataset(items, assignment);

        Lockfile lockfile = new IntegrityChecker(json, layout, properties).verifyAndLock();

        assertEquals(ArtifactLayout.DATASET.size(), lockfile.getArtifacts().size());
        assertEquals(ArtifactLayout.REPORTS.size(), lockfile.getReports().size());
        assertEquals(IntegrityChecker.sha256(layout.resolve(ArtifactLayout.GOLDEN)),
            lockfile.getArtifacts().get(ArtifactLayout.GOLDEN));
        assertEquals(IntegrityChecker.sha256(layout.resolve(ArtifactLayout.SPLITS)),
            lockfile.getSplits().get(ArtifactLayout.SPLITS));
        assertEquals(lockfile, json.read(layout.resolve(ArtifactLayout.LOCKFILE), Lockfile.class));
    }

    @Test
    void testMissingArtifactsReported() throws Exception {
        packager.packageDataset(items, assignment());

        IntegrityCheckException e = assertThrows(IntegrityCheckException.class,
            () -> new IntegrityChecker(json, layout, properties).verifyAndLock());
        assertTrue(e.getFailures().contains("missing artifact " + ArtifactLayout.DEDUP_REPORT));
        assertTrue(e.getFailures().contains("missing artifact " + ArtifactLayout.SPLITS));
        assertFalse(Files.exists(layout.resolve(ArtifactLayout.LOCKFILE)));
    }

    @Test
    void testTamperedSplitFileFailsLock() throws Exception {
        SplitAssignment assignment = assignment();
        writeReports(assignment);
        packager.packageDataset(items, assignment);
        json.writeLines(layout.split("val"), List.of());

        IntegrityCheckException e = assertThrows(IntegrityCheckException.class,
            () -> new IntegrityChecker(json, layout, properties).verifyAndLock());
        assertTrue(e.getFailures().contains("val count mismatch: 0 vs 1"));
        assertTrue(e.getFailures().contains("golden count mismatch: 4 vs 3"));
        assertFalse(Files.exists(layout.resolve(ArtifactLayout.LOCKFILE)));
    }

    @Test
    void testUnderfilledStratumReported() throws Exception {
        SplitAssignment assignment = assignment();
        writeReports(assignment);
        packager.packageDataset(items, assignment);
        properties.setQuota(3);

        IntegrityCheckException e = assertThrows(IntegrityCheckException.class,
            () -> new IntegrityChecker(json, layout, properties).verifyAndLock());
        assertTrue(e.getFailures().contains("expected at least 6 items, got 4"));
        assertTrue(e.getFailures().contains("stratum blog-MVP-en has 2 items, expected at least 3"));
    }
}
