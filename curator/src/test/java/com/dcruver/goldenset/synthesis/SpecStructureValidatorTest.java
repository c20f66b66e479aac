package com.dcruver.goldenset.synthesis;

import com.dcruver.goldenset.TestKits;
import com.dcruver.goldenset.config.ArchetypeKitCatalog;
import com.dcruver.goldenset.config.CurationProperties;
import com.dcruver.goldenset.domain.LengthBand;
import com.dcruver.goldenset.domain.Platform;
import com.dcruver.goldenset.domain.Slot;
import com.dcruver.goldenset.domain.SpecItem;
import com.dcruver.goldenset.domain.StratumKey;
import com.dcruver.goldenset.domain.bands.BandClassifier;
import com.dcruver.goldenset.nlp.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SpecStructureValidatorTest {

    private SpecStructureValidator validator;
    private SpecItem serverItem;
    private SpecItem staticItem;

    @BeforeEach
    void setUp() {
        CurationProperties properties = TestKits.properties();
        BandClassifier bands = new BandClassifier(new TextNormalizer(), properties);
        TemplateSynthesizer synthesizer = new TemplateSynthesizer(new ArchetypeKitCatalog(properties), bands);
        validator = new SpecStructureValidator(bands, properties);

        serverItem = synthesizer.synthesize(
            Slot.of(new StratumKey("blog", "MVP", "en"), "replit", 2, 2, LengthBand.STANDARD), 1, 2025L).get(0);
        staticItem = synthesizer.synthesize(
            Slot.of(new StratumKey("notes", "MVP", "en"), "replit", 2, 12, LengthBand.STANDARD), 1, 2025L).get(0);
    }

    @Test
    void testGeneratedItemsAccepted() {
        assertTrue(validator.validate(serverItem).isAccepted());
        assertTrue(validator.validate(staticItem).isAccepted());
    }

    @Test
    void testMissingSectionRejected() {
        String spec = serverItem.getSpec().replace("## Data Models", "## Models");
        ValidationOutcome outcome = validator.validate(serverItem.withSpec(spec));

        assertFalse(outcome.isAccepted());
        assertTrue(outcome.getDiagnostics().stream().anyMatch(d ->
            d.startsWith("SECTION_ERR") && d.contains("missing [Data Models]") && d.contains("extra [Models]")));
    }

    @Test
    void testRepeatedSectionRejected() {
        String spec = serverItem.getSpec() + "\n## Vision\n\nAgain.\n";
        ValidationOutcome outcome = validator.validate(serverItem.withSpec(spec));
        assertTrue(outcome.getDiagnostics().stream().anyMatch(d -> d.contains("repeated [Vision]")));
    }

    @Test
    void testAccessControlRequired() {
        String withoutBlock = serverItem.getSpec().replace("### Access Control", "### Permissions");
        assertTrue(validator.validate(serverItem.withSpec(withoutBlock)).getDiagnostics()
            .contains("ACL_ERR: Missing Access Control section"));

        String withoutManage = serverItem.getSpec().replace("`manage`", "`moderate`");
        assertTrue(validator.validate(serverItem.withSpec(withoutManage)).getDiagnostics().stream()
            .anyMatch(d -> d.startsWith("ACL_ERR") && d.contains("Admin")));
    }

    @Test
    void testStaticSpecMustNotMentionNetworking() {
        String spec = staticItem.getSpec().replace("## NFR & SLOs\n",
            "## NFR & SLOs\n\nThe app will listen on port 3000.\n");
        ValidationOutcome outcome = validator.validate(staticItem.withSpec(spec));
        assertTrue(outcome.getDiagnostics().contains("PLATFORM_ERR: Static spec mentions network binding terms"));

        assertTrue(SpecStructureValidator.containsBannedNetworkTerms("Runs an API server"));
        assertFalse(SpecStructureValidator.containsBannedNetworkTerms("Replit static site hosting on a serverless edge"));
    }

    @Test
    void testPlatformShape() {
        SpecItem wrongName = staticItem.withPlatform(Platform.of("vercel", false));
        assertTrue(validator.validate(wrongName).getDiagnostics().contains("PLATFORM_ERR: Platform name must be 'replit'"));

        SpecItem unbound = serverItem.withPlatform(Platform.builder().name("replit").server(true).build());
        assertTrue(validator.validate(unbound).getDiagnostics().stream()
            .anyMatch(d -> d.startsWith("PLATFORM_ERR: A server spec must bind")));

        assertTrue(validator.validate(serverItem.withPlatform(null)).getDiagnostics()
            .contains("PLATFORM_ERR: Missing platform"));
    }

    @Test
    void testBandMismatchCorrectsItem() {
        ValidationOutcome outcome = validator.validate(serverItem.withLengthBand(LengthBand.EXTENDED));

        assertFalse(outcome.isAccepted());
        assertTrue(outcome.getDiagnostics().stream().anyMatch(d -> d.startsWith("BAND_ERR")));
        assertEquals(LengthBand.STANDARD, outcome.getItem().getLengthBand());
    }

    @Test
    void testPiiDetected() {
        assertEquals(Set.of("email"), SpecStructureValidator.findPii("Contact jane.doe@example.com for access"));
        assertEquals(Set.of("phone"), SpecStructureValidator.findPii("Call 555-123-4567 after hours"));
        assertTrue(SpecStructureValidator.findPii("Uptime of 99.9% with p95 under 200ms").isEmpty());

        String spec = serverItem.getSpec().replace("## Vision\n", "## Vision\n\nOwner: admin@example.org\n");
        assertTrue(validator.validate(serverItem.withSpec(spec)).getDiagnostics().stream()
            .anyMatch(d -> d.equals("PII_ERR: Found potential PII: email")));
    }

    @Test
    void testCodeStyleLimits() {
        String block = "```js\nconst a = 1;\n\nconst b = 2;\n```\n";
        SpecStructureValidator.CodeStyle style = SpecStructureValidator.codeStyle(block + block);
        assertEquals(2, style.blocks());
        assertEquals(4, style.lines());

        String spec = serverItem.getSpec() + "\n" + block.repeat(4);
        assertTrue(validator.validate(serverItem.withSpec(spec)).getDiagnostics().stream()
            .anyMatch(d -> d.startsWith("STYLE_ERR")));
    }

    @Test
    void testSectionsSplitByHeader() {
        Map<String, String> sections = SpecStructureValidator.sections("## Vision\n\nA\n\n## Tech Stack\n\n- B\n");
        assertEquals(Map.of("Vision", "A", "Tech Stack", "- B"), sections);
    }
}
