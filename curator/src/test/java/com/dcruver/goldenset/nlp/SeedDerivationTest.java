package com.dcruver.goldenset.nlp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeedDerivationTest {

    @Test
    void testSeedIsFirstEightHexDigitsOfSha256() {
        // sha256("abc") = ba7816bf...
        assertEquals(0xba7816bfL, SeedDerivation.seedFor("abc"));
    }

    @Test
    void testDerivedSeedsAreStableAndDistinct() {
        long v1 = SeedDerivation.variantSeed(2025, "golden_blogMVPen_replit_rep01_seq001", 1);
        assertEquals(v1, SeedDerivation.variantSeed(2025, "golden_blogMVPen_replit_rep01_seq001", 1));
        assertNotEquals(v1, SeedDerivation.variantSeed(2025, "golden_blogMVPen_replit_rep01_seq001", 2));
        assertNotEquals(
            SeedDerivation.regenerationSeed(2025, "blog", "MVP", 1),
            SeedDerivation.regenerationSeed(2025, "blog", "MVP", 2));
        assertTrue(v1 >= 0 && v1 <= 0xFFFFFFFFL);
    }
}
