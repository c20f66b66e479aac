package com.dcruver.goldenset.nlp;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Deterministic seeds from a context string: the first 8 hex digits of its SHA-256.
 */
public final class SeedDerivation {

    private SeedDerivation() {
    }

    public static long seedFor(String context) {
        return Long.parseLong(DigestUtils.sha256Hex(context).substring(0, 8), 16);
    }

    /**
     * Seed for one synthesized variant of a slot
     */
    public static long variantSeed(long baseSeed, String slotId, int variant) {
        return seedFor(baseSeed + "|" + slotId + "|" + variant);
    }

    /**
     * Seed for one regeneration attempt of a stratum
     */
    public static long regenerationSeed(long baseSeed, String archetype, String complexity, int attempt) {
        return seedFor(baseSeed + "|" + archetype + "|" + complexity + "|" + attempt);
    }
}
