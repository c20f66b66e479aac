package com.dcruver.goldenset.domain;

/**
 * Identity of a stratum: one cell of the archetype x complexity x locale grid.
 * Ordered by its rendered key so iteration matches the lexicographic order of
 * "archetype-complexity-locale".
 */
public record StratumKey(String archetype, String complexity, String locale) implements Comparable<StratumKey> {

    public static StratumKey parse(String key) {
        String[] parts = key.split("-");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Stratum key must look like archetype-complexity-locale: " + key);
        }
        return new StratumKey(parts[0], parts[1], parts[2]);
    }

    /**
     * Compact form used inside slot identifiers, e.g. "blogMVPen"
     */
    public String compact() {
        return archetype + complexity + locale;
    }

    @Override
    public int compareTo(StratumKey other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return archetype + "-" + complexity + "-" + locale;
    }
}
