package com.dcruver.goldenset.nlp;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;

/**
 * Builds min-hash sketches with universal-hash permutations over the Mersenne prime 2^61 - 1.
 * Permutation coefficients are drawn once from the seed, so a given (seed, numPerm) always
 * produces bit-identical sketches for the same shingles.
 */
public class MinHasher {

    static final long MERSENNE_PRIME = (1L << 61) - 1;
    static final long MAX_HASH = 0xFFFFFFFFL;

    private final long seed;
    private final long[] a;
    private final long[] b;

    public MinHasher(int numPerm, long seed) {
        if (numPerm <= 0) {
            throw new IllegalArgumentException("Permutation count must be positive: " + numPerm);
        }
        this.seed = seed;
        this.a = new long[numPerm];
        this.b = new long[numPerm];
        UniformRandomProvider rng = RandomSource.XO_RO_SHI_RO_128_PP.create(seed);
        for (int i = 0; i < numPerm; i++) {
            a[i] = 1 + rng.nextLong(MERSENNE_PRIME - 1);
            b[i] = rng.nextLong(MERSENNE_PRIME);
        }
    }

    public long getSeed() {
        return seed;
    }

    public int getNumPerm() {
        return a.length;
    }

    public MinHashSketch sketch(Collection<String> shingles) {
        long[] values = new long[a.length];
        Arrays.fill(values, MAX_HASH);
        for (String shingle : shingles) {
            long hv = shingleHash(shingle);
            for (int i = 0; i < values.length; i++) {
                long phi = mulAddMod(a[i], hv, b[i]) & MAX_HASH;
                if (phi < values[i]) {
                    values[i] = phi;
                }
            }
        }
        return new MinHashSketch(seed, values);
    }

    /**
     * First four bytes of SHA-1, read little-endian as an unsigned 32-bit value
     */
    static long shingleHash(String shingle) {
        byte[] digest = DigestUtils.sha1(shingle.getBytes(StandardCharsets.UTF_8));
        return (digest[0] & 0xFFL)
            | (digest[1] & 0xFFL) << 8
            | (digest[2] & 0xFFL) << 16
            | (digest[3] & 0xFFL) << 24;
    }

    /**
     * (a * x + b) mod (2^61 - 1) for a, b below the prime and x below 2^32
     */
    static long mulAddMod(long a, long x, long b) {
        long hi = Math.multiplyHigh(a, x);
        long lo = a * x;
        // 2^64 = 8 (mod p), 2^61 = 1 (mod p)
        long sum = (hi << 3) + (lo >>> 61) + (lo & MERSENNE_PRIME) + b;
        long r = (sum & MERSENNE_PRIME) + (sum >>> 61);
        return r >= MERSENNE_PRIME ? r - MERSENNE_PRIME : r;
    }
}
