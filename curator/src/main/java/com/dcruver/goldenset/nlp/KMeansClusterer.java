package com.dcruver.goldenset.nlp;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Lloyd's k-means with k-means++ seeding and several restarts; the restart
 * with the lowest inertia wins.
 *
 * All randomness comes from a single generator seeded once per call, so the
 * same points, k and seed always give the same labels.
 */
@Slf4j
public class KMeansClusterer {

    private final int restarts;
    private final int maxIterations;
    private final double tolerance;

    public KMeansClusterer(int restarts, int maxIterations, double tolerance) {
        if (restarts < 1) {
            throw new IllegalArgumentException("Restart count must be positive: " + restarts);
        }
        this.restarts = restarts;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public Clustering cluster(double[][] points, int k, long seed) {
        int n = points.length;
        if (n == 0) {
            throw new IllegalArgumentException("Cannot cluster an empty point set");
        }
        if (k <= 0 || k > n) {
            throw new IllegalArgumentException(String.format("k must be in [1, %d]: %d", n, k));
        }

        UniformRandomProvider rng = RandomSource.XO_RO_SHI_RO_128_PP.create(seed);
        Clustering best = null;
        for (int run = 0; run < restarts; run++) {
            Clustering candidate = lloyd(points, seedCentroids(points, k, rng));
            log.debug("k-means restart {}: inertia {} after {} iterations",
                run, candidate.inertia(), candidate.iterations());
            if (best == null || candidate.inertia() < best.inertia()) {
                best = candidate;
            }
        }
        return best;
    }

    double[][] seedCentroids(double[][] points, int k, UniformRandomProvider rng) {
        int n = points.length;
        double[][] centroids = new double[k][];
        centroids[0] = points[rng.nextInt(n)].clone();

        double[] closest = new double[n];
        for (int i = 0; i < n; i++) {
            closest[i] = squaredDistance(points[i], centroids[0]);
        }

        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (double d : closest) {
                total += d;
            }
            int chosen;
            if (total == 0.0) {
                chosen = rng.nextInt(n);
            } else {
                double target = rng.nextDouble() * total;
                chosen = n - 1;
                double cumulative = 0.0;
                for (int i = 0; i < n; i++) {
                    cumulative += closest[i];
                    if (cumulative > target) {
                        chosen = i;
                        break;
                    }
                }
            }
            centroids[c] = points[chosen].clone();
            for (int i = 0; i < n; i++) {
                closest[i] = Math.min(closest[i], squaredDistance(points[i], centroids[c]));
            }
        }
        return centroids;
    }

    private Clustering lloyd(double[][] points, double[][] centroids) {
        int n = points.length;
        int k = centroids.length;
        int[] labels = new int[n];
        int iteration = 0;

        while (iteration < maxIterations) {
            iteration++;
            assign(points, centroids, labels);

            double[][] updated = recompute(points, labels, k);
            fillEmptyClusters(points, labels, updated);

            double shift = 0.0;
            for (int c = 0; c < k; c++) {
                shift += squaredDistance(centroids[c], updated[c]);
            }
            centroids = updated;
            if (shift <= tolerance) {
                break;
            }
        }

        assign(points, centroids, labels);
        fillEmptyClusters(points, labels, centroids);
        return new Clustering(labels, centroids, inertia(points, labels, centroids), iteration);
    }

    private static double inertia(double[][] points, int[] labels, double[][] centroids) {
        double inertia = 0.0;
        for (int i = 0; i < points.length; i++) {
            inertia += squaredDistance(points[i], centroids[labels[i]]);
        }
        return inertia;
    }

    /**
     * Nearest centroid per point, ties to the lowest label; returns the inertia
     */
    private static double assign(double[][] points, double[][] centroids, int[] labels) {
        double inertia = 0.0;
        for (int i = 0; i < points.length; i++) {
            int bestLabel = 0;
            double bestDistance = Double.MAX_VALUE;
            for (int c = 0; c < centroids.length; c++) {
                double d = squaredDistance(points[i], centroids[c]);
                if (d < bestDistance) {
                    bestDistance = d;
                    bestLabel = c;
                }
            }
            labels[i] = bestLabel;
            inertia += bestDistance;
        }
        return inertia;
    }

    private static double[][] recompute(double[][] points, int[] labels, int k) {
        int dims = points[0].length;
        double[][] sums = new double[k][dims];
        int[] counts = new int[k];
        for (int i = 0; i < points.length; i++) {
            counts[labels[i]]++;
            for (int d = 0; d < dims; d++) {
                sums[labels[i]][d] += points[i][d];
            }
        }
        for (int c = 0; c < k; c++) {
            if (counts[c] > 0) {
                for (int d = 0; d < dims; d++) {
                    sums[c][d] /= counts[c];
                }
            }
        }
        return sums;
    }

    // An empty cluster takes over the point farthest from its current centroid
    private static void fillEmptyClusters(double[][] points, int[] labels, double[][] centroids) {
        int[] counts = new int[centroids.length];
        for (int label : labels) {
            counts[label]++;
        }
        for (int c = 0; c < centroids.length; c++) {
            if (counts[c] > 0) {
                continue;
            }
            int farthest = -1;
            double farthestDistance = -1.0;
            for (int i = 0; i < points.length; i++) {
                if (counts[labels[i]] <= 1) {
                    continue;
                }
                double d = squaredDistance(points[i], centroids[labels[i]]);
                if (d > farthestDistance) {
                    farthestDistance = d;
                    farthest = i;
                }
            }
            if (farthest < 0) {
                continue;
            }
            counts[labels[farthest]]--;
            labels[farthest] = c;
            counts[c] = 1;
            centroids[c] = points[farthest].clone();
        }
    }

    public static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    /**
     * Labels per point, final centroids, and the sum of squared distances
     */
    public record Clustering(int[] labels, double[][] centroids, double inertia, int iterations) {

        public int k() {
            return centroids.length;
        }

        public int[] sizes() {
            int[] sizes = new int[centroids.length];
            for (int label : labels) {
                sizes[label]++;
            }
            return sizes;
        }
    }
}
