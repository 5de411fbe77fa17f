package org.repcluster.clustering.engine;

import lombok.experimental.UtilityClass;
import org.repcluster.clustering.distance.DistanceMetric;

import java.util.SplittableRandom;

/**
 * Deterministic seeded selection of the initial {@code k} center periods.
 */
@UtilityClass
final class CenterInitializer {

    /**
     * Selects {@code k} distinct period offsets (0-based) as initial centers.
     *
     * @param data period vectors.
     * @param k number of centers, {@code 1 <= k <= data.length}.
     * @param metric distance metric.
     * @param method initialization method.
     * @param seed deterministic seed.
     * @return distinct period offsets in selection order.
     */
    static int[] selectCenters(double[][] data, int k, DistanceMetric metric, InitializationMethod method, long seed) {
        return switch (method) {
            case K_MEANS_PLUS_PLUS -> kMeansPlusPlus(data, k, metric, seed);
            case RANDOM -> shuffledPrefix(data.length, k, seed);
        };
    }

    /**
     * k-means++ seeding: each next center is sampled with probability proportional to the
     * squared distance to its nearest chosen center. Falls back to the farthest period
     * (lowest offset on ties) when all remaining weights are zero or overflow.
     */
    private static int[] kMeansPlusPlus(double[][] data, int k, DistanceMetric metric, long seed) {
        int n = data.length;
        SplittableRandom random = new SplittableRandom(seed);
        int[] chosen = new int[k];
        boolean[] used = new boolean[n];
        double[] nearest = new double[n];

        chosen[0] = random.nextInt(n);
        used[chosen[0]] = true;
        for (int p = 0; p < n; p++) {
            double d = metric.distance(data[p], data[chosen[0]]);
            nearest[p] = used[p] ? 0.0d : d * d;
        }

        for (int c = 1; c < k; c++) {
            double total = 0.0d;
            for (int p = 0; p < n; p++) {
                if (!used[p]) {
                    total += nearest[p];
                }
            }
            // draw even when unused so the stream position only depends on c
            double target = random.nextDouble() * total;
            int pick = -1;
            if (total > 0.0d && Double.isFinite(total)) {
                double cumulative = 0.0d;
                int lastEligible = -1;
                for (int p = 0; p < n; p++) {
                    if (used[p] || nearest[p] <= 0.0d) {
                        continue;
                    }
                    lastEligible = p;
                    cumulative += nearest[p];
                    if (cumulative > target) {
                        pick = p;
                        break;
                    }
                }
                if (pick < 0) {
                    pick = lastEligible;
                }
            }
            if (pick < 0) {
                pick = farthestUnused(nearest, used);
            }

            chosen[c] = pick;
            used[pick] = true;
            nearest[pick] = 0.0d;
            for (int p = 0; p < n; p++) {
                if (used[p]) {
                    continue;
                }
                double d = metric.distance(data[p], data[pick]);
                double squared = d * d;
                if (squared < nearest[p]) {
                    nearest[p] = squared;
                }
            }
        }
        return chosen;
    }

    private static int farthestUnused(double[] nearest, boolean[] used) {
        int best = -1;
        for (int p = 0; p < nearest.length; p++) {
            if (used[p]) {
                continue;
            }
            if (best < 0 || nearest[p] > nearest[best]) {
                best = p;
            }
        }
        return best;
    }

    /**
     * Takes the first {@code k} offsets of a seeded Fisher-Yates shuffle.
     */
    private static int[] shuffledPrefix(int n, int k, long seed) {
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        SplittableRandom random = new SplittableRandom(seed);
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        int[] chosen = new int[k];
        System.arraycopy(order, 0, chosen, 0, k);
        return chosen;
    }
}
