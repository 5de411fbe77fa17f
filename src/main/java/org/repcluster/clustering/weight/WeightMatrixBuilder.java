package org.repcluster.clustering.weight;

import lombok.extern.slf4j.Slf4j;
import lombok.experimental.UtilityClass;
import org.repcluster.clustering.core.ClusteringConfig;
import org.repcluster.clustering.core.ClusteringConfigurationException;
import org.repcluster.clustering.core.ClusteringInvariantException;
import org.repcluster.clustering.engine.ClusteringResult;
import org.repcluster.clustering.period.PeriodVectorSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Derives the period-to-representative weight matrix from a clustering result.
 *
 * <p>{@link WeightPolicy#HARD} yields indicator rows. {@link WeightPolicy#CONVEX} fits each
 * period as a convex combination of all representatives by projected gradient descent onto
 * the probability simplex, starting from the indicator row; medoid periods keep their
 * indicator row. Every row must sum to 1 within {@link #ROW_SUM_TOLERANCE}.</p>
 */
@Slf4j
@UtilityClass
public final class WeightMatrixBuilder {
    public static final String REASON_ROW_SUM = "C4_ROW_SUM";
    public static final String REASON_SHAPE_MISMATCH = "C4_SHAPE_MISMATCH";

    public static final double ROW_SUM_TOLERANCE = 1e-9;

    /** Weights below this are treated as numerical noise and dropped before renormalizing. */
    static final double ZERO_WEIGHT_THRESHOLD = 1e-12;

    /**
     * Builds the weight matrix and representative summaries.
     *
     * @param result clustering result.
     * @param vectors period vectors the result was computed from (used by {@code CONVEX}).
     * @param config run parameters (policy, fit bounds, resolution).
     * @return matrix and summaries.
     * @throws ClusteringConfigurationException when vectors and result disagree in shape.
     * @throws ClusteringInvariantException when a row does not sum to 1.
     */
    public static WeightMatrixResult build(ClusteringResult result, PeriodVectorSet vectors, ClusteringConfig config) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(vectors, "vectors");
        Objects.requireNonNull(config, "config");
        if (vectors.numPeriods() != result.numPeriods() || vectors.periodDuration() != result.periodDuration()) {
            throw new ClusteringConfigurationException(
                    REASON_SHAPE_MISMATCH,
                    "clustering result covers " + result.numPeriods() + " periods of duration "
                            + result.periodDuration() + " but vectors have " + vectors.numPeriods()
                            + " periods of duration " + vectors.periodDuration()
            );
        }

        int n = result.numPeriods();
        int k = result.numRepresentativePeriods();
        double[][] rows = new double[n][k];
        for (int p = 0; p < n; p++) {
            rows[p][result.repPeriodOf(p + 1) - 1] = 1.0d;
        }
        if (config.getWeightPolicy() == WeightPolicy.CONVEX && k > 1) {
            fitConvex(rows, result, vectors, config);
        }
        checkRowSums(rows);

        WeightMatrix matrix = new WeightMatrix(rows, k);
        List<RepresentativeSummary> summaries = new ArrayList<>(k);
        for (int r = 1; r <= k; r++) {
            summaries.add(RepresentativeSummary.builder()
                    .repPeriod(r)
                    .assignedPeriods(result.membersOf(r).length)
                    .totalWeight(matrix.columnSum(r))
                    .numTimesteps(result.periodDuration())
                    .resolution(config.getResolution())
                    .build());
        }
        log.info("Built {} weight matrix {}x{}", config.getWeightPolicy(), n, k);
        return new WeightMatrixResult(config.getWeightPolicy(), matrix, summaries);
    }

    private static void fitConvex(
            double[][] rows,
            ClusteringResult result,
            PeriodVectorSet vectors,
            ClusteringConfig config
    ) {
        int k = result.numRepresentativePeriods();
        double[][] reps = new double[k][];
        double lipschitz = 0.0d;
        boolean[] medoidPeriod = new boolean[result.numPeriods() + 1];
        for (int r = 0; r < k; r++) {
            reps[r] = result.representativeCopy(r + 1);
            for (double v : reps[r]) {
                lipschitz += v * v;
            }
            OptionalInt medoid = result.medoidPeriod(r + 1);
            if (medoid.isPresent()) {
                medoidPeriod[medoid.getAsInt()] = true;
            }
        }
        lipschitz *= 2.0d;
        if (lipschitz == 0.0d) {
            // all representatives are zero vectors; every combination fits equally well
            return;
        }

        // Gram matrix and R x terms make each gradient step O(k^2)
        double[][] gram = new double[k][k];
        for (int i = 0; i < k; i++) {
            for (int j = i; j < k; j++) {
                double dot = dot(reps[i], reps[j]);
                gram[i][j] = dot;
                gram[j][i] = dot;
            }
        }

        double step = 1.0d / lipschitz;
        int maxIterations = config.getWeightFitMaxIterations();
        double tolerance = config.getWeightFitTolerance();
        int unconverged = 0;
        for (int p = 0; p < rows.length; p++) {
            if (medoidPeriod[p + 1]) {
                continue;
            }
            double[] x = vectors.vectorCopy(p + 1);
            double[] rx = new double[k];
            for (int r = 0; r < k; r++) {
                rx[r] = dot(reps[r], x);
            }
            double[] w = rows[p];
            boolean converged = false;
            for (int iteration = 0; iteration < maxIterations; iteration++) {
                double[] next = new double[k];
                for (int r = 0; r < k; r++) {
                    double gradient = -rx[r];
                    for (int j = 0; j < k; j++) {
                        gradient += gram[r][j] * w[j];
                    }
                    next[r] = w[r] - step * 2.0d * gradient;
                }
                projectOntoSimplex(next);
                double change = 0.0d;
                for (int r = 0; r < k; r++) {
                    change = Math.max(change, Math.abs(next[r] - w[r]));
                }
                w = next;
                if (change < tolerance) {
                    converged = true;
                    break;
                }
            }
            if (!converged) {
                unconverged++;
            }
            rows[p] = cleanup(w);
        }
        if (unconverged > 0) {
            log.debug("Convex weight fit hit the iteration bound for {} periods", unconverged);
        }
    }

    /**
     * Euclidean projection onto {@code {w >= 0, sum(w) = 1}} (sort-based, in place).
     */
    static void projectOntoSimplex(double[] v) {
        int k = v.length;
        double[] sorted = Arrays.copyOf(v, k);
        Arrays.sort(sorted);
        double cumulative = 0.0d;
        double theta = 0.0d;
        for (int j = 1; j <= k; j++) {
            double u = sorted[k - j];
            cumulative += u;
            double candidate = (cumulative - 1.0d) / j;
            if (u - candidate > 0.0d) {
                theta = candidate;
            }
        }
        for (int r = 0; r < k; r++) {
            v[r] = Math.max(v[r] - theta, 0.0d);
        }
    }

    private static double[] cleanup(double[] w) {
        double sum = 0.0d;
        for (int r = 0; r < w.length; r++) {
            if (w[r] < ZERO_WEIGHT_THRESHOLD) {
                w[r] = 0.0d;
            }
            sum += w[r];
        }
        for (int r = 0; r < w.length; r++) {
            w[r] /= sum;
        }
        return w;
    }

    private static void checkRowSums(double[][] rows) {
        for (int p = 0; p < rows.length; p++) {
            double sum = 0.0d;
            for (double w : rows[p]) {
                if (w < 0.0d || !Double.isFinite(w)) {
                    throw new ClusteringInvariantException(
                            REASON_ROW_SUM,
                            "period " + (p + 1) + " has invalid weight " + w
                    );
                }
                sum += w;
            }
            if (Math.abs(sum - 1.0d) > ROW_SUM_TOLERANCE) {
                throw new ClusteringInvariantException(
                        REASON_ROW_SUM,
                        "weights of period " + (p + 1) + " sum to " + sum
                );
            }
        }
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0d;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
