package org.repcluster.clustering.engine;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.repcluster.clustering.core.ClusteringConfig;
import org.repcluster.clustering.core.ClusteringConfigurationException;
import org.repcluster.clustering.core.ClusteringDataException;
import org.repcluster.clustering.distance.DistanceMetric;
import org.repcluster.clustering.distance.DistanceMetricRegistry;
import org.repcluster.clustering.period.PeriodVectorSet;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * Partition-based clustering of period vectors into representative periods.
 *
 * <p>Execution flow per run:</p>
 * <ul>
 * <li>Validate {@code k}, the distance metric and finiteness of every period vector.</li>
 * <li>Seed {@code k} centers deterministically (k-means++ or shuffled prefix).</li>
 * <li>Iterate: assign every period to its nearest center (ties go to the lowest center
 * index), re-seed empty clusters from the farthest assigned period, stop once the
 * assignment repeats, otherwise recompute medoids or means.</li>
 * <li>Relabel clusters by the lowest period they contain and materialize the result.</li>
 * </ul>
 *
 * <p>The assignment step may fan out over a run-owned {@link ForkJoinPool}; every period
 * writes only its own slot and the step completes before repair and update, so results
 * are identical to the sequential path.</p>
 */
@Slf4j
public final class ClusteringEngine {
    public static final String REASON_K_OUT_OF_RANGE = "C3_K_OUT_OF_RANGE";
    public static final String REASON_UNKNOWN_DISTANCE_METRIC = "C3_UNKNOWN_DISTANCE_METRIC";
    public static final String REASON_PERIOD_DURATION_MISMATCH = "C3_PERIOD_DURATION_MISMATCH";
    public static final String REASON_NON_FINITE_VALUE = "C3_NON_FINITE_VALUE";

    private final DistanceMetricRegistry metricRegistry;

    /**
     * Creates an engine resolving metrics from the built-in registry.
     */
    public ClusteringEngine() {
        this(DistanceMetricRegistry.defaultRegistry());
    }

    /**
     * Creates an engine resolving metrics from a custom registry.
     */
    public ClusteringEngine(DistanceMetricRegistry metricRegistry) {
        this.metricRegistry = Objects.requireNonNull(metricRegistry, "metricRegistry");
    }

    /**
     * Clusters all period vectors into {@code config.representativePeriods} groups.
     *
     * @param vectors period vectors (one per period index, all series concatenated).
     * @param config run parameters.
     * @return immutable clustering result.
     * @throws ClusteringConfigurationException when {@code k} or the metric is invalid.
     * @throws ClusteringDataException when a period vector contains a non-finite value.
     */
    public ClusteringResult cluster(PeriodVectorSet vectors, ClusteringConfig config) {
        Objects.requireNonNull(vectors, "vectors");
        Objects.requireNonNull(config, "config").validate();

        if (config.getPeriodDuration() != vectors.periodDuration()) {
            throw new ClusteringConfigurationException(
                    REASON_PERIOD_DURATION_MISMATCH,
                    "period_duration " + config.getPeriodDuration()
                            + " does not match segmented vectors with duration " + vectors.periodDuration()
            );
        }
        int n = vectors.numPeriods();
        int k = config.getRepresentativePeriods();
        if (k > n) {
            throw new ClusteringConfigurationException(
                    REASON_K_OUT_OF_RANGE,
                    "num_representative_periods " + k + " exceeds the number of periods " + n
            );
        }
        DistanceMetric metric = resolveMetric(config.getDistanceMetric());
        double[][] data = vectors.vectorsCopy();
        requireFinite(data, vectors);

        ClusteringResult result;
        if (k == n) {
            result = identity(vectors, data, config, metric);
        } else {
            try (ClusteringRun run = new ClusteringRun(data, k, metric, config)) {
                result = run.execute(vectors);
            }
        }
        log.info(
                "Clustered {} periods of {} series into {} representative periods "
                        + "(metric={}, kind={}, iterations={}, converged={}, cost={})",
                n, vectors.seriesCount(), k, metric.id(), config.getRepresentativeKind(),
                result.iterations(), result.converged(), result.totalCost()
        );
        result.convergenceWarning().ifPresent(warning -> log.warn("{}", warning.message()));
        return result;
    }

    private DistanceMetric resolveMetric(String metricId) {
        DistanceMetric metric = metricRegistry.metric(metricId);
        if (metric == null) {
            throw new ClusteringConfigurationException(
                    REASON_UNKNOWN_DISTANCE_METRIC,
                    "unknown distance_metric '" + metricId + "', expected one of " + metricRegistry.metricIds()
            );
        }
        return metric;
    }

    private static void requireFinite(double[][] data, PeriodVectorSet vectors) {
        for (int p = 0; p < data.length; p++) {
            double[] row = data[p];
            for (int d = 0; d < row.length; d++) {
                if (!Double.isFinite(row[d])) {
                    throw new ClusteringDataException(
                            REASON_NON_FINITE_VALUE,
                            "non-finite value " + row[d] + " in series " + vectors.seriesKeyForDimension(d)
                                    + ", period " + (p + 1)
                                    + ", timestep " + (d % vectors.periodDuration() + 1)
                    );
                }
            }
        }
    }

    /**
     * {@code k == numPeriods}: every period represents itself.
     */
    private static ClusteringResult identity(
            PeriodVectorSet vectors,
            double[][] data,
            ClusteringConfig config,
            DistanceMetric metric
    ) {
        int n = data.length;
        int[] assignment = new int[n];
        int[] medoids = new int[n];
        for (int p = 0; p < n; p++) {
            assignment[p] = p + 1;
            medoids[p] = config.getRepresentativeKind() == RepresentativeKind.MEDOID
                    ? p + 1
                    : ClusteringResult.NO_MEDOID;
        }
        return new ClusteringResult(
                vectors.seriesKeys(),
                vectors.periodDuration(),
                assignment,
                data,
                medoids,
                config.getRepresentativeKind(),
                metric.id(),
                0,
                true,
                0.0d,
                null
        );
    }

    /**
     * @return offset of the center closest to {@code point}; ties go to the lowest offset.
     */
    static int nearestCenter(double[] point, double[][] centers, DistanceMetric metric) {
        int bestCenter = 0;
        double bestDistance = metric.distance(point, centers[0]);
        for (int c = 1; c < centers.length; c++) {
            double d = metric.distance(point, centers[c]);
            if (d < bestDistance) {
                bestDistance = d;
                bestCenter = c;
            }
        }
        return bestCenter;
    }

    /**
     * Picks the period to move into an empty cluster: the farthest from its center among
     * clusters with more than one member, lowest period offset on ties.
     *
     * @return period offset, or {@code -1} when every cluster is a singleton.
     */
    static int farthestDonor(int[] assignment, double[] distances, int[] sizes) {
        int farthest = -1;
        for (int p = 0; p < assignment.length; p++) {
            if (sizes[assignment[p]] <= 1) {
                continue;
            }
            if (farthest < 0 || distances[p] > distances[farthest]) {
                farthest = p;
            }
        }
        return farthest;
    }

    /**
     * Mutable state of one iterative run. Owned by a single {@link #cluster} call and never
     * exposed before the result is materialized.
     */
    private static final class ClusteringRun implements AutoCloseable {
        private final double[][] data;
        private final int n;
        private final int k;
        private final DistanceMetric metric;
        private final ClusteringConfig config;
        private final ForkJoinPool pool;

        private final double[][] centers;
        private final int[] assignment;
        private final double[] distances;

        private ClusteringRun(double[][] data, int k, DistanceMetric metric, ClusteringConfig config) {
            this.data = data;
            this.n = data.length;
            this.k = k;
            this.metric = metric;
            this.config = config;
            this.pool = config.getParallelism() > 1 ? new ForkJoinPool(config.getParallelism()) : null;
            this.centers = new double[k][];
            this.assignment = new int[n];
            this.distances = new double[n];
        }

        private ClusteringResult execute(PeriodVectorSet vectors) {
            int[] seeds = CenterInitializer.selectCenters(
                    data, k, metric, config.getInitialization(), config.getRandomSeed()
            );
            for (int c = 0; c < k; c++) {
                centers[c] = data[seeds[c]].clone();
            }

            int maxIterations = config.getMaxIterations();
            int[] previous = null;
            int[] best = null;
            double bestCost = Double.POSITIVE_INFINITY;
            int bestIteration = 0;
            int iterations = 0;
            boolean converged = false;
            int unstable = n;

            for (int iteration = 1; iteration <= maxIterations; iteration++) {
                iterations = iteration;
                assignAll();
                repairEmptyClusters(iteration);

                double cost = 0.0d;
                for (int p = 0; p < n; p++) {
                    cost += distances[p];
                }
                // an overflowing or NaN cost must still leave an assignment to return
                if (best == null || cost < bestCost) {
                    bestCost = cost;
                    best = assignment.clone();
                    bestIteration = iteration;
                }
                unstable = previous == null ? n : countChanged(previous, assignment);
                log.debug("Iteration {}: cost={}, moved={}", iteration, cost, unstable);
                if (previous != null && unstable == 0) {
                    converged = true;
                    break;
                }
                previous = assignment.clone();
                updateCenters(assignment);
            }

            int[] finalAssignment = converged ? assignment.clone() : best;
            ConvergenceWarning warning = null;
            if (!converged) {
                warning = ConvergenceWarning.builder()
                        .maxIterations(maxIterations)
                        .bestIteration(bestIteration)
                        .bestCost(bestCost)
                        .unstablePeriods(unstable)
                        .build();
            }
            return materialize(vectors, finalAssignment, iterations, converged, warning);
        }

        private void assignAll() {
            if (pool == null) {
                for (int p = 0; p < n; p++) {
                    assignOne(p);
                }
                return;
            }
            try {
                pool.submit(() -> IntStream.range(0, n).parallel().forEach(this::assignOne)).get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("assignment step interrupted", ex);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("assignment step failed", cause);
            }
        }

        private void assignOne(int p) {
            int c = nearestCenter(data[p], centers, metric);
            assignment[p] = c;
            distances[p] = metric.distance(data[p], centers[c]);
        }

        /**
         * Moves the farthest period of a multi-member cluster into each empty cluster.
         * Ties on distance go to the lowest period offset.
         */
        private void repairEmptyClusters(int iteration) {
            int[] sizes = new int[k];
            for (int p = 0; p < n; p++) {
                sizes[assignment[p]]++;
            }
            for (int c = 0; c < k; c++) {
                if (sizes[c] > 0) {
                    continue;
                }
                // k <= n guarantees a donor cluster while any cluster is empty
                int farthest = farthestDonor(assignment, distances, sizes);
                sizes[assignment[farthest]]--;
                assignment[farthest] = c;
                sizes[c] = 1;
                distances[farthest] = 0.0d;
                centers[c] = data[farthest].clone();
                log.debug("Iteration {}: re-seeded empty cluster {} from period {}", iteration, c, farthest + 1);
            }
        }

        private void updateCenters(int[] currentAssignment) {
            IntArrayList[] members = groupByCluster(currentAssignment);
            for (int c = 0; c < k; c++) {
                centers[c] = config.getRepresentativeKind() == RepresentativeKind.MEDOID
                        ? data[medoidOf(members[c])].clone()
                        : meanOf(members[c]);
            }
        }

        private IntArrayList[] groupByCluster(int[] currentAssignment) {
            IntArrayList[] members = new IntArrayList[k];
            for (int c = 0; c < k; c++) {
                members[c] = new IntArrayList();
            }
            for (int p = 0; p < n; p++) {
                members[currentAssignment[p]].add(p);
            }
            return members;
        }

        /**
         * Member with the smallest summed distance to all other members; lowest offset on ties.
         */
        private int medoidOf(IntArrayList members) {
            int size = members.size();
            if (size == 1) {
                return members.getInt(0);
            }
            int best = members.getInt(0);
            double bestSum = Double.POSITIVE_INFINITY;
            for (int i = 0; i < size; i++) {
                int candidate = members.getInt(i);
                double sum = 0.0d;
                for (int j = 0; j < size && sum < bestSum; j++) {
                    if (i != j) {
                        sum += metric.distance(data[candidate], data[members.getInt(j)]);
                    }
                }
                if (sum < bestSum) {
                    bestSum = sum;
                    best = candidate;
                }
            }
            return best;
        }

        private double[] meanOf(IntArrayList members) {
            double[] mean = new double[data[0].length];
            for (int i = 0; i < members.size(); i++) {
                double[] row = data[members.getInt(i)];
                for (int d = 0; d < mean.length; d++) {
                    mean[d] += row[d];
                }
            }
            int size = members.size();
            for (int d = 0; d < mean.length; d++) {
                mean[d] /= size;
            }
            return mean;
        }

        private ClusteringResult materialize(
                PeriodVectorSet vectors,
                int[] finalAssignment,
                int iterations,
                boolean converged,
                ConvergenceWarning warning
        ) {
            // ids follow the first period encountered in each cluster
            int[] idByCluster = new int[k];
            int nextId = 1;
            for (int p = 0; p < n; p++) {
                int c = finalAssignment[p];
                if (idByCluster[c] == 0) {
                    idByCluster[c] = nextId++;
                }
            }

            IntArrayList[] members = groupByCluster(finalAssignment);
            double[][] representatives = new double[k][];
            int[] medoids = new int[k];
            for (int c = 0; c < k; c++) {
                int id = idByCluster[c];
                if (config.getRepresentativeKind() == RepresentativeKind.MEDOID) {
                    int medoid = medoidOf(members[c]);
                    representatives[id - 1] = data[medoid].clone();
                    medoids[id - 1] = medoid + 1;
                } else {
                    representatives[id - 1] = meanOf(members[c]);
                    medoids[id - 1] = ClusteringResult.NO_MEDOID;
                }
            }

            int[] relabeled = new int[n];
            double totalCost = 0.0d;
            for (int p = 0; p < n; p++) {
                relabeled[p] = idByCluster[finalAssignment[p]];
                totalCost += metric.distance(data[p], representatives[relabeled[p] - 1]);
            }
            return new ClusteringResult(
                    vectors.seriesKeys(),
                    vectors.periodDuration(),
                    relabeled,
                    representatives,
                    medoids,
                    config.getRepresentativeKind(),
                    metric.id(),
                    iterations,
                    converged,
                    totalCost,
                    warning
            );
        }

        private static int countChanged(int[] before, int[] after) {
            int changed = 0;
            for (int i = 0; i < before.length; i++) {
                if (before[i] != after[i]) {
                    changed++;
                }
            }
            return changed;
        }

        @Override
        public void close() {
            if (pool != null) {
                pool.shutdown();
            }
        }
    }
}
