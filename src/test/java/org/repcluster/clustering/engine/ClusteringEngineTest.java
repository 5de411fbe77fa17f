package org.repcluster.clustering.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.repcluster.clustering.core.ClusteringConfig;
import org.repcluster.clustering.core.ClusteringConfigurationException;
import org.repcluster.clustering.core.ClusteringDataException;
import org.repcluster.clustering.distance.DistanceMetric;
import org.repcluster.clustering.distance.DistanceMetricRegistry;
import org.repcluster.clustering.distance.EuclideanDistance;
import org.repcluster.clustering.period.PeriodSegmenter;
import org.repcluster.clustering.period.PeriodVectorSet;
import org.repcluster.clustering.profile.ProfileKey;
import org.repcluster.clustering.testutil.ProfileFixtures;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Clustering Engine Tests")
class ClusteringEngineTest {

    private final ClusteringEngine engine = new ClusteringEngine();

    private static PeriodVectorSet scalarPeriods(double... values) {
        double[][] rows = new double[values.length][];
        for (int p = 0; p < values.length; p++) {
            rows[p] = new double[]{values[p]};
        }
        return new PeriodVectorSet(List.of(ProfileKey.parse("demand-A")), 1, rows);
    }

    private static ClusteringConfig.ClusteringConfigBuilder config(int k, int periodDuration) {
        return ClusteringConfig.builder().representativePeriods(k).periodDuration(periodDuration);
    }

    private static void assertPartition(ClusteringResult result) {
        int covered = 0;
        int previousFirst = 0;
        for (int r = 1; r <= result.numRepresentativePeriods(); r++) {
            int[] members = result.membersOf(r);
            assertTrue(members.length > 0, "representative " + r + " must not be empty");
            assertTrue(members[0] > previousFirst, "ids must follow the first member period");
            previousFirst = members[0];
            covered += members.length;
        }
        assertEquals(result.numPeriods(), covered);
        assertEquals(1, result.repPeriodOf(1));
    }

    @Nested
    @DisplayName("Core properties")
    class CoreProperties {

        @Test
        @DisplayName("Well-separated day shapes are recovered and labeled by first period")
        void testRecoversShapes() {
            PeriodVectorSet vectors = PeriodSegmenter.assemble(ProfileFixtures.threeShapeYear(30, 7L), 24);

            ClusteringResult result = engine.cluster(vectors, config(3, 24).build());

            assertTrue(result.converged());
            assertTrue(result.convergenceWarning().isEmpty());
            for (int p = 1; p <= 30; p++) {
                assertEquals((p - 1) % 3 + 1, result.repPeriodOf(p), "period " + p);
            }
            assertPartition(result);
        }

        @Test
        @DisplayName("Identical inputs, config and seed give identical results")
        void testDeterministic() {
            PeriodVectorSet vectors = PeriodSegmenter.assemble(ProfileFixtures.threeShapeYear(45, 11L), 24);
            ClusteringConfig cfg = config(5, 24).randomSeed(1234L).build();

            ClusteringResult a = engine.cluster(vectors, cfg);
            ClusteringResult b = engine.cluster(vectors, cfg);

            assertArrayEquals(a.assignmentCopy(), b.assignmentCopy());
            for (int r = 1; r <= 5; r++) {
                assertArrayEquals(a.representativeCopy(r), b.representativeCopy(r));
                assertEquals(a.medoidPeriod(r), b.medoidPeriod(r));
            }
            assertEquals(a.totalCost(), b.totalCost());
            assertEquals(a.iterations(), b.iterations());
        }

        @Test
        @DisplayName("k equal to the number of periods is the identity clustering")
        void testIdentity() {
            PeriodVectorSet vectors = PeriodSegmenter.assemble(ProfileFixtures.twoSeriesTwoDays(), 24);

            ClusteringResult result = engine.cluster(vectors, config(2, 24).build());

            assertEquals(1, result.repPeriodOf(1));
            assertEquals(2, result.repPeriodOf(2));
            assertArrayEquals(vectors.vectorCopy(1), result.representativeCopy(1));
            assertArrayEquals(vectors.vectorCopy(2), result.representativeCopy(2));
            assertEquals(0, result.iterations());
            assertEquals(0.0d, result.totalCost());
            assertEquals(2, result.medoidPeriod(2).getAsInt());
        }

        @Test
        @DisplayName("k = 1 with centroid representatives yields the mean of all periods")
        void testSingleCentroidIsMean() {
            PeriodVectorSet vectors = PeriodSegmenter.assemble(ProfileFixtures.twoSeriesTwoDays(), 24);

            ClusteringResult result = engine.cluster(
                    vectors,
                    config(1, 24).representativeKind(RepresentativeKind.CENTROID).build()
            );

            double[] first = vectors.vectorCopy(1);
            double[] second = vectors.vectorCopy(2);
            double[] representative = result.representativeCopy(1);
            for (int d = 0; d < first.length; d++) {
                assertEquals((first[d] + second[d]) / 2.0d, representative[d], 1e-12);
            }
            assertTrue(result.medoidPeriod(1).isEmpty());
            assertArrayEquals(new int[]{1, 2}, result.membersOf(1));
        }

        @Test
        @DisplayName("k = 1 with medoid representatives picks the lowest period on ties")
        void testSingleMedoidTieBreak() {
            PeriodVectorSet vectors = PeriodSegmenter.assemble(ProfileFixtures.twoSeriesTwoDays(), 24);

            ClusteringResult result = engine.cluster(vectors, config(1, 24).build());

            assertEquals(1, result.medoidPeriod(1).getAsInt());
            assertArrayEquals(vectors.vectorCopy(1), result.representativeCopy(1));
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 2, 3})
        @DisplayName("Constant series produce constant representatives")
        void testConstantSeries(int k) {
            PeriodVectorSet vectors = PeriodSegmenter.assemble(
                    ProfileFixtures.table(ProfileFixtures.series("demand-A", ProfileFixtures.constant(96, 5.0d))),
                    24
            );

            ClusteringResult result = engine.cluster(vectors, config(k, 24).build());

            for (int r = 1; r <= k; r++) {
                for (double value : result.representativeCopy(r)) {
                    assertEquals(5.0d, value);
                }
            }
            assertPartition(result);
        }

        @ParameterizedTest
        @ValueSource(longs = {0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L})
        @DisplayName("Duplicate periods never leave a representative empty")
        void testEmptyClusterRepair(long seed) {
            PeriodVectorSet vectors = scalarPeriods(0.0d, 0.0d, 0.0d, 10.0d);

            ClusteringResult result = engine.cluster(
                    vectors,
                    config(2, 1).initialization(InitializationMethod.RANDOM).randomSeed(seed).build()
            );

            assertArrayEquals(new int[]{1, 1, 1, 2}, result.assignmentCopy());
            assertPartition(result);
        }

        @Test
        @DisplayName("Every supported metric produces a valid partition")
        void testAllMetrics() {
            PeriodVectorSet vectors = PeriodSegmenter.assemble(ProfileFixtures.threeShapeYear(12, 5L), 24);
            for (String metric : DistanceMetricRegistry.defaultRegistry().metricIds()) {
                ClusteringResult result = engine.cluster(vectors, config(3, 24).distanceMetric(metric).build());
                assertEquals(metric, result.distanceMetricId());
                assertPartition(result);
            }
        }
    }

    @Nested
    @DisplayName("Errors and warnings")
    class ErrorsAndWarnings {

        @Test
        @DisplayName("k larger than the number of periods is a configuration error")
        void testKOutOfRange() {
            ClusteringConfigurationException ex = assertThrows(
                    ClusteringConfigurationException.class,
                    () -> engine.cluster(scalarPeriods(1.0d, 2.0d), config(3, 1).build())
            );
            assertEquals(ClusteringEngine.REASON_K_OUT_OF_RANGE, ex.reasonCode());
        }

        @Test
        @DisplayName("k below one is a configuration error")
        void testKNonPositive() {
            ClusteringConfigurationException ex = assertThrows(
                    ClusteringConfigurationException.class,
                    () -> engine.cluster(scalarPeriods(1.0d, 2.0d), config(0, 1).build())
            );
            assertEquals(ClusteringConfig.REASON_K_NON_POSITIVE, ex.reasonCode());
        }

        @Test
        @DisplayName("Non-finite values fail naming series and period")
        void testNonFinite() {
            ClusteringDataException ex = assertThrows(
                    ClusteringDataException.class,
                    () -> engine.cluster(scalarPeriods(1.0d, Double.NaN, 3.0d), config(2, 1).build())
            );
            assertEquals(ClusteringEngine.REASON_NON_FINITE_VALUE, ex.reasonCode());
            assertTrue(ex.getMessage().contains("demand-A"));
            assertTrue(ex.getMessage().contains("period 2"));
        }

        @Test
        @DisplayName("Unknown metric and duration mismatch are configuration errors")
        void testConfigMismatches() {
            PeriodVectorSet vectors = scalarPeriods(1.0d, 2.0d, 3.0d);

            assertEquals(
                    ClusteringEngine.REASON_UNKNOWN_DISTANCE_METRIC,
                    assertThrows(
                            ClusteringConfigurationException.class,
                            () -> engine.cluster(vectors, config(2, 1).distanceMetric("HAMMING").build())
                    ).reasonCode()
            );
            assertEquals(
                    ClusteringEngine.REASON_PERIOD_DURATION_MISMATCH,
                    assertThrows(
                            ClusteringConfigurationException.class,
                            () -> engine.cluster(vectors, config(2, 24).build())
                    ).reasonCode()
            );
        }

        @Test
        @DisplayName("A single iteration cannot confirm convergence and returns a warning")
        void testConvergenceWarning() {
            PeriodVectorSet vectors = PeriodSegmenter.assemble(ProfileFixtures.threeShapeYear(30, 7L), 24);

            ClusteringResult result = engine.cluster(vectors, config(3, 24).maxIterations(1).build());

            assertFalse(result.converged());
            assertEquals(1, result.iterations());
            ConvergenceWarning warning = result.convergenceWarning().orElseThrow();
            assertEquals(1, warning.getMaxIterations());
            assertEquals(1, warning.getBestIteration());
            assertTrue(warning.message().contains("1 iterations"));
            assertPartition(result);
        }

        @Test
        @DisplayName("Overflowing distances without convergence still return an assignment")
        void testOverflowingCostReturnsAssignment() {
            PeriodVectorSet vectors = scalarPeriods(1e200, -1e200, 0.0d);

            ClusteringResult result = engine.cluster(vectors, config(2, 1).maxIterations(1).build());

            assertFalse(result.converged());
            ConvergenceWarning warning = result.convergenceWarning().orElseThrow();
            assertEquals(1, warning.getBestIteration());
            assertTrue(Double.isInfinite(warning.getBestCost()));
            assertPartition(result);
        }
    }

    @Nested
    @DisplayName("Tie-breaking")
    class TieBreaking {
        private final DistanceMetric euclidean = new EuclideanDistance();

        @Test
        @DisplayName("An equidistant period goes to the lowest center offset")
        void testNearestCenterTie() {
            double[] point = {5.0d};

            assertEquals(0, ClusteringEngine.nearestCenter(point, new double[][]{{0.0d}, {10.0d}}, euclidean));
            assertEquals(0, ClusteringEngine.nearestCenter(point, new double[][]{{10.0d}, {0.0d}}, euclidean));
            assertEquals(1, ClusteringEngine.nearestCenter(point, new double[][]{{9.0d}, {4.0d}, {6.0d}}, euclidean));
        }

        @Test
        @DisplayName("Empty clusters take the farthest period, lowest offset on equal distances")
        void testFarthestDonorTie() {
            int[] assignment = {0, 0, 1, 1, 1};
            double[] distances = {3.0d, 3.0d, 4.0d, 4.0d, 1.0d};

            assertEquals(2, ClusteringEngine.farthestDonor(assignment, distances, new int[]{2, 3, 0}));
        }

        @Test
        @DisplayName("Singleton clusters never donate their period")
        void testFarthestDonorSkipsSingletons() {
            int[] assignment = {0, 1, 1};
            double[] distances = {9.0d, 2.0d, 2.0d};

            assertEquals(1, ClusteringEngine.farthestDonor(assignment, distances, new int[]{1, 2, 0}));
            assertEquals(-1, ClusteringEngine.farthestDonor(new int[]{0, 1}, new double[]{1.0d, 1.0d}, new int[]{1, 1, 0}));
        }

        @Test
        @DisplayName("Midpoint period joins the cluster seeded first")
        void testMidpointJoinsFirstCenter() {
            PeriodVectorSet vectors = scalarPeriods(0.0d, 10.0d, 5.0d);
            double[][] data = vectors.vectorsCopy();
            int checked = 0;
            for (long seed = 0L; seed < 32L; seed++) {
                int[] seeds = CenterInitializer.selectCenters(
                        data, 2, euclidean, InitializationMethod.RANDOM, seed
                );
                if (seeds[0] == 2 || seeds[1] == 2) {
                    continue;
                }
                ClusteringResult result = engine.cluster(
                        vectors,
                        config(2, 1).initialization(InitializationMethod.RANDOM).randomSeed(seed).build()
                );

                assertArrayEquals(new int[]{1, 2, seeds[0] + 1}, result.assignmentCopy(), "seed " + seed);
                assertTrue(result.converged());
                checked++;
            }
            assertTrue(checked > 0);
        }
    }

    @Nested
    @DisplayName("Parallel assignment")
    class ParallelAssignment {

        @Test
        @Timeout(30)
        @DisplayName("Parallel assignment matches the sequential result exactly")
        void testParallelMatchesSequential() {
            PeriodVectorSet vectors = PeriodSegmenter.assemble(ProfileFixtures.threeShapeYear(90, 21L), 24);
            ClusteringConfig sequential = config(6, 24).randomSeed(99L).build();
            ClusteringConfig parallel = sequential.toBuilder().parallelism(4).build();

            ClusteringResult a = engine.cluster(vectors, sequential);
            ClusteringResult b = engine.cluster(vectors, parallel);

            assertArrayEquals(a.assignmentCopy(), b.assignmentCopy());
            for (int r = 1; r <= 6; r++) {
                assertArrayEquals(a.representativeCopy(r), b.representativeCopy(r));
            }
            assertEquals(a.totalCost(), b.totalCost());
        }
    }
}
