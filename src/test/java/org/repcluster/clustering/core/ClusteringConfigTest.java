package org.repcluster.clustering.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.repcluster.clustering.distance.DistanceMetricRegistry;
import org.repcluster.clustering.engine.InitializationMethod;
import org.repcluster.clustering.engine.RepresentativeKind;
import org.repcluster.clustering.weight.WeightPolicy;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ClusteringConfig Tests")
class ClusteringConfigTest {

    @Test
    @DisplayName("Builder defaults match the documented configuration surface")
    void testDefaults() {
        ClusteringConfig config = ClusteringConfig.builder().representativePeriods(3).build().validate();

        assertEquals(24, config.getPeriodDuration());
        assertEquals(DistanceMetricRegistry.METRIC_EUCLIDEAN, config.getDistanceMetric());
        assertEquals(42L, config.getRandomSeed());
        assertEquals(100, config.getMaxIterations());
        assertEquals(RepresentativeKind.MEDOID, config.getRepresentativeKind());
        assertEquals(InitializationMethod.K_MEANS_PLUS_PLUS, config.getInitialization());
        assertEquals(WeightPolicy.HARD, config.getWeightPolicy());
        assertEquals(1.0d, config.getResolution());
        assertEquals(1, config.getParallelism());
    }

    @Test
    @DisplayName("Snake-case overrides are parsed and normalized")
    void testOverrides() {
        ClusteringConfig config = ClusteringConfig.builder().build().withOverrides(Map.of(
                "num_representative_periods", "5",
                "period_duration", "12",
                "distance_metric", "manhattan",
                "initialization", "kmeans++",
                "representative_kind", "centroid",
                "weight_policy", "convex",
                "random_seed", "-7",
                "parallelism", "4"
        )).validate();

        assertEquals(5, config.getRepresentativePeriods());
        assertEquals(12, config.getPeriodDuration());
        assertEquals("MANHATTAN", config.getDistanceMetric());
        assertEquals(InitializationMethod.K_MEANS_PLUS_PLUS, config.getInitialization());
        assertEquals(RepresentativeKind.CENTROID, config.getRepresentativeKind());
        assertEquals(WeightPolicy.CONVEX, config.getWeightPolicy());
        assertEquals(-7L, config.getRandomSeed());
        assertEquals(4, config.getParallelism());
    }

    @Test
    @DisplayName("Unknown and malformed options fail with reason codes")
    void testOverrideErrors() {
        ClusteringConfig base = ClusteringConfig.builder().build();

        ClusteringConfigurationException unknown = assertThrows(
                ClusteringConfigurationException.class,
                () -> base.withOverrides(Map.of("num_clusters", "3"))
        );
        assertEquals(ClusteringConfig.REASON_UNKNOWN_OPTION, unknown.reasonCode());

        ClusteringConfigurationException malformed = assertThrows(
                ClusteringConfigurationException.class,
                () -> base.withOverrides(Map.of("max_iterations", "many"))
        );
        assertEquals(ClusteringConfig.REASON_MALFORMED_OPTION, malformed.reasonCode());

        ClusteringConfigurationException badEnum = assertThrows(
                ClusteringConfigurationException.class,
                () -> base.withOverrides(Map.of("representative_kind", "median"))
        );
        assertEquals(ClusteringConfig.REASON_MALFORMED_OPTION, badEnum.reasonCode());
    }

    @Test
    @DisplayName("Validation rejects out-of-range values")
    void testValidation() {
        assertReason(ClusteringConfig.REASON_K_NON_POSITIVE, ClusteringConfig.builder().representativePeriods(0));
        assertReason(
                ClusteringConfig.REASON_PERIOD_DURATION_NON_POSITIVE,
                ClusteringConfig.builder().representativePeriods(1).periodDuration(0)
        );
        assertReason(
                ClusteringConfig.REASON_MAX_ITERATIONS_NON_POSITIVE,
                ClusteringConfig.builder().representativePeriods(1).maxIterations(0)
        );
        assertReason(
                ClusteringConfig.REASON_PARALLELISM_NON_POSITIVE,
                ClusteringConfig.builder().representativePeriods(1).parallelism(0)
        );
        assertReason(
                ClusteringConfig.REASON_METRIC_REQUIRED,
                ClusteringConfig.builder().representativePeriods(1).distanceMetric(" ")
        );
        assertReason(
                ClusteringConfig.REASON_RESOLUTION_INVALID,
                ClusteringConfig.builder().representativePeriods(1).resolution(Double.NaN)
        );
        assertReason(
                ClusteringConfig.REASON_WEIGHT_FIT_BOUNDS,
                ClusteringConfig.builder().representativePeriods(1).weightFitTolerance(0.0d)
        );
    }

    @Test
    @DisplayName("Prefixed properties override defaults and foreign properties are ignored")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("repcluster.num_representative_periods", "2");
        properties.setProperty("repcluster.max_iterations", "9");
        properties.setProperty("java.home", "/ignored");

        ClusteringConfig config = ClusteringConfig.fromProperties(properties).validate();

        assertEquals(2, config.getRepresentativePeriods());
        assertEquals(9, config.getMaxIterations());
        assertEquals(24, config.getPeriodDuration());
    }

    private static void assertReason(String expected, ClusteringConfig.ClusteringConfigBuilder builder) {
        ClusteringConfigurationException ex = assertThrows(
                ClusteringConfigurationException.class,
                () -> builder.build().validate()
        );
        assertEquals(expected, ex.reasonCode());
    }
}
