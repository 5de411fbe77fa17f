package org.repcluster.clustering.distance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Distance Metric Tests")
class DistanceMetricRegistryTest {

    private static final double[] A = {0.0d, 0.0d};
    private static final double[] B = {3.0d, 4.0d};

    @Test
    @DisplayName("Built-in metrics compute their textbook values")
    void testBuiltIns() {
        DistanceMetricRegistry registry = DistanceMetricRegistry.defaultRegistry();

        assertEquals(5.0d, registry.metric("EUCLIDEAN").distance(A, B), 1e-12);
        assertEquals(25.0d, registry.metric("SQUARED_EUCLIDEAN").distance(A, B), 1e-12);
        assertEquals(7.0d, registry.metric("MANHATTAN").distance(A, B), 1e-12);
        assertEquals(0.0d, registry.metric("COSINE").distance(B, new double[]{6.0d, 8.0d}), 1e-12);
        assertEquals(2.0d, registry.metric("COSINE").distance(B, new double[]{-3.0d, -4.0d}), 1e-12);
    }

    @Test
    @DisplayName("Cosine distance handles zero vectors")
    void testCosineZeroVectors() {
        CosineDistance cosine = new CosineDistance();

        assertEquals(0.0d, cosine.distance(A, A));
        assertEquals(1.0d, cosine.distance(A, B));
    }

    @Test
    @DisplayName("Lookup is case-insensitive and unknown ids resolve to null")
    void testLookup() {
        DistanceMetricRegistry registry = new DistanceMetricRegistry();

        assertNotNull(registry.metric("euclidean"));
        assertNull(registry.metric("CHEBYSHEV"));
        assertNull(registry.metric(" "));
        assertTrue(registry.metricIds().contains(DistanceMetricRegistry.METRIC_MANHATTAN));
    }

    @Test
    @DisplayName("Custom metrics are registered and override built-ins on id collision")
    void testCustomMetrics() {
        DistanceMetric chebyshev = new DistanceMetric() {
            @Override
            public String id() {
                return "chebyshev";
            }

            @Override
            public double distance(double[] a, double[] b) {
                double max = 0.0d;
                for (int i = 0; i < a.length; i++) {
                    max = Math.max(max, Math.abs(a[i] - b[i]));
                }
                return max;
            }
        };
        DistanceMetric constantEuclidean = new DistanceMetric() {
            @Override
            public String id() {
                return DistanceMetricRegistry.METRIC_EUCLIDEAN;
            }

            @Override
            public double distance(double[] a, double[] b) {
                return 1.0d;
            }
        };

        DistanceMetricRegistry registry = new DistanceMetricRegistry(List.of(chebyshev, constantEuclidean));

        assertEquals(4.0d, registry.metric("CHEBYSHEV").distance(A, B));
        assertEquals(1.0d, registry.metric("EUCLIDEAN").distance(A, B));
    }

    @Test
    @DisplayName("Dimension mismatch is rejected")
    void testDimensionMismatch() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new EuclideanDistance().distance(A, new double[]{1.0d})
        );
    }
}
