package org.repcluster.clustering.distance;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable registry of distance metrics keyed by upper-case id.
 */
public final class DistanceMetricRegistry {
    public static final String METRIC_EUCLIDEAN = "EUCLIDEAN";
    public static final String METRIC_SQUARED_EUCLIDEAN = "SQUARED_EUCLIDEAN";
    public static final String METRIC_MANHATTAN = "MANHATTAN";
    public static final String METRIC_COSINE = "COSINE";

    private static final List<DistanceMetric> BUILT_INS = List.of(
            new EuclideanDistance(),
            new SquaredEuclideanDistance(),
            new ManhattanDistance(),
            new CosineDistance()
    );

    private final Map<String, DistanceMetric> metricsById;

    /**
     * Creates a registry with built-in metrics only.
     */
    public DistanceMetricRegistry() {
        this(List.of());
    }

    /**
     * Creates a registry by merging built-ins with custom metrics.
     *
     * <p>Custom metric ids override built-ins when ids collide.</p>
     */
    public DistanceMetricRegistry(Collection<? extends DistanceMetric> customMetrics) {
        LinkedHashMap<String, DistanceMetric> merged = new LinkedHashMap<>();
        for (DistanceMetric metric : BUILT_INS) {
            merged.put(metric.id(), metric);
        }
        if (customMetrics != null) {
            for (DistanceMetric metric : customMetrics) {
                DistanceMetric nonNull = Objects.requireNonNull(metric, "metric");
                merged.put(normalizeId(nonNull.id()), nonNull);
            }
        }
        this.metricsById = Map.copyOf(merged);
    }

    /**
     * Returns metric by id (case-insensitive), or {@code null} when not registered.
     */
    public DistanceMetric metric(String metricId) {
        if (metricId == null || metricId.isBlank()) {
            return null;
        }
        return metricsById.get(normalizeId(metricId));
    }

    /**
     * Returns immutable set of registered metric ids.
     */
    public Set<String> metricIds() {
        return metricsById.keySet();
    }

    /**
     * Returns a new default registry instance.
     */
    public static DistanceMetricRegistry defaultRegistry() {
        return new DistanceMetricRegistry();
    }

    private static String normalizeId(String id) {
        String normalized = Objects.requireNonNull(id, "metric.id").trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("metric.id must be non-blank");
        }
        return normalized;
    }
}
