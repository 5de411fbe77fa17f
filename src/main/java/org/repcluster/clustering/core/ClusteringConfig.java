package org.repcluster.clustering.core;

import lombok.Builder;
import lombok.Value;
import org.repcluster.clustering.distance.DistanceMetricRegistry;
import org.repcluster.clustering.engine.InitializationMethod;
import org.repcluster.clustering.engine.RepresentativeKind;
import org.repcluster.clustering.weight.WeightPolicy;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable parameters of one representative-period clustering run.
 *
 * <p>Option names accepted by {@link #withOverrides(Map)} and, with the
 * {@value #SYSTEM_PROPERTY_PREFIX} prefix, by {@link #fromSystemProperties()}:</p>
 * <ul>
 * <li>{@code period_duration}, {@code num_representative_periods}, {@code distance_metric},
 * {@code random_seed}, {@code max_iterations}</li>
 * <li>{@code representative_kind}, {@code initialization}, {@code weight_policy},
 * {@code weight_fit_max_iterations}, {@code weight_fit_tolerance}, {@code resolution},
 * {@code parallelism}</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class ClusteringConfig {
    public static final String REASON_PERIOD_DURATION_NON_POSITIVE = "C2_PERIOD_DURATION_NON_POSITIVE";
    public static final String REASON_K_NON_POSITIVE = "C3_K_NON_POSITIVE";
    public static final String REASON_MAX_ITERATIONS_NON_POSITIVE = "C3_MAX_ITERATIONS_NON_POSITIVE";
    public static final String REASON_PARALLELISM_NON_POSITIVE = "C3_PARALLELISM_NON_POSITIVE";
    public static final String REASON_METRIC_REQUIRED = "C3_DISTANCE_METRIC_REQUIRED";
    public static final String REASON_WEIGHT_FIT_BOUNDS = "C4_WEIGHT_FIT_BOUNDS_INVALID";
    public static final String REASON_RESOLUTION_INVALID = "C5_RESOLUTION_INVALID";
    public static final String REASON_UNKNOWN_OPTION = "C0_UNKNOWN_OPTION";
    public static final String REASON_MALFORMED_OPTION = "C0_MALFORMED_OPTION";

    public static final String SYSTEM_PROPERTY_PREFIX = "repcluster.";

    public static final String OPTION_PERIOD_DURATION = "period_duration";
    public static final String OPTION_NUM_REPRESENTATIVE_PERIODS = "num_representative_periods";
    public static final String OPTION_DISTANCE_METRIC = "distance_metric";
    public static final String OPTION_RANDOM_SEED = "random_seed";
    public static final String OPTION_MAX_ITERATIONS = "max_iterations";
    public static final String OPTION_REPRESENTATIVE_KIND = "representative_kind";
    public static final String OPTION_INITIALIZATION = "initialization";
    public static final String OPTION_WEIGHT_POLICY = "weight_policy";
    public static final String OPTION_WEIGHT_FIT_MAX_ITERATIONS = "weight_fit_max_iterations";
    public static final String OPTION_WEIGHT_FIT_TOLERANCE = "weight_fit_tolerance";
    public static final String OPTION_RESOLUTION = "resolution";
    public static final String OPTION_PARALLELISM = "parallelism";

    public static final int DEFAULT_PERIOD_DURATION = 24;
    public static final long DEFAULT_RANDOM_SEED = 42L;
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    /**
     * Length of one period in time steps.
     */
    @Builder.Default
    int periodDuration = DEFAULT_PERIOD_DURATION;

    /**
     * Target representative period count {@code k}; must satisfy {@code 1 <= k <= numPeriods}.
     */
    int representativePeriods;

    /**
     * Registry id of the distance metric.
     */
    @Builder.Default
    String distanceMetric = DistanceMetricRegistry.METRIC_EUCLIDEAN;

    /**
     * Seed for every randomized choice made during initialization.
     */
    @Builder.Default
    long randomSeed = DEFAULT_RANDOM_SEED;

    /**
     * Safety bound on assignment/update iterations.
     */
    @Builder.Default
    int maxIterations = DEFAULT_MAX_ITERATIONS;

    @Builder.Default
    RepresentativeKind representativeKind = RepresentativeKind.MEDOID;

    @Builder.Default
    InitializationMethod initialization = InitializationMethod.K_MEANS_PLUS_PLUS;

    @Builder.Default
    WeightPolicy weightPolicy = WeightPolicy.HARD;

    /**
     * Projected-gradient iteration bound for {@link WeightPolicy#CONVEX}.
     */
    @Builder.Default
    int weightFitMaxIterations = 1_000;

    /**
     * Max-norm change below which the convex weight fit stops.
     */
    @Builder.Default
    double weightFitTolerance = 1e-9;

    /**
     * Duration of one time step, reported with every representative period.
     */
    @Builder.Default
    double resolution = 1.0d;

    /**
     * Worker count for the assignment step; {@code 1} keeps it on the calling thread.
     */
    @Builder.Default
    int parallelism = 1;

    /**
     * Validates ranges that do not depend on the input data.
     *
     * @return this config.
     * @throws ClusteringConfigurationException when an option is out of range.
     */
    public ClusteringConfig validate() {
        if (periodDuration <= 0) {
            throw new ClusteringConfigurationException(
                    REASON_PERIOD_DURATION_NON_POSITIVE,
                    "period_duration must be > 0, got " + periodDuration
            );
        }
        if (representativePeriods <= 0) {
            throw new ClusteringConfigurationException(
                    REASON_K_NON_POSITIVE,
                    "num_representative_periods must be >= 1, got " + representativePeriods
            );
        }
        if (maxIterations <= 0) {
            throw new ClusteringConfigurationException(
                    REASON_MAX_ITERATIONS_NON_POSITIVE,
                    "max_iterations must be > 0, got " + maxIterations
            );
        }
        if (parallelism <= 0) {
            throw new ClusteringConfigurationException(
                    REASON_PARALLELISM_NON_POSITIVE,
                    "parallelism must be > 0, got " + parallelism
            );
        }
        if (distanceMetric == null || distanceMetric.isBlank()) {
            throw new ClusteringConfigurationException(REASON_METRIC_REQUIRED, "distance_metric must be non-blank");
        }
        if (weightFitMaxIterations <= 0 || !Double.isFinite(weightFitTolerance) || weightFitTolerance <= 0.0d) {
            throw new ClusteringConfigurationException(
                    REASON_WEIGHT_FIT_BOUNDS,
                    "weight fit requires max iterations > 0 and a finite tolerance > 0"
            );
        }
        if (!Double.isFinite(resolution) || resolution <= 0.0d) {
            throw new ClusteringConfigurationException(
                    REASON_RESOLUTION_INVALID,
                    "resolution must be finite and > 0, got " + resolution
            );
        }
        Objects.requireNonNull(representativeKind, "representativeKind");
        Objects.requireNonNull(initialization, "initialization");
        Objects.requireNonNull(weightPolicy, "weightPolicy");
        return this;
    }

    /**
     * Builds a config from {@code repcluster.*} system properties on top of the defaults.
     */
    public static ClusteringConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Builds a config from prefixed properties on top of the defaults.
     * Properties outside the {@value #SYSTEM_PROPERTY_PREFIX} namespace are ignored.
     */
    public static ClusteringConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Map<String, String> options = new LinkedHashMap<>();
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                options.put(name.substring(SYSTEM_PROPERTY_PREFIX.length()), properties.getProperty(name));
            }
        }
        return ClusteringConfig.builder().build().withOverrides(options);
    }

    /**
     * Returns a copy with the given snake_case options applied.
     *
     * @param options option name to raw value.
     * @return overridden config (not yet validated).
     * @throws ClusteringConfigurationException on unknown names or malformed values.
     */
    public ClusteringConfig withOverrides(Map<String, String> options) {
        Objects.requireNonNull(options, "options");
        ClusteringConfigBuilder builder = toBuilder();
        for (Map.Entry<String, String> entry : options.entrySet()) {
            String name = entry.getKey() == null ? "" : entry.getKey().trim().toLowerCase(Locale.ROOT);
            String raw = entry.getValue() == null ? "" : entry.getValue().trim();
            switch (name) {
                case OPTION_PERIOD_DURATION -> builder.periodDuration(parseInt(name, raw));
                case OPTION_NUM_REPRESENTATIVE_PERIODS -> builder.representativePeriods(parseInt(name, raw));
                case OPTION_DISTANCE_METRIC -> builder.distanceMetric(raw.toUpperCase(Locale.ROOT));
                case OPTION_RANDOM_SEED -> builder.randomSeed(parseLong(name, raw));
                case OPTION_MAX_ITERATIONS -> builder.maxIterations(parseInt(name, raw));
                case OPTION_REPRESENTATIVE_KIND -> builder.representativeKind(
                        parseEnum(name, raw, RepresentativeKind.class)
                );
                case OPTION_INITIALIZATION -> builder.initialization(parseInitialization(raw));
                case OPTION_WEIGHT_POLICY -> builder.weightPolicy(parseEnum(name, raw, WeightPolicy.class));
                case OPTION_WEIGHT_FIT_MAX_ITERATIONS -> builder.weightFitMaxIterations(parseInt(name, raw));
                case OPTION_WEIGHT_FIT_TOLERANCE -> builder.weightFitTolerance(parseDouble(name, raw));
                case OPTION_RESOLUTION -> builder.resolution(parseDouble(name, raw));
                case OPTION_PARALLELISM -> builder.parallelism(parseInt(name, raw));
                default -> throw new ClusteringConfigurationException(
                        REASON_UNKNOWN_OPTION,
                        "unknown clustering option: " + entry.getKey()
                );
            }
        }
        return builder.build();
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw malformed(name, raw, ex);
        }
    }

    private static long parseLong(String name, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw malformed(name, raw, ex);
        }
    }

    private static double parseDouble(String name, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw malformed(name, raw, ex);
        }
    }

    private static InitializationMethod parseInitialization(String raw) {
        String normalized = raw.toLowerCase(Locale.ROOT);
        if (normalized.equals("kmeans++") || normalized.equals("k-means++")) {
            return InitializationMethod.K_MEANS_PLUS_PLUS;
        }
        return parseEnum(OPTION_INITIALIZATION, raw, InitializationMethod.class);
    }

    private static <E extends Enum<E>> E parseEnum(String name, String raw, Class<E> type) {
        try {
            return Enum.valueOf(type, raw.replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw malformed(name, raw, ex);
        }
    }

    private static ClusteringConfigurationException malformed(String name, String raw, Exception cause) {
        return new ClusteringConfigurationException(
                REASON_MALFORMED_OPTION,
                "malformed value for " + name + ": '" + raw + "'",
                cause
        );
    }
}
