package org.repcluster.clustering.profile;

import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import org.repcluster.clustering.core.ClusteringDataException;
import org.repcluster.core.id.IDMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Validated in-memory form of the {@code profiles(asset, time_step, value)} input table.
 *
 * <p>Contract summary:</p>
 * <ul>
 * <li>Series are ordered by ascending external name; this order fixes the layout of every
 * period vector.</li>
 * <li>Every series covers time steps {@code 1..H} with no gaps or duplicates.</li>
 * <li>All series share the same horizon {@code H}.</li>
 * </ul>
 */
public final class ProfileTable {
    public static final String REASON_EMPTY_TABLE = "C1_EMPTY_TABLE";
    public static final String REASON_TIME_STEP_INVALID = "C1_TIME_STEP_INVALID";
    public static final String REASON_DUPLICATE_TIME_STEP = "C1_DUPLICATE_TIME_STEP";
    public static final String REASON_TIME_STEP_GAP = "C1_TIME_STEP_GAP";
    public static final String REASON_DUPLICATE_SERIES = "C1_DUPLICATE_SERIES";
    public static final String REASON_HORIZON_MISMATCH = "C1_HORIZON_MISMATCH";

    private final List<ProfileSeries> series;
    private final IDMapper seriesIds;
    private final int horizon;

    private ProfileTable(List<ProfileSeries> series) {
        this.series = Collections.unmodifiableList(series);
        List<String> names = new ArrayList<>(series.size());
        for (ProfileSeries s : series) {
            names.add(s.key().externalName());
        }
        this.seriesIds = IDMapper.fromOrderedNames(names);
        this.horizon = series.get(0).horizon();
    }

    /**
     * Creates a table from already-materialized series.
     *
     * @throws ClusteringDataException on empty input, duplicate keys or horizon mismatch.
     */
    public static ProfileTable of(Collection<ProfileSeries> series) {
        Objects.requireNonNull(series, "series");
        TreeMap<ProfileKey, ProfileSeries> sorted = new TreeMap<>();
        for (ProfileSeries s : series) {
            ProfileSeries nonNull = Objects.requireNonNull(s, "series element");
            if (sorted.put(nonNull.key(), nonNull) != null) {
                throw new ClusteringDataException(
                        REASON_DUPLICATE_SERIES,
                        "series " + nonNull.key() + " appears more than once"
                );
            }
        }
        return fromSorted(new ArrayList<>(sorted.values()));
    }

    private static ProfileTable fromSorted(List<ProfileSeries> sorted) {
        if (sorted.isEmpty()) {
            throw new ClusteringDataException(REASON_EMPTY_TABLE, "profiles table contains no series");
        }
        int expected = sorted.get(0).horizon();
        for (ProfileSeries s : sorted) {
            if (s.horizon() != expected) {
                throw new ClusteringDataException(
                        REASON_HORIZON_MISMATCH,
                        "series " + s.key() + " has horizon " + s.horizon()
                                + " but " + sorted.get(0).key() + " has " + expected
                );
            }
        }
        return new ProfileTable(sorted);
    }

    /**
     * @return row-oriented builder for {@code (asset, time_step, value)} records.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return series in deterministic table order.
     */
    public List<ProfileSeries> series() {
        return series;
    }

    public int seriesCount() {
        return series.size();
    }

    /**
     * @return shared horizon length {@code H}.
     */
    public int horizon() {
        return horizon;
    }

    /**
     * @return position of the series in table order.
     * @throws IDMapper.UnknownIDException when the key is not part of the table.
     */
    public int seriesIndex(ProfileKey key) {
        return seriesIds.toInternal(Objects.requireNonNull(key, "key").externalName());
    }

    /**
     * @return series at the given table position.
     */
    public ProfileSeries series(int index) {
        return series.get(index);
    }

    /**
     * Accumulates raw table rows and validates series contracts on {@link #build()}.
     */
    public static final class Builder {
        private final Map<ProfileKey, Int2DoubleOpenHashMap> rowsByKey = new TreeMap<>();

        private Builder() {
        }

        /**
         * Adds one input row.
         *
         * @param asset external profile name ({@code type-name}).
         * @param timeStep 1-based time step.
         * @param value sample value.
         * @return this builder.
         * @throws ClusteringDataException on malformed names, invalid or duplicate steps.
         */
        public Builder add(String asset, int timeStep, double value) {
            ProfileKey key = ProfileKey.parse(asset);
            if (timeStep < 1) {
                throw new ClusteringDataException(
                        REASON_TIME_STEP_INVALID,
                        "series " + key + " has time_step " + timeStep + " (must be >= 1)"
                );
            }
            Int2DoubleOpenHashMap rows = rowsByKey.computeIfAbsent(key, ignored -> new Int2DoubleOpenHashMap());
            if (rows.containsKey(timeStep)) {
                throw new ClusteringDataException(
                        REASON_DUPLICATE_TIME_STEP,
                        "series " + key + " has duplicate time_step " + timeStep
                );
            }
            rows.put(timeStep, value);
            return this;
        }

        /**
         * @return validated immutable table.
         */
        public ProfileTable build() {
            List<ProfileSeries> sorted = new ArrayList<>(rowsByKey.size());
            for (Map.Entry<ProfileKey, Int2DoubleOpenHashMap> entry : rowsByKey.entrySet()) {
                sorted.add(toSeries(entry.getKey(), entry.getValue()));
            }
            return fromSorted(sorted);
        }

        private static ProfileSeries toSeries(ProfileKey key, Int2DoubleOpenHashMap rows) {
            int horizon = rows.size();
            double[] values = new double[horizon];
            for (int step = 1; step <= horizon; step++) {
                if (!rows.containsKey(step)) {
                    throw new ClusteringDataException(
                            REASON_TIME_STEP_GAP,
                            "series " + key + " is missing time_step " + step
                    );
                }
                values[step - 1] = rows.get(step);
            }
            return new ProfileSeries(key, values);
        }
    }
}
