package org.repcluster.clustering.period;

import org.repcluster.clustering.profile.ProfileKey;
import org.repcluster.core.id.IDMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable matrix of period vectors, one row per period index.
 *
 * <p>Row {@code p - 1} holds period {@code p}. Within a row, series {@code s} occupies
 * columns {@code [s * periodDuration, (s + 1) * periodDuration)}.</p>
 */
public final class PeriodVectorSet {
    private final List<ProfileKey> seriesKeys;
    private final IDMapper seriesIds;
    private final int periodDuration;
    private final double[][] vectors;

    /**
     * @param seriesKeys series in column-block order.
     * @param periodDuration length of one series block.
     * @param vectors rows of width {@code seriesKeys.size() * periodDuration}.
     */
    public PeriodVectorSet(List<ProfileKey> seriesKeys, int periodDuration, double[][] vectors) {
        Objects.requireNonNull(seriesKeys, "seriesKeys");
        Objects.requireNonNull(vectors, "vectors");
        if (seriesKeys.isEmpty()) {
            throw new IllegalArgumentException("at least one series is required");
        }
        if (periodDuration <= 0) {
            throw new IllegalArgumentException("periodDuration must be > 0");
        }
        if (vectors.length == 0) {
            throw new IllegalArgumentException("at least one period is required");
        }
        this.seriesKeys = List.copyOf(seriesKeys);
        List<String> names = new ArrayList<>(seriesKeys.size());
        for (ProfileKey key : this.seriesKeys) {
            names.add(key.externalName());
        }
        this.seriesIds = IDMapper.fromOrderedNames(names);
        this.periodDuration = periodDuration;

        int dimension = seriesKeys.size() * periodDuration;
        this.vectors = new double[vectors.length][];
        for (int p = 0; p < vectors.length; p++) {
            double[] row = Objects.requireNonNull(vectors[p], "vectors[" + p + "]");
            if (row.length != dimension) {
                throw new IllegalArgumentException(
                        "vectors[" + p + "] length mismatch: " + row.length + " != " + dimension
                );
            }
            this.vectors[p] = Arrays.copyOf(row, dimension);
        }
    }

    public int numPeriods() {
        return vectors.length;
    }

    public int periodDuration() {
        return periodDuration;
    }

    public int seriesCount() {
        return seriesKeys.size();
    }

    public int dimension() {
        return seriesKeys.size() * periodDuration;
    }

    public List<ProfileKey> seriesKeys() {
        return seriesKeys;
    }

    /**
     * @return column-block index of the series.
     * @throws IDMapper.UnknownIDException when the key is not part of this set.
     */
    public int seriesIndex(ProfileKey key) {
        return seriesIds.toInternal(Objects.requireNonNull(key, "key").externalName());
    }

    /**
     * @return series owning the given vector column.
     */
    public ProfileKey seriesKeyForDimension(int dimension) {
        return seriesKeys.get(dimension / periodDuration);
    }

    /**
     * @param periodIndex 1-based period index.
     * @return defensive copy of the period vector.
     */
    public double[] vectorCopy(int periodIndex) {
        double[] row = vectors[checkPeriod(periodIndex) - 1];
        return Arrays.copyOf(row, row.length);
    }

    /**
     * @return defensive copy of the full matrix, row {@code p - 1} = period {@code p}.
     */
    public double[][] vectorsCopy() {
        double[][] copy = new double[vectors.length][];
        for (int p = 0; p < vectors.length; p++) {
            copy[p] = Arrays.copyOf(vectors[p], vectors[p].length);
        }
        return copy;
    }

    private int checkPeriod(int periodIndex) {
        if (periodIndex < 1 || periodIndex > vectors.length) {
            throw new IndexOutOfBoundsException(
                    "periodIndex out of bounds: " + periodIndex + " not in [1," + vectors.length + "]"
            );
        }
        return periodIndex;
    }
}
