package org.repcluster.clustering.profile;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * One named hourly series over the full horizon.
 *
 * <p>Time steps are implicit: index {@code i} of the backing array holds time step
 * {@code i + 1}, so contiguity and uniqueness hold by construction. Values are not
 * checked here; non-finite values are reported by the clustering engine with their
 * period.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ProfileSeries {
    private final ProfileKey key;
    @Getter(AccessLevel.NONE)
    private final double[] values;

    /**
     * @param key series identifier.
     * @param values values for time steps {@code 1..values.length}.
     */
    public ProfileSeries(ProfileKey key, double[] values) {
        this.key = Objects.requireNonNull(key, "key");
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            throw new IllegalArgumentException("series " + key + " must contain at least one time step");
        }
        this.values = Arrays.copyOf(values, values.length);
    }

    /**
     * @return horizon length {@code H}.
     */
    public int horizon() {
        return values.length;
    }

    /**
     * @param timeStep 1-based time step.
     * @return value at that step.
     */
    public double valueAt(int timeStep) {
        if (timeStep < 1 || timeStep > values.length) {
            throw new IndexOutOfBoundsException(
                    "timeStep out of bounds for " + key + ": " + timeStep + " not in [1," + values.length + "]"
            );
        }
        return values[timeStep - 1];
    }

    /**
     * Copies a contiguous window into {@code target}.
     *
     * @param firstTimeStep 1-based first step of the window.
     * @param target destination array.
     * @param targetOffset first destination index.
     * @param length window length.
     */
    public void copyWindow(int firstTimeStep, double[] target, int targetOffset, int length) {
        System.arraycopy(values, firstTimeStep - 1, target, targetOffset, length);
    }

    /**
     * @return defensive copy of all values.
     */
    public double[] valuesCopy() {
        return Arrays.copyOf(values, values.length);
    }
}
