package org.repcluster.clustering.period;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.repcluster.clustering.profile.ProfileKey;
import org.repcluster.clustering.profile.ProfileSeries;

import java.util.Objects;

/**
 * Fixed-length window of one series, addressed by {@code (series, periodIndex)}.
 *
 * <p>Views the backing series without copying it.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Period {
    private final ProfileSeries series;
    private final int periodIndex;
    private final int duration;

    Period(ProfileSeries series, int periodIndex, int duration) {
        this.series = Objects.requireNonNull(series, "series");
        this.periodIndex = periodIndex;
        this.duration = duration;
    }

    public ProfileKey seriesKey() {
        return series.key();
    }

    /**
     * @return first series time step covered by this period.
     */
    public int firstTimeStep() {
        return (periodIndex - 1) * duration + 1;
    }

    /**
     * @param timestep 1-based step within the period.
     * @return series value at that step.
     */
    public double valueAt(int timestep) {
        if (timestep < 1 || timestep > duration) {
            throw new IndexOutOfBoundsException("timestep out of bounds: " + timestep + " not in [1," + duration + "]");
        }
        return series.valueAt(firstTimeStep() + timestep - 1);
    }

    /**
     * Copies this period's values into {@code target} starting at {@code offset}.
     */
    public void copyInto(double[] target, int offset) {
        series.copyWindow(firstTimeStep(), target, offset, duration);
    }

    /**
     * @return defensive copy of this period's values.
     */
    public double[] valuesCopy() {
        double[] copy = new double[duration];
        copyInto(copy, 0);
        return copy;
    }

    @Override
    public String toString() {
        return "Period(" + series.key() + ", " + periodIndex + ")";
    }
}
