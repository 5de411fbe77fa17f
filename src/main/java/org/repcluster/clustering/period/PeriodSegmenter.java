package org.repcluster.clustering.period;

import lombok.extern.slf4j.Slf4j;
import lombok.experimental.UtilityClass;
import org.repcluster.clustering.core.ClusteringConfigurationException;
import org.repcluster.clustering.profile.ProfileKey;
import org.repcluster.clustering.profile.ProfileSeries;
import org.repcluster.clustering.profile.ProfileTable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Splits series into fixed-length, non-overlapping periods.
 *
 * <p>A horizon that is not a multiple of the period duration is rejected; partial
 * periods are never dropped or padded.</p>
 */
@Slf4j
@UtilityClass
public final class PeriodSegmenter {
    public static final String REASON_PERIOD_DURATION_NON_POSITIVE = "C2_PERIOD_DURATION_NON_POSITIVE";
    public static final String REASON_NON_DIVISIBLE_HORIZON = "C2_NON_DIVISIBLE_HORIZON";

    /**
     * Returns a lazy, restartable sequence of the series' periods.
     *
     * @param series source series.
     * @param periodDuration period length in time steps.
     * @return periods {@code 1..H/periodDuration}; each {@code iterator()} call starts over.
     * @throws ClusteringConfigurationException on non-positive duration or non-divisible horizon.
     */
    public static Iterable<Period> segment(ProfileSeries series, int periodDuration) {
        Objects.requireNonNull(series, "series");
        int numPeriods = numPeriods(series.key(), series.horizon(), periodDuration);
        return () -> new PeriodIterator(series, periodDuration, numPeriods);
    }

    /**
     * Computes {@code H / periodDuration} after validating both.
     */
    public static int numPeriods(ProfileKey seriesKey, int horizon, int periodDuration) {
        if (periodDuration <= 0) {
            throw new ClusteringConfigurationException(
                    REASON_PERIOD_DURATION_NON_POSITIVE,
                    "period_duration must be > 0, got " + periodDuration
            );
        }
        if (horizon % periodDuration != 0) {
            throw new ClusteringConfigurationException(
                    REASON_NON_DIVISIBLE_HORIZON,
                    "series " + seriesKey + " has length " + horizon
                            + " which is not divisible by period_duration " + periodDuration
                            + " (remainder " + (horizon % periodDuration) + ")"
            );
        }
        return horizon / periodDuration;
    }

    /**
     * Builds one period vector per period index, concatenating all series in table order.
     *
     * @param table validated profile table.
     * @param periodDuration period length in time steps.
     * @return period vectors of dimension {@code seriesCount * periodDuration}.
     */
    public static PeriodVectorSet assemble(ProfileTable table, int periodDuration) {
        Objects.requireNonNull(table, "table");
        int seriesCount = table.seriesCount();
        int numPeriods = numPeriods(table.series(0).key(), table.horizon(), periodDuration);
        double[][] vectors = new double[numPeriods][seriesCount * periodDuration];
        List<ProfileKey> keys = new ArrayList<>(seriesCount);

        for (int s = 0; s < seriesCount; s++) {
            ProfileSeries series = table.series(s);
            keys.add(series.key());
            int offset = s * periodDuration;
            for (Period period : segment(series, periodDuration)) {
                period.copyInto(vectors[period.periodIndex() - 1], offset);
            }
        }
        log.debug("Assembled {} period vectors of dimension {} from {} series",
                numPeriods, seriesCount * periodDuration, seriesCount);
        return new PeriodVectorSet(keys, periodDuration, vectors);
    }

    private static final class PeriodIterator implements Iterator<Period> {
        private final ProfileSeries series;
        private final int periodDuration;
        private final int numPeriods;
        private int nextIndex = 1;

        private PeriodIterator(ProfileSeries series, int periodDuration, int numPeriods) {
            this.series = series;
            this.periodDuration = periodDuration;
            this.numPeriods = numPeriods;
        }

        @Override
        public boolean hasNext() {
            return nextIndex <= numPeriods;
        }

        @Override
        public Period next() {
            if (!hasNext()) {
                throw new NoSuchElementException("series " + series.key() + " has only " + numPeriods + " periods");
            }
            return new Period(series, nextIndex++, periodDuration);
        }
    }
}
