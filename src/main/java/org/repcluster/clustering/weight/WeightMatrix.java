package org.repcluster.clustering.weight;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense {@code numPeriods x k} matrix of non-negative weights. Row {@code p} expresses
 * original period {@code p} as a combination of representative periods.
 *
 * <p>Indices are 1-based on the public surface to match period and representative ids.</p>
 */
public final class WeightMatrix {
    private final double[][] rows;
    private final int numRepresentativePeriods;

    WeightMatrix(double[][] rows, int numRepresentativePeriods) {
        Objects.requireNonNull(rows, "rows");
        this.numRepresentativePeriods = numRepresentativePeriods;
        this.rows = new double[rows.length][];
        for (int p = 0; p < rows.length; p++) {
            if (rows[p].length != numRepresentativePeriods) {
                throw new IllegalArgumentException(
                        "row " + (p + 1) + " width mismatch: " + rows[p].length + " != " + numRepresentativePeriods
                );
            }
            this.rows[p] = Arrays.copyOf(rows[p], numRepresentativePeriods);
        }
    }

    public int numPeriods() {
        return rows.length;
    }

    public int numRepresentativePeriods() {
        return numRepresentativePeriods;
    }

    /**
     * @param period 1-based original period.
     * @param repPeriod 1-based representative id.
     */
    public double get(int period, int repPeriod) {
        checkPeriod(period);
        if (repPeriod < 1 || repPeriod > numRepresentativePeriods) {
            throw new IndexOutOfBoundsException(
                    "repPeriod out of bounds: " + repPeriod + " not in [1," + numRepresentativePeriods + "]"
            );
        }
        return rows[period - 1][repPeriod - 1];
    }

    public double rowSum(int period) {
        checkPeriod(period);
        double sum = 0.0d;
        for (double w : rows[period - 1]) {
            sum += w;
        }
        return sum;
    }

    /**
     * @return summed weight of one representative over all periods.
     */
    public double columnSum(int repPeriod) {
        double sum = 0.0d;
        for (int p = 1; p <= rows.length; p++) {
            sum += get(p, repPeriod);
        }
        return sum;
    }

    private void checkPeriod(int period) {
        if (period < 1 || period > rows.length) {
            throw new IndexOutOfBoundsException(
                    "period out of bounds: " + period + " not in [1," + rows.length + "]"
            );
        }
    }
}
