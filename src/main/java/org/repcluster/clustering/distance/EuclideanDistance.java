package org.repcluster.clustering.distance;

/**
 * Euclidean (L2) distance: {@code sqrt(sum_i (a_i - b_i)^2)}.
 */
public final class EuclideanDistance implements DistanceMetric {

    @Override
    public String id() {
        return DistanceMetricRegistry.METRIC_EUCLIDEAN;
    }

    @Override
    public double distance(double[] a, double[] b) {
        return Math.sqrt(SquaredEuclideanDistance.sumOfSquares(a, b));
    }
}
