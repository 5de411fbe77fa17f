package org.repcluster.clustering.distance;

/**
 * Manhattan (L1) distance: {@code sum_i |a_i - b_i|}.
 */
public final class ManhattanDistance implements DistanceMetric {

    @Override
    public String id() {
        return DistanceMetricRegistry.METRIC_MANHATTAN;
    }

    @Override
    public double distance(double[] a, double[] b) {
        DistanceMetric.requireSameDimension(a, b);
        double sum = 0.0d;
        for (int i = 0; i < a.length; i++) {
            sum += Math.abs(a[i] - b[i]);
        }
        return sum;
    }
}
