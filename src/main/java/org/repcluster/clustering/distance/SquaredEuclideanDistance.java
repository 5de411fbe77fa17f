package org.repcluster.clustering.distance;

/**
 * Squared Euclidean distance: {@code sum_i (a_i - b_i)^2}.
 *
 * <p>Orders pairs exactly like {@link EuclideanDistance} but weighs outlier periods
 * more heavily in medoid selection.</p>
 */
public final class SquaredEuclideanDistance implements DistanceMetric {

    @Override
    public String id() {
        return DistanceMetricRegistry.METRIC_SQUARED_EUCLIDEAN;
    }

    @Override
    public double distance(double[] a, double[] b) {
        return sumOfSquares(a, b);
    }

    static double sumOfSquares(double[] a, double[] b) {
        DistanceMetric.requireSameDimension(a, b);
        double sum = 0.0d;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }
}
