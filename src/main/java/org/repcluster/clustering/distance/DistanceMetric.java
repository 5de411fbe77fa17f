package org.repcluster.clustering.distance;

/**
 * Strategy contract for measuring distance between two period vectors.
 *
 * <p>Implementations must be stateless, symmetric, return {@code 0} for identical
 * vectors, and never return NaN for finite input. Smaller means closer.</p>
 */
public interface DistanceMetric {

    /**
     * Returns stable registry identifier.
     */
    String id();

    /**
     * Computes the distance between two vectors of equal length.
     *
     * @param a first vector.
     * @param b second vector.
     * @return non-negative distance.
     * @throws IllegalArgumentException on dimension mismatch.
     */
    double distance(double[] a, double[] b);

    /**
     * Validates equal vector dimensions.
     */
    static void requireSameDimension(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
    }
}
