package org.repcluster.clustering.distance;

/**
 * Cosine distance: {@code 1 - (a . b) / (|a| |b|)}, clamped to {@code [0, 2]}.
 *
 * <p>Two zero vectors are at distance {@code 0}; a zero vector and a non-zero vector are
 * at distance {@code 1}.</p>
 */
public final class CosineDistance implements DistanceMetric {

    @Override
    public String id() {
        return DistanceMetricRegistry.METRIC_COSINE;
    }

    @Override
    public double distance(double[] a, double[] b) {
        DistanceMetric.requireSameDimension(a, b);
        double dot = 0.0d;
        double normA = 0.0d;
        double normB = 0.0d;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0d && normB == 0.0d) {
            return 0.0d;
        }
        if (normA == 0.0d || normB == 0.0d) {
            return 1.0d;
        }
        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.min(2.0d, Math.max(0.0d, 1.0d - similarity));
    }
}
