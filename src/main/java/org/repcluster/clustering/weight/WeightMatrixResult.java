package org.repcluster.clustering.weight;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Objects;

/**
 * Weight matrix together with its per-representative summaries.
 */
@Getter
@Accessors(fluent = true)
public final class WeightMatrixResult {
    private final WeightPolicy policy;
    private final WeightMatrix matrix;
    private final List<RepresentativeSummary> summaries;

    WeightMatrixResult(WeightPolicy policy, WeightMatrix matrix, List<RepresentativeSummary> summaries) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.matrix = Objects.requireNonNull(matrix, "matrix");
        this.summaries = List.copyOf(summaries);
    }

    /**
     * @param repPeriod 1-based representative id.
     */
    public RepresentativeSummary summary(int repPeriod) {
        if (repPeriod < 1 || repPeriod > summaries.size()) {
            throw new IndexOutOfBoundsException(
                    "repPeriod out of bounds: " + repPeriod + " not in [1," + summaries.size() + "]"
            );
        }
        return summaries.get(repPeriod - 1);
    }
}
