package org.repcluster.clustering.weight;

import lombok.Builder;
import lombok.Value;

/**
 * Per-representative metadata reported alongside the weight matrix.
 */
@Value
@Builder
public class RepresentativeSummary {
    int repPeriod;
    /** Periods hard-assigned to this representative. */
    int assignedPeriods;
    /** Column sum of the weight matrix. */
    double totalWeight;
    int numTimesteps;
    double resolution;
}
