package org.repcluster.serialization.flexbuffers;

import lombok.Builder;
import lombok.Value;
import org.repcluster.clustering.export.ExportTables;

/**
 * Export tables plus the run metadata persisted next to them.
 */
@Value
@Builder
public class RepresentativePeriodArtifact {
    String runId;
    int periodDuration;
    int numRepresentativePeriods;
    String distanceMetric;
    boolean converged;
    ExportTables tables;
}
