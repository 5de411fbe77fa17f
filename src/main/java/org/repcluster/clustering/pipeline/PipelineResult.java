package org.repcluster.clustering.pipeline;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.repcluster.clustering.engine.ClusteringResult;
import org.repcluster.clustering.engine.ConvergenceWarning;
import org.repcluster.clustering.export.ExportTables;
import org.repcluster.clustering.period.PeriodVectorSet;
import org.repcluster.clustering.weight.WeightMatrixResult;

import java.util.List;

/**
 * Typed outputs of every stage of one pipeline run.
 */
@Value
@Builder
public class PipelineResult {
    String runId;
    PeriodVectorSet periodVectors;
    ClusteringResult clustering;
    WeightMatrixResult weights;
    ExportTables exportTables;
    @Singular
    List<ConvergenceWarning> warnings;
}
