package org.repcluster.clustering.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.repcluster.clustering.core.ClusteringConfig;
import org.repcluster.clustering.engine.ClusteringEngine;
import org.repcluster.clustering.engine.ClusteringResult;
import org.repcluster.clustering.export.ExportShaper;
import org.repcluster.clustering.export.ExportTables;
import org.repcluster.clustering.period.PeriodSegmenter;
import org.repcluster.clustering.period.PeriodVectorSet;
import org.repcluster.clustering.profile.ProfileTable;
import org.repcluster.clustering.weight.WeightMatrixBuilder;
import org.repcluster.clustering.weight.WeightMatrixResult;

import java.util.Objects;

/**
 * Composes segmenter, engine, weight builder and export shaper in strict order.
 *
 * <p>Each stage is also exposed on its own so callers and tests can drive it with typed
 * inputs. The pipeline holds no run state; everything run-scoped lives in the
 * {@link PipelineRunContext} passed in.</p>
 */
@Slf4j
public final class RepresentativePeriodPipeline {
    private final ClusteringEngine engine;

    public RepresentativePeriodPipeline() {
        this(new ClusteringEngine());
    }

    public RepresentativePeriodPipeline(ClusteringEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Runs all four stages.
     *
     * @param table validated input table.
     * @param context run context.
     * @return outputs of every stage.
     */
    public PipelineResult run(ProfileTable table, PipelineRunContext context) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(context, "context");
        ClusteringConfig config = context.config();
        log.info("Run {}: {} series, horizon {}, period_duration {}, k={}",
                context.runId(), table.seriesCount(), table.horizon(),
                config.getPeriodDuration(), config.getRepresentativePeriods());

        PeriodVectorSet vectors = segment(table, context);
        ClusteringResult clustering = cluster(vectors, context);
        WeightMatrixResult weights = weigh(clustering, vectors, context);
        ExportTables tables = export(clustering, weights, context);

        return PipelineResult.builder()
                .runId(context.runId())
                .periodVectors(vectors)
                .clustering(clustering)
                .weights(weights)
                .exportTables(tables)
                .warnings(context.warnings())
                .build();
    }

    public PeriodVectorSet segment(ProfileTable table, PipelineRunContext context) {
        return PeriodSegmenter.assemble(table, context.config().getPeriodDuration());
    }

    /**
     * Clusters the vectors and records a convergence warning on the context, if any.
     */
    public ClusteringResult cluster(PeriodVectorSet vectors, PipelineRunContext context) {
        ClusteringResult result = engine.cluster(vectors, context.config());
        result.convergenceWarning().ifPresent(context::addWarning);
        return result;
    }

    public WeightMatrixResult weigh(ClusteringResult result, PeriodVectorSet vectors, PipelineRunContext context) {
        return WeightMatrixBuilder.build(result, vectors, context.config());
    }

    public ExportTables export(ClusteringResult result, WeightMatrixResult weights, PipelineRunContext context) {
        return ExportShaper.shape(result, weights, context.config().getParallelism() > 1);
    }
}
