package org.repcluster.clustering.pipeline;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.repcluster.clustering.core.ClusteringConfig;
import org.repcluster.clustering.engine.ConvergenceWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * State owned by a single pipeline run: its id, its validated config and the warnings
 * raised by its stages. Created by the caller and passed into every stage.
 */
@Getter
@Accessors(fluent = true)
public final class PipelineRunContext {
    private final String runId;
    private final ClusteringConfig config;
    @Getter(AccessLevel.NONE)
    private final List<ConvergenceWarning> warnings = new ArrayList<>();

    /**
     * @param runId caller-chosen run identifier.
     * @param config run parameters; validated here.
     */
    public PipelineRunContext(String runId, ClusteringConfig config) {
        Objects.requireNonNull(runId, "runId");
        if (runId.isBlank()) {
            throw new IllegalArgumentException("runId must be non-blank");
        }
        this.runId = runId;
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    /**
     * Creates a context with a random run id.
     */
    public static PipelineRunContext create(ClusteringConfig config) {
        return new PipelineRunContext(UUID.randomUUID().toString(), config);
    }

    void addWarning(ConvergenceWarning warning) {
        warnings.add(Objects.requireNonNull(warning, "warning"));
    }

    /**
     * @return warnings collected so far, in the order they were raised.
     */
    public List<ConvergenceWarning> warnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }
}
