package org.repcluster.clustering.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Internal-consistency failure inside the engine, e.g. a weight-matrix row that does not
 * sum to one. Indicates a defect; callers must not treat it as recoverable.
 */
@Getter
@Accessors(fluent = true)
public final class ClusteringInvariantException extends IllegalStateException {
    private final String reasonCode;

    /**
     * Creates a reason-coded invariant violation.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public ClusteringInvariantException(String reasonCode, String message) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] "
                + Objects.requireNonNull(message, "message"));
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        this.reasonCode = reasonCode;
    }
}
