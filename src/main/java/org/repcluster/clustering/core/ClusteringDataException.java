package org.repcluster.clustering.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when input data is malformed: non-finite values, gaps or duplicates in a series,
 * or a profile name that does not follow the {@code type-name} convention.
 *
 * <p>The message always names the offending series, period or profile.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ClusteringDataException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded data failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message naming the offending input.
     */
    public ClusteringDataException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded data failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message naming the offending input.
     * @param cause underlying exception.
     */
    public ClusteringDataException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
