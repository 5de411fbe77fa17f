package org.repcluster.clustering.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when clustering parameters are invalid (k out of range, non-divisible horizon,
 * non-positive period duration, unknown distance metric).
 *
 * <p>Always fatal to the current run. Messages are prefixed with the deterministic
 * reason code.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ClusteringConfigurationException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded configuration failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public ClusteringConfigurationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded configuration failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public ClusteringConfigurationException(String reasonCode, String message, Throwable cause) {
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
