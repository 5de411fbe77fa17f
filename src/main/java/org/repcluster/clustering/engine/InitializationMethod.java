package org.repcluster.clustering.engine;

/**
 * Seeded strategies for choosing the initial cluster centers.
 *
 * <p>{@code K_MEANS_PLUS_PLUS} samples each next center proportionally to its squared
 * distance from the centers chosen so far.</p>
 * <p>{@code RANDOM} takes the first {@code k} periods of a seeded Fisher-Yates shuffle.</p>
 */
public enum InitializationMethod {
    K_MEANS_PLUS_PLUS,
    RANDOM
}
