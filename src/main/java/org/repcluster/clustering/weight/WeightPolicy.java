package org.repcluster.clustering.weight;

/**
 * Policy for turning a cluster assignment into weight-matrix rows.
 *
 * <p>{@code HARD} puts weight 1 on the assigned representative and 0 elsewhere.</p>
 * <p>{@code CONVEX} fits every row as a convex combination of all representatives.</p>
 */
public enum WeightPolicy {
    HARD,
    CONVEX
}
