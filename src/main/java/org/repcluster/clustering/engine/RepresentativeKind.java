package org.repcluster.clustering.engine;

/**
 * How a cluster's representative profile is derived from its members.
 *
 * <p>{@code MEDOID} picks the member period with the smallest summed distance to the
 * other members, so every representative is a real period.</p>
 * <p>{@code CENTROID} uses the elementwise mean of the member periods.</p>
 */
public enum RepresentativeKind {
    MEDOID,
    CENTROID
}
