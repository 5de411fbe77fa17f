package org.repcluster.clustering.engine;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.repcluster.clustering.profile.ProfileKey;
import org.repcluster.core.id.IDMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable output of one clustering run: {@code k} representative periods and the hard
 * assignment of every original period.
 *
 * <p>Representative ids run {@code 1..k} in ascending order of the lowest period index
 * each cluster contains, so representative {@code 1} always contains period {@code 1}.</p>
 */
public final class ClusteringResult {
    static final int NO_MEDOID = 0;

    private final List<ProfileKey> seriesKeys;
    private final IDMapper seriesIds;
    private final int periodDuration;
    private final int[] assignment;
    private final double[][] representatives;
    private final int[] medoidPeriods;
    private final int[][] members;
    private final RepresentativeKind representativeKind;
    private final String distanceMetricId;
    private final int iterations;
    private final boolean converged;
    private final double totalCost;
    private final ConvergenceWarning convergenceWarning;

    ClusteringResult(
            List<ProfileKey> seriesKeys,
            int periodDuration,
            int[] assignment,
            double[][] representatives,
            int[] medoidPeriods,
            RepresentativeKind representativeKind,
            String distanceMetricId,
            int iterations,
            boolean converged,
            double totalCost,
            ConvergenceWarning convergenceWarning
    ) {
        this.seriesKeys = List.copyOf(seriesKeys);
        List<String> names = new ArrayList<>(seriesKeys.size());
        for (ProfileKey key : this.seriesKeys) {
            names.add(key.externalName());
        }
        this.seriesIds = IDMapper.fromOrderedNames(names);
        this.periodDuration = periodDuration;
        this.assignment = assignment.clone();
        this.representatives = new double[representatives.length][];
        for (int r = 0; r < representatives.length; r++) {
            this.representatives[r] = representatives[r].clone();
        }
        this.medoidPeriods = medoidPeriods.clone();
        this.representativeKind = Objects.requireNonNull(representativeKind, "representativeKind");
        this.distanceMetricId = Objects.requireNonNull(distanceMetricId, "distanceMetricId");
        this.iterations = iterations;
        this.converged = converged;
        this.totalCost = totalCost;
        this.convergenceWarning = convergenceWarning;
        this.members = groupMembers(this.assignment, representatives.length);
    }

    private static int[][] groupMembers(int[] assignment, int k) {
        IntArrayList[] lists = new IntArrayList[k];
        for (int r = 0; r < k; r++) {
            lists[r] = new IntArrayList();
        }
        for (int p = 0; p < assignment.length; p++) {
            int rep = assignment[p];
            if (rep < 1 || rep > k) {
                throw new IllegalArgumentException("period " + (p + 1) + " assigned to unknown representative " + rep);
            }
            lists[rep - 1].add(p + 1);
        }
        int[][] grouped = new int[k][];
        for (int r = 0; r < k; r++) {
            if (lists[r].isEmpty()) {
                throw new IllegalArgumentException("representative " + (r + 1) + " has no assigned periods");
            }
            grouped[r] = lists[r].toIntArray();
        }
        return grouped;
    }

    public List<ProfileKey> seriesKeys() {
        return seriesKeys;
    }

    public int periodDuration() {
        return periodDuration;
    }

    public int numPeriods() {
        return assignment.length;
    }

    /**
     * @return chosen {@code k}.
     */
    public int numRepresentativePeriods() {
        return representatives.length;
    }

    public RepresentativeKind representativeKind() {
        return representativeKind;
    }

    public String distanceMetricId() {
        return distanceMetricId;
    }

    /**
     * @return assignment/update iterations executed; {@code 0} for the identity shortcut.
     */
    public int iterations() {
        return iterations;
    }

    public boolean converged() {
        return converged;
    }

    /**
     * @return summed distance of every period to its representative.
     */
    public double totalCost() {
        return totalCost;
    }

    public Optional<ConvergenceWarning> convergenceWarning() {
        return Optional.ofNullable(convergenceWarning);
    }

    /**
     * @param periodIndex 1-based original period.
     * @return representative id in {@code 1..k}.
     */
    public int repPeriodOf(int periodIndex) {
        if (periodIndex < 1 || periodIndex > assignment.length) {
            throw new IndexOutOfBoundsException(
                    "periodIndex out of bounds: " + periodIndex + " not in [1," + assignment.length + "]"
            );
        }
        return assignment[periodIndex - 1];
    }

    /**
     * @return copy of the assignment, entry {@code p - 1} = representative of period {@code p}.
     */
    public int[] assignmentCopy() {
        return assignment.clone();
    }

    /**
     * @return ascending 1-based periods assigned to the representative.
     */
    public int[] membersOf(int repPeriod) {
        return members[checkRep(repPeriod) - 1].clone();
    }

    /**
     * @return medoid period of the representative; empty for centroid representatives.
     */
    public OptionalInt medoidPeriod(int repPeriod) {
        int medoid = medoidPeriods[checkRep(repPeriod) - 1];
        return medoid == NO_MEDOID ? OptionalInt.empty() : OptionalInt.of(medoid);
    }

    /**
     * @return copy of the full representative vector (all series, table order).
     */
    public double[] representativeCopy(int repPeriod) {
        return representatives[checkRep(repPeriod) - 1].clone();
    }

    /**
     * @param repPeriod representative id.
     * @param key series key.
     * @return the series' {@code periodDuration} values in the representative.
     */
    public double[] representativeProfile(int repPeriod, ProfileKey key) {
        int offset = seriesIds.toInternal(Objects.requireNonNull(key, "key").externalName()) * periodDuration;
        double[] row = representatives[checkRep(repPeriod) - 1];
        return Arrays.copyOfRange(row, offset, offset + periodDuration);
    }

    private int checkRep(int repPeriod) {
        if (repPeriod < 1 || repPeriod > representatives.length) {
            throw new IndexOutOfBoundsException(
                    "repPeriod out of bounds: " + repPeriod + " not in [1," + representatives.length + "]"
            );
        }
        return repPeriod;
    }
}
