package org.repcluster.clustering.export;

import lombok.extern.slf4j.Slf4j;
import lombok.experimental.UtilityClass;
import org.repcluster.clustering.engine.ClusteringResult;
import org.repcluster.clustering.profile.ProfileKey;
import org.repcluster.clustering.weight.RepresentativeSummary;
import org.repcluster.clustering.weight.WeightMatrix;
import org.repcluster.clustering.weight.WeightMatrixResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reshapes a clustering result and its weights into the export tables.
 *
 * <p>Pure: the inputs are immutable and every table is fully sorted before it is
 * returned, so shaping twice (sequentially or in parallel) gives equal tables.</p>
 */
@Slf4j
@UtilityClass
public final class ExportShaper {
    static final Comparator<RepPeriodMappingRow> MAPPING_ORDER = Comparator
            .comparingInt(RepPeriodMappingRow::getPeriod)
            .thenComparingInt(RepPeriodMappingRow::getRepPeriod);

    static final Comparator<ProfileRepPeriodRow> PROFILE_ORDER = Comparator
            .comparing(ProfileRepPeriodRow::getProfile)
            .thenComparingInt(ProfileRepPeriodRow::getRepPeriod)
            .thenComparingInt(ProfileRepPeriodRow::getTimestep);

    /**
     * Shapes on the calling thread.
     */
    public static ExportTables shape(ClusteringResult result, WeightMatrixResult weights) {
        return shape(result, weights, false);
    }

    /**
     * @param result clustering result.
     * @param weights weight matrix derived from {@code result}.
     * @param parallelProfiles reshape profiles on a parallel stream.
     * @return sorted export tables.
     */
    public static ExportTables shape(ClusteringResult result, WeightMatrixResult weights, boolean parallelProfiles) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(weights, "weights");
        WeightMatrix matrix = weights.matrix();
        if (matrix.numPeriods() != result.numPeriods()
                || matrix.numRepresentativePeriods() != result.numRepresentativePeriods()) {
            throw new IllegalArgumentException(
                    "weight matrix " + matrix.numPeriods() + "x" + matrix.numRepresentativePeriods()
                            + " does not match clustering result " + result.numPeriods()
                            + "x" + result.numRepresentativePeriods()
            );
        }

        List<RepPeriodDataRow> data = new ArrayList<>(weights.summaries().size());
        for (RepresentativeSummary summary : weights.summaries()) {
            data.add(new RepPeriodDataRow(summary.getRepPeriod(), summary.getNumTimesteps(), summary.getResolution()));
        }

        List<RepPeriodMappingRow> mapping = new ArrayList<>();
        for (int p = 1; p <= matrix.numPeriods(); p++) {
            for (int r = 1; r <= matrix.numRepresentativePeriods(); r++) {
                double weight = matrix.get(p, r);
                if (weight != 0.0d) {
                    mapping.add(new RepPeriodMappingRow(p, r, weight));
                }
            }
        }
        mapping.sort(MAPPING_ORDER);

        Stream<ProfileKey> keys = parallelProfiles
                ? result.seriesKeys().parallelStream()
                : result.seriesKeys().stream();
        List<ProfileRepPeriodRow> profiles = keys
                .flatMap(key -> reshapeProfile(result, key).stream())
                .sorted(PROFILE_ORDER)
                .collect(Collectors.toList());

        log.info("Shaped {} data rows, {} mapping rows, {} profile rows",
                data.size(), mapping.size(), profiles.size());
        return new ExportTables(data, mapping, profiles);
    }

    private static List<ProfileRepPeriodRow> reshapeProfile(ClusteringResult result, ProfileKey key) {
        int k = result.numRepresentativePeriods();
        int d = result.periodDuration();
        List<ProfileRepPeriodRow> rows = new ArrayList<>(k * d);
        for (int r = 1; r <= k; r++) {
            double[] values = result.representativeProfile(r, key);
            for (int t = 1; t <= d; t++) {
                rows.add(new ProfileRepPeriodRow(key, r, t, values[t - 1]));
            }
        }
        return rows;
    }
}
