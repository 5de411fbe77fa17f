package org.repcluster.clustering.export;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The three long-format tables handed to the downstream model, already sorted.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class ExportTables {
    private final List<RepPeriodDataRow> repPeriodsData;
    private final List<RepPeriodMappingRow> repPeriodsMapping;
    private final List<ProfileRepPeriodRow> profilesRepPeriods;

    /**
     * Wraps already-sorted rows; lists are copied.
     */
    public ExportTables(
            List<RepPeriodDataRow> repPeriodsData,
            List<RepPeriodMappingRow> repPeriodsMapping,
            List<ProfileRepPeriodRow> profilesRepPeriods
    ) {
        this.repPeriodsData = List.copyOf(repPeriodsData);
        this.repPeriodsMapping = List.copyOf(repPeriodsMapping);
        this.profilesRepPeriods = List.copyOf(profilesRepPeriods);
    }

    /**
     * Splits {@link #profilesRepPeriods()} by profile type, keeping row order.
     *
     * @return profile type to its rows, types ascending.
     */
    public SortedMap<String, List<ProfileRepPeriodRow>> profilesRepPeriodsByType() {
        TreeMap<String, List<ProfileRepPeriodRow>> byType = new TreeMap<>();
        for (ProfileRepPeriodRow row : profilesRepPeriods) {
            byType.computeIfAbsent(row.getProfile().getProfileType(), ignored -> new ArrayList<>()).add(row);
        }
        for (Map.Entry<String, List<ProfileRepPeriodRow>> entry : byType.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
        }
        return Collections.unmodifiableSortedMap(byType);
    }
}
