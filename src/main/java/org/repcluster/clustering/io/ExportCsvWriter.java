package org.repcluster.clustering.io;

import lombok.extern.slf4j.Slf4j;
import lombok.experimental.UtilityClass;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.repcluster.clustering.export.ExportTables;
import org.repcluster.clustering.export.ProfileRepPeriodRow;
import org.repcluster.clustering.export.RepPeriodDataRow;
import org.repcluster.clustering.export.RepPeriodMappingRow;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes export tables as CSV files, each preceded by a units record and a header record.
 *
 * <p>Units cells without a unit are written as {@code null} so they stay unquoted.</p>
 */
@Slf4j
@UtilityClass
public final class ExportCsvWriter {
    public static final String REP_PERIODS_DATA_FILE = "rep-periods-data.csv";
    public static final String REP_PERIODS_MAPPING_FILE = "rep-periods-mapping.csv";
    public static final String PROFILES_REP_PERIODS_FILE = "profiles-rep-periods.csv";
    public static final String PROFILES_REP_PERIODS_TYPE_PREFIX = "profiles-rep-periods-";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    /**
     * Writes every table into {@code directory}, creating it when missing.
     *
     * @return written files in write order.
     */
    public static List<Path> writeAll(ExportTables tables, Path directory) throws IOException {
        Objects.requireNonNull(tables, "tables");
        Objects.requireNonNull(directory, "directory");
        Files.createDirectories(directory);
        List<Path> written = new ArrayList<>();

        Path data = directory.resolve(REP_PERIODS_DATA_FILE);
        try (Writer writer = Files.newBufferedWriter(data, StandardCharsets.UTF_8)) {
            writeRepPeriodsData(tables.repPeriodsData(), writer);
        }
        written.add(data);

        Path mapping = directory.resolve(REP_PERIODS_MAPPING_FILE);
        try (Writer writer = Files.newBufferedWriter(mapping, StandardCharsets.UTF_8)) {
            writeRepPeriodsMapping(tables.repPeriodsMapping(), writer);
        }
        written.add(mapping);

        Path profiles = directory.resolve(PROFILES_REP_PERIODS_FILE);
        try (Writer writer = Files.newBufferedWriter(profiles, StandardCharsets.UTF_8)) {
            writeProfilesRepPeriods(tables.profilesRepPeriods(), writer, false);
        }
        written.add(profiles);

        for (Map.Entry<String, List<ProfileRepPeriodRow>> entry : tables.profilesRepPeriodsByType().entrySet()) {
            Path perType = directory.resolve(PROFILES_REP_PERIODS_TYPE_PREFIX + entry.getKey() + ".csv");
            try (Writer writer = Files.newBufferedWriter(perType, StandardCharsets.UTF_8)) {
                writeProfilesRepPeriods(entry.getValue(), writer, true);
            }
            written.add(perType);
        }
        log.info("Wrote {} export files to {}", written.size(), directory);
        return written;
    }

    public static void writeRepPeriodsData(List<RepPeriodDataRow> rows, Writer writer) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, FORMAT);
        printer.printRecord(null, null, "h");
        printer.printRecord("rep_period", "num_timesteps", "resolution");
        for (RepPeriodDataRow row : rows) {
            printer.printRecord(row.getRepPeriod(), row.getNumTimesteps(), row.getResolution());
        }
        printer.flush();
    }

    public static void writeRepPeriodsMapping(List<RepPeriodMappingRow> rows, Writer writer) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, FORMAT);
        printer.printRecord(null, null, null);
        printer.printRecord("period", "rep_period", "weight");
        for (RepPeriodMappingRow row : rows) {
            printer.printRecord(row.getPeriod(), row.getRepPeriod(), row.getWeight());
        }
        printer.flush();
    }

    /**
     * @param entityNameOnly write the entity name instead of {@code type-name}, as the
     *                       per-type tables do.
     */
    public static void writeProfilesRepPeriods(
            List<ProfileRepPeriodRow> rows,
            Writer writer,
            boolean entityNameOnly
    ) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, FORMAT);
        printer.printRecord(null, null, null, "p.u.");
        printer.printRecord("profile_name", "rep_period", "timestep", "value");
        for (ProfileRepPeriodRow row : rows) {
            String name = entityNameOnly ? row.getProfile().getEntityName() : row.profileName();
            printer.printRecord(name, row.getRepPeriod(), row.getTimestep(), row.getValue());
        }
        printer.flush();
    }
}
