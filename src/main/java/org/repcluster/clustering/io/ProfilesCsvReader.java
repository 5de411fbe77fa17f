package org.repcluster.clustering.io;

import lombok.extern.slf4j.Slf4j;
import lombok.experimental.UtilityClass;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.repcluster.clustering.core.ClusteringDataException;
import org.repcluster.clustering.profile.ProfileTable;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads the {@code profiles(asset, time_step, value)} table from CSV.
 *
 * <p>The header must be the first or second record; a leading units record such as
 * {@code ,,p.u.} is skipped. Column order follows the header.</p>
 */
@Slf4j
@UtilityClass
public final class ProfilesCsvReader {
    public static final String REASON_HEADER_MISSING = "C1_CSV_HEADER_MISSING";
    public static final String REASON_MALFORMED_ROW = "C1_CSV_MALFORMED_ROW";

    public static final String COLUMN_ASSET = "asset";
    public static final String COLUMN_TIME_STEP = "time_step";
    public static final String COLUMN_VALUE = "value";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();

    /**
     * Reads a UTF-8 profiles file.
     */
    public static ProfileTable read(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ProfileTable table = read(reader);
            log.info("Read {} series with horizon {} from {}", table.seriesCount(), table.horizon(), path);
            return table;
        }
    }

    /**
     * Reads profiles CSV content. The reader is not closed.
     *
     * @throws ClusteringDataException on a missing header, malformed row or table contract violation.
     */
    public static ProfileTable read(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "reader");
        CSVParser parser = FORMAT.parse(reader);
        Iterator<CSVRecord> records = parser.iterator();
        int[] columns = locateHeader(records);

        int minFields = Math.max(columns[0], Math.max(columns[1], columns[2])) + 1;

        ProfileTable.Builder builder = ProfileTable.builder();
        while (records.hasNext()) {
            CSVRecord record = records.next();
            long line = parser.getCurrentLineNumber();
            if (record.size() < minFields) {
                throw new ClusteringDataException(
                        REASON_MALFORMED_ROW,
                        "line " + line + ": expected at least " + minFields + " fields, got " + record.size()
                );
            }
            String asset = record.get(columns[0]);
            String rawStep = record.get(columns[1]);
            String rawValue = record.get(columns[2]);
            int timeStep;
            double value;
            try {
                timeStep = Integer.parseInt(rawStep);
                value = Double.parseDouble(rawValue);
            } catch (NumberFormatException ex) {
                throw new ClusteringDataException(
                        REASON_MALFORMED_ROW,
                        "line " + line + ": cannot parse time_step '" + rawStep + "' or value '" + rawValue + "'",
                        ex
                );
            }
            builder.add(asset, timeStep, value);
        }
        return builder.build();
    }

    /**
     * Consumes records up to and including the header and returns the asset, time_step and
     * value column indexes.
     */
    private static int[] locateHeader(Iterator<CSVRecord> records) {
        for (int attempt = 0; attempt < 2 && records.hasNext(); attempt++) {
            CSVRecord record = records.next();
            int[] columns = {-1, -1, -1};
            for (int i = 0; i < record.size(); i++) {
                switch (record.get(i).toLowerCase(Locale.ROOT)) {
                    case COLUMN_ASSET -> columns[0] = i;
                    case COLUMN_TIME_STEP -> columns[1] = i;
                    case COLUMN_VALUE -> columns[2] = i;
                    default -> {
                    }
                }
            }
            if (columns[0] >= 0 && columns[1] >= 0 && columns[2] >= 0) {
                return columns;
            }
        }
        throw new ClusteringDataException(
                REASON_HEADER_MISSING,
                "profiles CSV must have an asset,time_step,value header in its first two records"
        );
    }
}
