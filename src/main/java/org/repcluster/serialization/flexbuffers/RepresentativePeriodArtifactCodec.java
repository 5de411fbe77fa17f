package org.repcluster.serialization.flexbuffers;

import com.google.flatbuffers.ArrayReadWriteBuf;
import com.google.flatbuffers.FlexBuffers;
import com.google.flatbuffers.FlexBuffersBuilder;
import lombok.experimental.UtilityClass;
import org.repcluster.clustering.export.ExportTables;
import org.repcluster.clustering.export.ProfileRepPeriodRow;
import org.repcluster.clustering.export.RepPeriodDataRow;
import org.repcluster.clustering.export.RepPeriodMappingRow;
import org.repcluster.clustering.profile.ProfileKey;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Schemaless FlexBuffers codec for {@link RepresentativePeriodArtifact}.
 *
 * <p>Layout: a root map with header fields ({@code file_identifier}, {@code schema_version}),
 * run metadata, and one map per table holding column vectors of equal length. Numeric
 * columns are typed vectors.</p>
 */
@UtilityClass
public final class RepresentativePeriodArtifactCodec {
    private static final String LOADER_NAME = "RepresentativePeriodArtifactCodec";

    private static final String KEY_RUN_ID = "run_id";
    private static final String KEY_PERIOD_DURATION = "period_duration";
    private static final String KEY_NUM_REP_PERIODS = "num_rep_periods";
    private static final String KEY_DISTANCE_METRIC = "distance_metric";
    private static final String KEY_CONVERGED = "converged";

    private static final String TABLE_DATA = "rep_periods_data";
    private static final String TABLE_MAPPING = "rep_periods_mapping";
    private static final String TABLE_PROFILES = "profiles_rep_periods";

    private static final String COL_REP_PERIOD = "rep_period";
    private static final String COL_NUM_TIMESTEPS = "num_timesteps";
    private static final String COL_RESOLUTION = "resolution";
    private static final String COL_PERIOD = "period";
    private static final String COL_WEIGHT = "weight";
    private static final String COL_PROFILE_TYPE = "profile_type";
    private static final String COL_ENTITY_NAME = "entity_name";
    private static final String COL_TIMESTEP = "timestep";
    private static final String COL_VALUE = "value";

    /**
     * Encodes the artifact into a standalone byte array.
     */
    public static byte[] encode(RepresentativePeriodArtifact artifact) {
        Objects.requireNonNull(artifact, "artifact");
        ExportTables tables = Objects.requireNonNull(artifact.getTables(), "tables");
        FlexBuffersBuilder builder = new FlexBuffersBuilder(
                new ArrayReadWriteBuf(4096),
                FlexBuffersBuilder.BUILDER_FLAG_SHARE_KEYS_AND_STRINGS
        );

        int root = builder.startMap();
        builder.putString(ArtifactContractValidator.KEY_FILE_IDENTIFIER, ArtifactContractValidator.FILE_IDENTIFIER);
        builder.putInt(ArtifactContractValidator.KEY_SCHEMA_VERSION, ArtifactContractValidator.SCHEMA_VERSION);
        builder.putString(KEY_RUN_ID, Objects.requireNonNull(artifact.getRunId(), "runId"));
        builder.putInt(KEY_PERIOD_DURATION, artifact.getPeriodDuration());
        builder.putInt(KEY_NUM_REP_PERIODS, artifact.getNumRepresentativePeriods());
        builder.putString(KEY_DISTANCE_METRIC, Objects.requireNonNull(artifact.getDistanceMetric(), "distanceMetric"));
        builder.putBoolean(KEY_CONVERGED, artifact.isConverged());

        List<RepPeriodDataRow> data = tables.repPeriodsData();
        int dataMap = builder.startMap();
        int column = builder.startVector();
        for (RepPeriodDataRow row : data) {
            builder.putInt(row.getRepPeriod());
        }
        builder.endVector(COL_REP_PERIOD, column, true, false);
        column = builder.startVector();
        for (RepPeriodDataRow row : data) {
            builder.putInt(row.getNumTimesteps());
        }
        builder.endVector(COL_NUM_TIMESTEPS, column, true, false);
        column = builder.startVector();
        for (RepPeriodDataRow row : data) {
            builder.putFloat(row.getResolution());
        }
        builder.endVector(COL_RESOLUTION, column, true, false);
        builder.endMap(TABLE_DATA, dataMap);

        List<RepPeriodMappingRow> mapping = tables.repPeriodsMapping();
        int mappingMap = builder.startMap();
        column = builder.startVector();
        for (RepPeriodMappingRow row : mapping) {
            builder.putInt(row.getPeriod());
        }
        builder.endVector(COL_PERIOD, column, true, false);
        column = builder.startVector();
        for (RepPeriodMappingRow row : mapping) {
            builder.putInt(row.getRepPeriod());
        }
        builder.endVector(COL_REP_PERIOD, column, true, false);
        column = builder.startVector();
        for (RepPeriodMappingRow row : mapping) {
            builder.putFloat(row.getWeight());
        }
        builder.endVector(COL_WEIGHT, column, true, false);
        builder.endMap(TABLE_MAPPING, mappingMap);

        List<ProfileRepPeriodRow> profiles = tables.profilesRepPeriods();
        int profilesMap = builder.startMap();
        column = builder.startVector();
        for (ProfileRepPeriodRow row : profiles) {
            builder.putString(row.getProfile().getProfileType());
        }
        builder.endVector(COL_PROFILE_TYPE, column, false, false);
        column = builder.startVector();
        for (ProfileRepPeriodRow row : profiles) {
            builder.putString(row.getProfile().getEntityName());
        }
        builder.endVector(COL_ENTITY_NAME, column, false, false);
        column = builder.startVector();
        for (ProfileRepPeriodRow row : profiles) {
            builder.putInt(row.getRepPeriod());
        }
        builder.endVector(COL_REP_PERIOD, column, true, false);
        column = builder.startVector();
        for (ProfileRepPeriodRow row : profiles) {
            builder.putInt(row.getTimestep());
        }
        builder.endVector(COL_TIMESTEP, column, true, false);
        column = builder.startVector();
        for (ProfileRepPeriodRow row : profiles) {
            builder.putFloat(row.getValue());
        }
        builder.endVector(COL_VALUE, column, true, false);
        builder.endMap(TABLE_PROFILES, profilesMap);

        builder.endMap(null, root);
        ByteBuffer buffer = builder.finish();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    /**
     * Decodes and validates an artifact.
     *
     * @throws IllegalArgumentException when the header contract or a column is invalid.
     */
    public static RepresentativePeriodArtifact decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            throw new IllegalArgumentException(LOADER_NAME + ": artifact is empty");
        }
        FlexBuffers.Map root = ArtifactContractValidator.validateHeader(
                FlexBuffers.getRoot(ByteBuffer.wrap(bytes)),
                LOADER_NAME
        );

        FlexBuffers.Map data = requireTable(root, TABLE_DATA);
        FlexBuffers.Vector dataRep = requireColumn(data, TABLE_DATA, COL_REP_PERIOD, -1);
        FlexBuffers.Vector dataSteps = requireColumn(data, TABLE_DATA, COL_NUM_TIMESTEPS, dataRep.size());
        FlexBuffers.Vector dataResolution = requireColumn(data, TABLE_DATA, COL_RESOLUTION, dataRep.size());
        List<RepPeriodDataRow> dataRows = new ArrayList<>(dataRep.size());
        for (int i = 0; i < dataRep.size(); i++) {
            dataRows.add(new RepPeriodDataRow(
                    dataRep.get(i).asInt(),
                    dataSteps.get(i).asInt(),
                    dataResolution.get(i).asFloat()
            ));
        }

        FlexBuffers.Map mapping = requireTable(root, TABLE_MAPPING);
        FlexBuffers.Vector mapPeriod = requireColumn(mapping, TABLE_MAPPING, COL_PERIOD, -1);
        FlexBuffers.Vector mapRep = requireColumn(mapping, TABLE_MAPPING, COL_REP_PERIOD, mapPeriod.size());
        FlexBuffers.Vector mapWeight = requireColumn(mapping, TABLE_MAPPING, COL_WEIGHT, mapPeriod.size());
        List<RepPeriodMappingRow> mappingRows = new ArrayList<>(mapPeriod.size());
        for (int i = 0; i < mapPeriod.size(); i++) {
            mappingRows.add(new RepPeriodMappingRow(
                    mapPeriod.get(i).asInt(),
                    mapRep.get(i).asInt(),
                    mapWeight.get(i).asFloat()
            ));
        }

        FlexBuffers.Map profiles = requireTable(root, TABLE_PROFILES);
        FlexBuffers.Vector types = requireColumn(profiles, TABLE_PROFILES, COL_PROFILE_TYPE, -1);
        FlexBuffers.Vector names = requireColumn(profiles, TABLE_PROFILES, COL_ENTITY_NAME, types.size());
        FlexBuffers.Vector profRep = requireColumn(profiles, TABLE_PROFILES, COL_REP_PERIOD, types.size());
        FlexBuffers.Vector profStep = requireColumn(profiles, TABLE_PROFILES, COL_TIMESTEP, types.size());
        FlexBuffers.Vector profValue = requireColumn(profiles, TABLE_PROFILES, COL_VALUE, types.size());
        List<ProfileRepPeriodRow> profileRows = new ArrayList<>(types.size());
        ProfileKey previous = null;
        for (int i = 0; i < types.size(); i++) {
            String type = types.get(i).asString();
            String name = names.get(i).asString();
            ProfileKey key = previous != null
                    && previous.getProfileType().equals(type)
                    && previous.getEntityName().equals(name)
                    ? previous
                    : ProfileKey.of(type, name);
            profileRows.add(new ProfileRepPeriodRow(
                    key,
                    profRep.get(i).asInt(),
                    profStep.get(i).asInt(),
                    profValue.get(i).asFloat()
            ));
            previous = key;
        }

        return RepresentativePeriodArtifact.builder()
                .runId(ArtifactContractValidator.require(root, KEY_RUN_ID, LOADER_NAME).asString())
                .periodDuration(ArtifactContractValidator.require(root, KEY_PERIOD_DURATION, LOADER_NAME).asInt())
                .numRepresentativePeriods(
                        ArtifactContractValidator.require(root, KEY_NUM_REP_PERIODS, LOADER_NAME).asInt()
                )
                .distanceMetric(ArtifactContractValidator.require(root, KEY_DISTANCE_METRIC, LOADER_NAME).asString())
                .converged(ArtifactContractValidator.require(root, KEY_CONVERGED, LOADER_NAME).asBoolean())
                .tables(new ExportTables(dataRows, mappingRows, profileRows))
                .build();
    }

    private static FlexBuffers.Map requireTable(FlexBuffers.Map root, String table) {
        FlexBuffers.Reference ref = ArtifactContractValidator.require(root, table, LOADER_NAME);
        if (!ref.isMap()) {
            throw new IllegalArgumentException(LOADER_NAME + ": " + table + " must be a map");
        }
        return ref.asMap();
    }

    /**
     * @param expectedSize required length, or {@code -1} when this column defines it.
     */
    private static FlexBuffers.Vector requireColumn(
            FlexBuffers.Map table,
            String tableName,
            String column,
            int expectedSize
    ) {
        FlexBuffers.Reference ref = table.get(column);
        if (ref.isNull() || !(ref.isVector() || ref.isTypedVector())) {
            throw new IllegalArgumentException(LOADER_NAME + ": " + tableName + "." + column + " missing");
        }
        FlexBuffers.Vector vector = ref.asVector();
        if (expectedSize >= 0 && vector.size() != expectedSize) {
            throw new IllegalArgumentException(
                    LOADER_NAME + ": " + tableName + "." + column + " has " + vector.size()
                            + " entries, expected " + expectedSize
            );
        }
        return vector;
    }
}
