package org.repcluster.serialization.flexbuffers;

import com.google.flatbuffers.FlexBuffers;
import lombok.experimental.UtilityClass;

/**
 * Shared validator for the artifact header contract.
 */
@UtilityClass
public final class ArtifactContractValidator {
    public static final String FILE_IDENTIFIER = "RPCL";
    public static final long SCHEMA_VERSION = 1L;

    static final String KEY_FILE_IDENTIFIER = "file_identifier";
    static final String KEY_SCHEMA_VERSION = "schema_version";

    /**
     * Validates identifier and schema version of a decoded root.
     *
     * @param root FlexBuffers root reference.
     * @param loaderName logical loader name for error messages.
     * @return root map.
     */
    public static FlexBuffers.Map validateHeader(FlexBuffers.Reference root, String loaderName) {
        if (root == null || !root.isMap()) {
            throw new IllegalArgumentException(loaderName + ": artifact root must be a map");
        }
        FlexBuffers.Map map = root.asMap();

        FlexBuffers.Reference identifier = map.get(KEY_FILE_IDENTIFIER);
        if (identifier.isNull() || !FILE_IDENTIFIER.equals(identifier.asString())) {
            throw new IllegalArgumentException(
                    loaderName + ": file_identifier missing or not " + FILE_IDENTIFIER
            );
        }

        FlexBuffers.Reference version = map.get(KEY_SCHEMA_VERSION);
        if (version.isNull()) {
            throw new IllegalArgumentException(loaderName + ": schema_version missing");
        }
        long schemaVersion = version.asLong();
        if (schemaVersion != SCHEMA_VERSION) {
            throw new IllegalArgumentException(
                    loaderName + ": unsupported schema_version " + schemaVersion
                            + " (expected " + SCHEMA_VERSION + ")"
            );
        }
        return map;
    }

    /**
     * Returns a required field of the root map.
     */
    public static FlexBuffers.Reference require(FlexBuffers.Map map, String key, String loaderName) {
        FlexBuffers.Reference value = map.get(key);
        if (value.isNull()) {
            throw new IllegalArgumentException(loaderName + ": " + key + " missing");
        }
        return value;
    }
}
