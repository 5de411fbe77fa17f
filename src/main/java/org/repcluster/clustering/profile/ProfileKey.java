package org.repcluster.clustering.profile;

import lombok.Value;
import org.repcluster.clustering.core.ClusteringDataException;

/**
 * Structured profile identifier: a profile type (e.g. {@code availability}) and the entity
 * it belongs to (e.g. {@code Asgard_Solar}).
 *
 * <p>The hyphenated external form {@code type-name} only exists at table boundaries;
 * it is parsed once at ingestion and rebuilt by {@link #externalName()} on export.
 * The type never contains the separator, so the first separator splits the pair.</p>
 */
@Value
public class ProfileKey implements Comparable<ProfileKey> {
    public static final char SEPARATOR = '-';

    public static final String REASON_PROFILE_NAME_REQUIRED = "C1_PROFILE_NAME_REQUIRED";
    public static final String REASON_PROFILE_SEPARATOR_MISSING = "C1_PROFILE_SEPARATOR_MISSING";
    public static final String REASON_PROFILE_PART_BLANK = "C1_PROFILE_PART_BLANK";
    public static final String REASON_PROFILE_TYPE_CONTAINS_SEPARATOR = "C1_PROFILE_TYPE_CONTAINS_SEPARATOR";

    String profileType;
    String entityName;

    private ProfileKey(String profileType, String entityName) {
        this.profileType = profileType;
        this.entityName = entityName;
    }

    /**
     * Creates a key from its two parts.
     *
     * @throws ClusteringDataException when a part is blank or the type contains the separator.
     */
    public static ProfileKey of(String profileType, String entityName) {
        if (profileType == null || profileType.isBlank() || entityName == null || entityName.isBlank()) {
            throw new ClusteringDataException(
                    REASON_PROFILE_PART_BLANK,
                    "profile type and entity name must be non-blank: type=" + profileType + ", name=" + entityName
            );
        }
        if (profileType.indexOf(SEPARATOR) >= 0) {
            throw new ClusteringDataException(
                    REASON_PROFILE_TYPE_CONTAINS_SEPARATOR,
                    "profile type must not contain '" + SEPARATOR + "': " + profileType
            );
        }
        return new ProfileKey(profileType, entityName);
    }

    /**
     * Parses the external {@code type-name} convention.
     *
     * @param externalName boundary name such as {@code demand-Midgard_E_demand}.
     * @return structured key.
     * @throws ClusteringDataException when the name is missing, has no separator, or has a blank part.
     */
    public static ProfileKey parse(String externalName) {
        if (externalName == null || externalName.isBlank()) {
            throw new ClusteringDataException(REASON_PROFILE_NAME_REQUIRED, "profile name must be non-blank");
        }
        String trimmed = externalName.trim();
        int split = trimmed.indexOf(SEPARATOR);
        if (split < 0) {
            throw new ClusteringDataException(
                    REASON_PROFILE_SEPARATOR_MISSING,
                    "profile name '" + trimmed + "' does not follow the <profile_type>"
                            + SEPARATOR + "<entity_name> convention"
            );
        }
        String type = trimmed.substring(0, split);
        String name = trimmed.substring(split + 1);
        if (type.isBlank() || name.isBlank()) {
            throw new ClusteringDataException(
                    REASON_PROFILE_PART_BLANK,
                    "profile name '" + trimmed + "' has a blank type or entity part"
            );
        }
        return new ProfileKey(type, name);
    }

    /**
     * @return hyphenated boundary form {@code type-name}.
     */
    public String externalName() {
        return profileType + SEPARATOR + entityName;
    }

    /**
     * Orders keys by their external name so exported rows sort by {@code profile_name}.
     */
    @Override
    public int compareTo(ProfileKey other) {
        return externalName().compareTo(other.externalName());
    }

    @Override
    public String toString() {
        return externalName();
    }
}
