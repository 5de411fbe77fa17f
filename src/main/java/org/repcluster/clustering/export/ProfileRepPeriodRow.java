package org.repcluster.clustering.export;

import lombok.Value;
import org.repcluster.clustering.profile.ProfileKey;

/**
 * One value of a representative profile, exported as a {@code profiles_rep_periods} row.
 */
@Value
public class ProfileRepPeriodRow {
    ProfileKey profile;
    int repPeriod;
    int timestep;
    double value;

    /**
     * @return boundary name {@code type-name}.
     */
    public String profileName() {
        return profile.externalName();
    }
}
