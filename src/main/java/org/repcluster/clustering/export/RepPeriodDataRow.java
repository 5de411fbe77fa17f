package org.repcluster.clustering.export;

import lombok.Value;

/**
 * One row of {@code rep_periods_data}.
 */
@Value
public class RepPeriodDataRow {
    int repPeriod;
    int numTimesteps;
    double resolution;
}
