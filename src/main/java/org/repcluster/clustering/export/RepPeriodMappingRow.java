package org.repcluster.clustering.export;

import lombok.Value;

/**
 * One nonzero entry of the weight matrix, exported as a {@code rep_periods_mapping} row.
 */
@Value
public class RepPeriodMappingRow {
    int period;
    int repPeriod;
    double weight;
}
