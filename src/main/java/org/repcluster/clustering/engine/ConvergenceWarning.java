package org.repcluster.clustering.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Non-fatal notice that the assignment did not stabilize within the iteration bound.
 *
 * <p>The run still completes with the lowest-cost assignment it saw; callers may retry
 * with a higher bound, another seed or another {@code k}.</p>
 */
@Value
@Builder
public class ConvergenceWarning {
    /** Iteration bound that was exhausted. */
    int maxIterations;
    /** Iteration whose assignment was returned. */
    int bestIteration;
    /** Summed period-to-center distance of the returned assignment at that iteration. */
    double bestCost;
    /** Periods whose assignment still changed in the last iteration. */
    int unstablePeriods;

    /**
     * @return human-readable summary for logs and CLI output.
     */
    public String message() {
        return "clustering did not converge within " + maxIterations + " iterations ("
                + unstablePeriods + " periods still moving); returned assignment from iteration "
                + bestIteration + " with cost " + bestCost;
    }
}
