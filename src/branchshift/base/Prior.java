package branchshift.base;

import java.util.Random;

/**
 * Prior densities used by the chain. All densities are on the log scale.
 */
public interface Prior {

    /** Log density of the Poisson event rate (expected number of events). */
    double eventRatePrior(double eventRate);

    /** Log density of the parameter carried by a single event. */
    double eventParameterPrior(double value);

    /** Draws an event parameter from its prior. */
    double generateEventParameterFromPrior(Random rng);
}
