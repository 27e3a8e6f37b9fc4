package branchshift.base;

import java.util.Random;

/**
 * Odds and ends shared by the sampler.
 */
public class Utils {

    /** Turns on consistency checks after every generation. */
    public static boolean DEBUG = false;

    private Utils() {
    }

    /**
     * Chooses an index with probability proportional to its weight.
     * @param weights non-negative, not all zero
     */
    public static int weightedChoose(double[] weights, Random rng) {
        double sum = 0.0;
        for (double w : weights)
            sum += w;
        if (!(sum > 0.0))
            throw new IllegalArgumentException("Weights sum to " + sum);

        double r = rng.nextDouble() * sum;
        for (int i = 0; i < weights.length; i++) {
            r -= weights[i];
            if (r < 0.0)
                return i;
        }
        // rounding; return the last index with positive weight
        for (int i = weights.length - 1; i >= 0; i--) {
            if (weights[i] > 0.0)
                return i;
        }
        return weights.length - 1;
    }
}
