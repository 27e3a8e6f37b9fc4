package branchshift.base;

import java.util.Random;

import org.apache.commons.math3.distribution.ExponentialDistribution;

/**
 * Exponential priors on the event rate and on the event parameters, both
 * given by their rate (the inverse of the mean).
 */
public class ExponentialPrior implements Prior {

    private final ExponentialDistribution eventRateDistribution;
    private final ExponentialDistribution parameterDistribution;

    public ExponentialPrior(double poissonRatePrior, double eventParameterPrior) {
        // commons-math parameterises by the mean
        eventRateDistribution = new ExponentialDistribution(1.0 / poissonRatePrior);
        parameterDistribution = new ExponentialDistribution(1.0 / eventParameterPrior);
    }

    public ExponentialPrior(Settings settings) {
        this(settings.poissonRatePrior, settings.eventRateParameterPrior);
    }

    @Override
    public double eventRatePrior(double eventRate) {
        return eventRateDistribution.logDensity(eventRate);
    }

    @Override
    public double eventParameterPrior(double value) {
        return parameterDistribution.logDensity(value);
    }

    @Override
    public double generateEventParameterFromPrior(Random rng) {
        // inversion keeps all draws on the chain's own generator
        return parameterDistribution.inverseCumulativeProbability(rng.nextDouble());
    }
}
