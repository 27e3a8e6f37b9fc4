package branchshift.base;

/**
 * Multiplicative update of the Poisson event rate,
 * {@code r' = r * exp(scale * (u - 0.5))}.
 */
public class EventRateMove<E extends BranchEvent> extends MCMCMove<E, EventRateMove.RateResult> {

    public EventRateMove(Model<E> model) {
        super(model);
    }

    @Override
    protected RateResult jump() {
        double oldRate = model.getEventRate();
        double u = model.getRandom().nextDouble();
        double newRate = oldRate * Math.exp(model.getUpdateEventRateScale() * (u - 0.5));

        int k = model.getNumberOfEvents();
        Prior prior = model.getPrior();
        double logRatio = Math.log(newRate / oldRate);

        double bpp = prior.eventRatePrior(newRate) - prior.eventRatePrior(oldRate);
        // Poisson probability of the current number of events
        bpp += k * logRatio - (newRate - oldRate);
        // Hastings ratio of the multiplier
        bpp += logRatio;

        model.setEventRate(newRate);
        return new RateResult(bpp, oldRate);
    }

    @Override
    protected void restore(RateResult result) {
        model.setEventRate(result.oldRate);
    }

    @Override
    public String getName() {
        return "Event rate";
    }

    static class RateResult extends MCMCResult {
        final double oldRate;

        RateResult(double bpp, double oldRate) {
            super(bpp);
            this.oldRate = oldRate;
        }
    }
}
