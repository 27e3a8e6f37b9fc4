package branchshift.base;

/**
 * A Metropolis-Hastings proposal on a model. {@link #jump()} changes the
 * state and reports the log proposal ratio; if the proposal is rejected,
 * {@link #restore(MCMCResult)} must bring back the exact previous state.
 *
 * @param <E> event type of the model
 * @param <R> result type handed from jump to restore
 */
public abstract class MCMCMove<E extends BranchEvent, R extends MCMCResult> {
    protected final Model<E> model;

    private int sampled;
    private int accepted;

    public MCMCMove(Model<E> model) {
        this.model = model;
    }

    /**
     * Proposes, then accepts or rejects.
     * @return true if the proposal was accepted
     */
    public boolean sample() {
        double oldLogLikelihood = model.computeLogLikelihood();

        R result = jump();
        if (result == null)
            return false;   // nothing to propose in this state

        double newLogLikelihood = model.computeLogLikelihood();

        sampled++;
        boolean isAccepted = Math.log(model.getRandom().nextDouble())
                < result.bpp + (newLogLikelihood - oldLogLikelihood) * model.getColdness();

        if (isAccepted) {
            accept(result);
            accepted++;
            model.incrementAcceptCount();
        } else {
            restore(result);
            model.incrementRejectCount();
        }

        return isAccepted;
    }

    /** @return the proposal, or null if none is possible */
    protected abstract R jump();

    protected void accept(R result) {
    }

    protected abstract void restore(R result);

    public abstract String getName();

    public int getSampled() {
        return sampled;
    }

    public int getAccepted() {
        return accepted;
    }

    public double getAcceptanceRate() {
        return sampled == 0 ? 0.0 : (double) accepted / sampled;
    }
}
