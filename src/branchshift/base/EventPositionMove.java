package branchshift.base;

/**
 * Moves a random event, locally or anywhere on the tree. Both kinds of move
 * are symmetric, so the proposal ratio is 1.
 */
public class EventPositionMove<E extends BranchEvent> extends MCMCMove<E, MCMCResult> {

    private final double localProbability;

    public EventPositionMove(Model<E> model) {
        super(model);
        double ratio = model.getLocalGlobalMoveRatio();
        localProbability = ratio / (1.0 + ratio);
    }

    @Override
    protected MCMCResult jump() {
        E moved;
        if (model.getRandom().nextDouble() < localProbability) {
            moved = model.eventLocalMove();
        } else {
            moved = model.eventGlobalMove();
        }
        return moved == null ? null : new MCMCResult(0.0);
    }

    @Override
    protected void accept(MCMCResult result) {
        model.acceptLastMove();
    }

    @Override
    protected void restore(MCMCResult result) {
        model.revertMovedEventToPrevious();
    }

    @Override
    public String getName() {
        return "Event position";
    }
}
