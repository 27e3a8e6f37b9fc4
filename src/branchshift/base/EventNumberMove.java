package branchshift.base;

/**
 * Reversible-jump birth/death of events. Births and deaths are proposed with
 * equal probability; a birth puts an event with prior-drawn parameters at a
 * uniform position, a death removes a uniformly chosen event. With a Poisson
 * prior of mean eventRate on the number of events, the parameter and position
 * densities cancel and only the count ratio remains.
 */
public class EventNumberMove<E extends BranchEvent> extends MCMCMove<E, EventNumberMove.NumberResult<E>> {

    public EventNumberMove(Model<E> model) {
        super(model);
    }

    @Override
    protected NumberResult<E> jump() {
        int k = model.getNumberOfEvents();
        double eventRate = model.getEventRate();

        if (model.getRandom().nextDouble() < 0.5) {
            E born = model.addEventToTree();
            return new NumberResult<E>(Math.log(eventRate) - Math.log(k + 1), born, true);
        }

        if (k == 0)
            return null;
        E died = model.deleteRandomEventFromTree();
        return new NumberResult<E>(Math.log(k) - Math.log(eventRate), died, false);
    }

    @Override
    protected void restore(NumberResult<E> result) {
        if (result.birth) {
            model.deleteEventFromTree(result.event);
        } else {
            model.restoreLastDeletedEvent();
        }
    }

    @Override
    public String getName() {
        return "Event number";
    }

    static class NumberResult<E> extends MCMCResult {
        final E event;
        final boolean birth;

        NumberResult(double bpp, E event, boolean birth) {
            super(bpp);
            this.event = event;
            this.birth = birth;
        }
    }
}
