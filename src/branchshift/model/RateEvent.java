package branchshift.model;

import branchshift.base.BranchEvent;
import branchshift.base.Tree;

/**
 * An event carrying a single positive rate, in force from the event's
 * position tip-ward until the next event.
 */
public class RateEvent extends BranchEvent {

    private double rate;

    /** The root event. */
    RateEvent(Tree tree, long serial, double rate) {
        super(tree, serial);
        this.rate = rate;
    }

    RateEvent(double x, Tree tree, long serial, double rate) {
        super(x, tree, serial);
        this.rate = rate;
    }

    public double getRate() {
        return rate;
    }

    void setRate(double rate) {
        this.rate = rate;
    }
}
