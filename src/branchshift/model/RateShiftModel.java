package branchshift.model;

import java.util.InputMismatchException;
import java.util.Random;
import java.util.Scanner;

import branchshift.base.BranchEvent;
import branchshift.base.BranchHistory;
import branchshift.base.Coldness;
import branchshift.base.ExponentialPrior;
import branchshift.base.Model;
import branchshift.base.Node;
import branchshift.base.Prior;
import branchshift.base.Settings;
import branchshift.base.Tree;

/**
 * A piecewise-constant rate over the tree: every event sets a new rate that
 * holds tip-ward of it. New events draw their rate from the prior, event data
 * files give one rate per record.
 *
 * The model keeps the time-averaged rate of every branch up to date. It
 * carries no data likelihood of its own, so on its own the chain samples the
 * prior; subclasses override {@link #computeLogLikelihood()}.
 */
public class RateShiftModel extends Model<RateEvent> {

    private final double[] meanBranchRate;

    private double readRate;

    public RateShiftModel(Random rng, Tree tree, Settings settings) {
        this(rng, tree, settings, new ExponentialPrior(settings), new Coldness());
    }

    public RateShiftModel(Random rng, Tree tree, Settings settings, Prior prior, Coldness coldness) {
        super(rng, tree, settings, prior, coldness);
        meanBranchRate = new double[tree.getNumberOfNodes()];

        double rootRate = prior.generateEventParameterFromPrior(rng);
        initializeRootEvent(new RateEvent(tree, nextEventSerial(), rootRate));
    }

    @Override
    protected RateEvent newBranchEventWithRandomParameters(double x) {
        return new RateEvent(x, tree, nextEventSerial(), prior.generateEventParameterFromPrior(rng));
    }

    @Override
    protected RateEvent newBranchEventWithReadParameters(Node x, double mapTime) {
        return new RateEvent(mapTime, tree, nextEventSerial(), readRate);
    }

    @Override
    protected void readModelSpecificParameters(Scanner in) {
        double rate = in.nextDouble();
        if (!(rate > 0.0))
            throw new InputMismatchException("rate must be positive, got " + rate);
        readRate = rate;
    }

    @Override
    protected void setRootEventWithReadParameters() {
        rootEvent.setRate(readRate);
    }

    /**
     * Averages the rate along every branch over time. The rate at the
     * root-ward end is that of the ancestral node event; each event on the
     * branch switches to its own rate.
     */
    @Override
    protected void setMeanBranchParameters() {
        for (Node p : tree.getNodes()) {
            if (p.isRoot()) {
                meanBranchRate[p.getIndex()] = rootEvent.getRate();
                continue;
            }

            BranchHistory history = p.getBranchHistory();
            if (p.getBrlen() == 0.0) {
                meanBranchRate[p.getIndex()] = ((RateEvent) history.getNodeEvent()).getRate();
                continue;
            }

            double t = p.getAnc().getTime();
            double rate = ((RateEvent) history.getAncestralNodeEvent()).getRate();
            double sum = 0.0;
            for (BranchEvent e : history.getEvents()) {
                sum += rate * (e.getAbsoluteTime() - t);
                t = e.getAbsoluteTime();
                rate = ((RateEvent) e).getRate();
            }
            sum += rate * (p.getTime() - t);

            meanBranchRate[p.getIndex()] = sum / p.getBrlen();
        }
    }

    public double getMeanBranchRate(Node p) {
        return meanBranchRate[p.getIndex()];
    }

    @Override
    public double computeLogLikelihood() {
        return 0.0;
    }
}
