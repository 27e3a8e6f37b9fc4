package branchshift.base;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * This class handles an MCMC run on one chain. Each generation picks one of
 * the moves with probability proportional to its weight in the settings and
 * lets it propose, accept or reject.
 */
public class Mcmc<E extends BranchEvent> {

    private final Model<E> model;
    private final Settings settings;

    private final List<MCMCMove<E, ?>> moves = new ArrayList<MCMCMove<E, ?>>();
    private final double[] weights;

    public Mcmc(Model<E> model, Settings settings) {
        this.model = model;
        this.settings = settings;

        moves.add(new EventNumberMove<E>(model));
        moves.add(new EventPositionMove<E>(model));
        moves.add(new EventRateMove<E>(model));
        weights = new double[] {
                settings.updateRateEventNumber,
                settings.updateRateEventPosition,
                settings.updateRateEventRate };
    }

    /**
     * Runs the number of generations given in the settings.
     */
    public void run() {
        run(settings.numberOfGenerations);
    }

    public void run(int generations) {
        System.out.println("Starting MCMC...");
        boolean validate = settings.validateEventConfiguration || Utils.DEBUG;

        for (int i = 0; i < generations; i++) {
            sample();
            if (validate)
                model.validateBranchHistories();

            if (settings.printFreq > 0 && (i + 1) % settings.printFreq == 0) {
                System.out.println(String.format(Locale.US,
                        "Generation: %d\tEvents: %d\tEvent rate: %.4f\tAcceptance: %.4f",
                        model.getGeneration(), model.getNumberOfEvents(),
                        model.getEventRate(), model.getMHAcceptanceRate()));
            }
        }

        System.out.println(getInfoString());
    }

    /**
     * One generation.
     * @return true if the chosen move was accepted
     */
    public boolean sample() {
        int choice = Utils.weightedChoose(weights, model.getRandom());
        boolean accepted = moves.get(choice).sample();
        model.incrementGeneration();
        return accepted;
    }

    /**
     * Returns a string representation describing the acceptance ratios of the current MCMC run.
     */
    public String getInfoString() {
        StringBuilder builder = new StringBuilder("Acceptances: [");
        for (int i = 0; i < moves.size(); i++) {
            MCMCMove<E, ?> move = moves.get(i);
            if (i > 0)
                builder.append(", ");
            builder.append(String.format(Locale.US, "%s: %f (%d)",
                    move.getName(), move.getAcceptanceRate(), move.getSampled()));
        }
        return builder.append("]").toString();
    }

    public List<MCMCMove<E, ?>> getMoves() {
        return moves;
    }

    public Model<E> getModel() {
        return model;
    }
}
