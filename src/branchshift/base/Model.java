package branchshift.base;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Scanner;

/**
 * The state of one chain: a tree annotated with events, and the actions that
 * change it.
 *
 * Every node caches the event in force at its tip-ward end (its node event).
 * After any insertion, deletion or move the caches are refreshed by pushing
 * the new governing event down the tree; a branch that carries events of its
 * own stops the push, since its events shadow anything from above.
 *
 * Moves are undoable: a local or global move leaves a pending move behind
 * which must be either accepted ({@link #acceptLastMove()}) or reverted
 * ({@link #revertMovedEventToPrevious()}) before the chain can be changed
 * again. A deletion can likewise be undone by {@link #restoreLastDeletedEvent()}.
 *
 * Subclasses supply what events carry: how their parameters are drawn, read
 * from an event data file, and summarised over branches.
 *
 * @param <E> event type of the model
 */
public abstract class Model<E extends BranchEvent> {

    protected final Random rng;
    protected final Tree tree;
    protected final Settings settings;
    protected final Prior prior;
    private final Coldness coldness;

    protected E rootEvent;
    protected final EventIndex<E> eventCollection = new EventIndex<E>();

    private double eventRate;
    private final double scale;
    private final double updateEventRateScale;
    private final double localGlobalMoveRatio;

    private E lastEventModified;
    private E lastDeletedEvent;

    private int acceptCount;
    private int rejectCount;
    private long gen;

    private long eventSerial;

    public Model(Random rng, Tree tree, Settings settings, Prior prior, Coldness coldness) {
        this.rng = rng;
        this.tree = tree;
        this.settings = settings;
        this.prior = prior;
        this.coldness = coldness;

        // discard the first draws of a freshly seeded generator
        for (int i = 0; i < 100; i++)
            rng.nextDouble();

        // Event location scale is relative to the maximum root-to-tip length
        scale = settings.updateEventLocationScale * tree.maxRootToTipLength();

        updateEventRateScale = settings.updateEventRateScale;
        localGlobalMoveRatio = settings.localGlobalMoveRatio;

        // Initialize event rate to generate expected number of prior events
        eventRate = 1.0 / settings.poissonRatePrior;
    }

    ////////////           MODEL-SPECIFIC PART       ////////////////////////////////////////////

    /** A new event at map position x with parameters drawn from the prior. */
    protected abstract E newBranchEventWithRandomParameters(double x);

    /** A new event at mapTime on node x with the parameters last read. */
    protected abstract E newBranchEventWithReadParameters(Node x, double mapTime);

    /** Reads the parameter block following the event time of a record. */
    protected abstract void readModelSpecificParameters(Scanner in);

    /** Gives the root event the parameters last read. */
    protected abstract void setRootEventWithReadParameters();

    /** Recomputes whatever the model derives from the event configuration. */
    protected abstract void setMeanBranchParameters();

    public abstract double computeLogLikelihood();

    protected long nextEventSerial() {
        return eventSerial++;
    }

    /**
     * Installs the root event and makes it the governing event of every node.
     * Called once by the subclass constructor.
     */
    protected void initializeRootEvent(E root) {
        if (rootEvent != null)
            throw new IllegalStateException("Root event already set");
        rootEvent = root;
        BranchHistory rootHistory = tree.getRoot().getBranchHistory();
        rootHistory.setNodeEvent(root);
        rootHistory.setAncestralNodeEvent(root);
        forwardSetBranchHistories(root);
        setMeanBranchParameters();
    }

    ////////////           PROPAGATION       ////////////////////////////////////////////

    /**
     * Refreshes the node events below x after x was added, moved or became
     * the tip-most event of its branch. Nothing happens if another event sits
     * tip-ward of x on the same branch.
     */
    protected void forwardSetBranchHistories(BranchEvent x) {
        Node myNode = x.getEventNode();

        if (x == rootEvent) {
            forwardSetHistoriesRecursive(myNode.lfDesc, x);
            forwardSetHistoriesRecursive(myNode.rtDesc, x);
        } else if (x == myNode.getBranchHistory().getLastEvent()) {
            myNode.getBranchHistory().setNodeEvent(x);

            if (!myNode.isTip()) {
                forwardSetHistoriesRecursive(myNode.lfDesc, x);
                forwardSetHistoriesRecursive(myNode.rtDesc, x);
            }
        }
    }

    private void forwardSetHistoriesRecursive(Node p, BranchEvent lastEvent) {
        BranchHistory history = p.getBranchHistory();
        history.setAncestralNodeEvent(lastEvent);

        // an event on this branch ends the push
        if (history.getNumberOfBranchEvents() == 0) {
            history.setNodeEvent(lastEvent);

            if (!p.isTip()) {
                forwardSetHistoriesRecursive(p.lfDesc, lastEvent);
                forwardSetHistoriesRecursive(p.rtDesc, lastEvent);
            }
        }
    }

    ////////////           ACTIONS       ////////////////////////////////////////////

    /** Adds an event with random parameters at a uniform position. */
    public E addEventToTree() {
        double x = rng.nextDouble() * tree.getTotalMapLength();
        return addEventToTree(x);
    }

    /**
     * Adds an event with random parameters at map position x.
     * @throws ModelStateError if x is off the tree or a move is pending
     */
    public E addEventToTree(double x) {
        checkNoPendingMove();
        E newEvent = newBranchEventWithRandomParameters(x);
        lastDeletedEvent = null;
        attachEvent(newEvent);
        return newEvent;
    }

    private void attachEvent(E e) {
        e.getEventNode().getBranchHistory().addEventToBranchHistory(e);
        eventCollection.insert(e);
        forwardSetBranchHistories(e);
        setMeanBranchParameters();
    }

    /**
     * Removes e from the tree. The event immediately root-ward of it takes
     * over everything e governed.
     * @throws ModelStateError if e is the root event or not on the tree
     */
    public void deleteEventFromTree(E e) {
        checkNoPendingMove();
        if (e == rootEvent || !eventCollection.contains(e))
            throw new ModelStateError(ModelStateError.Kind.EVENT_NOT_FOUND, "cannot delete " + e);

        BranchHistory history = e.getEventNode().getBranchHistory();
        BranchEvent previousEvent = history.getLastEvent(e);
        history.popEventOffBranchHistory(e);
        eventCollection.remove(e);

        forwardSetBranchHistories(previousEvent);
        setMeanBranchParameters();

        lastDeletedEvent = e;
    }

    /** Deletes an event chosen uniformly at random and returns it. */
    public E deleteRandomEventFromTree() {
        E e = chooseEventAtRandom();
        deleteEventFromTree(e);
        return e;
    }

    /**
     * Puts the event removed by the last deletion back where it was.
     * @throws ModelStateError if the last action was not a deletion
     */
    public E restoreLastDeletedEvent() {
        if (lastDeletedEvent == null)
            throw new ModelStateError(ModelStateError.Kind.NO_PENDING_MOVE, "no deleted event to restore");
        E e = lastDeletedEvent;
        lastDeletedEvent = null;
        attachEvent(e);
        return e;
    }

    /**
     * @throws ModelStateError if there are no events besides the root event
     */
    public E chooseEventAtRandom() {
        return eventCollection.pickUniform(rng);
    }

    /** Local move of a random event; null if there are no events to move. */
    public E eventLocalMove() {
        return eventMove(true);
    }

    /** Global move of a random event; null if there are no events to move. */
    public E eventGlobalMove() {
        return eventMove(false);
    }

    private E eventMove(boolean local) {
        checkNoPendingMove();
        lastDeletedEvent = null;

        if (getNumberOfEvents() == 0)
            return null;

        // The event to be moved
        E chosenEvent = chooseEventAtRandom();

        // Histories are set forward from the event preceding the chosen one
        BranchEvent previousEvent = chosenEvent.getEventNode().getBranchHistory().getLastEvent(chosenEvent);

        lastEventModified = chosenEvent;

        chosenEvent.getEventNode().getBranchHistory().popEventOffBranchHistory(chosenEvent);

        if (local) {
            double step = rng.nextDouble() * scale - 0.5 * scale;
            chosenEvent.moveEventLocal(step);
        } else {
            chosenEvent.moveEventGlobal(rng);
        }

        chosenEvent.getEventNode().getBranchHistory().addEventToBranchHistory(chosenEvent);

        // first the old neighbourhood, then the new one
        forwardSetBranchHistories(previousEvent);
        forwardSetBranchHistories(chosenEvent);

        setMeanBranchParameters();
        return chosenEvent;
    }

    /**
     * Keeps the outcome of the last move.
     * @throws ModelStateError if no move is pending
     */
    public void acceptLastMove() {
        if (lastEventModified == null)
            throw new ModelStateError(ModelStateError.Kind.NO_PENDING_MOVE, "no move to accept");
        lastEventModified.clearOldMapPosition();
        lastEventModified = null;
    }

    /**
     * Puts the event moved last back where it was before the move.
     * @throws ModelStateError if no move is pending
     */
    public void revertMovedEventToPrevious() {
        if (lastEventModified == null)
            throw new ModelStateError(ModelStateError.Kind.NO_PENDING_MOVE, "no move to revert");

        E moved = lastEventModified;
        lastEventModified = null;

        // Event root-ward of the current position
        BranchEvent newLastEvent = moved.getEventNode().getBranchHistory().getLastEvent(moved);

        moved.getEventNode().getBranchHistory().popEventOffBranchHistory(moved);
        moved.revertOldMapPosition();
        moved.getEventNode().getBranchHistory().addEventToBranchHistory(moved);

        forwardSetBranchHistories(newLastEvent);
        forwardSetBranchHistories(moved);

        setMeanBranchParameters();
    }

    public boolean hasPendingMove() {
        return lastEventModified != null;
    }

    public E getLastEventModified() {
        return lastEventModified;
    }

    private void checkNoPendingMove() {
        if (lastEventModified != null)
            throw new ModelStateError(ModelStateError.Kind.MOVE_PENDING,
                    lastEventModified + " was moved and neither accepted nor reverted");
    }

    ////////////           EVENT DATA FILE       ////////////////////////////////////////////

    /**
     * Seeds the chain from the event data file named in the settings.
     */
    public void initializeModelFromEventDataFile() throws SeedFileException {
        if (settings.eventDataInfile == null)
            throw new SeedFileException("No event data file given");
        Path inputFile = Paths.get(settings.eventDataInfile);
        try (Reader in = Files.newBufferedReader(inputFile, StandardCharsets.UTF_8)) {
            System.out.println("Initializing model from <<" + inputFile + ">>");
            initializeModelFromEventData(in);
        } catch (NoSuchFileException e) {
            throw new SeedFileException("<<" + inputFile + ">> is a bad file name.", e);
        } catch (IOException e) {
            throw new SeedFileException("Cannot read <<" + inputFile + ">>", e);
        }
    }

    /**
     * Reads records of the form {@code species1 species2 time parameters...}.
     * A record names the node by the MRCA of two species, or by a single
     * species followed by NA. Records on the root set the parameters of the
     * root event; all others add an event at the given time before the node.
     */
    public void initializeModelFromEventData(Reader in) throws SeedFileException {
        checkNoPendingMove();
        lastDeletedEvent = null;

        Scanner scanner = new Scanner(in);
        scanner.useLocale(Locale.US);

        int eventCount = 0;
        while (scanner.hasNext()) {
            int record = eventCount + 1;
            String species1;
            String species2;
            double eTime;
            try {
                species1 = unquote(scanner.next());
                species2 = unquote(scanner.next());
                eTime = scanner.nextDouble();

                readModelSpecificParameters(scanner);
            } catch (NoSuchElementException e) {
                throw new SeedFileException("Incomplete or malformed record " + record + " in event data file", e);
            }

            Node x;
            try {
                if (!species1.equals("NA") && !species2.equals("NA")) {
                    x = tree.getNodeMRCA(species1, species2);
                } else if (!species1.equals("NA")) {
                    x = tree.getNodeByName(species1);
                } else {
                    throw new SeedFileException("Either both species are NA or the second species is NA "
                            + "in record " + record + " of the event data file");
                }
            } catch (IllegalArgumentException e) {
                throw new SeedFileException("Record " + record + ": " + e.getMessage(), e);
            }

            if (x == tree.getRoot()) {
                setRootEventWithReadParameters();
                setMeanBranchParameters();
            } else {
                double deltaT = x.getTime() - eTime;
                double newMapTime = x.getMapStart() + deltaT;
                if (!x.containsMapPosition(newMapTime))
                    throw new SeedFileException("Record " + record + ": time " + eTime
                            + " does not fall on the branch of " + x);

                E newEvent = newBranchEventWithReadParameters(x, newMapTime);
                attachEvent(newEvent);
            }

            eventCount++;
        }
        if (scanner.ioException() != null)
            throw new SeedFileException("Cannot read event data", scanner.ioException());

        System.out.println("Read a total of " + eventCount + " events.");
        System.out.println("Added " + eventCollection.size() + " pre-defined events to tree, plus root event.");
    }

    private static String unquote(String token) {
        if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\""))
            return token.substring(1, token.length() - 1);
        return token;
    }

    ////////////           CHECKS       ////////////////////////////////////////////

    /** Recursively counts the events in the branch histories below p. */
    public int countEventsInBranchHistory(Node p) {
        int count = p.getBranchHistory().getNumberOfBranchEvents();

        if (p.lfDesc != null)
            count += countEventsInBranchHistory(p.lfDesc);
        if (p.rtDesc != null)
            count += countEventsInBranchHistory(p.rtDesc);

        return count;
    }

    /**
     * Walks the whole tree and checks every cached node event against the
     * events actually on the branches.
     * @throws IllegalStateException at the first inconsistency
     */
    public void validateBranchHistories() {
        Node root = tree.getRoot();
        if (root.getBranchHistory().getNumberOfBranchEvents() != 0)
            throw new IllegalStateException("Events on the root branch");
        if (root.getBranchHistory().getNodeEvent() != rootEvent)
            throw new IllegalStateException("Root node is not governed by the root event");

        int onBranches = 0;
        for (Node p : tree.getNodes()) {
            BranchHistory history = p.getBranchHistory();
            for (BranchEvent e : history.getEvents()) {
                if (e.getEventNode() != p)
                    throw new IllegalStateException(e + " is filed under " + p);
                @SuppressWarnings("unchecked")
                E event = (E) e;
                if (!eventCollection.contains(event))
                    throw new IllegalStateException(e + " is missing from the event index");
            }
            onBranches += history.getNumberOfBranchEvents();

            if (p.isRoot())
                continue;
            BranchEvent expectedAncestral = p.anc.getBranchHistory().getNodeEvent();
            if (history.getAncestralNodeEvent() != expectedAncestral)
                throw new IllegalStateException("Stale ancestral node event at " + p);
            BranchEvent expected = history.getNumberOfBranchEvents() == 0
                    ? expectedAncestral : history.getLastEvent();
            if (history.getNodeEvent() != expected)
                throw new IllegalStateException("Node event of " + p + " is " + history.getNodeEvent()
                        + ", expected " + expected);
        }
        if (onBranches != eventCollection.size())
            throw new IllegalStateException(onBranches + " events on branches but "
                    + eventCollection.size() + " in the event index");
    }

    ////////////           BOOKKEEPING       ////////////////////////////////////////////

    public int getNumberOfEvents() {
        return eventCollection.size();
    }

    public EventIndex<E> getEventCollection() {
        return eventCollection;
    }

    public E getRootEvent() {
        return rootEvent;
    }

    public double getEventRate() {
        return eventRate;
    }

    public void setEventRate(double eventRate) {
        if (!(eventRate > 0.0))
            throw new IllegalArgumentException("Event rate must be positive: " + eventRate);
        this.eventRate = eventRate;
    }

    /** Width of the local move window on the map. */
    public double getLocalMoveScale() {
        return scale;
    }

    public double getUpdateEventRateScale() {
        return updateEventRateScale;
    }

    public double getLocalGlobalMoveRatio() {
        return localGlobalMoveRatio;
    }

    public void incrementAcceptCount() {
        acceptCount++;
    }

    public void incrementRejectCount() {
        rejectCount++;
    }

    public int getAcceptCount() {
        return acceptCount;
    }

    public int getRejectCount() {
        return rejectCount;
    }

    public double getMHAcceptanceRate() {
        int total = acceptCount + rejectCount;
        return total == 0 ? 0.0 : (double) acceptCount / total;
    }

    public void resetMHAcceptanceParameters() {
        acceptCount = 0;
        rejectCount = 0;
    }

    public long getGeneration() {
        return gen;
    }

    public void incrementGeneration() {
        gen++;
    }

    public double getColdness() {
        return coldness.get();
    }

    public Tree getTree() {
        return tree;
    }

    public Random getRandom() {
        return rng;
    }

    public Prior getPrior() {
        return prior;
    }

    public Settings getSettings() {
        return settings;
    }
}
