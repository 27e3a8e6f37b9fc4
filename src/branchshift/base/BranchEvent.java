package branchshift.base;

import java.util.Random;

/**
 * A change-point on the tree. An event sits at a map position on one branch
 * and governs every point tip-ward of it until the next event. The parameters
 * it carries belong to subclasses; this class only knows where it is.
 *
 * An event remembers the position it had before the last local or global move
 * so that a rejected proposal can be undone exactly. Only one move can be
 * outstanding at a time.
 */
public class BranchEvent {

    private final Tree tree;
    private final long serial;

    private Node node;
    private double mapTime;
    private double absTime;

    private boolean moved;
    private Node oldNode;
    private double oldMapTime;

    /**
     * Creates the root event, which sits at the origin of the tree and is never
     * moved.
     */
    protected BranchEvent(Tree tree, long serial) {
        this.tree = tree;
        this.serial = serial;
        node = tree.getRoot();
        mapTime = node.mapStart;
        absTime = 0.0;
    }

    /**
     * Creates an event at map position x on the branch containing it.
     * @throws ModelStateError if x is not on the tree
     */
    protected BranchEvent(double x, Tree tree, long serial) {
        this.tree = tree;
        this.serial = serial;
        setEventByMapPosition(x);
    }

    private void setEventByMapPosition(double x) {
        node = tree.mapEventToTree(x);
        mapTime = x;
        absTime = node.time - (x - node.mapStart);
    }

    /**
     * Shifts the event by step along the map, reflecting at both ends.
     */
    public void moveEventLocal(double step) {
        rememberPosition();
        setEventByMapPosition(reflect(mapTime + step, tree.getTotalMapLength()));
    }

    /**
     * Puts the event at a uniformly drawn position anywhere on the tree.
     */
    public void moveEventGlobal(Random rng) {
        rememberPosition();
        setEventByMapPosition(rng.nextDouble() * tree.getTotalMapLength());
    }

    private void rememberPosition() {
        oldNode = node;
        oldMapTime = mapTime;
        moved = true;
    }

    /**
     * Undoes the last local or global move.
     * @throws ModelStateError if there is no move to undo
     */
    public void revertOldMapPosition() {
        if (!moved)
            throw new ModelStateError(ModelStateError.Kind.NO_PENDING_MOVE,
                    "event " + serial + " has no recorded position");
        node = oldNode;
        mapTime = oldMapTime;
        absTime = node.time - (mapTime - node.mapStart);
        clearOldMapPosition();
    }

    /** Forgets the recorded position once a move has been accepted. */
    public void clearOldMapPosition() {
        moved = false;
        oldNode = null;
        oldMapTime = 0.0;
    }

    /**
     * Folds x back into {@code [0, length)} by mirroring it at both ends as
     * often as needed. The proposal stays symmetric: the probability of
     * stepping from a to b equals that of stepping from b to a.
     */
    public static double reflect(double x, double length) {
        while (x < 0.0 || x >= length) {
            if (x < 0.0) {
                x = -x;
            } else {
                x = 2.0 * length - x;
                if (x == length)
                    return Math.nextDown(length);
            }
        }
        return x;
    }

    public Node getEventNode() {
        return node;
    }

    public double getMapTime() {
        return mapTime;
    }

    /** Time since the root. */
    public double getAbsoluteTime() {
        return absTime;
    }

    public boolean hasOldMapPosition() {
        return moved;
    }

    public Node getOldEventNode() {
        return oldNode;
    }

    public double getOldMapTime() {
        return oldMapTime;
    }

    public Tree getTree() {
        return tree;
    }

    public long getSerial() {
        return serial;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + serial + "@" + mapTime + " on " + node;
    }
}
