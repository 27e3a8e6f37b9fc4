package branchshift.base;

import java.util.Collections;
import java.util.Comparator;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * The events sitting on one branch, ordered root-ward to tip-ward, plus two
 * cached references maintained by {@link Model}:
 * <ul>
 * <li>the node event, the event in force at the tip-ward end of the branch;</li>
 * <li>the ancestral node event, the node event of the ancestor, which is in
 * force at the root-ward end of the branch.</li>
 * </ul>
 * If the branch carries no events the two are the same.
 */
public class BranchHistory {

    /** Root-ward first; ties are broken by creation order. */
    static final Comparator<BranchEvent> ROOT_TO_TIP = new Comparator<BranchEvent>() {
        @Override
        public int compare(BranchEvent a, BranchEvent b) {
            int c = Double.compare(a.getAbsoluteTime(), b.getAbsoluteTime());
            return c != 0 ? c : Long.compare(a.getSerial(), b.getSerial());
        }
    };

    private final Node node;
    private final TreeSet<BranchEvent> events = new TreeSet<BranchEvent>(ROOT_TO_TIP);

    private BranchEvent nodeEvent;
    private BranchEvent ancestralNodeEvent;

    BranchHistory(Node node) {
        this.node = node;
    }

    /**
     * Inserts e at its place on the branch. The event must already have been
     * positioned on this branch and must not be mutated while it is here.
     */
    public void addEventToBranchHistory(BranchEvent e) {
        if (e.getEventNode() != node)
            throw new ModelStateError(ModelStateError.Kind.POSITION_OUT_OF_RANGE,
                    e + " does not belong to branch " + node);
        events.add(e);
    }

    /**
     * @throws ModelStateError if e is not on this branch
     */
    public void popEventOffBranchHistory(BranchEvent e) {
        if (!events.remove(e))
            throw new ModelStateError(ModelStateError.Kind.EVENT_NOT_FOUND,
                    e + " is not on branch " + node);
    }

    /** The tip-most event on the branch, null if there is none. */
    public BranchEvent getLastEvent() {
        return events.isEmpty() ? null : events.last();
    }

    /**
     * The event immediately root-ward of e: its predecessor on this branch or,
     * if e is the first event here, the event inherited from the ancestor.
     */
    public BranchEvent getLastEvent(BranchEvent e) {
        if (!events.contains(e))
            throw new ModelStateError(ModelStateError.Kind.EVENT_NOT_FOUND,
                    e + " is not on branch " + node);
        BranchEvent previous = events.lower(e);
        return previous != null ? previous : ancestralNodeEvent;
    }

    public boolean containsEvent(BranchEvent e) {
        return events.contains(e);
    }

    public int getNumberOfBranchEvents() {
        return events.size();
    }

    /** Events on the branch, root-ward first. */
    public NavigableSet<BranchEvent> getEvents() {
        return Collections.unmodifiableNavigableSet(events);
    }

    public BranchEvent getNodeEvent() {
        return nodeEvent;
    }

    public BranchEvent getAncestralNodeEvent() {
        return ancestralNodeEvent;
    }

    void setNodeEvent(BranchEvent e) {
        nodeEvent = e;
    }

    void setAncestralNodeEvent(BranchEvent e) {
        ancestralNodeEvent = e;
    }

    public Node getNode() {
        return node;
    }
}
