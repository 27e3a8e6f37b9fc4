package branchshift.base;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything a move may touch, captured by identity so that two snapshots
 * compare equal only if the very same events sit at the very same places.
 */
final class ModelSnapshot {

    private final Map<Node, BranchEvent> nodeEvents = new HashMap<Node, BranchEvent>();
    private final Map<Node, BranchEvent> ancestralNodeEvents = new HashMap<Node, BranchEvent>();
    private final Map<Node, List<BranchEvent>> branchEvents = new HashMap<Node, List<BranchEvent>>();
    private final Map<BranchEvent, Double> mapTimes = new HashMap<BranchEvent, Double>();
    private final Map<BranchEvent, Node> owners = new HashMap<BranchEvent, Node>();
    private final Set<BranchEvent> members = new HashSet<BranchEvent>();

    private ModelSnapshot() {
    }

    static ModelSnapshot of(Model<?> model) {
        ModelSnapshot snapshot = new ModelSnapshot();
        for (Node p : model.getTree().getNodes()) {
            BranchHistory history = p.getBranchHistory();
            snapshot.nodeEvents.put(p, history.getNodeEvent());
            snapshot.ancestralNodeEvents.put(p, history.getAncestralNodeEvent());
            snapshot.branchEvents.put(p, new ArrayList<BranchEvent>(history.getEvents()));
        }
        for (BranchEvent e : model.getEventCollection().sortedByMapTime()) {
            snapshot.members.add(e);
            snapshot.mapTimes.put(e, e.getMapTime());
            snapshot.owners.put(e, e.getEventNode());
        }
        return snapshot;
    }

    BranchEvent nodeEvent(Node p) {
        return nodeEvents.get(p);
    }

    void assertSameAs(ModelSnapshot expected) {
        assertEquals(expected.members, members, "event index membership");
        assertEquals(expected.mapTimes, mapTimes, "event positions");
        assertEquals(expected.owners, owners, "event owners");
        assertEquals(expected.branchEvents, branchEvents, "branch histories");
        assertEquals(expected.nodeEvents, nodeEvents, "node events");
        assertEquals(expected.ancestralNodeEvents, ancestralNodeEvents, "ancestral node events");
    }
}
