package branchshift.base;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.stat.inference.ChiSquareTest;
import org.junit.jupiter.api.Test;

class EventIndexTest {

    private final Tree tree = new Tree(TestTrees.SMALL);

    private List<BranchEvent> events(int n) {
        List<BranchEvent> list = new ArrayList<BranchEvent>();
        for (int i = 0; i < n; i++)
            list.add(new BranchEvent(i * 10.0 / n, tree, i + 1));
        return list;
    }

    @Test
    void insertAndRemove() {
        EventIndex<BranchEvent> index = new EventIndex<BranchEvent>();
        List<BranchEvent> events = events(5);
        for (BranchEvent e : events)
            index.insert(e);
        index.insert(events.get(2));
        assertEquals(5, index.size());

        index.remove(events.get(0));
        index.remove(events.get(3));
        assertEquals(3, index.size());
        assertFalse(index.contains(events.get(0)));
        assertFalse(index.contains(events.get(3)));
        assertTrue(index.contains(events.get(1)));
        assertTrue(index.contains(events.get(2)));
        assertTrue(index.contains(events.get(4)));

        // the survivors can still be removed after being shuffled around
        index.remove(events.get(4));
        index.remove(events.get(1));
        index.remove(events.get(2));
        assertTrue(index.isEmpty());
    }

    @Test
    void removingAnAbsentEventFails() {
        EventIndex<BranchEvent> index = new EventIndex<BranchEvent>();
        BranchEvent e = events(1).get(0);
        ModelStateError error = assertThrows(ModelStateError.class, () -> index.remove(e));
        assertEquals(ModelStateError.Kind.EVENT_NOT_FOUND, error.getKind());
    }

    @Test
    void pickingFromAnEmptyIndexFails() {
        EventIndex<BranchEvent> index = new EventIndex<BranchEvent>();
        ModelStateError error = assertThrows(ModelStateError.class, () -> index.pickUniform(new Random(1)));
        assertEquals(ModelStateError.Kind.EMPTY_INDEX, error.getKind());
    }

    @Test
    void singleMemberIsAlwaysPicked() {
        EventIndex<BranchEvent> index = new EventIndex<BranchEvent>();
        BranchEvent e = events(1).get(0);
        index.insert(e);
        Random rng = new Random(3);
        for (int i = 0; i < 20; i++)
            assertSame(e, index.pickUniform(rng));
    }

    @Test
    void picksAreUniform() {
        EventIndex<BranchEvent> index = new EventIndex<BranchEvent>();
        List<BranchEvent> events = events(8);
        for (BranchEvent e : events)
            index.insert(e);
        // leave holes so that swapped slots are exercised too
        index.remove(events.get(1));
        index.remove(events.get(6));
        events.remove(6);
        events.remove(1);

        Random rng = new Random(42);
        int draws = 60000;
        long[] observed = new long[events.size()];
        for (int i = 0; i < draws; i++)
            observed[events.indexOf(index.pickUniform(rng))]++;

        double[] expected = new double[events.size()];
        for (int i = 0; i < expected.length; i++)
            expected[i] = (double) draws / events.size();

        double p = new ChiSquareTest().chiSquareTest(expected, observed);
        assertTrue(p > 0.001, "p-value " + p);
    }

    @Test
    void sortedByMapTime() {
        EventIndex<BranchEvent> index = new EventIndex<BranchEvent>();
        List<BranchEvent> events = events(4);
        for (int i = events.size() - 1; i >= 0; i--)
            index.insert(events.get(i));
        assertEquals(events, index.sortedByMapTime());
    }
}
