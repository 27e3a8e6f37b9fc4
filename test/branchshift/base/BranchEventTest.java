package branchshift.base;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

class BranchEventTest {

    private final Tree tree = new Tree(TestTrees.SMALL);

    @Test
    void reflection() {
        assertEquals(3.0, BranchEvent.reflect(3.0, 10.0));
        assertEquals(0.0, BranchEvent.reflect(0.0, 10.0));
        assertEquals(2.0, BranchEvent.reflect(-2.0, 10.0));
        assertEquals(8.0, BranchEvent.reflect(12.0, 10.0));
        assertEquals(5.0, BranchEvent.reflect(25.0, 10.0));
        assertEquals(Math.nextDown(10.0), BranchEvent.reflect(10.0, 10.0));
        assertEquals(Math.nextDown(10.0), BranchEvent.reflect(-10.0, 10.0));
    }

    @Test
    void reflectionStaysInRange() {
        Random rng = new Random(7);
        for (int i = 0; i < 10000; i++) {
            double x = (rng.nextDouble() - 0.5) * 100.0;
            double y = BranchEvent.reflect(x, 10.0);
            assertTrue(y >= 0.0 && y < 10.0, x + " reflected to " + y);
        }
    }

    @Test
    void positionAndAbsoluteTime() {
        BranchEvent e = new BranchEvent(5.0, tree, 1);
        assertSame(tree.getNodeByName("B"), e.getEventNode());
        assertEquals(5.0, e.getMapTime());
        assertEquals(2.0, e.getAbsoluteTime(), 1e-12);
        assertFalse(e.hasOldMapPosition());

        BranchEvent root = new BranchEvent(tree, 0);
        assertSame(tree.getRoot(), root.getEventNode());
        assertEquals(0.0, root.getAbsoluteTime());
    }

    @Test
    void positionOffTheTree() {
        ModelStateError error = assertThrows(ModelStateError.class, () -> new BranchEvent(10.0, tree, 1));
        assertEquals(ModelStateError.Kind.POSITION_OUT_OF_RANGE, error.getKind());
    }

    @Test
    void localMoveAcrossBranchesAndBack() {
        BranchEvent e = new BranchEvent(2.5, tree, 1);
        e.moveEventLocal(1.0);

        assertSame(tree.getNodeByName("B"), e.getEventNode());
        assertEquals(3.5, e.getMapTime(), 1e-12);
        assertTrue(e.hasOldMapPosition());
        assertSame(tree.getNodeByName("A"), e.getOldEventNode());
        assertEquals(2.5, e.getOldMapTime());

        e.revertOldMapPosition();
        assertSame(tree.getNodeByName("A"), e.getEventNode());
        assertEquals(2.5, e.getMapTime());
        assertEquals(0.5, e.getAbsoluteTime(), 1e-12);
        assertFalse(e.hasOldMapPosition());
    }

    @Test
    void localMoveReflectsAtTheEnds() {
        BranchEvent e = new BranchEvent(9.5, tree, 1);
        e.moveEventLocal(1.0);
        assertEquals(9.5, e.getMapTime(), 1e-12);
        e.clearOldMapPosition();

        e.moveEventLocal(-10.0);
        assertEquals(0.5, e.getMapTime(), 1e-12);
        assertSame(tree.getNodeByName("A"), e.getEventNode());
    }

    @Test
    void globalMoveLandsOnTheTree() {
        BranchEvent e = new BranchEvent(5.0, tree, 1);
        Random rng = new Random(11);
        for (int i = 0; i < 100; i++) {
            e.moveEventGlobal(rng);
            assertTrue(e.getEventNode().containsMapPosition(e.getMapTime()));
            e.clearOldMapPosition();
        }
    }

    @Test
    void revertWithoutMove() {
        BranchEvent e = new BranchEvent(5.0, tree, 1);
        ModelStateError error = assertThrows(ModelStateError.class, e::revertOldMapPosition);
        assertEquals(ModelStateError.Kind.NO_PENDING_MOVE, error.getKind());

        e.moveEventLocal(0.5);
        e.clearOldMapPosition();
        assertThrows(ModelStateError.class, e::revertOldMapPosition);
        assertEquals(5.5, e.getMapTime(), 1e-12);
    }
}
