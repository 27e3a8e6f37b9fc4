package branchshift.base;

import java.util.Random;

import branchshift.model.RateShiftModel;

/**
 * Trees and models shared by the tests.
 */
final class TestTrees {

    /** A [0,3), B [3,7), C [7,9), D [9,10). */
    static final String SMALL = "(A:3,(C:2,D:1)B:4);";

    /** X [0,1), M [1,4), A [4,5), B [5,6); M has time 3. */
    static final String SEED = "(X:1,(A:1,B:1)M:3);";

    static final String LARGE = "(((t1:1.5,t2:0.7)n12:2.0,(t3:0.4,(t4:1.1,t5:0.9)n45:0.8)n345:1.2)n15:0.6,"
            + "((t6:2.2,t7:0.3)n67:1.4,(t8:0.6,(t9:1.7,t10:0.5)n910:1.0)n810:0.9)n610:1.3)root;";

    private TestTrees() {
    }

    static RateShiftModel model(String newick, long seed) {
        return new RateShiftModel(new Random(seed), new Tree(newick), new Settings());
    }

    static RateShiftModel modelWithEvents(String newick, long seed, int events) {
        RateShiftModel model = model(newick, seed);
        for (int i = 0; i < events; i++)
            model.addEventToTree();
        return model;
    }
}
