package branchshift.base;

/**
 * A node of the (fixed) binary tree together with the branch leading to it.
 *
 * Topology and map geometry are assigned once by {@link Tree} and never change
 * afterwards; the only mutable part of a node is its {@link BranchHistory}.
 */
public class Node {

    /** Position of this node in {@link Tree#getNodes()}. */
    final int index;

    /**
     * The name of the node. Tips are always named, internal nodes only if the
     * Newick description labels them.
     */
    public final String name;

    /** This reference points to the ancestor of the node, null for the root. */
    Node anc;
    /** Left descendant, null for tips. */
    Node lfDesc;
    /** Right descendant, null for tips. */
    Node rtDesc;

    /** The length of the branch that connects this node with its ancestor. */
    final double brlen;

    double time;        // distance from the root to this node
    double mapStart;    // tip-ward end of the branch on the tree map
    double mapEnd;      // root-ward end, mapStart + brlen

    private final BranchHistory history = new BranchHistory(this);

    Node(int index, String name, double brlen) {
        this.index = index;
        this.name = name;
        this.brlen = brlen;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public Node getAnc() {
        return anc;
    }

    public Node getLfDesc() {
        return lfDesc;
    }

    public Node getRtDesc() {
        return rtDesc;
    }

    public double getBrlen() {
        return brlen;
    }

    public double getTime() {
        return time;
    }

    public double getMapStart() {
        return mapStart;
    }

    public double getMapEnd() {
        return mapEnd;
    }

    public BranchHistory getBranchHistory() {
        return history;
    }

    public boolean isTip() {
        return lfDesc == null;
    }

    public boolean isRoot() {
        return anc == null;
    }

    /** True if map position x lies on this node's branch. */
    boolean containsMapPosition(double x) {
        return x >= mapStart && x < mapEnd;
    }

    /** True if this node is p or lies in the subtree below p. */
    public boolean isDescendantOf(Node p) {
        for (Node v = this; v != null; v = v.anc) {
            if (v == p)
                return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return (name != null ? name : "node" + index) + "[" + mapStart + ", " + mapEnd + ")";
    }
}
