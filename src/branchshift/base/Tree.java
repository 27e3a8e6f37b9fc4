package branchshift.base;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * A rooted binary tree with a one-dimensional map over its branches.
 *
 * Every branch occupies the half-open interval {@code [mapStart, mapEnd)} of the
 * map. The root branch is empty and sits at 0; the other branches follow each
 * other in pre-order, left subtree first, so the map covers
 * {@code [0, totalMapLength)} without gaps. Within a branch the map runs from
 * the tip-ward end ({@code mapStart}) towards the root-ward end.
 *
 * The tree is read from a Newick description and is immutable afterwards.
 */
public class Tree {

    private final List<Node> nodes = new ArrayList<Node>();
    private final Node root;

    private final Map<String, Node> namedNodes = new HashMap<String, Node>();
    /** Branches of positive length keyed by mapStart, for position lookup. */
    private final TreeMap<Double, Node> mapIndex = new TreeMap<Double, Node>();

    private double totalMapLength;
    private double maxRootToTipLength;

    // parser state, only used while constructing
    private String descriptor;
    private int pos;

    /**
     * Builds the tree described by a Newick string such as
     * {@code ((A:1,B:1)AB:2,C:3);}. Every non-root node needs a branch length,
     * every tip needs a name and every internal node exactly two children.
     *
     * @throws IllegalArgumentException if the description is malformed
     */
    public Tree(String newick) {
        descriptor = stripWhitespace(newick);
        pos = 0;
        if (descriptor.isEmpty())
            throw new IllegalArgumentException("Empty tree description");

        root = parseSubtree(true);
        if (pos < descriptor.length() && descriptor.charAt(pos) == ';')
            pos++;
        if (pos != descriptor.length())
            throw malformed("unexpected trailing input");
        descriptor = null;

        root.time = 0.0;
        double tracker = setTreeMap(root, 0.0);
        totalMapLength = tracker;
    }

    /** Reads a file holding a single Newick tree. */
    public static Tree read(Path file) throws IOException {
        return new Tree(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    ////////////           PARSING       ////////////////////////////////////////////

    private Node parseSubtree(boolean isRoot) {
        Node left = null;
        Node right = null;

        if (peek() == '(') {
            pos++;
            left = parseSubtree(false);
            expect(',');
            right = parseSubtree(false);
            if (peek() == ',')
                throw malformed("only binary trees are supported");
            expect(')');
        }

        String name = readLabel();
        double length = 0.0;
        if (peek() == ':') {
            pos++;
            length = readNumber();
        } else if (!isRoot) {
            throw malformed("missing branch length");
        }
        if (length < 0.0)
            throw malformed("negative branch length " + length);
        if (left == null && name == null)
            throw malformed("unnamed tip");

        // the root branch is empty by definition
        Node node = new Node(nodes.size(), name, isRoot ? 0.0 : length);
        nodes.add(node);
        if (left != null) {
            node.lfDesc = left;
            node.rtDesc = right;
            left.anc = node;
            right.anc = node;
        }
        if (name != null && namedNodes.put(name, node) != null)
            throw malformed("duplicate node name " + name);

        return node;
    }

    private char peek() {
        return pos < descriptor.length() ? descriptor.charAt(pos) : ';';
    }

    private void expect(char ch) {
        if (peek() != ch)
            throw malformed("expected '" + ch + "'");
        pos++;
    }

    private String readLabel() {
        int start = pos;
        while (pos < descriptor.length() && ":,();".indexOf(descriptor.charAt(pos)) < 0)
            pos++;
        return pos > start ? descriptor.substring(start, pos) : null;
    }

    private double readNumber() {
        int start = pos;
        while (pos < descriptor.length() && ":,();".indexOf(descriptor.charAt(pos)) < 0)
            pos++;
        try {
            return Double.parseDouble(descriptor.substring(start, pos));
        } catch (NumberFormatException e) {
            throw malformed("bad branch length '" + descriptor.substring(start, pos) + "'");
        }
    }

    private IllegalArgumentException malformed(String reason) {
        return new IllegalArgumentException("Malformed Newick tree at position " + pos + ": " + reason);
    }

    private static String stripWhitespace(String s) {
        StringBuilder builder = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (!Character.isWhitespace(ch))
                builder.append(ch);
        }
        return builder.toString();
    }

    ////////////           MAP       ////////////////////////////////////////////

    /**
     * Assigns node times and map intervals in pre-order.
     * @return the map position following the subtree of p
     */
    private double setTreeMap(Node p, double tracker) {
        if (p.anc != null)
            p.time = p.anc.time + p.brlen;

        p.mapStart = tracker;
        tracker += p.brlen;
        p.mapEnd = tracker;
        if (p.brlen > 0.0)
            mapIndex.put(p.mapStart, p);

        if (p.isTip()) {
            maxRootToTipLength = Math.max(maxRootToTipLength, p.time);
        } else {
            tracker = setTreeMap(p.lfDesc, tracker);
            tracker = setTreeMap(p.rtDesc, tracker);
        }
        return tracker;
    }

    /**
     * Returns the node whose branch contains map position x.
     * @throws ModelStateError if x is not on the tree
     */
    public Node mapEventToTree(double x) {
        if (!(x >= 0.0 && x < totalMapLength))
            throw new ModelStateError(ModelStateError.Kind.POSITION_OUT_OF_RANGE,
                    "map position " + x + " outside [0, " + totalMapLength + ")");
        Map.Entry<Double, Node> entry = mapIndex.floorEntry(x);
        if (entry == null || !entry.getValue().containsMapPosition(x))
            throw new ModelStateError(ModelStateError.Kind.POSITION_OUT_OF_RANGE,
                    "no branch contains map position " + x);
        return entry.getValue();
    }

    ////////////           LOOKUP       ////////////////////////////////////////////

    public Node getRoot() {
        return root;
    }

    /** All nodes, the root last. */
    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int getNumberOfNodes() {
        return nodes.size();
    }

    /** Sum of all branch lengths. */
    public double getTotalMapLength() {
        return totalMapLength;
    }

    public double maxRootToTipLength() {
        return maxRootToTipLength;
    }

    /**
     * @throws IllegalArgumentException if no node carries that name
     */
    public Node getNodeByName(String name) {
        Node node = namedNodes.get(name);
        if (node == null)
            throw new IllegalArgumentException("No node named " + name);
        return node;
    }

    /**
     * The most recent common ancestor of two named nodes.
     * @throws IllegalArgumentException if either name is unknown
     */
    public Node getNodeMRCA(String name1, String name2) {
        Node a = getNodeByName(name1);
        Node b = getNodeByName(name2);

        Set<Node> ancestors = new HashSet<Node>();
        for (Node v = a; v != null; v = v.anc)
            ancestors.add(v);
        for (Node v = b; v != null; v = v.anc) {
            if (ancestors.contains(v))
                return v;
        }
        // both nodes hang below the same root
        throw new IllegalStateException("Nodes " + name1 + " and " + name2 + " share no ancestor");
    }
}
