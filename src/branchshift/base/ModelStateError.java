package branchshift.base;

/**
 * Signals a broken contract inside the event machinery: an event missing from
 * the branch or index it should be in, a position off the tree, a random pick
 * from an empty index or a revert with nothing to revert.
 *
 * These never happen under correct use. The chain cannot continue after one,
 * so this is an {@link Error} and nothing in the core catches it.
 */
public class ModelStateError extends Error {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        POSITION_OUT_OF_RANGE,
        EVENT_NOT_FOUND,
        EMPTY_INDEX,
        NO_PENDING_MOVE,
        MOVE_PENDING
    }

    private final Kind kind;

    public ModelStateError(Kind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
