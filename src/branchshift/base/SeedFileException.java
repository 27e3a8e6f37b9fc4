package branchshift.base;

/**
 * An event data file that cannot be used to initialise a chain: unreadable,
 * truncated, or naming species that are not in the tree.
 */
public class SeedFileException extends Exception {

    private static final long serialVersionUID = 1L;

    public SeedFileException(String message) {
        super(message);
    }

    public SeedFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
