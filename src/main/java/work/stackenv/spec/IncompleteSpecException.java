package work.stackenv.spec;

/**
 * Raised when an operation that needs a fully concrete spec (hashing, serialization) sees an abstract one.
 */
public final class IncompleteSpecException extends RuntimeException {
    private final String spec;

    public IncompleteSpecException(String spec, String message) {
        super(message);
        this.spec = spec;
    }

    public String spec() {
        return spec;
    }
}
