package work.stackenv.concretize;

/**
 * Resolution failed for a reason the user has to fix in the manifest or configuration.
 */
public class ConcretizationException extends RuntimeException {
    public ConcretizationException(String message) {
        super(message);
    }
}
