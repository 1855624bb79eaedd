package work.stackenv.env;

/**
 * An environment operation was misused, for example adding a package twice or removing one that is absent.
 */
public class EnvironmentException extends RuntimeException {
    public EnvironmentException(String message) {
        super(message);
    }

    public EnvironmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
