package work.stackenv.env;

/**
 * No environment with the requested name exists.
 */
public final class UnknownEnvironmentException extends EnvironmentException {
    private final String environmentName;

    public UnknownEnvironmentException(String environmentName) {
        super("No such environment: '" + environmentName + "'");
        this.environmentName = environmentName;
    }

    public String environmentName() {
        return environmentName;
    }
}
