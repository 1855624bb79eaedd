package work.stackenv.install;

import work.stackenv.spec.Spec;

/**
 * The build collaborator failed to install one node.
 */
public class BuildFailureException extends RuntimeException {
    private final transient Spec spec;

    public BuildFailureException(Spec spec, Throwable cause) {
        super("Failed to install " + spec.format() + "/" + spec.shortHash() + ": " + cause.getMessage(), cause);
        this.spec = spec;
    }

    public Spec spec() {
        return spec;
    }

    public String hash() {
        return spec.dagHash();
    }
}
