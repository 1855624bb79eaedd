package work.stackenv.repo;

/**
 * No recipe for the requested package name (and namespace, if one was given).
 */
public final class PackageNotFoundException extends RuntimeException {
    private final String packageName;

    public PackageNotFoundException(String packageName, String message) {
        super(message);
        this.packageName = packageName;
    }

    public String packageName() {
        return packageName;
    }
}
