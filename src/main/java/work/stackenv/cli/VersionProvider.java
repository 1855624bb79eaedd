package work.stackenv.cli;

import picocli.CommandLine;
import work.stackenv.env.Lockfile;

/**
 * Reports the jar's implementation version along with the lockfile format it writes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String UNRELEASED = "development";

    @Override
    public String[] getVersion() {
        Package pkg = Main.class.getPackage();
        String version = pkg == null || pkg.getImplementationVersion() == null
            ? UNRELEASED
            : pkg.getImplementationVersion();
        return new String[] {
            "stackenv " + version,
            "lockfile format " + Lockfile.CURRENT_VERSION + ", java " + Runtime.version().feature()
        };
    }
}
