package work.stackenv.spec;

import java.util.Objects;

/**
 * Compiler request ({@code %gcc}, {@code %gcc@4.5:}) or, when the version is pinned, a concrete compiler.
 */
public record CompilerSpec(String name, VersionConstraint versions) {
    public CompilerSpec {
        Objects.requireNonNull(name, "name");
        versions = versions == null ? VersionConstraint.ANY : versions;
    }

    public static CompilerSpec parse(String raw) {
        String trimmed = raw.trim();
        int at = trimmed.indexOf('@');
        if (at < 0) {
            return new CompilerSpec(trimmed, VersionConstraint.ANY);
        }
        return new CompilerSpec(trimmed.substring(0, at), VersionConstraint.parse(trimmed.substring(at + 1)));
    }

    public static CompilerSpec of(String name, Version version) {
        return new CompilerSpec(name, VersionConstraint.exactly(version));
    }

    public boolean isConcrete() {
        return versions.singleVersion() != null;
    }

    public Version version() {
        return versions.singleVersion();
    }

    public boolean satisfies(CompilerSpec constraint) {
        if (!name.equals(constraint.name)) {
            return false;
        }
        if (isConcrete()) {
            return constraint.versions.contains(version());
        }
        return versions.intersects(constraint.versions);
    }

    @Override
    public String toString() {
        return versions.isAny() ? name : name + "@" + versions;
    }
}
