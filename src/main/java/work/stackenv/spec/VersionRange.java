package work.stackenv.spec;

/**
 * Inclusive version interval. A missing bound is open; the upper bound also admits versions it prefixes, so
 * {@code :1.4} contains {@code 1.4.3} and the single-version range {@code 1.2} contains {@code 1.2.7}.
 */
public record VersionRange(Version lower, Version upper) {
    public static final VersionRange ANY = new VersionRange(null, null);

    public VersionRange {
        if (lower != null && upper != null && lower.compareTo(upper) > 0) {
            throw new IllegalArgumentException("Invalid version range " + lower + ":" + upper);
        }
    }

    public static VersionRange exactly(Version version) {
        return new VersionRange(version, version);
    }

    public static VersionRange parse(String raw) {
        String trimmed = raw.trim();
        int colon = trimmed.indexOf(':');
        if (colon < 0) {
            return exactly(Version.parse(trimmed));
        }
        String low = trimmed.substring(0, colon).trim();
        String high = trimmed.substring(colon + 1).trim();
        return new VersionRange(
            low.isEmpty() ? null : Version.parse(low),
            high.isEmpty() ? null : Version.parse(high)
        );
    }

    public boolean contains(Version version) {
        if (lower != null && version.compareTo(lower) < 0) {
            return false;
        }
        return upper == null || version.compareTo(upper) <= 0 || version.startsWith(upper);
    }

    public boolean intersects(VersionRange other) {
        return belowOrPrefixed(lower, other.upper) && belowOrPrefixed(other.lower, upper);
    }

    public boolean isSingleVersion() {
        return lower != null && lower.equals(upper);
    }

    private static boolean belowOrPrefixed(Version low, Version high) {
        if (low == null || high == null) {
            return true;
        }
        return low.compareTo(high) <= 0 || low.startsWith(high);
    }

    @Override
    public String toString() {
        if (isSingleVersion()) {
            return lower.toString();
        }
        return (lower == null ? "" : lower.toString()) + ":" + (upper == null ? "" : upper.toString());
    }
}
