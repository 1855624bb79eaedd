package work.stackenv.config;

/**
 * Malformed configuration; the message leads with {@code file:line} as the user wrote the path.
 */
public final class ConfigFormatException extends RuntimeException {
    private final String source;
    private final int line;

    public ConfigFormatException(String source, int line, String detail) {
        this(source, line, detail, null);
    }

    public ConfigFormatException(String source, int line, String detail, Throwable cause) {
        super(location(source, line) + ": " + detail, cause);
        this.source = source;
        this.line = line;
    }

    private static String location(String source, int line) {
        return line > 0 ? source + ":" + line : source;
    }

    public String source() {
        return source;
    }

    public int line() {
        return line;
    }
}
