package work.stackenv.env;

/**
 * A lockfile could not be read back: malformed content, an unsupported format version or a node whose content no
 * longer matches its hash.
 */
public final class LockfileFormatException extends RuntimeException {
    public LockfileFormatException(String source, String detail) {
        super(source + ": " + detail);
    }

    public LockfileFormatException(String source, String detail, Throwable cause) {
        super(source + ": " + detail, cause);
    }
}
