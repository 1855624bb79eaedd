package work.stackenv.install;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclusive per-hash install claims shared by every environment using the same lock directory. A claim holds an
 * in-process lock, shared by every table of this JVM, and a file lock on {@code <locks>/<hash>.lock} for other
 * processes.
 */
public final class InstallClaimTable {
    private static final Logger log = LoggerFactory.getLogger(InstallClaimTable.class);
    private static final ConcurrentMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private final Path lockDirectory;

    public InstallClaimTable(Path lockDirectory) {
        this.lockDirectory = lockDirectory;
    }

    public Path lockDirectory() {
        return lockDirectory;
    }

    /**
     * Blocks until the hash is free, then claims it. Close the returned claim to release it.
     */
    public Claim claim(String hash) throws IOException {
        Path lockFile = lockDirectory.resolve(hash + ".lock").toAbsolutePath().normalize();
        ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(lockFile, key -> new ReentrantLock());
        local.lock();
        try {
            Files.createDirectories(lockDirectory);
            FileChannel channel = FileChannel.open(
                lockFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE
            );
            try {
                FileLock fileLock = channel.lock();
                log.trace("Claimed {}", hash);
                return new Claim(hash, local, channel, fileLock);
            } catch (IOException | RuntimeException ex) {
                channel.close();
                throw ex;
            }
        } catch (IOException | RuntimeException ex) {
            local.unlock();
            throw ex;
        }
    }

    /**
     * Held install claim for one hash.
     */
    public static final class Claim implements AutoCloseable {
        private final String hash;
        private final ReentrantLock local;
        private final FileChannel channel;
        private final FileLock fileLock;

        private Claim(String hash, ReentrantLock local, FileChannel channel, FileLock fileLock) {
            this.hash = hash;
            this.local = local;
            this.channel = channel;
            this.fileLock = fileLock;
        }

        public String hash() {
            return hash;
        }

        @Override
        public void close() throws IOException {
            try {
                fileLock.release();
                channel.close();
            } finally {
                local.unlock();
            }
        }
    }
}
