package com.purchasingpower.forksync.git;

import com.purchasingpower.forksync.exception.BusyException;
import com.purchasingpower.forksync.exception.ForkSyncException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Exclusive lock over a repository's working tree and ref namespace for the duration of a run.
 *
 * <p>Backed by an OS file lock on {@code <git-dir>/forksync.lock}, so it excludes other processes
 * as well as other runs in the same JVM. Acquisition never waits: a held lock fails fast with
 * {@link BusyException}.
 */
@Slf4j
public final class WorkspaceLock implements AutoCloseable {

    public static final String LOCK_FILE_NAME = "forksync.lock";

    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private WorkspaceLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    public static WorkspaceLock acquire(GitRepositoryHandle handle) {
        return acquire(handle.gitDir().resolve(LOCK_FILE_NAME));
    }

    public static WorkspaceLock acquire(Path lockFile) {
        FileChannel channel;
        try {
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ForkSyncException("Cannot open lock file " + lockFile, e);
        }

        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        } catch (IOException e) {
            closeQuietly(channel);
            throw new ForkSyncException("Cannot lock " + lockFile, e);
        }

        if (lock == null) {
            closeQuietly(channel);
            throw new BusyException("Another sync run holds " + lockFile);
        }

        WorkspaceLock acquired = new WorkspaceLock(lockFile, channel, lock);
        acquired.writeOwner();
        log.debug("Acquired {}", lockFile);
        return acquired;
    }

    public boolean isHeld() {
        return lock.isValid();
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
            channel.close();
            log.debug("Released {}", lockFile);
        } catch (IOException e) {
            throw new ForkSyncException("Failed to release " + lockFile, e);
        }
    }

    private void writeOwner() {
        String owner = ProcessHandle.current().pid() + " " + Instant.now() + "\n";
        try {
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(owner.getBytes(StandardCharsets.UTF_8)));
        } catch (IOException e) {
            log.warn("Could not record lock owner in {}: {}", lockFile, e.getMessage());
        }
    }

    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock channel: {}", e.getMessage());
        }
    }
}
