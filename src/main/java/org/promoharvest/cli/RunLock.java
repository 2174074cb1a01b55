package org.promoharvest.cli;

import org.promoharvest.pipeline.resources.storage.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive marker file {@code <log>.lock} holding the PID of the running ingest.
 * A stale lock from a crashed run must be overridden with {@code --force}.
 */
public final class RunLock implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunLock.class);
    public static final String SUFFIX = ".lock";

    private final Path file;

    private RunLock(Path file) {
        this.file = file;
    }

    /**
     * @throws LockHeldException if another run holds the lock and {@code force} is not set
     */
    public static RunLock acquire(Path recordLog, boolean force) throws IOException {
        Path file = AtomicFiles.sibling(recordLog, SUFFIX);
        byte[] pid = (currentPid() + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try {
            Files.write(file, pid, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            String holder = readHolder(file);
            if (!force) {
                throw new LockHeldException(file, holder);
            }
            LOGGER.warn("Overriding lock {} held by PID {}", file, holder);
            Files.write(file, pid);
        }
        LOGGER.debug("Acquired run lock {}", file);
        return new RunLock(file);
    }

    public Path file() {
        return file;
    }

    @Override
    public void close() throws IOException {
        Files.deleteIfExists(file);
        LOGGER.debug("Released run lock {}", file);
    }

    private static String readHolder(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8).trim();
    }

    private static String currentPid() {
        return ManagementFactory.getRuntimeMXBean().getName().split("@")[0];
    }

    public static final class LockHeldException extends IOException {
        private final String holder;

        LockHeldException(Path file, String holder) {
            super(String.format("Another ingest run holds %s (PID %s); use --force if it is no longer running",
                file, holder.isEmpty() ? "unknown" : holder));
            this.holder = holder;
        }

        public String getHolder() {
            return holder;
        }
    }
}
