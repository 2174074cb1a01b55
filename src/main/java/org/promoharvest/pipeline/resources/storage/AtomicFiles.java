package org.promoharvest.pipeline.resources.storage;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Crash-safe file replacement: content goes to {@code <name>.<uuid>.tmp} next to the target, is
 * fsynced, and is then atomically moved over the target. A reader never sees a half-written target.
 * Listings must skip {@link #isTempFile(Path) temp files}.
 */
public final class AtomicFiles {

    static final String TEMP_SUFFIX = ".tmp";

    private AtomicFiles() {
    }

    @FunctionalInterface
    public interface ContentWriter {
        void writeTo(OutputStream out) throws IOException;
    }

    public static void write(Path target, byte[] data) throws IOException {
        write(target, out -> out.write(data));
    }

    /**
     * Streams content into a temp file and atomically moves it over {@code target}.
     * On any failure the temp file is removed and the target is left untouched.
     */
    public static void write(Path target, ContentWriter content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve(target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            try (FileOutputStream fos = new FileOutputStream(temp.toFile());
                 OutputStream out = new BufferedOutputStream(fos)) {
                content.writeTo(out);
                out.flush();
                fos.getFD().sync();
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    public static boolean isTempFile(Path path) {
        return path.getFileName().toString().endsWith(TEMP_SUFFIX);
    }

    /**
     * Path of a sibling file that shares {@code base}'s name plus a suffix, e.g. {@code records.jsonl.checkpoint}.
     */
    public static Path sibling(Path base, String suffix) {
        return base.resolveSibling(base.getFileName() + suffix);
    }
}
