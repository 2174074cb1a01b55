package org.promoharvest.pipeline.resources.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and atomically writes the small JSON state files kept next to a record log:
 * {@code <log>.checkpoint} (validated log state) and {@code <log>.resume} (run position).
 * <p>
 * An unreadable state file is reported as absent so that callers fall back to a fresh scan.
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    public static final String CHECKPOINT_SUFFIX = ".checkpoint";
    public static final String RESUME_SUFFIX = ".resume";

    private final ObjectMapper mapper = JsonLinesCodec.mapper();
    private final Path checkpointFile;
    private final Path resumeFile;

    public CheckpointStore(Path recordLog) {
        this.checkpointFile = AtomicFiles.sibling(recordLog, CHECKPOINT_SUFFIX);
        this.resumeFile = AtomicFiles.sibling(recordLog, RESUME_SUFFIX);
    }

    public Path checkpointFile() {
        return checkpointFile;
    }

    public Path resumeFile() {
        return resumeFile;
    }

    public Optional<Checkpoint> readCheckpoint() {
        return read(checkpointFile, Checkpoint.class);
    }

    public void writeCheckpoint(Checkpoint checkpoint) throws IOException {
        write(checkpointFile, checkpoint);
    }

    public Optional<ResumePoint> readResumePoint() {
        return read(resumeFile, ResumePoint.class);
    }

    public void writeResumePoint(ResumePoint point) throws IOException {
        write(resumeFile, point);
    }

    public void clearResumePoint() throws IOException {
        Files.deleteIfExists(resumeFile);
    }

    private <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            log.warn("Ignoring unreadable state file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(Path file, Object value) throws IOException {
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value, e);
        }
        AtomicFiles.write(file, json);
    }
}
