package org.promoharvest.pipeline.services;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.promoharvest.pipeline.resources.storage.AtomicFiles;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Publishes {@code <log>.progress.json} (counts and timing) and {@code <log>.heartbeat.json}
 * (status and timestamp) for external liveness probes. Both files are replaced atomically.
 * <p>
 * Failures to write these files are logged and otherwise ignored: they carry no correctness guarantees.
 */
public class ProgressReporter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    public static final String PROGRESS_SUFFIX = ".progress.json";
    public static final String HEARTBEAT_SUFFIX = ".heartbeat.json";

    private final ObjectMapper mapper = JsonLinesCodec.mapper();
    private final Path progressFile;
    private final Path heartbeatFile;
    private final Clock clock;
    private ScheduledExecutorService scheduler;

    public ProgressReporter(Path recordLog, Clock clock) {
        this.progressFile = AtomicFiles.sibling(recordLog, PROGRESS_SUFFIX);
        this.heartbeatFile = AtomicFiles.sibling(recordLog, HEARTBEAT_SUFFIX);
        this.clock = clock;
    }

    public Path progressFile() {
        return progressFile;
    }

    public Path heartbeatFile() {
        return heartbeatFile;
    }

    /**
     * Sets the run status and writes both files immediately.
     */
    public void transition(PipelineState state, RunStatus status, String message) {
        state.status(status);
        writeProgress(state);
        writeHeartbeat(status, message);
        log.debug("Run status is now {}", status.wireName());
    }

    public void writeProgress(PipelineState state) {
        Instant now = clock.instant();
        long elapsedSeconds = Math.max(0, Duration.between(state.startedAt(), now).getSeconds());
        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("status", state.status().wireName());
        progress.put("timestamp", now.toString());
        progress.put("started_at", state.startedAt().toString());
        progress.put("elapsed_seconds", elapsedSeconds);
        progress.put("total", state.total());
        progress.put("processed", state.processed());
        progress.put("succeeded", state.succeeded());
        progress.put("failed", state.failed());
        progress.put("empty", state.empty());
        progress.put("skipped", state.skipped());
        progress.put("deferred", state.deferred());
        progress.put("requeued", state.requeued());
        progress.put("duplicates", state.duplicates());
        progress.put("batches_flushed", state.batchesFlushed());
        progress.put("rate_per_minute", elapsedSeconds == 0 ? 0.0 : state.succeeded() * 60.0 / elapsedSeconds);
        progress.put("last_identity", state.lastIdentity());
        write(progressFile, progress);
    }

    public void writeHeartbeat(RunStatus status, String message) {
        Map<String, Object> heartbeat = new LinkedHashMap<>();
        heartbeat.put("status", status.wireName());
        heartbeat.put("timestamp", clock.instant().toString());
        heartbeat.put("message", message);
        write(heartbeatFile, heartbeat);
    }

    /**
     * Refreshes the heartbeat at a fixed cadence until {@link #close()}.
     */
    public synchronized void startHeartbeat(PipelineState state, Duration interval, String threadName) {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        long periodMs = Math.max(1, interval.toMillis());
        scheduler.scheduleAtFixedRate(() -> writeHeartbeat(state.status(),
                String.format("processed %d/%d", state.processed(), state.total())),
            periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /**
     * Reads one of the status files, as written by this class.
     */
    public static Optional<Map<String, Object>> read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(JsonLinesCodec.mapper().readValue(file.toFile(), new TypeReference<Map<String, Object>>() { }));
    }

    private void write(Path file, Map<String, Object> content) {
        try {
            AtomicFiles.write(file, mapper.writeValueAsBytes(content));
        } catch (IOException e) {
            log.warn("Failed to write {}: {}", file.getFileName(), e.getMessage());
        }
    }
}
