package org.promoharvest.pipeline.resources.storage;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.promoharvest.junit.extensions.logging.ExpectLog;
import org.promoharvest.junit.extensions.logging.LogLevel;
import org.promoharvest.junit.extensions.logging.LogWatchExtension;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CheckpointStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void checkpoint_usesSnakeCaseKeys() throws Exception {
        CheckpointStore store = new CheckpointStore(tempDir.resolve("records.jsonl"));

        store.writeCheckpoint(new Checkpoint("P-9", 9));

        assertThat(Files.readString(store.checkpointFile()))
            .contains("\"last_valid_identity\":\"P-9\"")
            .contains("\"last_valid_line\":9");
        assertThat(store.readCheckpoint()).contains(new Checkpoint("P-9", 9));
    }

    @Test
    void resumePoint_roundTripsAndClears() throws Exception {
        CheckpointStore store = new CheckpointStore(tempDir.resolve("records.jsonl"));

        store.writeResumePoint(new ResumePoint("P-3", 3, "2024-03-01T12:00:00Z"));
        assertThat(store.readResumePoint()).hasValueSatisfying(r -> assertThat(r.lastAttemptedIdentity()).isEqualTo("P-3"));

        store.clearResumePoint();
        assertThat(store.readResumePoint()).isEmpty();
        assertThat(store.resumeFile()).doesNotExist();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unreadable state file .*")
    void unreadableFileIsTreatedAsAbsent() throws Exception {
        CheckpointStore store = new CheckpointStore(tempDir.resolve("records.jsonl"));
        Files.writeString(store.checkpointFile(), "{\"last_valid_identity\": ");

        assertThat(store.readCheckpoint()).isEmpty();
    }

    @Test
    void missingFileIsAbsentWithoutWarning() {
        CheckpointStore store = new CheckpointStore(tempDir.resolve("records.jsonl"));

        assertThat(store.readCheckpoint()).isEmpty();
        assertThat(store.readResumePoint()).isEmpty();
    }
}
