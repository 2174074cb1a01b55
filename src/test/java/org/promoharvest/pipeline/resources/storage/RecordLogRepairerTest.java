package org.promoharvest.pipeline.resources.storage;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.promoharvest.junit.extensions.logging.LogWatchExtension;
import org.promoharvest.pipeline.api.records.DuplicatePolicy;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RecordLogRepairerTest {

    @TempDir
    Path tempDir;

    private Path recordLog;
    private RecordLogRepairer repairer;

    @BeforeEach
    void setUp() {
        recordLog = tempDir.resolve("records.jsonl");
        repairer = new RecordLogRepairer("repairer", ConfigFactory.parseMap(Map.of("recordLog", recordLog.toString())));
    }

    @Test
    void repair_keepsEveryDocumentOfConcatenatedLines() throws Exception {
        // Given: two good lines, one line with two concatenated documents and a truncated one
        Files.writeString(recordLog, String.join("\n",
            "{\"product_id\":\"a\"}",
            "{\"product_id\":\"b\"}{\"product_id\":\"c\"}",
            "{\"product_id\":\"d\",\"name\":\"tru",
            "{\"product_id\":\"e\"}") + "\n");

        RepairReport report = repairer.repair();

        assertThat(report.totalLines()).isEqualTo(4);
        assertThat(report.documents()).isEqualTo(4);
        assertThat(report.invalid()).isEqualTo(1);
        assertThat(report.multiDocumentLines()).isEqualTo(1);
        assertThat(report.survivors()).isEqualTo(4);
        assertThat(report.lastIdentity()).isEqualTo("e");
        assertThat(identities()).containsExactly("a", "b", "c", "e");
        assertThat(Files.readAllLines(recordLog)).hasSize(4);
    }

    @Test
    void repair_keepsAnonymousDocumentsWithoutDeduplicating() throws Exception {
        // Given: two identical documents without identity among identified ones
        Files.writeString(recordLog,
            "{\"product_id\":\"a\"}\n{\"name\":\"no id\"}\n{\"name\":\"no id\"}\n{\"product_id\":\"a\"}\n");

        // When
        RepairReport report = repairer.repair();

        // Then: both anonymous documents survive and never count against the identity
        assertThat(report.invalid()).isZero();
        assertThat(report.duplicates()).isEqualTo(1);
        assertThat(report.survivors()).isEqualTo(3);
        assertThat(report.lastIdentity()).isEqualTo("a");
        assertThat(JsonLinesCodec.readAll(recordLog)).extracting(r -> r.get("name")).containsExactly(null, "no id", "no id");
        assertThat(repairer.validate().isClean()).isTrue();
    }

    @Test
    void repair_keepsSiblingAppendedAfterDocumentTruncatedAtFieldBoundary() throws Exception {
        // Given: a write cut off after a comma, with the next record appended onto the same line
        Files.writeString(recordLog, String.join("\n",
            "{\"product_id\":\"a\"}",
            "{\"product_id\":\"b\",\"name\":\"pen\",{\"product_id\":\"c\",\"name\":\"cap\"}") + "\n");

        // When
        RepairReport report = repairer.repair();

        // Then
        assertThat(report.invalid()).isEqualTo(1);
        assertThat(report.survivors()).isEqualTo(2);
        assertThat(report.lastIdentity()).isEqualTo("c");
        assertThat(identities()).containsExactly("a", "c");
    }

    @Test
    void repair_keepFirstByDefaultAndKeepLastOnRequest() throws Exception {
        String content = "{\"product_id\":\"a\",\"v\":1}\n{\"product_id\":\"b\",\"v\":1}\n{\"product_id\":\"a\",\"v\":2}\n";
        Files.writeString(recordLog, content);

        RepairReport first = repairer.repair();
        assertThat(first.duplicates()).isEqualTo(1);
        assertThat(JsonLinesCodec.readAll(recordLog)).extracting(r -> r.get("v")).containsExactly(1, 1);
        assertThat(first.lastIdentity()).isEqualTo("b");

        Files.writeString(recordLog, content);
        RepairReport last = repairer.repair(DuplicatePolicy.KEEP_LAST, false);
        assertThat(JsonLinesCodec.readAll(recordLog)).extracting(r -> r.get("product_id")).containsExactly("b", "a");
        assertThat(last.lastIdentity()).isEqualTo("a");
    }

    @Test
    void repair_writesBackupAndCheckpoint() throws Exception {
        String original = "{\"product_id\":\"a\"}\n{\"product_id\":\"a\"}\n";
        Files.writeString(recordLog, original);

        repairer.repair();

        assertThat(Files.readString(AtomicFiles.sibling(recordLog, RecordLogRepairer.BACKUP_SUFFIX))).isEqualTo(original);
        assertThat(repairer.getCheckpointStore().readCheckpoint()).contains(new Checkpoint("a", 1));
    }

    @Test
    void repair_isIdempotent() throws Exception {
        Files.writeString(recordLog, "{\"product_id\":\"a\"}{\"product_id\":\"b\"}\n{\"product_id\":\"a\"}\n");

        repairer.repair();
        String once = Files.readString(recordLog);
        RepairReport again = repairer.repair();

        assertThat(Files.readString(recordLog)).isEqualTo(once);
        assertThat(again.isClean()).isTrue();
    }

    @Test
    void validate_cleanLogOnlyWritesMissingCheckpoint() throws Exception {
        Files.writeString(recordLog, "{\"product_id\":\"a\"}\n{\"product_id\":\"b\"}\n");

        RepairReport report = repairer.validate();

        assertThat(report.repaired()).isFalse();
        assertThat(report.checkpointStale()).isTrue();
        assertThat(repairer.getCheckpointStore().readCheckpoint()).contains(new Checkpoint("b", 2));
        assertThat(AtomicFiles.sibling(recordLog, RecordLogRepairer.BACKUP_SUFFIX)).doesNotExist();
    }

    @Test
    void validate_reconcilesWhenLogChangedSinceCheckpoint() throws Exception {
        Files.writeString(recordLog, "{\"product_id\":\"a\"}\n");
        repairer.validate();

        // When: records are appended behind the checkpoint's back
        Files.writeString(recordLog, "{\"product_id\":\"a\"}\n{\"product_id\":\"b\"}\n");
        RepairReport report = repairer.validate();

        assertThat(report.checkpointStale()).isTrue();
        assertThat(repairer.getCheckpointStore().readCheckpoint()).contains(new Checkpoint("b", 2));
    }

    @Test
    void validate_repairsDirtyLog() throws Exception {
        Files.writeString(recordLog, "{\"product_id\":\"a\"}\n{\"product_id\":\"a\"}\ngarbage\n");

        RepairReport report = repairer.validate();

        assertThat(report.repaired()).isTrue();
        assertThat(identities()).containsExactly("a");
    }

    @Test
    void missingLogIsEmptyAndStaysAbsent() throws Exception {
        RepairReport report = repairer.validate();

        assertThat(report.survivors()).isZero();
        assertThat(recordLog).doesNotExist();
        assertThat(repairer.readIdentities()).isEmpty();
    }

    @Test
    void requiredFieldsAreEnforced() throws Exception {
        RecordLogRepairer strict = new RecordLogRepairer("strict", ConfigFactory.parseMap(Map.of(
            "recordLog", recordLog.toString(), "requiredFields", List.of("name"))));
        Files.writeString(recordLog, "{\"product_id\":\"a\",\"name\":\"pen\"}\n{\"product_id\":\"b\"}\n");

        RepairReport report = strict.repair();

        assertThat(report.invalid()).isEqualTo(1);
        assertThat(identities()).containsExactly("a");
    }

    private List<Object> identities() throws Exception {
        return JsonLinesCodec.readAll(recordLog).stream().map(r -> r.get("product_id")).toList();
    }
}
