package org.promoharvest.pipeline.resources.backlog;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.promoharvest.junit.extensions.logging.ExpectLog;
import org.promoharvest.junit.extensions.logging.LogLevel;
import org.promoharvest.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class JsonLinesIdentityBacklogTest {

    @TempDir
    Path tempDir;

    @Test
    void loadIdentities_mixesJsonAndPlainLinesAndCollapsesDuplicates() throws Exception {
        Path links = tempDir.resolve("links.jsonl");
        Files.writeString(links, String.join("\n",
            "{\"id\":\"P-1\",\"url\":\"https://example.com/p/1\"}",
            "{\"productId\":\"P-2\"}",
            "P-3",
            "",
            "{\"ProductID\":\"P-1\"}") + "\n");

        JsonLinesIdentityBacklog backlog = backlog(links);

        assertThat(backlog.loadIdentities()).containsExactly("P-1", "P-2", "P-3");
        assertThat(backlog.getMetrics()).containsEntry("identities_loaded", 3L);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Skipped 2 backlog lines without identity in links.jsonl")
    void loadIdentities_skipsLinesWithoutIdentity() throws Exception {
        Path links = tempDir.resolve("links.jsonl");
        Files.writeString(links, "{\"url\":\"https://example.com\"}\n{\"id\":\"P-1\"}\n{broken\n");

        JsonLinesIdentityBacklog backlog = backlog(links);

        assertThat(backlog.loadIdentities()).containsExactly("P-1");
        assertThat(backlog.getErrors()).hasSize(1);
    }

    @Test
    void loadIdentities_missingFileFails() {
        JsonLinesIdentityBacklog backlog = backlog(tempDir.resolve("absent.jsonl"));

        assertThatThrownBy(backlog::loadIdentities).isInstanceOf(IOException.class)
            .hasMessageContaining("absent.jsonl");
    }

    private static JsonLinesIdentityBacklog backlog(Path file) {
        return new JsonLinesIdentityBacklog("backlog", ConfigFactory.parseMap(Map.of("file", file.toString())));
    }
}
