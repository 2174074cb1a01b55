package org.promoharvest.pipeline.resources.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only record of identities that ended a run without a record, kept in {@code <log>.failed}.
 * One JSON object per line; a later line for the same identity supersedes earlier ones.
 */
public class FailedIdentityLedger {

    private static final Logger log = LoggerFactory.getLogger(FailedIdentityLedger.class);

    public static final String SUFFIX = ".failed";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
        @JsonProperty("identity") String identity,
        @JsonProperty("kind") String kind,
        @JsonProperty("message") String message,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("at") String at
    ) {
    }

    private final ObjectMapper mapper = JsonLinesCodec.mapper();
    private final Path file;

    public FailedIdentityLedger(Path recordLog) {
        this.file = AtomicFiles.sibling(recordLog, SUFFIX);
    }

    public Path file() {
        return file;
    }

    public void append(Entry entry) throws IOException {
        Files.write(file, (toJson(entry) + "\n").getBytes(StandardCharsets.UTF_8),
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    }

    /**
     * @return the latest entry per identity, in first-appearance order
     */
    public Map<String, Entry> load() throws IOException {
        Map<String, Entry> entries = new LinkedHashMap<>();
        if (!Files.isRegularFile(file)) {
            return entries;
        }
        JsonLinesCodec.forEachLine(file, (lineNumber, line) -> {
            if (line.isBlank()) {
                return;
            }
            try {
                Entry entry = mapper.readValue(line, Entry.class);
                if (entry.identity() != null) {
                    entries.put(entry.identity(), entry);
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed ledger line {} of {}", lineNumber, file.getFileName());
            }
        });
        return entries;
    }

    /**
     * Replaces the ledger with the given entries; an empty collection removes the file.
     */
    public void rewrite(Collection<Entry> entries) throws IOException {
        if (entries.isEmpty()) {
            Files.deleteIfExists(file);
            return;
        }
        AtomicFiles.write(file, out -> {
            for (Entry entry : entries) {
                out.write((toJson(entry) + "\n").getBytes(StandardCharsets.UTF_8));
            }
        });
    }

    private String toJson(Entry entry) {
        try {
            return mapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
