package org.promoharvest.pipeline.resources.storage;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Batch file naming: {@code {prefix}_{yyyyMMdd'T'HHmmss'Z'}_{sequence:06d}.jsonl}.
 * The sequence, not the timestamp, defines merge order.
 */
public record BatchFileName(String prefix, String timestamp, long sequence) {

    public static final String EXTENSION = ".jsonl";

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private static final Pattern PATTERN = Pattern.compile("^(.+)_(\\d{8}T\\d{6}Z)_(\\d+)\\.jsonl$");

    public static BatchFileName of(String prefix, Instant createdAt, long sequence) {
        return new BatchFileName(prefix, TIMESTAMP.format(createdAt), sequence);
    }

    /**
     * Parses a batch file name, returning empty for other files (including temp files) and other prefixes.
     */
    public static Optional<BatchFileName> parse(Path file, String expectedPrefix) {
        Matcher m = PATTERN.matcher(file.getFileName().toString());
        if (!m.matches() || !m.group(1).equals(expectedPrefix)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BatchFileName(m.group(1), m.group(2), Long.parseLong(m.group(3))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public String fileName() {
        return String.format("%s_%s_%06d%s", prefix, timestamp, sequence, EXTENSION);
    }
}
