package org.promoharvest.pipeline.resources.storage;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.promoharvest.pipeline.api.records.Batch;
import org.promoharvest.pipeline.api.records.DuplicatePolicy;
import org.promoharvest.pipeline.api.records.HarvestRecord;
import org.promoharvest.pipeline.api.records.IdentityResolver;
import org.promoharvest.pipeline.api.resources.IIdentityTracker;
import org.promoharvest.pipeline.resources.AbstractResource;
import org.promoharvest.pipeline.resources.idempotency.InMemoryIdentityTracker;
import org.promoharvest.pipeline.utils.PathExpansion;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Buffers records into fixed-size batches, flushes each batch atomically to its own file and merges
 * the batch files into the record log.
 * <p>
 * Batch sequence numbers continue from the highest sequence found on disk, so merge order stays stable
 * across restarts. Identities already present in batch files are loaded at construction and rejected
 * as duplicates.
 * <p>
 * Not thread-safe: a single owner must call {@link #add(HarvestRecord)}, {@link #flush()} and {@link #merge()}.
 */
public class RecordBatcher extends AbstractResource {

    private static final Logger log = LoggerFactory.getLogger(RecordBatcher.class);

    public enum AddResult { BUFFERED, FLUSHED, DUPLICATE }

    private final Path batchDirectory;
    private final Path recordLog;
    private final String prefix;
    private final int batchSize;
    private final IdentityResolver resolver;
    private final DuplicatePolicy duplicatePolicy;
    private final boolean deleteBatchesAfterMerge;
    private final boolean mergeIntoExisting;
    private final Clock clock;

    private final IIdentityTracker seen = new InMemoryIdentityTracker();
    private final List<HarvestRecord> current = new ArrayList<>();
    private long nextSequence;

    private long batchesFlushed;
    private long recordsFlushed;
    private long duplicatesRejected;

    public RecordBatcher(String name, Config options) {
        this(name, options, Clock.systemUTC());
    }

    public RecordBatcher(String name, Config options, Clock clock) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "prefix", "batch",
            "batchSize", 100,
            "identityFields", IdentityResolver.DEFAULT_FIELDS,
            "duplicatePolicy", DuplicatePolicy.KEEP_FIRST.name(),
            "deleteBatchesAfterMerge", false,
            "mergeIntoExisting", true
        ));
        Config config = options.withFallback(defaults);
        if (!config.hasPath("batchDirectory") || !config.hasPath("recordLog")) {
            throw new IllegalArgumentException("RecordBatcher '" + name + "' requires 'batchDirectory' and 'recordLog'");
        }
        this.batchDirectory = PathExpansion.resolve(config.getString("batchDirectory"));
        this.recordLog = PathExpansion.resolve(config.getString("recordLog"));
        this.prefix = config.getString("prefix");
        this.batchSize = config.getInt("batchSize");
        this.resolver = new IdentityResolver(config.getStringList("identityFields"));
        this.duplicatePolicy = DuplicatePolicy.valueOf(config.getString("duplicatePolicy"));
        this.deleteBatchesAfterMerge = config.getBoolean("deleteBatchesAfterMerge");
        this.mergeIntoExisting = config.getBoolean("mergeIntoExisting");
        this.clock = clock;

        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
        }
        if (prefix.isBlank() || prefix.contains("/") || prefix.contains("..")) {
            throw new IllegalArgumentException("Invalid batch prefix: '" + prefix + "'");
        }
        try {
            Files.createDirectories(batchDirectory);
            this.nextSequence = loadExistingBatches();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open batch directory " + batchDirectory, e);
        }
    }

    /**
     * Adds a record to the current batch, flushing when the batch reaches capacity.
     * Records whose identity is already known are rejected; anonymous records are always accepted.
     *
     * @throws IOException if the automatic flush fails; the batch stays buffered
     */
    public AddResult add(HarvestRecord record) throws IOException {
        Optional<String> identity = resolver.resolve(record);
        if (identity.isPresent() && !seen.markIngested(identity.get())) {
            duplicatesRejected++;
            log.debug("Rejected duplicate record {}", identity.get());
            return AddResult.DUPLICATE;
        }
        current.add(record);
        if (current.size() >= batchSize) {
            flush();
            return AddResult.FLUSHED;
        }
        return AddResult.BUFFERED;
    }

    /**
     * Writes the buffered records as a new batch file, even if the batch is not full.
     *
     * @return the flushed batch, or empty if nothing was buffered
     * @throws IOException if the write fails; the records stay buffered
     */
    public Optional<Batch> flush() throws IOException {
        if (current.isEmpty()) {
            return Optional.empty();
        }
        Batch batch = new Batch(nextSequence, clock.instant(), current);
        Path file = batchDirectory.resolve(BatchFileName.of(prefix, batch.createdAt(), batch.sequence()).fileName());
        try {
            AtomicFiles.write(file, out -> JsonLinesCodec.write(out, batch.records()));
        } catch (IOException e) {
            recordError("FLUSH_FAILED", "Failed to write batch file", "File: " + file + ", Error: " + e.getMessage());
            throw e;
        }
        nextSequence++;
        current.clear();
        batchesFlushed++;
        recordsFlushed += batch.size();
        log.info("Flushed batch {} with {} records to {}", batch.sequence(), batch.size(), file.getFileName());
        return Optional.of(batch);
    }

    /**
     * Merges all batch files, in sequence order, into the record log and deduplicates by identity.
     * Existing log content is merged first unless {@code mergeIntoExisting} is off. The log is replaced atomically.
     */
    public MergeReport merge() throws IOException {
        return merge(duplicatePolicy, deleteBatchesAfterMerge);
    }

    public MergeReport merge(DuplicatePolicy policy, boolean deleteBatches) throws IOException {
        List<Path> batchFiles = listBatchFiles();
        List<Path> sources = new ArrayList<>();
        if (mergeIntoExisting && Files.isRegularFile(recordLog)) {
            sources.add(recordLog);
        }
        sources.addAll(batchFiles);

        Map<String, Long> winners = new HashMap<>();
        long[] ordinal = {0};
        for (Path source : sources) {
            JsonLinesCodec.forEachLine(source, (lineNumber, line) -> {
                for (Map<String, Object> document : JsonLinesCodec.extract(line).documents()) {
                    long at = ordinal[0]++;
                    IdentityResolver.resolveIdentity(document, resolver.candidateFields()).ifPresent(id -> {
                        if (policy == DuplicatePolicy.KEEP_LAST) {
                            winners.put(id, at);
                        } else {
                            winners.putIfAbsent(id, at);
                        }
                    });
                }
            });
        }

        long[] counts = new long[4]; // written, duplicates, anonymous, invalid
        AtomicFiles.write(recordLog, out -> {
            long[] position = {0};
            for (Path source : sources) {
                JsonLinesCodec.forEachLine(source, (lineNumber, line) -> {
                    JsonLinesCodec.LineExtraction extraction = JsonLinesCodec.extract(line);
                    counts[3] += extraction.invalidFragments();
                    for (Map<String, Object> document : extraction.documents()) {
                        long at = position[0]++;
                        Optional<String> id = IdentityResolver.resolveIdentity(document, resolver.candidateFields());
                        if (id.isPresent() && winners.get(id.get()) != at) {
                            counts[1]++;
                            continue;
                        }
                        if (id.isEmpty()) {
                            counts[2]++;
                        }
                        JsonLinesCodec.write(out, List.of(HarvestRecord.of(document)));
                        counts[0]++;
                    }
                });
            }
        });

        if (deleteBatches) {
            for (Path batchFile : batchFiles) {
                Files.deleteIfExists(batchFile);
            }
        }
        MergeReport report = new MergeReport(batchFiles.size(), counts[0], counts[1], counts[2], counts[3]);
        log.info("Merged {} batch files into {}: {} records written, {} duplicates dropped",
            report.batchFiles(), recordLog.getFileName(), report.written(), report.duplicates());
        return report;
    }

    /**
     * @return the batch files on disk, in sequence order; temp files are excluded
     */
    public List<Path> listBatchFiles() throws IOException {
        try (Stream<Path> files = Files.list(batchDirectory)) {
            return files
                .filter(p -> !AtomicFiles.isTempFile(p))
                .filter(Files::isRegularFile)
                .map(p -> BatchFileName.parse(p, prefix).map(n -> Map.entry(n.sequence(), p)))
                .flatMap(Optional::stream)
                .sorted(Map.Entry.comparingByKey(Comparator.naturalOrder()))
                .map(Map.Entry::getValue)
                .collect(Collectors.toList());
        }
    }

    public boolean isKnown(String identity) {
        return seen.isIngested(identity);
    }

    /**
     * @return identities in flushed batch files and the current buffer
     */
    public Set<String> knownIdentities() {
        return seen.snapshot();
    }

    public int bufferedCount() {
        return current.size();
    }

    public long getNextSequence() {
        return nextSequence;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public Path getRecordLog() {
        return recordLog;
    }

    public Path getBatchDirectory() {
        return batchDirectory;
    }

    public IdentityResolver getIdentityResolver() {
        return resolver;
    }

    private long loadExistingBatches() throws IOException {
        long maxSequence = 0;
        List<Path> existing = listBatchFiles();
        for (Path file : existing) {
            long sequence = BatchFileName.parse(file, prefix).map(BatchFileName::sequence).orElse(0L);
            maxSequence = Math.max(maxSequence, sequence);
            for (HarvestRecord record : JsonLinesCodec.readAll(file)) {
                resolver.resolve(record).ifPresent(seen::markIngested);
            }
        }
        if (!existing.isEmpty()) {
            log.info("Found {} existing batch files in {}, continuing at sequence {}",
                existing.size(), batchDirectory, maxSequence + 1);
        }
        return maxSequence + 1;
    }

    @Override
    public ResourceState getState(String usageType) {
        return isHealthy() ? ResourceState.ACTIVE : ResourceState.FAILED;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("batches_flushed", batchesFlushed);
        metrics.put("records_flushed", recordsFlushed);
        metrics.put("records_buffered", current.size());
        metrics.put("duplicates_rejected", duplicatesRejected);
        metrics.put("next_sequence", nextSequence);
    }
}
