package org.promoharvest.pipeline.resources.storage;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.promoharvest.pipeline.api.records.DuplicatePolicy;
import org.promoharvest.pipeline.api.records.HarvestRecord;
import org.promoharvest.pipeline.api.records.IdentityResolver;
import org.promoharvest.pipeline.resources.AbstractResource;
import org.promoharvest.pipeline.utils.PathExpansion;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Makes a possibly corrupted record log safe to consume.
 * <p>
 * Every well-formed object is recovered from each line, even when several objects share a line or follow
 * a truncated one. Objects missing a required field are invalid and dropped. Objects without an identity
 * are anonymous: they are kept and never deduplicated. Among objects sharing an identity one survives,
 * first-seen by default. A repair backs the log up to
 * {@code <log>.bak}, rewrites it atomically and stores a {@link Checkpoint} of the result.
 */
public class RecordLogRepairer extends AbstractResource {

    private static final Logger log = LoggerFactory.getLogger(RecordLogRepairer.class);

    public static final String BACKUP_SUFFIX = ".bak";

    private final Path recordLog;
    private final IdentityResolver resolver;
    private final List<String> requiredFields;
    private final DuplicatePolicy duplicatePolicy;
    private final boolean backup;
    private final CheckpointStore checkpoints;

    private long repairsPerformed;
    private long documentsDropped;

    public RecordLogRepairer(String name, Config options) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "identityFields", IdentityResolver.DEFAULT_FIELDS,
            "requiredFields", List.of(),
            "duplicatePolicy", DuplicatePolicy.KEEP_FIRST.name(),
            "backup", true
        ));
        Config config = options.withFallback(defaults);
        if (!config.hasPath("recordLog")) {
            throw new IllegalArgumentException("RecordLogRepairer '" + name + "' requires 'recordLog'");
        }
        this.recordLog = PathExpansion.resolve(config.getString("recordLog"));
        this.resolver = new IdentityResolver(config.getStringList("identityFields"));
        this.requiredFields = List.copyOf(config.getStringList("requiredFields"));
        this.duplicatePolicy = DuplicatePolicy.valueOf(config.getString("duplicatePolicy"));
        this.backup = config.getBoolean("backup");
        this.checkpoints = new CheckpointStore(recordLog);
    }

    public Path getRecordLog() {
        return recordLog;
    }

    public CheckpointStore getCheckpointStore() {
        return checkpoints;
    }

    /**
     * Read-only analysis with the configured duplicate policy.
     */
    public RepairReport scan() throws IOException {
        return analyze(duplicatePolicy).report;
    }

    public RepairReport repair() throws IOException {
        return repair(duplicatePolicy, backup);
    }

    /**
     * Rewrites the log with only surviving documents and stores a fresh checkpoint.
     * A missing log is treated as empty and left absent.
     */
    public RepairReport repair(DuplicatePolicy policy, boolean makeBackup) throws IOException {
        Analysis analysis = analyze(policy);
        if (!Files.exists(recordLog)) {
            return analysis.report;
        }
        if (makeBackup) {
            Path backupFile = AtomicFiles.sibling(recordLog, BACKUP_SUFFIX);
            Files.copy(recordLog, backupFile, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Backed up {} to {}", recordLog, backupFile);
        }
        AtomicFiles.write(recordLog, out -> {
            long[] ordinal = {0};
            JsonLinesCodec.forEachLine(recordLog, (lineNumber, line) -> {
                for (Map<String, Object> document : JsonLinesCodec.extract(line).documents()) {
                    long at = ordinal[0]++;
                    if (analysis.keeps(at)) {
                        JsonLinesCodec.write(out, List.of(HarvestRecord.of(document)));
                    }
                }
            });
        });
        RepairReport report = analysis.report.withOutcome(true, false);
        checkpoints.writeCheckpoint(report.toCheckpoint());
        repairsPerformed++;
        documentsDropped += report.invalid() + report.duplicates();
        log.info("Repaired {}: {} kept, {} invalid, {} duplicates, {} multi-document lines",
            recordLog.getFileName(), report.survivors(), report.invalid(), report.duplicates(), report.multiDocumentLines());
        return report;
    }

    /**
     * Compares the stored checkpoint with a fresh scan. A dirty log is repaired; a clean log with a
     * missing or disagreeing checkpoint only gets a fresh checkpoint.
     */
    public RepairReport validate() throws IOException {
        RepairReport fresh = scan();
        Optional<Checkpoint> stored = checkpoints.readCheckpoint();
        boolean stale = stored.isEmpty() || !stored.get().equals(fresh.toCheckpoint());
        if (stored.isPresent() && stale) {
            log.info("Checkpoint of {} is stale (stored {}, scanned {}), reconciling",
                recordLog.getFileName(), stored.get(), fresh.toCheckpoint());
        }
        if (!fresh.isClean()) {
            return repair().withOutcome(true, stale);
        }
        if (stale && Files.exists(recordLog)) {
            checkpoints.writeCheckpoint(fresh.toCheckpoint());
        }
        return fresh.withOutcome(false, stale);
    }

    /**
     * @return identities present in the log, in first-seen order
     */
    public Set<String> readIdentities() throws IOException {
        Set<String> identities = new LinkedHashSet<>();
        if (!Files.exists(recordLog)) {
            return identities;
        }
        JsonLinesCodec.forEachLine(recordLog, (lineNumber, line) -> {
            for (Map<String, Object> document : JsonLinesCodec.extract(line).documents()) {
                IdentityResolver.resolveIdentity(document, resolver.candidateFields()).ifPresent(identities::add);
            }
        });
        return identities;
    }

    private boolean isValid(Map<String, Object> document) {
        for (String field : requiredFields) {
            Object value = document.get(field);
            if (value == null || (value instanceof String && ((String) value).isBlank())) {
                return false;
            }
        }
        return true;
    }

    private Analysis analyze(DuplicatePolicy policy) throws IOException {
        Analysis analysis = new Analysis();
        if (!Files.exists(recordLog)) {
            analysis.report = new RepairReport(0, 0, 0, 0, 0, 0, 0, null, false, false);
            return analysis;
        }
        long[] c = new long[5]; // lines, documents, valid, invalid, multi
        long[] ordinal = {0};
        JsonLinesCodec.forEachLine(recordLog, (lineNumber, line) -> {
            c[0]++;
            JsonLinesCodec.LineExtraction extraction = JsonLinesCodec.extract(line);
            if (extraction.invalidFragments() > 0) {
                log.debug("Line {} of {}: {} unparseable fragments", lineNumber, recordLog.getFileName(), extraction.invalidFragments());
            }
            c[3] += extraction.invalidFragments();
            if (extraction.documents().size() > 1) {
                c[4]++;
            }
            for (Map<String, Object> document : extraction.documents()) {
                long at = ordinal[0]++;
                c[1]++;
                Optional<String> identity = IdentityResolver.resolveIdentity(document, resolver.candidateFields());
                if (!isValid(document)) {
                    c[3]++;
                    continue;
                }
                c[2]++;
                if (identity.isEmpty()) {
                    analysis.anonymous.add(at);
                } else if (policy == DuplicatePolicy.KEEP_LAST) {
                    analysis.winners.put(identity.get(), at);
                } else {
                    analysis.winners.putIfAbsent(identity.get(), at);
                }
            }
        });
        String lastIdentity = null;
        long lastOrdinal = -1;
        for (Map.Entry<String, Long> winner : analysis.winners.entrySet()) {
            if (winner.getValue() > lastOrdinal) {
                lastOrdinal = winner.getValue();
                lastIdentity = winner.getKey();
            }
        }
        long survivors = analysis.winners.size() + analysis.anonymous.size();
        analysis.keptOrdinals = new HashSet<>(analysis.winners.values());
        analysis.keptOrdinals.addAll(analysis.anonymous);
        analysis.report = new RepairReport(c[0], c[1], c[2], c[3], c[2] - survivors, c[4],
            survivors, lastIdentity, false, false);
        return analysis;
    }

    private static final class Analysis {
        final Map<String, Long> winners = new HashMap<>();
        final List<Long> anonymous = new ArrayList<>();
        Set<Long> keptOrdinals = Set.of();
        RepairReport report;

        boolean keeps(long ordinal) {
            return keptOrdinals.contains(ordinal);
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("repairs_performed", repairsPerformed);
        metrics.put("documents_dropped", documentsDropped);
    }

    @Override
    public String toString() {
        return "RecordLogRepairer[" + recordLog + "]";
    }
}
