package org.promoharvest.pipeline.services;

import com.typesafe.config.Config;
import org.promoharvest.pipeline.api.catalog.ICatalogImporter;
import org.promoharvest.pipeline.api.catalog.ImportResult;
import org.promoharvest.pipeline.api.records.HarvestRecord;
import org.promoharvest.pipeline.api.records.IdentityResolver;
import org.promoharvest.pipeline.api.resources.IResource;
import org.promoharvest.pipeline.utils.PathExpansion;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pushes the merged record log to the catalog in chunks. Rejected records are logged and skipped;
 * there is no retry beyond that. Anonymous records are not imported.
 * <p>
 * Resources: {@code importer} ({@link ICatalogImporter}, required). Options: {@code recordLog},
 * {@code batchSize} (default 25), {@code identityFields}, {@code dryRun}.
 */
public class CatalogImportService extends AbstractService {

    private final ICatalogImporter importer;
    private final Path recordLog;
    private final int batchSize;
    private final boolean dryRun;
    private final IdentityResolver resolver;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong chunks = new AtomicLong();

    public CatalogImportService(String name, Config options, Map<String, List<IResource>> resources) {
        super(name, options, resources);
        this.importer = getRequiredResource("importer", ICatalogImporter.class);
        if (!options.hasPath("recordLog")) {
            throw new IllegalArgumentException("CatalogImportService requires 'recordLog'");
        }
        this.recordLog = PathExpansion.resolve(options.getString("recordLog"));
        this.batchSize = options.hasPath("batchSize") ? options.getInt("batchSize") : 25;
        this.dryRun = options.hasPath("dryRun") && options.getBoolean("dryRun");
        this.resolver = new IdentityResolver(options.hasPath("identityFields")
            ? options.getStringList("identityFields") : IdentityResolver.DEFAULT_FIELDS);
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
    }

    @Override
    protected void logStarted() {
        log.info("CatalogImportService started: log={}, batchSize={}, dryRun={}", recordLog, batchSize, dryRun);
    }

    @Override
    protected void run() throws InterruptedException {
        if (!Files.isRegularFile(recordLog)) {
            throw new IllegalStateException("Record log not found: " + recordLog);
        }
        List<HarvestRecord> records;
        try {
            records = JsonLinesCodec.readAll(recordLog);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read record log " + recordLog, e);
        }

        List<HarvestRecord> chunk = new ArrayList<>(batchSize);
        for (HarvestRecord record : records) {
            if (isStopRequested()) {
                break;
            }
            checkPause();
            if (resolver.resolve(record).isEmpty()) {
                skipped.incrementAndGet();
                continue;
            }
            chunk.add(record);
            if (chunk.size() >= batchSize) {
                submit(chunk);
                chunk = new ArrayList<>(batchSize);
            }
        }
        if (!chunk.isEmpty() && !isStopRequested()) {
            submit(chunk);
        }
        log.info("Catalog import finished: {} accepted, {} rejected, {} skipped", accepted.get(), rejected.get(), skipped.get());
    }

    private void submit(List<HarvestRecord> chunk) throws InterruptedException {
        chunks.incrementAndGet();
        if (dryRun) {
            log.info("Dry run: would import {} records", chunk.size());
            accepted.addAndGet(chunk.size());
            return;
        }
        List<ImportResult> results = importer.importRecords(chunk);
        for (ImportResult result : results) {
            if (result.accepted()) {
                accepted.incrementAndGet();
            } else {
                rejected.incrementAndGet();
                log.warn("Catalog rejected record '{}': {}", result.identity(), result.reason());
                recordError("IMPORT_REJECTED", "Catalog rejected record",
                    String.format("Identity: %s, Reason: %s", result.identity(), result.reason()));
            }
        }
    }

    public long getAccepted() {
        return accepted.get();
    }

    public long getRejected() {
        return rejected.get();
    }

    public long getSkipped() {
        return skipped.get();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("records_accepted", accepted.get());
        metrics.put("records_rejected", rejected.get());
        metrics.put("records_skipped", skipped.get());
        metrics.put("chunks_submitted", chunks.get());
    }
}
