package org.promoharvest.pipeline.resources.catalog;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.promoharvest.pipeline.api.catalog.ICatalogImporter;
import org.promoharvest.pipeline.api.catalog.ImportResult;
import org.promoharvest.pipeline.api.records.HarvestRecord;
import org.promoharvest.pipeline.api.records.IdentityResolver;
import org.promoharvest.pipeline.resources.AbstractResource;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Posts each record as JSON to a catalog webhook. HTTP 200 and 201 are accepts, 409 (already present)
 * counts as accepted as well; anything else is a rejection carrying the status and a body excerpt.
 */
public class HttpCatalogImporter extends AbstractResource implements ICatalogImporter {

    private static final Logger log = LoggerFactory.getLogger(HttpCatalogImporter.class);

    private static final Set<Integer> ACCEPTED = Set.of(200, 201, 409);
    private static final int EXCERPT_LENGTH = 200;

    private final HttpClient client;
    private final URI webhookUrl;
    private final String apiKey;
    private final Duration timeout;
    private final IdentityResolver resolver;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public HttpCatalogImporter(String name, Config options) {
        super(name, options);
        Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "timeoutSeconds", 30,
            "identityFields", IdentityResolver.DEFAULT_FIELDS
        )));
        if (!config.hasPath("webhookUrl")) {
            throw new IllegalArgumentException("HttpCatalogImporter '" + name + "' requires 'webhookUrl'");
        }
        this.webhookUrl = URI.create(config.getString("webhookUrl"));
        String key = config.hasPath("apiKey") ? config.getString("apiKey") : null;
        if ((key == null || key.isBlank()) && config.hasPath("apiKeyEnv")) {
            key = System.getenv(config.getString("apiKeyEnv"));
        }
        this.apiKey = key;
        this.timeout = Duration.ofSeconds(config.getLong("timeoutSeconds"));
        this.resolver = new IdentityResolver(config.getStringList("identityFields"));
        this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public List<ImportResult> importRecords(List<HarvestRecord> records) throws InterruptedException {
        List<ImportResult> results = new ArrayList<>(records.size());
        for (HarvestRecord record : records) {
            results.add(post(record));
        }
        return results;
    }

    private ImportResult post(HarvestRecord record) throws InterruptedException {
        String identity = resolver.resolve(record).orElse(null);
        HttpRequest.Builder request = HttpRequest.newBuilder(webhookUrl)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(JsonLinesCodec.encode(record), StandardCharsets.UTF_8));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("X-API-Key", apiKey);
        }
        try {
            HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (ACCEPTED.contains(status)) {
                accepted.incrementAndGet();
                return ImportResult.accepted(identity, status == 409 ? "already exists" : "HTTP " + status);
            }
            rejected.incrementAndGet();
            return ImportResult.rejected(identity, "HTTP " + status + ": " + excerpt(response.body()));
        } catch (IOException e) {
            rejected.incrementAndGet();
            log.debug("Import of {} failed", identity, e);
            recordError("IMPORT_FAILED", "Catalog request failed", "Identity: " + identity + ", Error: " + e.getMessage());
            return ImportResult.rejected(identity, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static String excerpt(String body) {
        if (body == null) {
            return "";
        }
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() <= EXCERPT_LENGTH ? flat : flat.substring(0, EXCERPT_LENGTH) + "...";
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("records_accepted", accepted.get());
        metrics.put("records_rejected", rejected.get());
    }
}
