package org.promoharvest.pipeline.resources.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.promoharvest.pipeline.api.fetch.FetchResult;
import org.promoharvest.pipeline.api.fetch.IAuthenticator;
import org.promoharvest.pipeline.api.fetch.IRecordFetcher;
import org.promoharvest.pipeline.api.records.HarvestRecord;
import org.promoharvest.pipeline.resources.AbstractResource;
import org.promoharvest.pipeline.utils.PathExpansion;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fetches one record per identity from an HTTP JSON API and classifies failures.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code urlTemplate}: required, {@code {identity}} is replaced with the URL-encoded identity</li>
 *   <li>{@code timeoutSeconds}: per-request timeout, default 30</li>
 *   <li>{@code recordField}: optional field of the response holding the record</li>
 *   <li>{@code token}, {@code tokenEnv}, {@code tokenFile}: credential sources, re-read on re-authentication</li>
 *   <li>{@code authHeader} (default {@code Authorization}) and {@code tokenPrefix} (default {@code "Bearer "})</li>
 *   <li>{@code headers}: extra request headers</li>
 * </ul>
 */
public class HttpRecordFetcher extends AbstractResource implements IRecordFetcher, IAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(HttpRecordFetcher.class);

    private final ObjectMapper mapper = JsonLinesCodec.mapper();
    private final HttpClient client;
    private final String urlTemplate;
    private final Duration timeout;
    private final String recordField;
    private final String authHeader;
    private final String tokenPrefix;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private volatile String token;

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong throttled = new AtomicLong();
    private final AtomicLong authFailures = new AtomicLong();
    private final AtomicLong transientFailures = new AtomicLong();
    private final AtomicLong fatalFailures = new AtomicLong();

    public HttpRecordFetcher(String name, Config options) {
        super(name, options);
        Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "timeoutSeconds", 30,
            "authHeader", "Authorization",
            "tokenPrefix", "Bearer "
        )));
        if (!config.hasPath("urlTemplate")) {
            throw new IllegalArgumentException("HttpRecordFetcher '" + name + "' requires 'urlTemplate'");
        }
        this.urlTemplate = config.getString("urlTemplate");
        if (!urlTemplate.contains("{identity}")) {
            throw new IllegalArgumentException("urlTemplate must contain '{identity}': " + urlTemplate);
        }
        this.timeout = Duration.ofSeconds(config.getLong("timeoutSeconds"));
        this.recordField = config.hasPath("recordField") ? config.getString("recordField") : null;
        this.authHeader = config.getString("authHeader");
        this.tokenPrefix = config.getString("tokenPrefix");
        if (config.hasPath("headers")) {
            for (Map.Entry<String, ConfigValue> header : config.getConfig("headers").root().entrySet()) {
                headers.put(header.getKey(), String.valueOf(header.getValue().unwrapped()));
            }
        }
        try {
            this.token = readToken().orElse(null);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read token file for '" + name + "'", e);
        }
        this.client = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public FetchResult fetch(String identity) throws InterruptedException {
        requests.incrementAndGet();
        String url = urlTemplate.replace("{identity}", URLEncoder.encode(identity, StandardCharsets.UTF_8));
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET();
        headers.forEach(request::header);
        String currentToken = token;
        if (currentToken != null) {
            request.header(authHeader, tokenPrefix + currentToken);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            transientFailures.incrementAndGet();
            return FetchResult.retryable("timeout after " + timeout.getSeconds() + "s");
        } catch (IOException e) {
            transientFailures.incrementAndGet();
            log.debug("Fetch of {} failed", identity, e);
            return FetchResult.retryable(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return classify(identity, response.statusCode(), response.body());
    }

    FetchResult classify(String identity, int status, String body) {
        if (status == 200) {
            return parse(identity, body);
        }
        if (status == 401 || status == 403) {
            authFailures.incrementAndGet();
            return FetchResult.authExpired("HTTP " + status);
        }
        if (status == 429) {
            throttled.incrementAndGet();
            return FetchResult.rateLimited("HTTP 429");
        }
        if (status == 408 || status >= 500) {
            transientFailures.incrementAndGet();
            return FetchResult.retryable("HTTP " + status);
        }
        fatalFailures.incrementAndGet();
        return FetchResult.fatal("HTTP " + status);
    }

    private FetchResult parse(String identity, String body) {
        if (body == null || body.isBlank()) {
            successes.incrementAndGet();
            return FetchResult.empty();
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (recordField != null && node != null && node.isObject()) {
                node = node.get(recordField);
            }
            if (node == null || node.isNull() || node.isMissingNode()) {
                successes.incrementAndGet();
                return FetchResult.empty();
            }
            if (!node.isObject()) {
                fatalFailures.incrementAndGet();
                return FetchResult.fatal("Response for " + identity + " is not a JSON object");
            }
            Map<String, Object> fields = mapper.convertValue(node, JsonLinesCodec.documentType());
            successes.incrementAndGet();
            return FetchResult.success(HarvestRecord.of(fields));
        } catch (JsonProcessingException e) {
            fatalFailures.incrementAndGet();
            return FetchResult.fatal("Malformed JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * Re-reads the credential sources. Succeeds when a token is available afterwards.
     */
    @Override
    public boolean reauthenticate() {
        try {
            String fresh = readToken().orElse(null);
            if (fresh == null) {
                log.warn("Re-authentication for '{}' found no token", resourceName);
                recordError("AUTH_FAILED", "No token available", "Resource: " + resourceName);
                return false;
            }
            token = fresh;
            log.debug("Reloaded credentials for '{}'", resourceName);
            return true;
        } catch (IOException e) {
            log.warn("Re-authentication for '{}' could not read token file: {}", resourceName, e.getMessage());
            recordError("AUTH_FAILED", "Token file unreadable", e.getMessage());
            return false;
        }
    }

    private Optional<String> readToken() throws IOException {
        if (options.hasPath("tokenFile")) {
            Path file = PathExpansion.resolve(options.getString("tokenFile"));
            if (Files.isRegularFile(file)) {
                String value = Files.readString(file, StandardCharsets.UTF_8).trim();
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
        }
        if (options.hasPath("tokenEnv")) {
            String value = System.getenv(options.getString("tokenEnv"));
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        if (options.hasPath("token") && !options.getString("token").isBlank()) {
            return Optional.of(options.getString("token"));
        }
        return Optional.empty();
    }

    @Override
    public ResourceState getState(String usageType) {
        return token == null && (options.hasPath("tokenFile") || options.hasPath("tokenEnv"))
            ? ResourceState.WAITING : ResourceState.ACTIVE;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("requests", requests.get());
        metrics.put("successes", successes.get());
        metrics.put("rate_limited", throttled.get());
        metrics.put("auth_failures", authFailures.get());
        metrics.put("transient_failures", transientFailures.get());
        metrics.put("fatal_failures", fatalFailures.get());
    }
}
