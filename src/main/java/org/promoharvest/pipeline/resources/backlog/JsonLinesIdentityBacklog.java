package org.promoharvest.pipeline.resources.backlog;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.promoharvest.pipeline.api.backlog.IIdentityBacklog;
import org.promoharvest.pipeline.api.records.IdentityResolver;
import org.promoharvest.pipeline.resources.AbstractResource;
import org.promoharvest.pipeline.utils.PathExpansion;
import org.promoharvest.pipeline.utils.jsonl.JsonLinesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads pending identities from a links file: one JSON object per line (identity resolved from
 * {@code identityFields}) or one bare identity per line.
 */
public class JsonLinesIdentityBacklog extends AbstractResource implements IIdentityBacklog {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesIdentityBacklog.class);

    private final Path file;
    private final List<String> identityFields;

    private long lastLoaded;
    private long lastSkipped;

    public JsonLinesIdentityBacklog(String name, Config options) {
        super(name, options);
        Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "identityFields", List.of("id", "productId", "ProductID"))));
        if (!config.hasPath("file")) {
            throw new IllegalArgumentException("JsonLinesIdentityBacklog '" + name + "' requires 'file'");
        }
        this.file = PathExpansion.resolve(config.getString("file"));
        this.identityFields = config.getStringList("identityFields");
        if (identityFields.isEmpty()) {
            throw new IllegalArgumentException("identityFields must not be empty");
        }
    }

    @Override
    public List<String> loadIdentities() throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Backlog file not found: " + file);
        }
        Set<String> identities = new LinkedHashSet<>();
        long[] skipped = {0};
        JsonLinesCodec.forEachLine(file, (lineNumber, line) -> {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                return;
            }
            Optional<String> identity;
            if (trimmed.startsWith("{")) {
                List<Map<String, Object>> documents = JsonLinesCodec.extract(trimmed).documents();
                identity = documents.isEmpty()
                    ? Optional.empty()
                    : IdentityResolver.resolveIdentity(documents.get(0), identityFields);
            } else {
                identity = Optional.of(trimmed);
            }
            if (identity.isPresent()) {
                identities.add(identity.get());
            } else {
                skipped[0]++;
                log.debug("Line {} of {} has no identity", lineNumber, file.getFileName());
            }
        });
        if (skipped[0] > 0) {
            log.warn("Skipped {} backlog lines without identity in {}", skipped[0], file.getFileName());
            recordError("BACKLOG_LINES_SKIPPED", "Backlog lines without identity", "Count: " + skipped[0]);
        }
        lastLoaded = identities.size();
        lastSkipped = skipped[0];
        log.debug("Loaded {} identities from {}", identities.size(), file);
        return new ArrayList<>(identities);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("identities_loaded", lastLoaded);
        metrics.put("lines_skipped", lastSkipped);
    }
}
