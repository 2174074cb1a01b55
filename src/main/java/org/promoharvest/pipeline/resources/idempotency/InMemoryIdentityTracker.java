package org.promoharvest.pipeline.resources.idempotency;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.promoharvest.pipeline.api.resources.IIdentityTracker;
import org.promoharvest.pipeline.resources.AbstractResource;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unbounded in-memory identity set. Nothing is evicted: a forgotten identity would be fetched
 * and written twice.
 */
public class InMemoryIdentityTracker extends AbstractResource implements IIdentityTracker {

    private final LinkedHashSet<String> identities;

    private final AtomicLong totalChecks = new AtomicLong(0);
    private final AtomicLong totalDuplicates = new AtomicLong(0);

    public InMemoryIdentityTracker(String name, Config options) {
        super(name, options);
        Config config = options.withFallback(ConfigFactory.parseMap(Map.of("initialCapacity", 10_000)));
        this.identities = new LinkedHashSet<>(config.getInt("initialCapacity"));
    }

    public InMemoryIdentityTracker() {
        this("identity-tracker", ConfigFactory.empty());
    }

    @Override
    public synchronized boolean isIngested(String identity) {
        totalChecks.incrementAndGet();
        return identities.contains(identity);
    }

    @Override
    public synchronized boolean markIngested(String identity) {
        totalChecks.incrementAndGet();
        if (!identities.add(identity)) {
            totalDuplicates.incrementAndGet();
            return false;
        }
        return true;
    }

    @Override
    public synchronized boolean remove(String identity) {
        return identities.remove(identity);
    }

    @Override
    public synchronized long size() {
        return identities.size();
    }

    @Override
    public synchronized Set<String> snapshot() {
        return Set.copyOf(identities);
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("tracked_identities", size());
        metrics.put("total_checks", totalChecks.get());
        metrics.put("total_duplicates", totalDuplicates.get());
    }
}
