package org.promoharvest.pipeline.resources;

import com.typesafe.config.Config;
import org.promoharvest.pipeline.api.resources.IMonitorable;
import org.promoharvest.pipeline.api.resources.IResource;
import org.promoharvest.pipeline.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Base class for configurable resources: keeps the resource name and options, a bounded
 * error list and the metrics hook.
 * <p>
 * <strong>Error handling for resources:</strong>
 * <ul>
 *   <li>Transient problem, resource keeps working: {@code log.warn(...)} without the exception,
 *       plus {@link #recordError(String, String, String)}.</li>
 *   <li>Resource cannot continue: throw; the owning service decides whether the run aborts.</li>
 *   <li>During retries: {@code log.debug(...)} only.</li>
 * </ul>
 * Stack traces go to DEBUG.
 */
public abstract class AbstractResource implements IResource, IMonitorable {
    protected final String resourceName;
    protected final Config options;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * @return the maximum number of errors kept in memory; oldest are dropped first
     */
    protected int getMaxErrors() {
        return 1000;
    }

    /**
     * @param name    the resource name from configuration
     * @param options the {@code options} block of the resource
     */
    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    public Config getOptions() {
        return options;
    }

    @Override
    public ResourceState getState(String usageType) {
        return ResourceState.ACTIVE;
    }

    /**
     * Records a transient operational error. Use only when the resource keeps functioning.
     *
     * @param code    category, e.g. {@code "HTTP_ERROR"}
     * @param message human-readable message
     * @param details additional context
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for resource-specific metrics. Overrides must call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics mutable map already holding the base metrics
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // no custom metrics by default
    }
}
