package org.promoharvest.pipeline.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Components that expose metrics, recent operational errors and a health flag.
 */
public interface IMonitorable {

    /**
     * Returns a snapshot of the component's metrics, keyed by snake_case metric name.
     *
     * @return metric name to current value
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded since the last {@link #clearErrors()}.
     *
     * @return a copy of the recorded errors, oldest first
     */
    List<OperationalError> getErrors();

    /**
     * Clears the list of operational errors.
     */
    void clearErrors();

    /**
     * @return {@code true} if the component is operational
     */
    boolean isHealthy();
}
