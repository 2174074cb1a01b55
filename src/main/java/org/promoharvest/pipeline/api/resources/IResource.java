package org.promoharvest.pipeline.api.resources;

/**
 * Base interface for all resources used by the ingestion pipeline.
 * <p>
 * A resource wraps one external collaborator or one piece of durable state: the fetch
 * producer, the identity backlog, the batch directory, the catalog endpoint. Resources are
 * created from configuration and handed to services by name.
 */
public interface IResource {

    /**
     * The operational state of a resource for a specific usage context.
     */
    enum ResourceState {
        /**
         * The resource is functioning normally for this usage type.
         */
        ACTIVE,
        /**
         * The resource is temporarily unavailable (e.g. remote side throttling).
         */
        WAITING,
        /**
         * The resource has an error for this usage type.
         */
        FAILED
    }

    /**
     * Returns the configured name of this resource instance.
     *
     * @return the resource name
     */
    String getResourceName();

    /**
     * Returns the current state of the resource for a specific usage context.
     *
     * @param usageType the usage type (e.g. "fetch", "batch-write"), may be {@code null}
     * @return the current state for this usage context
     */
    ResourceState getState(String usageType);
}
