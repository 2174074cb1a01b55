package org.promoharvest.pipeline.api.resources;

import java.util.Set;

/**
 * Membership set of identities that are durably ingested (or buffered for a flush).
 * Implementations must be thread-safe.
 */
public interface IIdentityTracker extends IResource {

    boolean isIngested(String identity);

    /**
     * Marks an identity as ingested if it is not already.
     *
     * @return {@code true} if the identity was new, {@code false} for a duplicate
     */
    boolean markIngested(String identity);

    /**
     * @return {@code true} if the identity was tracked
     */
    boolean remove(String identity);

    long size();

    /**
     * @return an immutable copy of the tracked identities
     */
    Set<String> snapshot();
}
