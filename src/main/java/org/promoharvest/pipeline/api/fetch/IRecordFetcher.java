package org.promoharvest.pipeline.api.fetch;

import org.promoharvest.pipeline.api.resources.IResource;

/**
 * The external fetch producer: given an identity, obtain zero or one record, or fail.
 * <p>
 * Implementations must not throw for per-identity problems; every failure is reported as a
 * classified {@link FetchResult}. Implementations must be thread-safe when used with parallel fetching.
 */
public interface IRecordFetcher extends IResource {

    /**
     * Performs a single fetch attempt. Retrying is the caller's job.
     *
     * @param identity the identity token to fetch
     * @return the outcome
     * @throws InterruptedException if interrupted while waiting on the remote side
     */
    FetchResult fetch(String identity) throws InterruptedException;
}
