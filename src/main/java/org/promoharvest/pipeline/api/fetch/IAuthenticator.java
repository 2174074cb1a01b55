package org.promoharvest.pipeline.api.fetch;

/**
 * Refreshes the credentials a fetcher uses after an {@link FetchErrorKind#AUTH_EXPIRED} result.
 */
public interface IAuthenticator {

    /**
     * Attempts to obtain fresh credentials.
     *
     * @return {@code true} if new credentials are in place
     * @throws InterruptedException if interrupted while authenticating
     */
    boolean reauthenticate() throws InterruptedException;
}
