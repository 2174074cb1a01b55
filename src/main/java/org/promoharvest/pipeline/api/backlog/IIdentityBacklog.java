package org.promoharvest.pipeline.api.backlog;

import org.promoharvest.pipeline.api.resources.IResource;

import java.io.IOException;
import java.util.List;

/**
 * Source of identities pending ingestion.
 */
public interface IIdentityBacklog extends IResource {

    /**
     * Loads the current backlog. Duplicates are collapsed, keeping the first position.
     *
     * @return identities in backlog order
     * @throws IOException if the backlog cannot be read
     */
    List<String> loadIdentities() throws IOException;
}
