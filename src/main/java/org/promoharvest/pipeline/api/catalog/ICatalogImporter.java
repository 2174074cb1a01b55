package org.promoharvest.pipeline.api.catalog;

import org.promoharvest.pipeline.api.records.HarvestRecord;
import org.promoharvest.pipeline.api.resources.IResource;

import java.util.List;

/**
 * Downstream catalog consumer. Accepts records and reports acceptance per record.
 */
public interface ICatalogImporter extends IResource {

    /**
     * Pushes records to the catalog.
     *
     * @param records the records to import
     * @return one result per input record, in input order
     * @throws InterruptedException if interrupted while talking to the catalog
     */
    List<ImportResult> importRecords(List<HarvestRecord> records) throws InterruptedException;
}
