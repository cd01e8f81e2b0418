package edustats.oecd.pipeline.transformer;

import edustats.oecd.pipeline.model.CleanRecord;
import edustats.oecd.pipeline.model.CleaningResult;
import edustats.oecd.pipeline.model.DatasetKind;
import edustats.oecd.pipeline.model.FlatRecord;

import java.util.List;

/**
 * Cleans the decoded records of one dataset kind into typed rows.
 *
 * Implementations are obtained from
 * {@link edustats.oecd.pipeline.service.RecordCleanerFactory}, one per
 * {@link DatasetKind}.
 *
 * Contract:
 * - Rows that cannot be cleaned are dropped and counted, never raised
 * - Survivors keep their relative input order
 * - Every measure on an output row is finite and within the kind's bound
 *
 * @param <T> the clean record type produced
 */
public interface RecordCleaner<T extends CleanRecord> {

    /**
     * @return the dataset kind this cleaner handles
     */
    DatasetKind getKind();

    /**
     * Clean a batch and report how many rows were dropped and why.
     *
     * @param raw decoded records, in source order
     * @return surviving records plus drop tallies
     */
    CleaningResult<T> cleanWithReport(List<FlatRecord> raw);

    /**
     * Clean a batch, discarding the drop tallies.
     *
     * @param raw decoded records, in source order
     * @return surviving records
     */
    default List<T> clean(List<FlatRecord> raw) {
        return cleanWithReport(raw).getRecords();
    }
}
