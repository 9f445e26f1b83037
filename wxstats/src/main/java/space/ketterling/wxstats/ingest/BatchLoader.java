package space.ketterling.wxstats.ingest;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.wxstats.db.DailyRecordRepo;
import space.ketterling.wxstats.db.SqlErrors;
import space.ketterling.wxstats.model.DailyRecord;

/**
 * Writes daily records in fixed-size batches.
 *
 * <p>
 * Each batch is first inserted in one transaction. If that fails on the
 * (station, date) unique constraint the batch is rolled back and replayed one
 * record per transaction, so duplicates are skipped and the rest still land.
 * Any other batch failure is not replayed; the whole batch counts as errors.
 * </p>
 */
public class BatchLoader {
    private static final Logger log = LoggerFactory.getLogger(BatchLoader.class);

    private final DailyRecordRepo repo;
    private final int batchSize;

    public BatchLoader(DailyRecordRepo repo, int batchSize) {
        if (batchSize < 1)
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        this.repo = repo;
        this.batchSize = batchSize;
    }

    public int batchSize() {
        return batchSize;
    }

    /**
     * Loads records in input order, {@link #batchSize()} at a time.
     */
    public LoadCounts load(List<DailyRecord> records) {
        LoadCounts total = LoadCounts.ZERO;
        for (int from = 0; from < records.size(); from += batchSize) {
            int to = Math.min(from + batchSize, records.size());
            total = total.plus(loadBatch(records.subList(from, to)));
        }
        return total;
    }

    /**
     * Loads one batch: bulk insert first, per-record replay on a duplicate.
     */
    public LoadCounts loadBatch(List<DailyRecord> batch) {
        if (batch.isEmpty())
            return LoadCounts.ZERO;
        try {
            repo.insertAll(batch);
            return new LoadCounts(batch.size(), 0, 0);
        } catch (Exception e) {
            if (!SqlErrors.isUniqueViolation(e)) {
                DailyRecord first = batch.get(0);
                log.error("Batch insert failed for {} records starting {} {}: {}", batch.size(),
                        first.stationId(), first.date(), e.getMessage(), e);
                return new LoadCounts(0, 0, batch.size());
            }
            log.debug("Batch of {} hit a duplicate, retrying per record", batch.size());
            return loadIndividually(batch);
        }
    }

    private LoadCounts loadIndividually(List<DailyRecord> batch) {
        int ingested = 0, skipped = 0, errors = 0;
        for (DailyRecord r : batch) {
            try {
                repo.insert(r);
                ingested++;
            } catch (Exception e) {
                if (SqlErrors.isUniqueViolation(e)) {
                    log.debug("Duplicate skipped: {} {}", r.stationId(), r.date());
                    skipped++;
                } else {
                    log.error("Insert failed for {} {}: {}", r.stationId(), r.date(), e.getMessage(), e);
                    errors++;
                }
            }
        }
        log.debug("Per-record replay: ingested={} skipped={} errors={}", ingested, skipped, errors);
        return new LoadCounts(ingested, skipped, errors);
    }
}
