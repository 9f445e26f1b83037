package space.ketterling.wxstats.ingest;

/**
 * Counters for one directory ingest run. {@code errors} covers parse, file and
 * persistence failures; duplicates are only counted in {@code recordsSkipped}.
 */
public record IngestResult(int filesProcessed, int recordsIngested, int recordsSkipped, int errors) {
    public static final IngestResult EMPTY = new IngestResult(0, 0, 0, 0);

    /**
     * Adds one loader outcome.
     */
    public IngestResult plus(LoadCounts c) {
        return new IngestResult(filesProcessed, recordsIngested + c.ingested(), recordsSkipped + c.skipped(),
                errors + c.errors());
    }

    /**
     * Adds another run's (or file's) counters.
     */
    public IngestResult plus(IngestResult o) {
        return new IngestResult(filesProcessed + o.filesProcessed, recordsIngested + o.recordsIngested,
                recordsSkipped + o.recordsSkipped, errors + o.errors);
    }

    public IngestResult plusErrors(int n) {
        return new IngestResult(filesProcessed, recordsIngested, recordsSkipped, errors + n);
    }

    public IngestResult plusFile() {
        return new IngestResult(filesProcessed + 1, recordsIngested, recordsSkipped, errors);
    }
}
