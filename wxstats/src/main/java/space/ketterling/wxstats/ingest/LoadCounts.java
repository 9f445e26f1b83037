package space.ketterling.wxstats.ingest;

/**
 * Outcome of loading some records: inserted, skipped as duplicates, or failed.
 */
public record LoadCounts(int ingested, int skipped, int errors) {
    public static final LoadCounts ZERO = new LoadCounts(0, 0, 0);

    public LoadCounts plus(LoadCounts o) {
        return new LoadCounts(ingested + o.ingested, skipped + o.skipped, errors + o.errors);
    }
}
