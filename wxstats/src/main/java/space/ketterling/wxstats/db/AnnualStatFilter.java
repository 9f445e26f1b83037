package space.ketterling.wxstats.db;

/**
 * Optional criteria for listing annual summaries. Null fields are ignored;
 * year bounds are inclusive.
 */
public record AnnualStatFilter(String stationId, Integer year, Integer fromYear, Integer toYear) {

    public static AnnualStatFilter all() {
        return new AnnualStatFilter(null, null, null, null);
    }

    public static AnnualStatFilter station(String stationId) {
        return new AnnualStatFilter(stationId, null, null, null);
    }

    public AnnualStatFilter inYear(int y) {
        return new AnnualStatFilter(stationId, y, fromYear, toYear);
    }

    public AnnualStatFilter between(Integer start, Integer end) {
        return new AnnualStatFilter(stationId, year, start, end);
    }
}
