package space.ketterling.wxstats.stats;

/**
 * Counters for one aggregation run. Stations and years are distinct counts
 * over the station-year groups that were enumerated.
 */
public record AggregationResult(int stationsProcessed, int yearsProcessed, int statsCalculated, int errors) {
}
