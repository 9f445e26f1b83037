package space.ketterling.wxstats.stats;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.wxstats.db.AnnualStatRepo;
import space.ketterling.wxstats.db.DailyRecordRepo;
import space.ketterling.wxstats.db.DailyRecordRepo.StationYear;
import space.ketterling.wxstats.db.DailyRecordRepo.YearTotals;
import space.ketterling.wxstats.db.Transactions;
import space.ketterling.wxstats.model.AnnualStat;

/**
 * Recomputes per-station annual summaries from the stored daily rows.
 *
 * <p>
 * Every run rewrites each group it touches, so it can be repeated at any time.
 * It takes no lock against ingestion: run it once ingestion has finished or the
 * summaries may reflect a partial year.
 * </p>
 */
public class AnnualStatsAggregator {
    private static final Logger log = LoggerFactory.getLogger(AnnualStatsAggregator.class);

    private final HikariDataSource ds;
    private final DailyRecordRepo dailyRepo;
    private final AnnualStatRepo statRepo;

    public AnnualStatsAggregator(HikariDataSource ds, DailyRecordRepo dailyRepo, AnnualStatRepo statRepo) {
        this.ds = ds;
        this.dailyRepo = dailyRepo;
        this.statRepo = statRepo;
    }

    /**
     * Aggregates every station-year found in {@code daily_weather}.
     */
    public AggregationResult aggregateAll() throws Exception {
        log.info("Starting statistics calculation");
        return aggregate(dailyRepo.listStationYears(null));
    }

    /**
     * Aggregates every year of one station.
     */
    public AggregationResult aggregateStation(String stationId) throws Exception {
        log.info("Calculating stats for station {}", stationId);
        return aggregate(dailyRepo.listStationYears(stationId));
    }

    private AggregationResult aggregate(List<StationYear> groups) {
        Instant start = Instant.now();
        log.info("Found {} station-year combinations", groups.size());

        Set<String> stations = new HashSet<>();
        Set<Integer> years = new HashSet<>();
        int calculated = 0;
        int errors = 0;
        for (StationYear g : groups) {
            stations.add(g.stationId());
            years.add(g.year());
            try {
                aggregateGroup(g.stationId(), g.year());
                calculated++;
            } catch (Exception e) {
                log.error("Error calculating stats for {} {}: {}", g.stationId(), g.year(), e.getMessage(), e);
                errors++;
            }
        }

        AggregationResult result = new AggregationResult(stations.size(), years.size(), calculated, errors);
        log.info("Completed in {} ms: stations={} years={} stats={} errors={}",
                Duration.between(start, Instant.now()).toMillis(), result.stationsProcessed(),
                result.yearsProcessed(), result.statsCalculated(), result.errors());
        return result;
    }

    /**
     * Reads one group's totals and upserts its summary in a single transaction.
     */
    AnnualStat aggregateGroup(String stationId, int year) throws Exception {
        return Transactions.inTransaction(ds, c -> {
            YearTotals t = dailyRepo.yearTotals(c, stationId, year);
            AnnualStat stat = summarize(stationId, year, t);
            boolean inserted = statRepo.upsert(c, stat);
            log.debug("{} {} {}: days={} avgMax={} avgMin={} precip={}", inserted ? "Created" : "Updated",
                    stationId, year, t.days(), stat.avgMaxTempC(), stat.avgMinTempC(), stat.totalPrecipitationCm());
            return stat;
        });
    }

    /**
     * Converts raw totals to physical units: mean max/min in Celsius, total
     * precipitation in centimeters. A value with no non-missing days is null.
     */
    static AnnualStat summarize(String stationId, int year, YearTotals t) {
        return AnnualStat.of(stationId, year,
                mean(t.maxTempSum(), t.maxTempCount(), 10.0),
                mean(t.minTempSum(), t.minTempCount(), 10.0),
                t.precipitationCount() == 0 ? null : t.precipitationSum() / 100.0);
    }

    private static Double mean(long sum, long count, double divisor) {
        if (count == 0)
            return null;
        return (double) sum / count / divisor;
    }
}
