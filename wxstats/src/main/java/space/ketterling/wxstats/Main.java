/*
* Copyright 2025 Taylor Ketterling
* Command line entry point for wxstats, the station file ingest and annual statistics pipeline.
*
* Loads configuration, opens the connection pool, applies schema migrations and runs
* the requested job: ingest a directory of station files, recompute annual statistics,
* or both in sequence. Each job is recorded in the run log and its counters are printed
* as JSON.
*/

package space.ketterling.wxstats;

import space.ketterling.wxstats.config.AppConfig;
import space.ketterling.wxstats.db.*;
import space.ketterling.wxstats.ingest.*;
import space.ketterling.wxstats.stats.AggregationResult;
import space.ketterling.wxstats.stats.AnnualStatsAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.UUID;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_NO_DATA_DIR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "usage: wxstats ingest [dataDir] | stats [stationId] | run [dataDir]";

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        log.info("Starting wxstats");
        AppConfig cfg = AppConfig.load();
        int code = run(args, cfg, System.out);
        if (code != EXIT_OK)
            System.exit(code);
    }

    /**
     * Runs one command against the configured database and returns the exit
     * code.
     */
    static int run(String[] args, AppConfig cfg, PrintStream out) throws Exception {
        if (args.length == 0 || args.length > 2) {
            out.println(USAGE);
            return EXIT_USAGE;
        }
        String cmd = args[0];
        String arg = args.length > 1 ? args[1] : null;
        if (!cmd.equals("ingest") && !cmd.equals("stats") && !cmd.equals("run")) {
            out.println(USAGE);
            return EXIT_USAGE;
        }

        ObjectMapper om = new ObjectMapper();
        try (HikariDataSource ds = Database.createDataSource(cfg)) {
            if (cfg.dbMigrate())
                Database.migrate(ds);

            // Repos
            IngestLogRepo runLog = new IngestLogRepo(ds, om);
            DailyRecordRepo dailyRepo = new DailyRecordRepo(ds);
            AnnualStatRepo statRepo = new AnnualStatRepo(ds);

            if (cmd.equals("ingest") || cmd.equals("run")) {
                Path dataDir = Path.of(arg != null ? arg : cfg.dataDir());
                StationFileIngest ingest = new StationFileIngest(new BatchLoader(dailyRepo, cfg.batchSize()));
                IngestResult result;
                try {
                    result = recorded(runLog, "station_file_ingest", () -> ingest.ingestDirectory(dataDir));
                } catch (DirectoryNotFoundException e) {
                    log.error(e.getMessage());
                    out.println("Error: data directory '" + dataDir + "' not found");
                    return EXIT_NO_DATA_DIR;
                }
                out.println(om.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            }

            if (cmd.equals("stats") || cmd.equals("run")) {
                AnnualStatsAggregator aggregator = new AnnualStatsAggregator(ds, dailyRepo, statRepo);
                String station = cmd.equals("stats") ? arg : null;
                AggregationResult result = recorded(runLog, "annual_stats",
                        () -> station == null ? aggregator.aggregateAll() : aggregator.aggregateStation(station));
                out.println(om.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            }
        }
        return EXIT_OK;
    }

    /**
     * Runs a job under the {@code job} MDC key and records it in the run log.
     */
    private static <T> T recorded(IngestLogRepo runLog, String jobName, Job<T> job) throws Exception {
        MDC.put("job", jobName);
        UUID runId = runLog.startRun(jobName);
        try {
            T result = job.run();
            runLog.finishRun(runId, true, result);
            return result;
        } catch (Exception e) {
            try {
                runLog.finishRun(runId, false, null);
            } catch (Exception logErr) {
                e.addSuppressed(logErr);
            }
            throw e;
        } finally {
            MDC.remove("job");
        }
    }

    @FunctionalInterface
    interface Job<T> {
        T run() throws Exception;
    }
}
