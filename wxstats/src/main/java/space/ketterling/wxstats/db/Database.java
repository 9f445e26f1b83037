package space.ketterling.wxstats.db;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import space.ketterling.wxstats.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP and applies the schema.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private Database() {
    }

    /**
     * Builds the connection pool used by ingest and aggregation jobs.
     */
    public static HikariDataSource createDataSource(AppConfig cfg) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        if (!cfg.dbUsername().isBlank())
            hc.setUsername(cfg.dbUsername());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("wxstats-ingest");
        hc.setMaximumPoolSize(Math.max(2, cfg.dbPoolMax()));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }

    /**
     * Runs pending Flyway migrations from {@code classpath:db/migration}.
     *
     * @return number of migrations applied
     */
    public static int migrate(HikariDataSource ds) {
        MigrateResult result = Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .load()
                .migrate();
        log.info("Schema migration complete: applied={} version={}", result.migrationsExecuted,
                result.targetSchemaVersion);
        return result.migrationsExecuted;
    }
}
