package space.ketterling.wxstats.config;

import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups the runtime settings for the database pool, schema
 * migration and station file ingest.
 * </p>
 */
public record AppConfig(
        // DB
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax,
        boolean dbMigrate,

        // Ingest
        String dataDir,
        int batchSize) {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final int DEFAULT_BATCH_SIZE = 1000;

    public AppConfig {
        if (batchSize < 1)
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
    }

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            log.warn("Could not read application.properties, using env/system properties only", e);
        }
        return load(p);
    }

    /**
     * Builds the configuration from the given properties, still letting env vars
     * and -D properties win.
     */
    static AppConfig load(Properties p) {
        // Required
        String dbUrl = requireNonBlank("DB_JDBC_URL", envOr(p, "DB_JDBC_URL", "db.jdbcUrl", ""));
        String dbUser = envOr(p, "DB_USERNAME", "db.username", "");
        String dbPass = envOr(p, "DB_PASSWORD", "db.password", ""); // ok empty if local trust auth

        int dbPoolMax = Integer.parseInt(envOr(p, "DB_POOL_MAX", "db.poolMax", "8"));
        boolean migrate = Boolean.parseBoolean(envOr(p, "DB_MIGRATE", "db.migrate", "true"));

        String dataDir = envOr(p, "DATA_DIR", "ingest.dataDir", "wx_data");
        int batchSize = Integer.parseInt(envOr(p, "INGEST_BATCH_SIZE", "ingest.batchSize",
                Integer.toString(DEFAULT_BATCH_SIZE)));

        return new AppConfig(
                dbUrl,
                dbUser,
                dbPass,
                dbPoolMax,
                migrate,

                dataDir,
                batchSize);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v.trim();
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys.trim();
        return p.getProperty(propKey, def).trim();
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String name, String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + name + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }
}
