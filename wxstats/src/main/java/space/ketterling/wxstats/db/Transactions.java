package space.ketterling.wxstats.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Explicit transaction scopes over a pooled connection.
 *
 * <p>
 * The work either commits as a whole or is rolled back before the exception
 * leaves this class.
 * </p>
 */
public final class Transactions {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(Transactions.class);

    private Transactions() {
    }

    /**
     * Runs {@code work} on one connection inside a single transaction.
     */
    public static <T> T inTransaction(HikariDataSource ds, SqlWork<T> work) throws Exception {
        try (Connection c = ds.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            Exception failure = null;
            try {
                T result = work.run(c);
                c.commit();
                return result;
            } catch (Exception e) {
                failure = e;
                rollback(c, e);
                throw e;
            } finally {
                restoreAutoCommit(c, autoCommit, failure);
            }
        }
    }

    private static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (Exception re) {
            log.warn("Rollback failed: {}", re.getMessage());
            cause.addSuppressed(re);
        }
    }

    /**
     * Restores auto-commit. A failure here never replaces the work's own
     * exception; it is attached to it instead.
     */
    private static void restoreAutoCommit(Connection c, boolean autoCommit, Exception failure) throws SQLException {
        try {
            c.setAutoCommit(autoCommit);
        } catch (SQLException ae) {
            if (failure == null)
                throw ae;
            log.warn("Restoring auto-commit failed: {}", ae.getMessage());
            failure.addSuppressed(ae);
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection c) throws Exception;
    }
}
