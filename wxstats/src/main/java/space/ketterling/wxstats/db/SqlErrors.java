package space.ketterling.wxstats.db;

import java.sql.SQLException;

/**
 * Classifies JDBC failures by SQLState.
 */
public final class SqlErrors {
    /** SQLState for a unique / primary key violation (PostgreSQL, H2). */
    public static final String UNIQUE_VIOLATION = "23505";

    private SqlErrors() {
    }

    /**
     * Returns true if a unique-constraint violation appears anywhere in the
     * cause or next-exception chain.
     *
     * <p>
     * Batch drivers often wrap the real error in a BatchUpdateException whose
     * own state is generic, so both chains are walked.
     * </p>
     */
    public static boolean isUniqueViolation(Throwable t) {
        int guard = 0;
        while (t != null && guard++ < 32) {
            if (t instanceof SQLException sql) {
                if (UNIQUE_VIOLATION.equals(sql.getSQLState()))
                    return true;
                SQLException next = sql.getNextException();
                if (next != null && next != t && isUniqueViolation(next))
                    return true;
            }
            if (t.getCause() == t)
                break;
            t = t.getCause();
        }
        return false;
    }
}
