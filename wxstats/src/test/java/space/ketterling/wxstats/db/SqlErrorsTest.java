package space.ketterling.wxstats.db;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.BatchUpdateException;
import java.sql.SQLException;

import org.junit.jupiter.api.Test;

class SqlErrorsTest {

    @Test
    void detectsUniqueViolationDirectly() {
        assertThat(SqlErrors.isUniqueViolation(new SQLException("dup", "23505"))).isTrue();
    }

    @Test
    void detectsUniqueViolationInNextException() {
        BatchUpdateException batch = new BatchUpdateException("Batch entry 0 was aborted", "HY000", new int[0]);
        batch.setNextException(new SQLException("duplicate key value", "23505"));

        assertThat(SqlErrors.isUniqueViolation(batch)).isTrue();
    }

    @Test
    void detectsUniqueViolationInCause() {
        Exception wrapped = new RuntimeException(new SQLException("dup", "23505"));

        assertThat(SqlErrors.isUniqueViolation(wrapped)).isTrue();
    }

    @Test
    void otherIntegrityErrorsAreNotDuplicates() {
        assertThat(SqlErrors.isUniqueViolation(new SQLException("not null", "23502"))).isFalse();
        assertThat(SqlErrors.isUniqueViolation(new SQLException("too long", "22001"))).isFalse();
        assertThat(SqlErrors.isUniqueViolation(new SQLException("no state"))).isFalse();
        assertThat(SqlErrors.isUniqueViolation(new IllegalStateException("boom"))).isFalse();
        assertThat(SqlErrors.isUniqueViolation(null)).isFalse();
    }
}
