package space.ketterling.wxstats.db;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.LocalDate;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import space.ketterling.wxstats.model.DailyRecord;

class TransactionsTest {
    private TestDatabase db;
    private DailyRecordRepo repo;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        repo = new DailyRecordRepo(db.ds());
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void commitsOnSuccess() throws Exception {
        int rows = Transactions.inTransaction(db.ds(), c -> insertRaw(c, "S1", LocalDate.of(2020, 1, 1)));

        assertThat(rows).isEqualTo(1);
        assertThat(repo.count(DailyRecordFilter.all())).isEqualTo(1);
    }

    @Test
    void rollsBackEverythingOnFailure() throws Exception {
        assertThatThrownBy(() -> Transactions.inTransaction(db.ds(), c -> {
            insertRaw(c, "S1", LocalDate.of(2020, 1, 1));
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(repo.count(DailyRecordFilter.all())).isZero();
    }

    @Test
    void restoresAutoCommitOnPooledConnection() throws Exception {
        Transactions.inTransaction(db.ds(), c -> insertRaw(c, "S1", LocalDate.of(2020, 1, 1)));

        try (Connection c = db.ds().getConnection()) {
            assertThat(c.getAutoCommit()).isTrue();
        }
    }

    @Test
    void brokenConnectionKeepsTheWorkFailureAsPrimary() {
        assertThatThrownBy(() -> Transactions.inTransaction(db.ds(), c -> {
            insertRaw(c, "S1", LocalDate.of(2020, 1, 1));
            c.close();
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class)
                .hasMessage("boom")
                .satisfies(e -> assertThat(e.getSuppressed()).isNotEmpty());
    }

    private static int insertRaw(Connection c, String station, LocalDate date) throws Exception {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO daily_weather (station_id, obs_date, max_temp, min_temp, precipitation) "
                        + "VALUES (?, ?, 1, 1, 1)")) {
            ps.setString(1, station);
            ps.setDate(2, java.sql.Date.valueOf(date));
            return ps.executeUpdate();
        }
    }

    @Test
    void surfacesUniqueViolationFromWork() {
        DailyRecord r = new DailyRecord("S1", LocalDate.of(2020, 1, 1), 1, 1, 1);

        assertThatThrownBy(() -> {
            repo.insert(r);
            repo.insert(r);
        }).satisfies(e -> assertThat(SqlErrors.isUniqueViolation(e)).isTrue());
    }
}
