package space.ketterling.wxstats.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Database access for the ingest / aggregation run log.
 */
public class IngestLogRepo {
    private final HikariDataSource ds;
    private final ObjectMapper om;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(IngestLogRepo.class);

    /**
     * Creates a repo backed by the provided datasource and JSON mapper.
     */
    public IngestLogRepo(HikariDataSource ds, ObjectMapper om) {
        this.ds = ds;
        this.om = om;
    }

    /**
     * Starts a new run and returns its unique ID.
     */
    public UUID startRun(String jobName) throws Exception {
        UUID runId = UUID.randomUUID();
        if (ds.isClosed()) {
            log.warn("startRun skipped (datasource closed): {}", jobName);
            return runId;
        }
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO ingest_run (run_id, job_name, started_at, status) "
                                + "VALUES (?, ?, CURRENT_TIMESTAMP, 'RUNNING')")) {
            ps.setObject(1, runId);
            ps.setString(2, jobName);
            ps.executeUpdate();
        }
        log.debug("startRun: {} -> {}", jobName, runId);
        return runId;
    }

    /**
     * Marks a run as success or failure; {@code counters} is stored as JSON
     * notes.
     */
    public void finishRun(UUID runId, boolean success, Object counters) throws Exception {
        if (ds.isClosed()) {
            log.warn("finishRun skipped (datasource closed): {}", runId);
            return;
        }
        String notes = counters == null ? null : om.writeValueAsString(counters);
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "UPDATE ingest_run SET finished_at=CURRENT_TIMESTAMP, status=?, notes=? WHERE run_id=?")) {
            ps.setString(1, success ? "SUCCESS" : "FAILED");
            ps.setString(2, notes);
            ps.setObject(3, runId);
            ps.executeUpdate();
        }
        log.debug("finishRun: {} success={} notes={}", runId, success, notes);
    }

    /**
     * Loads one run row.
     */
    public Optional<RunRow> findRun(UUID runId) throws Exception {
        String sql = "SELECT run_id, job_name, started_at, finished_at, status, notes FROM ingest_run WHERE run_id=?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                return Optional.of(map(rs));
            }
        }
    }

    /**
     * One row of the run log.
     */
    public record RunRow(UUID runId, String jobName, OffsetDateTime startedAt, OffsetDateTime finishedAt,
            String status, String notes) {
    }

    private static RunRow map(ResultSet rs) throws SQLException {
        return new RunRow(
                rs.getObject("run_id", UUID.class),
                rs.getString("job_name"),
                rs.getObject("started_at", OffsetDateTime.class),
                rs.getObject("finished_at", OffsetDateTime.class),
                rs.getString("status"),
                rs.getString("notes"));
    }
}
