/*
* Copyright 2025 Taylor Ketterling
* Daily weather repository for wxstats, the station file ingest and annual statistics pipeline.
* Utilizes HikariCP for database connection pooling; inserts are never upserts so the
* (station_id, obs_date) unique constraint is what rejects duplicates.
*/
package space.ketterling.wxstats.db;

import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.wxstats.model.DailyRecord;

import java.sql.*;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database access for daily station observations.
 */
public class DailyRecordRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(DailyRecordRepo.class);

    private static final String INSERT_SQL = "INSERT INTO daily_weather "
            + "(station_id, obs_date, max_temp, min_temp, precipitation) VALUES (?, ?, ?, ?, ?)";

    private static final String SELECT_COLUMNS = "SELECT station_id, obs_date, max_temp, min_temp, precipitation, "
            + "created_at FROM daily_weather";

    /**
     * Creates a repo backed by the provided datasource.
     */
    public DailyRecordRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Inserts all records in one transaction. Any failure rolls back the whole
     * list.
     *
     * @return number of rows inserted
     */
    public int insertAll(List<DailyRecord> records) throws Exception {
        if (records.isEmpty())
            return 0;
        int rows = Transactions.inTransaction(ds, c -> {
            try (PreparedStatement ps = c.prepareStatement(INSERT_SQL)) {
                for (DailyRecord r : records) {
                    bind(ps, r);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return records.size();
        });
        log.debug("insertAll: {} rows", rows);
        return rows;
    }

    /**
     * Inserts one record in its own transaction.
     */
    public void insert(DailyRecord r) throws Exception {
        Transactions.inTransaction(ds, c -> {
            try (PreparedStatement ps = c.prepareStatement(INSERT_SQL)) {
                bind(ps, r);
                return ps.executeUpdate();
            }
        });
        log.debug("insert: {} {}", r.stationId(), r.date());
    }

    /**
     * Returns the stored record for a station and day, if any.
     */
    public Optional<DailyRecord> find(String stationId, LocalDate date) throws Exception {
        String sql = SELECT_COLUMNS + " WHERE station_id=? AND obs_date=?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, stationId);
            ps.setDate(2, Date.valueOf(date));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Lists records matching the filter, newest date first then station id.
     */
    public List<DailyRecord> list(DailyRecordFilter filter, int offset, int limit) throws Exception {
        int pageSize = Paging.checkedLimit(offset, limit);
        List<Object> args = new ArrayList<>();
        String sql = SELECT_COLUMNS + where(filter, args)
                + " ORDER BY obs_date DESC, station_id ASC LIMIT ? OFFSET ?";
        args.add(pageSize);
        args.add(offset);

        List<DailyRecord> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bindArgs(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    /**
     * Counts records matching the filter.
     */
    public long count(DailyRecordFilter filter) throws Exception {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM daily_weather" + where(filter, args);
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bindArgs(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    /**
     * Lists the distinct (station, year) pairs present, optionally for one
     * station only.
     */
    public List<StationYear> listStationYears(String stationId) throws Exception {
        String sql = "SELECT DISTINCT station_id, CAST(EXTRACT(YEAR FROM obs_date) AS INTEGER) AS yr "
                + "FROM daily_weather"
                + (stationId == null ? "" : " WHERE station_id=?")
                + " ORDER BY station_id, yr";
        List<StationYear> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (stationId != null)
                ps.setString(1, stationId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(new StationYear(rs.getString(1), rs.getInt(2)));
            }
        }
        return out;
    }

    /**
     * Sums and counts the non-missing values of one station-year, reading on the
     * caller's connection.
     */
    public YearTotals yearTotals(Connection c, String stationId, int year) throws Exception {
        String sql = "SELECT "
                + "SUM(CASE WHEN max_temp <> ? THEN max_temp END), "
                + "COUNT(CASE WHEN max_temp <> ? THEN 1 END), "
                + "SUM(CASE WHEN min_temp <> ? THEN min_temp END), "
                + "COUNT(CASE WHEN min_temp <> ? THEN 1 END), "
                + "SUM(CASE WHEN precipitation <> ? THEN precipitation END), "
                + "COUNT(CASE WHEN precipitation <> ? THEN 1 END), "
                + "COUNT(*) "
                + "FROM daily_weather WHERE station_id=? AND obs_date >= ? AND obs_date < ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 1; i <= 6; i++)
                ps.setInt(i, DailyRecord.MISSING);
            ps.setString(7, stationId);
            ps.setDate(8, Date.valueOf(LocalDate.of(year, 1, 1)));
            ps.setDate(9, Date.valueOf(LocalDate.of(year + 1, 1, 1)));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return new YearTotals(0, 0, 0, 0, 0, 0, 0);
                return new YearTotals(
                        rs.getLong(1), rs.getLong(2),
                        rs.getLong(3), rs.getLong(4),
                        rs.getLong(5), rs.getLong(6),
                        rs.getLong(7));
            }
        }
    }

    /**
     * A station and calendar year that has at least one daily row.
     */
    public record StationYear(String stationId, int year) {
    }

    /**
     * Sums and counts over one station-year with sentinel values left out.
     * {@code days} counts every row, missing values included.
     */
    public record YearTotals(
            long maxTempSum, long maxTempCount,
            long minTempSum, long minTempCount,
            long precipitationSum, long precipitationCount,
            long days) {
    }

    private static void bind(PreparedStatement ps, DailyRecord r) throws SQLException {
        ps.setString(1, r.stationId());
        ps.setDate(2, Date.valueOf(r.date()));
        ps.setInt(3, r.maxTemp());
        ps.setInt(4, r.minTemp());
        ps.setInt(5, r.precipitation());
    }

    private static String where(DailyRecordFilter f, List<Object> args) {
        List<String> clauses = new ArrayList<>();
        if (f.stationId() != null) {
            clauses.add("station_id=?");
            args.add(f.stationId());
        }
        if (f.date() != null) {
            clauses.add("obs_date=?");
            args.add(Date.valueOf(f.date()));
        }
        if (f.from() != null) {
            clauses.add("obs_date>=?");
            args.add(Date.valueOf(f.from()));
        }
        if (f.to() != null) {
            clauses.add("obs_date<=?");
            args.add(Date.valueOf(f.to()));
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    static void bindArgs(PreparedStatement ps, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++)
            ps.setObject(i + 1, args.get(i));
    }

    private static DailyRecord map(ResultSet rs) throws SQLException {
        return new DailyRecord(
                rs.getString("station_id"),
                rs.getDate("obs_date").toLocalDate(),
                rs.getInt("max_temp"),
                rs.getInt("min_temp"),
                rs.getInt("precipitation"),
                rs.getObject("created_at", OffsetDateTime.class));
    }
}
