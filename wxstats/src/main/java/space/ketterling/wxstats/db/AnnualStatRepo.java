package space.ketterling.wxstats.db;

import com.zaxxer.hikari.HikariDataSource;

import space.ketterling.wxstats.model.AnnualStat;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database access for per-station annual summaries.
 */
public class AnnualStatRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(AnnualStatRepo.class);

    private static final String SELECT_COLUMNS = "SELECT station_id, stat_year, avg_max_temp_c, avg_min_temp_c, "
            + "total_precip_cm, created_at, updated_at FROM annual_weather_stat";

    /**
     * Creates a repo backed by the provided datasource.
     */
    public AnnualStatRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Overwrites the derived values of an existing (station, year) row, or
     * inserts it when absent. Runs on the caller's connection so it can share a
     * transaction with the read that produced the values.
     *
     * @return true if a new row was inserted
     */
    public boolean upsert(Connection c, AnnualStat s) throws Exception {
        String update = "UPDATE annual_weather_stat SET avg_max_temp_c=?, avg_min_temp_c=?, total_precip_cm=?, "
                + "updated_at=CURRENT_TIMESTAMP WHERE station_id=? AND stat_year=?";
        try (PreparedStatement ps = c.prepareStatement(update)) {
            setDouble(ps, 1, s.avgMaxTempC());
            setDouble(ps, 2, s.avgMinTempC());
            setDouble(ps, 3, s.totalPrecipitationCm());
            ps.setString(4, s.stationId());
            ps.setInt(5, s.year());
            if (ps.executeUpdate() > 0) {
                log.debug("upsert (update): {} {}", s.stationId(), s.year());
                return false;
            }
        }

        String insert = "INSERT INTO annual_weather_stat "
                + "(station_id, stat_year, avg_max_temp_c, avg_min_temp_c, total_precip_cm) VALUES (?, ?, ?, ?, ?)";
        try (PreparedStatement ps = c.prepareStatement(insert)) {
            ps.setString(1, s.stationId());
            ps.setInt(2, s.year());
            setDouble(ps, 3, s.avgMaxTempC());
            setDouble(ps, 4, s.avgMinTempC());
            setDouble(ps, 5, s.totalPrecipitationCm());
            ps.executeUpdate();
        }
        log.debug("upsert (insert): {} {}", s.stationId(), s.year());
        return true;
    }

    /**
     * Returns the summary for a station and year, if one has been computed.
     */
    public Optional<AnnualStat> find(String stationId, int year) throws Exception {
        String sql = SELECT_COLUMNS + " WHERE station_id=? AND stat_year=?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, stationId);
            ps.setInt(2, year);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Lists summaries matching the filter, newest year first then station id.
     */
    public List<AnnualStat> list(AnnualStatFilter filter, int offset, int limit) throws Exception {
        int pageSize = Paging.checkedLimit(offset, limit);
        List<Object> args = new ArrayList<>();
        String sql = SELECT_COLUMNS + where(filter, args)
                + " ORDER BY stat_year DESC, station_id ASC LIMIT ? OFFSET ?";
        args.add(pageSize);
        args.add(offset);

        List<AnnualStat> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            DailyRecordRepo.bindArgs(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    /**
     * Counts summaries matching the filter.
     */
    public long count(AnnualStatFilter filter) throws Exception {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM annual_weather_stat" + where(filter, args);
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            DailyRecordRepo.bindArgs(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private static String where(AnnualStatFilter f, List<Object> args) {
        List<String> clauses = new ArrayList<>();
        if (f.stationId() != null) {
            clauses.add("station_id=?");
            args.add(f.stationId());
        }
        if (f.year() != null) {
            clauses.add("stat_year=?");
            args.add(f.year());
        }
        if (f.fromYear() != null) {
            clauses.add("stat_year>=?");
            args.add(f.fromYear());
        }
        if (f.toYear() != null) {
            clauses.add("stat_year<=?");
            args.add(f.toYear());
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    /**
     * Writes a nullable double to a prepared statement.
     */
    private static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null)
            ps.setNull(idx, java.sql.Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }

    private static Double getDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }

    private static AnnualStat map(ResultSet rs) throws SQLException {
        return new AnnualStat(
                rs.getString("station_id"),
                rs.getInt("stat_year"),
                getDouble(rs, "avg_max_temp_c"),
                getDouble(rs, "avg_min_temp_c"),
                getDouble(rs, "total_precip_cm"),
                rs.getObject("created_at", OffsetDateTime.class),
                rs.getObject("updated_at", OffsetDateTime.class));
    }
}
