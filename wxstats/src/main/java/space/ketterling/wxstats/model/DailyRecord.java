package space.ketterling.wxstats.model;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * One day of observations for one station, in the raw units of the source
 * files.
 *
 * <p>
 * Temperatures are tenths of a degree Celsius, precipitation is hundredths of
 * a centimeter, and {@link #MISSING} marks a value that was not recorded. The
 * unit accessors convert to physical units and return {@code null} for missing
 * values.
 * </p>
 *
 * @param createdAt set by the database; {@code null} on a freshly parsed record
 */
public record DailyRecord(
        String stationId,
        LocalDate date,
        int maxTemp,
        int minTemp,
        int precipitation,
        OffsetDateTime createdAt) {

    /** Sentinel for "not recorded" in every measurement column. */
    public static final int MISSING = -9999;

    public DailyRecord {
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(date, "date");
    }

    /**
     * Creates an unsaved record.
     */
    public DailyRecord(String stationId, LocalDate date, int maxTemp, int minTemp, int precipitation) {
        this(stationId, date, maxTemp, minTemp, precipitation, null);
    }

    public Double maxTempCelsius() {
        return scaled(maxTemp, 10.0);
    }

    public Double minTempCelsius() {
        return scaled(minTemp, 10.0);
    }

    public Double precipitationCm() {
        return scaled(precipitation, 100.0);
    }

    /**
     * Returns true if the value is the missing-data sentinel.
     */
    public static boolean isMissing(int raw) {
        return raw == MISSING;
    }

    private static Double scaled(int raw, double divisor) {
        return isMissing(raw) ? null : raw / divisor;
    }
}
