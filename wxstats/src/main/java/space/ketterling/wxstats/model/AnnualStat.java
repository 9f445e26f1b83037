package space.ketterling.wxstats.model;

import java.time.OffsetDateTime;

/**
 * Yearly summary for one station.
 *
 * <p>
 * Each derived value is {@code null} when every daily value feeding it was
 * missing.
 * </p>
 */
public record AnnualStat(
        String stationId,
        int year,
        Double avgMaxTempC,
        Double avgMinTempC,
        Double totalPrecipitationCm,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt) {

    /**
     * Creates an unsaved summary carrying only the derived values.
     */
    public static AnnualStat of(String stationId, int year, Double avgMaxTempC, Double avgMinTempC,
            Double totalPrecipitationCm) {
        return new AnnualStat(stationId, year, avgMaxTempC, avgMinTempC, totalPrecipitationCm, null, null);
    }
}
