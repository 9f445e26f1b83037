package space.ketterling.wxstats.db;

import java.time.LocalDate;

/**
 * Optional criteria for listing daily records. Null fields are ignored; date
 * bounds are inclusive.
 */
public record DailyRecordFilter(String stationId, LocalDate date, LocalDate from, LocalDate to) {

    public static DailyRecordFilter all() {
        return new DailyRecordFilter(null, null, null, null);
    }

    public static DailyRecordFilter station(String stationId) {
        return new DailyRecordFilter(stationId, null, null, null);
    }

    public DailyRecordFilter onDate(LocalDate d) {
        return new DailyRecordFilter(stationId, d, from, to);
    }

    public DailyRecordFilter between(LocalDate start, LocalDate end) {
        return new DailyRecordFilter(stationId, date, start, end);
    }
}
