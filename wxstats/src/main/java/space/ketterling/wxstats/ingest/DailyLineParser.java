package space.ketterling.wxstats.ingest;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

import space.ketterling.wxstats.model.DailyRecord;

/**
 * Parses one line of a station daily file:
 * {@code YYYYMMDD<TAB>maxTemp<TAB>minTemp<TAB>precipitation}.
 *
 * <p>
 * Values are copied as-is; unit conversion happens on read.
 * </p>
 */
public final class DailyLineParser {
    private static final int FIELD_COUNT = 4;
    private static final Pattern DATE_PATTERN = Pattern.compile("\\d{8}");
    // BASIC_ISO_DATE is strict, so 19850230 is rejected
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private DailyLineParser() {
    }

    /**
     * Parses a line for the given station.
     *
     * @throws LineParseException on a wrong field count, a bad date or a
     *                            non-integer value
     */
    public static DailyRecord parse(String line, String stationId) throws LineParseException {
        String[] parts = line.split("\t", -1);
        if (parts.length != FIELD_COUNT)
            throw new LineParseException("Expected " + FIELD_COUNT + " fields, got " + parts.length, line);

        LocalDate date = parseDate(parts[0].trim(), line);
        int maxTemp = parseInt(parts[1], "max temp", line);
        int minTemp = parseInt(parts[2], "min temp", line);
        int precipitation = parseInt(parts[3], "precipitation", line);
        return new DailyRecord(stationId, date, maxTemp, minTemp, precipitation);
    }

    private static LocalDate parseDate(String s, String line) throws LineParseException {
        if (!DATE_PATTERN.matcher(s).matches())
            throw new LineParseException("Date is not YYYYMMDD: '" + s + "'", line);
        try {
            return LocalDate.parse(s, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new LineParseException("Invalid calendar date: '" + s + "'", line, e);
        }
    }

    private static int parseInt(String s, String field, String line) throws LineParseException {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new LineParseException("Invalid " + field + ": '" + s.trim() + "'", line, e);
        }
    }
}
