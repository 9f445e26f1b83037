package space.ketterling.wxstats.ingest;

/**
 * Thrown when a station data line does not have the expected layout.
 */
public class LineParseException extends Exception {
    private final String line;

    public LineParseException(String message, String line) {
        super(message);
        this.line = line;
    }

    public LineParseException(String message, String line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    /**
     * The raw line that failed to parse.
     */
    public String line() {
        return line;
    }
}
