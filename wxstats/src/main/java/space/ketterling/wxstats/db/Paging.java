package space.ketterling.wxstats.db;

/**
 * Offset/limit checks shared by the listing queries.
 */
final class Paging {
    /** Largest page a caller can request. */
    static final int MAX_LIMIT = 1000;

    private Paging() {
    }

    /**
     * Validates the offset and returns the limit clamped to {@link #MAX_LIMIT}.
     */
    static int checkedLimit(int offset, int limit) {
        if (offset < 0)
            throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        if (limit < 1)
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        return Math.min(limit, MAX_LIMIT);
    }
}
