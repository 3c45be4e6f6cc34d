package com.askdb.stream;

/**
 * Authoritative regions of a finished answer.
 *
 * @param sql SQL text, empty when no SQL label appeared
 * @param explanation explanation text, possibly empty
 * @param hasSql whether the SQL label appeared at all
 */
public record ExtractedSections(String sql, String explanation, boolean hasSql) {

    public static ExtractedSections empty() {
        return new ExtractedSections("", "", false);
    }
}
