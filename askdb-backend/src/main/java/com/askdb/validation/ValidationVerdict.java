package com.askdb.validation;

/**
 * Outcome of a statement validation.
 *
 * @param accepted whether the statement may be executed
 * @param reason rejection kind, null when accepted
 * @param keyword offending keyword (lower case) for {@link RejectionKind#DISALLOWED_KEYWORD}, else null
 * @param message human readable description
 */
public record ValidationVerdict(boolean accepted, RejectionKind reason, String keyword, String message) {

    private static final ValidationVerdict ACCEPTED = new ValidationVerdict(true, null, null, "Statement accepted");

    public static ValidationVerdict accept() {
        return ACCEPTED;
    }

    public static ValidationVerdict reject(RejectionKind reason, String message) {
        return new ValidationVerdict(false, reason, null, message);
    }

    public static ValidationVerdict disallowedKeyword(String keyword) {
        return new ValidationVerdict(false, RejectionKind.DISALLOWED_KEYWORD, keyword,
                "Statement contains disallowed keyword: " + keyword);
    }
}
