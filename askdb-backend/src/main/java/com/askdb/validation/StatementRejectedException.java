package com.askdb.validation;

/**
 * Thrown when a generated statement fails validation and must not be executed.
 */
public class StatementRejectedException extends RuntimeException {

    private final ValidationVerdict verdict;

    public StatementRejectedException(ValidationVerdict verdict) {
        super(verdict.message());
        this.verdict = verdict;
    }

    public ValidationVerdict getVerdict() {
        return verdict;
    }
}
