package com.askdb.validation;

public enum RejectionKind {
    EMPTY_STATEMENT,
    NOT_A_SELECT,
    DISALLOWED_KEYWORD,
    INJECTION_PATTERN_DETECTED
}
