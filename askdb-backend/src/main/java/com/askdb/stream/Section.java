package com.askdb.stream;

/**
 * Region of a generated answer.
 */
public enum Section {
    SQL,
    EXPLANATION
}
