package com.askdb.stream;

import java.util.Objects;

/**
 * Label tokens that introduce the regions of a generated answer. Matched case-insensitively.
 *
 * @param sqlLabel label before the SQL region
 * @param explanationLabel label before the explanation region
 */
public record SectionLabels(String sqlLabel, String explanationLabel) {

    public static final SectionLabels DEFAULT = new SectionLabels("sql:", "explanation:");

    public SectionLabels {
        Objects.requireNonNull(sqlLabel, "sqlLabel");
        Objects.requireNonNull(explanationLabel, "explanationLabel");
        if (sqlLabel.isBlank() || explanationLabel.isBlank()) {
            throw new IllegalArgumentException("Section labels must not be blank");
        }
    }

    public String labelFor(Section section) {
        return section == Section.SQL ? sqlLabel : explanationLabel;
    }
}
