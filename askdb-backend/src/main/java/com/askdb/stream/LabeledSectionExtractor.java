package com.askdb.stream;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link SectionExtractor} for answers shaped as {@code sql: ... explanation: ...}.
 *
 * <p>Every fragment is appended to the accumulated text, which is then re-scanned from the
 * start, so a label split across two fragments is still found. A label only counts when it is
 * not preceded by a letter, digit or underscore. Each region runs from the end of its label to
 * the start of the other label when that one comes later, otherwise to the end of the text.
 * Either order of the two labels is accepted. Repeated copies of a label at the start of its
 * region ({@code SQL: sql: SELECT 1}) count as one.
 *
 * <p>Not thread-safe.
 */
public class LabeledSectionExtractor implements SectionExtractor {

    private enum State {
        SEEKING,
        IN_SQL,
        IN_EXPLANATION,
        DONE
    }

    private static final Pattern CODE_FENCE_OPEN = Pattern.compile("^```[a-zA-Z0-9_-]*\\s*");
    private static final Pattern CODE_FENCE_CLOSE = Pattern.compile("\\s*```$");

    private final SectionLabels labels;
    private final Pattern strayExplanationLabel;
    private final StringBuilder accumulated = new StringBuilder();

    private State state = State.SEEKING;
    private String lastSql;
    private String lastExplanation;
    private ExtractedSections result;

    public LabeledSectionExtractor() {
        this(SectionLabels.DEFAULT);
    }

    public LabeledSectionExtractor(SectionLabels labels) {
        this.labels = labels;
        String bareLabel = labels.explanationLabel().endsWith(":")
                ? labels.explanationLabel().substring(0, labels.explanationLabel().length() - 1)
                : labels.explanationLabel();
        this.strayExplanationLabel = Pattern.compile(
                "(?i)\\s*" + Pattern.quote(bareLabel) + "\\s*:?\\s*$");
    }

    @Override
    public List<SectionSnapshot> accept(String fragment) {
        if (state == State.DONE) {
            throw new IllegalStateException("Stream already finished");
        }
        if (fragment == null || fragment.isEmpty()) {
            return List.of();
        }
        accumulated.append(fragment);

        List<Region> regions = partition(accumulated);
        List<SectionSnapshot> snapshots = new ArrayList<>(2);
        for (Region region : regions) {
            String content = region.text().stripLeading();
            if (content.isEmpty()) {
                continue;
            }
            if (region.section() == Section.SQL) {
                if (!content.equals(lastSql)) {
                    lastSql = content;
                    snapshots.add(new SectionSnapshot(Section.SQL, content, true));
                }
            } else if (!content.equals(lastExplanation)) {
                lastExplanation = content;
                snapshots.add(new SectionSnapshot(Section.EXPLANATION, content, true));
            }
        }
        state = openState(regions);
        return snapshots;
    }

    @Override
    public ExtractedSections finish() {
        if (state == State.DONE) {
            return result;
        }
        state = State.DONE;

        String sql = "";
        String explanation = "";
        boolean hasSql = false;
        for (Region region : partition(accumulated)) {
            if (region.section() == Section.SQL) {
                hasSql = true;
                String text = strayExplanationLabel.matcher(region.text()).replaceFirst("");
                sql = stripCodeFence(text.trim());
            } else {
                explanation = region.text().trim();
            }
        }
        result = new ExtractedSections(sql, explanation, hasSql);
        return result;
    }

    /**
     * Current state; exposed for tests.
     */
    String state() {
        return state.name();
    }

    private State openState(List<Region> regions) {
        if (regions.isEmpty()) {
            return State.SEEKING;
        }
        // the region found last is the one still receiving text
        return regions.get(regions.size() - 1).section() == Section.SQL ? State.IN_SQL : State.IN_EXPLANATION;
    }

    private List<Region> partition(CharSequence text) {
        String s = text.toString();
        int sqlAt = findLabel(s, labels.sqlLabel(), 0);
        int explanationAt = findLabel(s, labels.explanationLabel(), 0);

        List<Region> regions = new ArrayList<>(2);
        if (sqlAt >= 0) {
            regions.add(region(s, Section.SQL, sqlAt, explanationAt));
        }
        if (explanationAt >= 0) {
            regions.add(region(s, Section.EXPLANATION, explanationAt, sqlAt));
        }
        regions.sort(Comparator.comparingInt(Region::labelAt));
        return regions;
    }

    private Region region(String s, Section section, int labelAt, int otherLabelAt) {
        String label = labels.labelFor(section);
        int start = skipRepeatedLabels(s, label, labelAt + label.length());
        int end = otherLabelAt > labelAt ? otherLabelAt : s.length();
        if (start > end) {
            start = end;
        }
        return new Region(section, labelAt, s.substring(start, end));
    }

    private static int skipRepeatedLabels(String s, String label, int from) {
        int pos = from;
        while (true) {
            int i = pos;
            while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
                i++;
            }
            if (!s.regionMatches(true, i, label, 0, label.length())) {
                return pos;
            }
            pos = i + label.length();
        }
    }

    static int findLabel(String s, String label, int from) {
        int last = s.length() - label.length();
        for (int i = Math.max(0, from); i <= last; i++) {
            if (s.regionMatches(true, i, label, 0, label.length())
                    && (i == 0 || !isWordChar(s.charAt(i - 1)))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static String stripCodeFence(String s) {
        if (!s.startsWith("```")) {
            return s;
        }
        String out = CODE_FENCE_OPEN.matcher(s).replaceFirst("");
        out = CODE_FENCE_CLOSE.matcher(out).replaceFirst("");
        return out.trim();
    }

    private record Region(Section section, int labelAt, String text) {
    }
}
