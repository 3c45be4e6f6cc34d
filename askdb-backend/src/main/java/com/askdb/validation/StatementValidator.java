package com.askdb.validation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static safety gate for generated SQL.
 *
 * <p>This is a keyword and pattern filter, not a parser. It runs before any network call and
 * never rewrites the statement. Known limits:
 * <ul>
 *   <li>a denylisted word inside a string literal is rejected</li>
 *   <li>read-only functions with side channels (e.g. {@code pg_read_file}) are accepted</li>
 * </ul>
 */
@Component
public class StatementValidator {

    private static final Pattern LEADING_SELECT = Pattern.compile("^select(\\W|$)");

    // Checked in order; the first hit is reported.
    private static final List<String> DENYLIST = List.of(
            "drop", "delete", "insert", "update", "alter", "truncate", "create",
            "grant", "revoke", "exec", "execute", "backup", "restore", "shutdown",
            "kill", "dbcc", "bulk", "openrowset", "opendatasource", "union all"
    );

    private static final List<Pattern> DENYLIST_PATTERNS = DENYLIST.stream()
            .map(k -> Pattern.compile("\\b" + k.replace(" ", "\\s+") + "\\b"))
            .toList();

    private static final Pattern PROCEDURE_PREFIX = Pattern.compile("\\b(sp_|xp_)");

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile(";\\s*(drop|delete|insert|update)\\b"),
            Pattern.compile("\\bunion\\s+select\\b"),
            Pattern.compile("\\b(or|and)\\s+(\\d+)\\s*=\\s*\\2\\b"),
            Pattern.compile("'\\s*(or|and)\\s*'([^']*)'\\s*=\\s*'\\2"),
            Pattern.compile("'\\s*or\\s*1\\s*=\\s*1\\s*(--|#|/\\*)")
    );

    /**
     * Validate a statement.
     *
     * @param sqlText statement text, may be null
     * @return verdict; the input is never modified
     */
    public ValidationVerdict validate(String sqlText) {
        if (sqlText == null || sqlText.isBlank()) {
            return ValidationVerdict.reject(RejectionKind.EMPTY_STATEMENT, "Statement is empty");
        }
        String folded = sqlText.trim().toLowerCase(Locale.ROOT);

        if (!LEADING_SELECT.matcher(folded).find()) {
            return ValidationVerdict.reject(RejectionKind.NOT_A_SELECT, "Only SELECT statements are allowed");
        }

        for (int i = 0; i < DENYLIST.size(); i++) {
            if (DENYLIST_PATTERNS.get(i).matcher(folded).find()) {
                return ValidationVerdict.disallowedKeyword(DENYLIST.get(i));
            }
        }
        Matcher procedure = PROCEDURE_PREFIX.matcher(folded);
        if (procedure.find()) {
            return ValidationVerdict.disallowedKeyword(procedure.group(1));
        }

        for (Pattern pattern : INJECTION_PATTERNS) {
            if (pattern.matcher(folded).find()) {
                return ValidationVerdict.reject(RejectionKind.INJECTION_PATTERN_DETECTED,
                        "Statement matches a SQL injection pattern");
            }
        }
        return ValidationVerdict.accept();
    }
}
