package com.querygate.safety;

import com.querygate.model.SafetyRule;
import com.querygate.model.SafetyVerdict;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Read-only policy applied to every query before it is sent to the warehouse, including every
 * repaired query.
 *
 * <p>Rules are evaluated in {@link SafetyRule} order and the first violation wins. The evaluation is
 * deterministic and performs no I/O.
 */
@Component
public class SqlSafetyPolicy {

    static final List<String> BLOCKED_KEYWORDS = List.of(
            "DELETE",
            "UPDATE",
            "TRUNCATE",
            "DROP",
            "ALTER",
            "INSERT",
            "MERGE",
            "CREATE",
            "REPLACE",
            "GRANT",
            "REVOKE"
    );

    private static final List<Pattern> BLOCKED_PATTERNS = BLOCKED_KEYWORDS.stream()
            .map(k -> Pattern.compile("\\b" + k + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();

    private static final Pattern ALLOWED_PREFIX = Pattern.compile("^(SELECT|WITH)\\b", Pattern.CASE_INSENSITIVE);

    private final StatementTreeInspector statementTreeInspector;

    public SqlSafetyPolicy() {
        this(new StatementTreeInspector());
    }

    public SqlSafetyPolicy(StatementTreeInspector statementTreeInspector) {
        this.statementTreeInspector = statementTreeInspector;
    }

    /**
     * Validate a query against the read-only policy.
     *
     * @param queryText query text
     * @return verdict naming the violated rule, if any
     */
    public SafetyVerdict validate(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return SafetyVerdict.rejected(SafetyRule.EMPTY, "Blocked [EMPTY]: SQL query is empty");
        }

        // A literal boundary that depends on backslash handling must not hide a statement from
        // either kind of engine, so every text rule sees both lexings.
        List<SqlTextScanner.Scan> scans = List.of(
                SqlTextScanner.scan(queryText, true),
                SqlTextScanner.scan(queryText, false)
        );

        for (SqlTextScanner.Scan scan : scans) {
            if (hasMultipleStatements(scan.code())) {
                return SafetyVerdict.rejected(
                        SafetyRule.MULTIPLE_STATEMENTS,
                        "Blocked [MULTIPLE_STATEMENTS]: Query contains multiple statements"
                );
            }
        }

        for (SqlTextScanner.Scan scan : scans) {
            for (String comment : scan.comments()) {
                if (comment.indexOf(';') >= 0) {
                    return SafetyVerdict.rejected(
                            SafetyRule.COMMENT_SEPARATOR,
                            "Blocked [COMMENT_SEPARATOR]: Query contains a statement separator inside a comment"
                    );
                }
            }
        }

        for (int i = 0; i < BLOCKED_PATTERNS.size(); i++) {
            for (SqlTextScanner.Scan scan : scans) {
                if (BLOCKED_PATTERNS.get(i).matcher(scan.withoutLiterals()).find()) {
                    return SafetyVerdict.rejected(
                            SafetyRule.BLOCKED_KEYWORD,
                            "Blocked [BLOCKED_KEYWORD]: Query contains destructive keyword '" + BLOCKED_KEYWORDS.get(i) + "'"
                    );
                }
            }
        }

        for (SqlTextScanner.Scan scan : scans) {
            if (!ALLOWED_PREFIX.matcher(scan.code().trim()).find()) {
                return SafetyVerdict.rejected(
                        SafetyRule.ALLOWLIST,
                        "Blocked [ALLOWLIST]: Query must start with SELECT or WITH"
                );
            }
        }

        StatementTreeInspector.Inspection inspection = statementTreeInspector.inspect(queryText);
        if (inspection.outcome() == StatementTreeInspector.Outcome.MUTATING) {
            return SafetyVerdict.rejected(
                    SafetyRule.STATEMENT_TREE,
                    "Blocked [STATEMENT_TREE]: Query parses as a non-read operation (" + inspection.operation() + ")"
            );
        }

        return SafetyVerdict.ok();
    }

    /**
     * One separator is tolerated when it is the last non-blank character.
     */
    private boolean hasMultipleStatements(String code) {
        String trimmed = code.trim();
        int count = 0;
        int last = -1;
        for (int i = 0; i < trimmed.length(); i++) {
            if (trimmed.charAt(i) == ';') {
                count++;
                last = i;
            }
        }
        if (count == 0) {
            return false;
        }
        return count > 1 || last != trimmed.length() - 1;
    }
}
