package com.querygate.safety;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SetOperationList;

import java.util.Locale;

/**
 * Parses a query into a statement tree and reports whether it is a pure read.
 *
 * <p>Parse failures are reported as {@link Outcome#UNPARSEABLE} so the caller can fall back to its
 * lexical verdict. Warehouse dialects the parser does not understand are common and must not be
 * treated as either safe or unsafe on that basis alone.
 */
@Slf4j
public class StatementTreeInspector {

    public enum Outcome {
        READ_ONLY,
        MUTATING,
        UNPARSEABLE
    }

    /**
     * Inspection result.
     *
     * @param outcome classification
     * @param operation name of the offending operation when {@code MUTATING}, otherwise null
     */
    public record Inspection(Outcome outcome, String operation) {
        static Inspection readOnly() {
            return new Inspection(Outcome.READ_ONLY, null);
        }

        static Inspection mutating(String operation) {
            return new Inspection(Outcome.MUTATING, operation);
        }

        static Inspection unparseable() {
            return new Inspection(Outcome.UNPARSEABLE, null);
        }
    }

    /**
     * Parse and classify a single statement.
     *
     * @param sql query text, at most one trailing separator
     * @return inspection result
     */
    public Inspection inspect(String sql) {
        if (sql == null || sql.isBlank()) {
            return Inspection.unparseable();
        }

        String trimmed = sql.trim();
        if (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }

        // The parser waits on a worker thread, which fails fast and swallows the flag when the caller
        // is interrupted. Parse with the flag cleared and restore it afterwards.
        boolean interrupted = Thread.interrupted();
        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(trimmed);
        } catch (JSQLParserException | RuntimeException e) {
            log.debug("Statement tree unavailable, falling back to lexical checks: {}", e.getMessage());
            return Inspection.unparseable();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        if (statement == null) {
            return Inspection.unparseable();
        }
        if (!(statement instanceof Select select)) {
            return Inspection.mutating(statement.getClass().getSimpleName().toUpperCase(Locale.ROOT));
        }
        return containsSelectInto(select) ? Inspection.mutating("SELECT INTO") : Inspection.readOnly();
    }

    private boolean containsSelectInto(Select select) {
        if (select instanceof PlainSelect plain) {
            return plain.getIntoTables() != null && !plain.getIntoTables().isEmpty();
        }
        if (select instanceof SetOperationList setOperations && setOperations.getSelects() != null) {
            for (Select branch : setOperations.getSelects()) {
                if (containsSelectInto(branch)) {
                    return true;
                }
            }
            return false;
        }
        if (select instanceof ParenthesedSelect parenthesed && parenthesed.getSelect() != null) {
            return containsSelectInto(parenthesed.getSelect());
        }
        return false;
    }
}
