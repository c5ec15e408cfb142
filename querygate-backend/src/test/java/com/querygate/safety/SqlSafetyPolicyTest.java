package com.querygate.safety;

import com.querygate.model.SafetyRule;
import com.querygate.model.SafetyVerdict;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SqlSafetyPolicyTest {

    private final SqlSafetyPolicy policy = new SqlSafetyPolicy();

    @Test
    void validate_shouldAcceptPlainSelect() {
        SafetyVerdict verdict = policy.validate("SELECT id, amount FROM orders WHERE amount > 10 LIMIT 10");

        Assertions.assertTrue(verdict.isSafe());
        Assertions.assertNull(verdict.getRule());
        Assertions.assertNull(verdict.getReason());
    }

    @Test
    void validate_shouldAcceptCommonTableExpression() {
        SafetyVerdict verdict = policy.validate(
                "WITH recent AS (SELECT * FROM orders WHERE created_at > '2024-01-01') SELECT COUNT(*) FROM recent");

        Assertions.assertTrue(verdict.isSafe());
    }

    @Test
    void validate_shouldAcceptSingleTrailingSeparator() {
        Assertions.assertTrue(policy.validate("SELECT 1;").isSafe());
        Assertions.assertTrue(policy.validate("SELECT 1 ;  \n").isSafe());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "DROP TABLE x",
            "drop table x",
            "SELECT * FROM t; DrOp TABLE t",
            "DELETE FROM orders",
            "UPDATE orders SET amount = 0",
            "TRUNCATE TABLE orders",
            "ALTER TABLE orders ADD COLUMN c INT",
            "INSERT INTO orders VALUES (1)",
            "MERGE INTO t USING s ON t.id = s.id WHEN MATCHED THEN DELETE",
            "CREATE TABLE t AS SELECT 1",
            "GRANT SELECT ON t TO bob",
            "REVOKE SELECT ON t FROM bob",
            "CREATE OR REPLACE VIEW v AS SELECT 1"
    })
    void validate_shouldRejectMutatingStatements(String sql) {
        Assertions.assertFalse(policy.validate(sql).isSafe(), sql);
    }

    @Test
    void validate_shouldRejectKeywordInsideSelect() {
        SafetyVerdict verdict = policy.validate("SELECT * FROM t WHERE 1 = 1\n  AND\tDELETE");

        Assertions.assertFalse(verdict.isSafe());
        Assertions.assertEquals(SafetyRule.BLOCKED_KEYWORD, verdict.getRule());
        Assertions.assertEquals("Blocked [BLOCKED_KEYWORD]: Query contains destructive keyword 'DELETE'", verdict.getReason());
    }

    @Test
    void validate_shouldRejectMultipleStatementsBeforeKeywords() {
        SafetyVerdict verdict = policy.validate("SELECT 1; DELETE FROM t");

        Assertions.assertFalse(verdict.isSafe());
        Assertions.assertEquals(SafetyRule.MULTIPLE_STATEMENTS, verdict.getRule());
        Assertions.assertTrue(verdict.getReason().contains("multiple statements"));
    }

    @Test
    void validate_shouldRejectTwoSelects() {
        SafetyVerdict verdict = policy.validate("SELECT 1; SELECT 2;");

        Assertions.assertEquals(SafetyRule.MULTIPLE_STATEMENTS, verdict.getRule());
    }

    @Test
    void validate_shouldIgnoreSeparatorAndKeywordInsideStringLiteral() {
        SafetyVerdict verdict = policy.validate("SELECT * FROM audit WHERE note = 'drop; delete everything'");

        Assertions.assertTrue(verdict.isSafe());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT 'a\\'; DELETE FROM t; --'",
            "SELECT 'a\\' ; DROP TABLE orders ; SELECT '",
            "SELECT \"a\\\"; DELETE FROM t; --\""
    })
    void validate_shouldRejectStatementHiddenBehindBackslashQuote(String sql) {
        SafetyVerdict verdict = policy.validate(sql);

        Assertions.assertFalse(verdict.isSafe(), sql);
        Assertions.assertEquals(SafetyRule.MULTIPLE_STATEMENTS, verdict.getRule(), sql);
    }

    @Test
    void validate_shouldRejectKeywordHiddenBehindBackslashQuote() {
        SafetyVerdict verdict = policy.validate("SELECT 'a\\', TRUNCATE, 'b' FROM t");

        Assertions.assertFalse(verdict.isSafe());
        Assertions.assertEquals(SafetyRule.BLOCKED_KEYWORD, verdict.getRule());
        Assertions.assertTrue(verdict.getReason().contains("TRUNCATE"));
    }

    @Test
    void validate_shouldAcceptBackslashInsideLiteralWhenBothLexingsAgree() {
        Assertions.assertTrue(policy.validate("SELECT * FROM files WHERE path = 'C:\\temp\\'").isSafe());
    }

    @Test
    void validate_shouldNotMatchKeywordAsPartOfIdentifier() {
        Assertions.assertTrue(policy.validate("SELECT update_date, created_by FROM orders").isSafe());
        Assertions.assertTrue(policy.validate("SELECT * FROM dropped_items").isSafe());
    }

    @Test
    void validate_shouldRejectSeparatorHiddenInComment() {
        SafetyVerdict verdict = policy.validate("SELECT 1 /* ; */ FROM t");

        Assertions.assertFalse(verdict.isSafe());
        Assertions.assertEquals(SafetyRule.COMMENT_SEPARATOR, verdict.getRule());
    }

    @Test
    void validate_shouldRejectKeywordInsideComment() {
        SafetyVerdict verdict = policy.validate("SELECT 1 -- then drop it\nFROM t");

        Assertions.assertEquals(SafetyRule.BLOCKED_KEYWORD, verdict.getRule());
    }

    @Test
    void validate_shouldRejectNonSelectPrefix() {
        SafetyVerdict verdict = policy.validate("EXPLAIN SELECT * FROM orders");

        Assertions.assertFalse(verdict.isSafe());
        Assertions.assertEquals(SafetyRule.ALLOWLIST, verdict.getRule());
        Assertions.assertEquals("Blocked [ALLOWLIST]: Query must start with SELECT or WITH", verdict.getReason());
    }

    @Test
    void validate_shouldAllowLeadingComment() {
        Assertions.assertTrue(policy.validate("-- monthly revenue\nSELECT SUM(amount) FROM orders").isSafe());
    }

    @Test
    void validate_shouldRejectSelectInto() {
        SafetyVerdict verdict = policy.validate("SELECT * INTO orders_copy FROM orders");

        Assertions.assertFalse(verdict.isSafe());
        Assertions.assertEquals(SafetyRule.STATEMENT_TREE, verdict.getRule());
        Assertions.assertTrue(verdict.getReason().contains("SELECT INTO"));
    }

    @Test
    void validate_shouldAcceptDialectTheParserDoesNotKnow() {
        SafetyVerdict verdict = policy.validate(
                "SELECT * FROM `project.dataset.orders` WHERE _PARTITIONTIME > TIMESTAMP_SUB(CURRENT_TIMESTAMP(), INTERVAL 1 DAY)");

        Assertions.assertTrue(verdict.isSafe());
    }

    @Test
    void validate_shouldRejectEmptyText() {
        Assertions.assertEquals(SafetyRule.EMPTY, policy.validate("   ").getRule());
        Assertions.assertEquals(SafetyRule.EMPTY, policy.validate(null).getRule());
    }

    @Test
    void validate_shouldBeDeterministic() {
        String sql = "SELECT a FROM t WHERE b = 'x'";

        Assertions.assertEquals(policy.validate(sql), policy.validate(sql));
    }
}
