package com.querygate.safety;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SqlTextScannerTest {

    @Test
    void scan_shouldBlankLiteralsAndKeepLength() {
        String sql = "SELECT 'a;b' AS x";

        SqlTextScanner.Scan scan = SqlTextScanner.scan(sql);

        Assertions.assertEquals(sql.length(), scan.withoutLiterals().length());
        Assertions.assertEquals(sql.length(), scan.code().length());
        Assertions.assertFalse(scan.withoutLiterals().contains(";"));
        Assertions.assertTrue(scan.withoutLiterals().startsWith("SELECT "));
    }

    @Test
    void scan_shouldHandleDoubledQuoteEscape() {
        SqlTextScanner.Scan scan = SqlTextScanner.scan("SELECT 'it''s; fine' FROM t");

        Assertions.assertFalse(scan.code().contains(";"));
        Assertions.assertTrue(scan.code().contains("FROM t"));
    }

    @Test
    void scan_shouldHandleBackslashEscape() {
        SqlTextScanner.Scan scan = SqlTextScanner.scan("SELECT 'it\\'s; fine' FROM t");

        Assertions.assertFalse(scan.code().contains(";"));
        Assertions.assertTrue(scan.code().contains("FROM t"));
    }

    @Test
    void scan_shouldEndLiteralAtQuoteAfterBackslashInStandardMode() {
        SqlTextScanner.Scan scan = SqlTextScanner.scan("SELECT 'a\\'; DELETE FROM t; --'", false);

        Assertions.assertTrue(scan.code().contains("; DELETE FROM t;"));
        Assertions.assertEquals(1, scan.comments().size());
    }

    @Test
    void scan_shouldTreatTripleQuoteAsDoubledEscapeInStandardMode() {
        SqlTextScanner.Scan scan = SqlTextScanner.scan("SELECT '''a''' FROM t", false);

        Assertions.assertTrue(scan.code().contains("FROM t"));
        Assertions.assertFalse(scan.code().contains("a"));
    }

    @Test
    void scan_shouldBlankTripleQuotedLiteral() {
        SqlTextScanner.Scan scan = SqlTextScanner.scan("SELECT \"\"\"drop ' table\"\"\" FROM t");

        Assertions.assertFalse(scan.withoutLiterals().toLowerCase().contains("drop"));
        Assertions.assertTrue(scan.code().contains("FROM t"));
    }

    @Test
    void scan_shouldCollectCommentsAndKeepThemInLiteralFreeView() {
        SqlTextScanner.Scan scan = SqlTextScanner.scan("SELECT 1 -- note;\n/* block */ FROM t # tail");

        Assertions.assertEquals(3, scan.comments().size());
        Assertions.assertEquals("-- note;", scan.comments().get(0));
        Assertions.assertEquals("/* block */", scan.comments().get(1));
        Assertions.assertEquals("# tail", scan.comments().get(2));
        Assertions.assertTrue(scan.withoutLiterals().contains("note;"));
        Assertions.assertFalse(scan.code().contains("note"));
        Assertions.assertTrue(scan.code().contains("\n"));
    }

    @Test
    void scan_shouldLeaveUnterminatedLiteralVisible() {
        SqlTextScanner.Scan scan = SqlTextScanner.scan("SELECT 'open; DROP TABLE t");

        Assertions.assertTrue(scan.code().contains("DROP TABLE t"));
        Assertions.assertTrue(scan.code().contains(";"));
    }

    @Test
    void scan_shouldNotOpenLiteralInsideBacktickIdentifier() {
        SqlTextScanner.Scan scan = SqlTextScanner.scan("SELECT * FROM `it's` WHERE x = 1; DROP TABLE t");

        Assertions.assertTrue(scan.code().contains("; DROP TABLE t"));
    }

    @Test
    void scan_shouldReturnEmptyViewsForNull() {
        SqlTextScanner.Scan scan = SqlTextScanner.scan(null);

        Assertions.assertEquals("", scan.code());
        Assertions.assertTrue(scan.comments().isEmpty());
    }
}
