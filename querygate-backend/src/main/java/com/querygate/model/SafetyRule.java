package com.querygate.model;

/**
 * Safety policy rules, evaluated in declaration order.
 */
public enum SafetyRule {
    EMPTY,
    MULTIPLE_STATEMENTS,
    COMMENT_SEPARATOR,
    BLOCKED_KEYWORD,
    ALLOWLIST,
    STATEMENT_TREE
}
