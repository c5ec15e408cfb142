package com.querygate.warehouse;

import com.querygate.model.ClassifiedError;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

class SqlStateErrorClassifierTest {

    private final SqlStateErrorClassifier classifier = new SqlStateErrorClassifier();

    @Test
    void classify_shouldTreatSyntaxAndDataErrorsAsLogic() {
        Assertions.assertEquals(ClassifiedError.Kind.LOGIC,
                classifier.classify(new SQLSyntaxErrorException("syntax error at or near \"FORM\"", "42601")).getKind());
        Assertions.assertEquals(ClassifiedError.Kind.LOGIC,
                classifier.classify(new SQLException("column \"amout\" does not exist", "42703")).getKind());
        Assertions.assertEquals(ClassifiedError.Kind.LOGIC,
                classifier.classify(new SQLException("division by zero", "22012")).getKind());
    }

    @Test
    void classify_shouldTreatConnectionAndSerializationFailuresAsTransient() {
        Assertions.assertTrue(classifier.classify(new SQLException("connection failure", "08006")).isTransient());
        Assertions.assertTrue(classifier.classify(new SQLException("could not serialize access", "40001")).isTransient());
        Assertions.assertTrue(classifier.classify(new SQLTransientConnectionException("pool timeout")).isTransient());
    }

    @Test
    void classify_shouldFlagTimeoutsAsDeadlineExceeded() {
        Assertions.assertTrue(classifier.classify(new SQLTimeoutException("query timed out")).isDeadlineExceeded());
        Assertions.assertTrue(classifier.classify(new SQLException("canceling statement due to statement timeout", "57014"))
                .isDeadlineExceeded());
    }

    @Test
    void classify_shouldTreatPermissionAndUnknownStatesAsFatal() {
        Assertions.assertEquals(ClassifiedError.Kind.FATAL,
                classifier.classify(new SQLException("permission denied for table orders", "42501")).getKind());
        Assertions.assertEquals(ClassifiedError.Kind.FATAL,
                classifier.classify(new SQLException("internal error", "XX000")).getKind());
        Assertions.assertEquals(ClassifiedError.Kind.FATAL,
                classifier.classify(new IllegalStateException("no SQL cause")).getKind());
    }

    @Test
    void classify_shouldFindSqlExceptionInCauseChain() {
        RuntimeException wrapped = new RuntimeException("wrapped", new SQLException("deadlock detected", "40P01"));

        Assertions.assertTrue(classifier.classify(wrapped).isTransient());
    }

    @Test
    void classify_shouldSniffMessageWhenStateIsMissing() {
        Assertions.assertTrue(classifier.classify(new SQLException("Syntax error near FROM")).isLogic());
        Assertions.assertEquals(ClassifiedError.Kind.FATAL,
                classifier.classify(new SQLException("driver exploded")).getKind());
    }
}
