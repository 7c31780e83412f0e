package com.investments.infrastructure.persistence.adapter;

import org.hibernate.exception.ConstraintViolationException;

import java.util.Locale;

/**
 * Detection of PostgreSQL unique-key violations raised by a racing insert of the same natural key
 */
final class UniqueViolations {

    static final String POSTGRES_UNIQUE_VIOLATION = "23505";

    private UniqueViolations() {
    }

    static boolean isUniqueViolation(Throwable t, String constraintName) {
        ConstraintViolationException cve = findConstraintViolation(t);
        if (cve == null) return false;
        if (!POSTGRES_UNIQUE_VIOLATION.equals(cve.getSQLState())) return false;
        String constraint = cve.getConstraintName();
        String detail = cve.getMessage();
        String expected = constraintName.toLowerCase(Locale.ROOT);
        boolean constraintMatch = constraint != null && constraint.toLowerCase(Locale.ROOT).contains(expected);
        boolean detailMatch = detail != null && detail.toLowerCase(Locale.ROOT).contains(expected);
        return constraintMatch || detailMatch;
    }

    private static ConstraintViolationException findConstraintViolation(Throwable t) {
        Throwable cur = t;
        while (cur != null) {
            if (cur instanceof ConstraintViolationException cve) return cve;
            cur = cur.getCause();
        }
        return null;
    }
}
