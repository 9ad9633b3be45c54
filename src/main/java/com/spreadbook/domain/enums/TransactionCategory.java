package com.spreadbook.domain.enums;

/**
 * What an option transaction did to its leg. Exactly one category per transaction:
 * OPEN (bought/sold to open), CLOSE (sold to close / bought to cover),
 * EXERCISE (option exercised) and ASSIGNMENT (option assigned).
 */
public enum TransactionCategory {
    OPEN,
    CLOSE,
    EXERCISE,
    ASSIGNMENT
}
