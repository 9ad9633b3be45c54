package com.spreadbook.domain.model;

import com.spreadbook.domain.enums.OptionType;
import com.spreadbook.domain.enums.TransactionCategory;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A normalized option transaction from a brokerage export.
 *
 * <p>Quantity is signed: positive = long-increasing (buy to open, buy to cover),
 * negative = short-increasing (sell to open, sell to close). Price is per unit; amount is the
 * signed cash effect reported by the broker. Read-only for the duration of a run.
 */
@Value
@Builder
public class Transaction {

    LocalDate date;
    String ticker;
    LocalDate expiration;
    BigDecimal strike;
    OptionType optionType;
    int quantity;
    BigDecimal price;
    BigDecimal amount;
    TransactionCategory category;

    public boolean isOpen() {
        return category == TransactionCategory.OPEN;
    }

    public boolean isClosed() {
        return category == TransactionCategory.CLOSE;
    }

    public boolean isExercised() {
        return category == TransactionCategory.EXERCISE;
    }

    public boolean isAssigned() {
        return category == TransactionCategory.ASSIGNMENT;
    }

    public LegKey legKey() {
        return LegKey.of(ticker, expiration, strike, optionType);
    }
}
