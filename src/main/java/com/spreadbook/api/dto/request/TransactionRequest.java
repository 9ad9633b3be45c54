package com.spreadbook.api.dto.request;

import com.spreadbook.domain.enums.OptionType;
import com.spreadbook.domain.enums.TransactionCategory;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One option transaction. Ticker, strike, type and expiration are not enforced here: rows
 * missing them are dropped by leg pairing instead of failing the whole import.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionRequest {

    @NotNull
    private LocalDate date;

    private String ticker;
    private LocalDate expiration;
    private BigDecimal strike;
    private OptionType optionType;

    /** Signed: positive = long-increasing, negative = short-increasing. */
    private int quantity;

    private BigDecimal price;
    private BigDecimal amount;

    @NotNull
    private TransactionCategory category;
}
