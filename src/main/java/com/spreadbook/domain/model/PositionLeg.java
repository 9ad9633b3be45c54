package com.spreadbook.domain.model;

import com.spreadbook.domain.enums.LegType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of a persisted position.
 *
 * <p>Quantity is signed: positive = long, negative = short. Stock and cash legs have no strike
 * or expiration. {@code sourceRowRef} identifies the stored row the leg was loaded from; it is
 * null for legs created during the current run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionLeg {

    private String sourceRowRef;
    private String symbol;
    private LocalDate expiration;
    private BigDecimal strike;
    private LegType legType;
    private int quantity;
    private BigDecimal averagePrice;

    /** Exit value resolved from closes, exercises/assignments or expiry. Null = unresolved. */
    private BigDecimal closingPrice;

    public boolean isLong() {
        return quantity > 0;
    }

    public boolean isShort() {
        return quantity < 0;
    }

    /** Leg key for option legs, null for stock and cash. */
    public LegKey legKey() {
        if (legType == null || !legType.isOption() || strike == null) {
            return null;
        }
        return LegKey.of(symbol, expiration, strike, legType.toOptionType());
    }
}
