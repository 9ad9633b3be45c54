package com.spreadbook.domain.model;

import com.spreadbook.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Option line of a broker portfolio snapshot. Quantity is signed: negative = short. */
@Value
@Builder
public class OptionHolding {

    String ticker;
    LocalDate expiration;
    BigDecimal strike;
    OptionType optionType;
    int quantity;
    BigDecimal pricePaid;

    public LegKey legKey() {
        return LegKey.of(ticker, expiration, strike, optionType);
    }
}
