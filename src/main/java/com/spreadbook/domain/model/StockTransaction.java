package com.spreadbook.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A normalized equity buy/sell. Quantity is signed: positive = bought, negative = sold.
 * Used for stock position deltas and as the market-price proxy for exercised/assigned options.
 */
@Value
@Builder
public class StockTransaction {

    LocalDate date;
    String ticker;
    int quantity;
    BigDecimal price;
    BigDecimal amount;
}
