package com.spreadbook.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Stock line of a broker portfolio snapshot. Quantity is the absolute share count held. */
@Value
@Builder
public class StockHolding {

    String ticker;
    int quantity;
    BigDecimal pricePaid;
}
