package com.spreadbook.domain.model;

import com.spreadbook.domain.enums.ClosingPriceSource;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Resolved exit value of one option leg and the rule that produced it.
 */
@Value
@Builder
public class ClosingPrice {

    LegKey legKey;
    BigDecimal price;
    ClosingPriceSource source;
}
