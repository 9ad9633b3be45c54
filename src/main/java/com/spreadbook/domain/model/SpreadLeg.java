package com.spreadbook.domain.model;

import com.spreadbook.domain.enums.OptionType;
import com.spreadbook.domain.enums.Side;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One option leg of a spread order. Quantity is an unsigned magnitude; {@link #getSide()} says
 * whether it is held long or short.
 */
@Value
@Builder(toBuilder = true)
public class SpreadLeg {

    BigDecimal strike;
    OptionType optionType;
    Side side;
    int quantity;
    BigDecimal price;

    /** Positive for long legs, negative for short legs. */
    public int signedQuantity() {
        return side.sign() * quantity;
    }
}
