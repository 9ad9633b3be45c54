package com.spreadbook.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Leg whose quantity derived from the transaction history differs from the broker snapshot.
 */
@Value
@Builder
public class OptionQuantityMismatch {

    LegKey legKey;
    int expectedQuantity;
    int actualQuantity;
}
