package com.spreadbook.domain.enums;

/**
 * Rule that produced a leg's closing price, in priority order.
 */
public enum ClosingPriceSource {
    CLOSE_FILL,
    INTRINSIC_VALUE,
    EXPIRED_WORTHLESS
}
