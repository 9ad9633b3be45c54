package com.spreadbook.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Instrument kind of a persisted position leg. Stock and cash legs carry no strike or expiration.
 */
@Getter
@RequiredArgsConstructor
public enum LegType {
    CALL("Call"),
    PUT("Put"),
    STOCK("Stock"),
    CASH("Cash");

    private final String label;

    public boolean isOption() {
        return this == CALL || this == PUT;
    }

    public OptionType toOptionType() {
        return switch (this) {
            case CALL -> OptionType.CALL;
            case PUT -> OptionType.PUT;
            default -> null;
        };
    }
}
