package com.spreadbook.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Call or put. The label is the broker/export spelling and is also the bare type tag used in
 * canonical keys of verticals and naked legs.
 */
@Getter
@RequiredArgsConstructor
public enum OptionType {
    CALL("Call"),
    PUT("Put");

    private final String label;

    public LegType toLegType() {
        return this == CALL ? LegType.CALL : LegType.PUT;
    }
}
