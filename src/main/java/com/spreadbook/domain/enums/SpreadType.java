package com.spreadbook.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Shape of a spread order produced by leg pairing (or by stock/cash aggregation).
 *
 * <p>{@code keyTag} is the abbreviation used in canonical keys for multi-leg shapes; verticals and
 * naked legs use the bare option type instead, stock and cash have their own fixed keys.
 */
@Getter
@RequiredArgsConstructor
public enum SpreadType {
    VERTICAL("vertical", null, "Vertical"),
    IRON_CONDOR("iron-condor", "IC", "Iron Condor"),
    LONG_STRADDLE("long-straddle", "LS", "Long Straddle"),
    SHORT_STRADDLE("short-straddle", "SS", "Short Straddle"),
    LONG_STRANGLE("long-strangle", "LSg", "Long Strangle"),
    SHORT_STRANGLE("short-strangle", "SSg", "Short Strangle"),
    NAKED_LONG("naked-long", null, "Long"),
    NAKED_SHORT("naked-short", null, "Short"),
    STOCK("stock", null, "Stock"),
    CASH("cash", null, "Cash");

    private final String code;
    private final String keyTag;
    private final String displayName;

    /** True for shapes that carry an explicit leg list instead of the flat lower/upper layout. */
    public boolean isMultiLeg() {
        return keyTag != null;
    }
}
