package com.spreadbook.domain.enums;

/**
 * Direction of an option leg. Quantities are kept as unsigned magnitudes next to a Side and only
 * turned into signed values (positive = long, negative = short) at the position store boundary.
 */
public enum Side {
    LONG,
    SHORT;

    public static Side ofSigned(long quantity) {
        return quantity < 0 ? SHORT : LONG;
    }

    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
