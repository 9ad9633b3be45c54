package com.spreadbook.domain.enums;

/**
 * How a reconciliation run treats the existing store and stock quantities.
 *
 * <p>FRESH and REBUILD read stock holdings from a portfolio snapshot as absolute quantities;
 * REBUILD additionally discards the stored positions. UPDATE accumulates stock deltas from stock
 * transactions newer than each ticker's last recorded date.
 */
public enum ReconcileMode {
    FRESH,
    UPDATE,
    REBUILD
}
