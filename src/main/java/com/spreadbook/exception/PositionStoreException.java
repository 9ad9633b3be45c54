package com.spreadbook.exception;

/**
 * Reading or writing the position store failed. Fatal for the reconciliation run; the store is
 * written in a single transaction, so the previous state is left intact.
 */
public class PositionStoreException extends BaseException {

    public PositionStoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_ERROR, message, cause);
    }
}
