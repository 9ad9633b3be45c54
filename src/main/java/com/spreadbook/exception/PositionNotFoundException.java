package com.spreadbook.exception;

import java.util.Map;

/**
 * No position is stored under the requested canonical key. The key is echoed in the error details
 * because keys contain {@code |} and {@code /} and are easy to mangle in a query string.
 */
public class PositionNotFoundException extends BaseException {

    public PositionNotFoundException(String canonicalKey) {
        super(
                ErrorCode.NOT_FOUND,
                "No position stored under key " + canonicalKey,
                Map.of("canonicalKey", canonicalKey));
    }
}
