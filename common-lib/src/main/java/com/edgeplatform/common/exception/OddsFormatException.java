package com.edgeplatform.common.exception;

/**
 * Raised at the odds-normalization boundary when a price is malformed or outside the
 * range any bookmaker would quote. Callers skip the affected market.
 */
public class OddsFormatException extends EdgeException {

    public OddsFormatException(String message) {
        super("OddsConverter", message);
    }
}
