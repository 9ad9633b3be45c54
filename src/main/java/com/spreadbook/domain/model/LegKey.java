package com.spreadbook.domain.model;

import com.spreadbook.domain.enums.OptionType;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Identity of one option leg across transactions: ticker, expiration, strike and type.
 *
 * <p>Strikes are normalized (trailing zeros stripped) so that 350, 350.0 and 350.00 address the
 * same leg. {@link #toString()} renders the pipe-joined form {@code TSLA|2028-12-15|350|Call}.
 */
public record LegKey(String ticker, LocalDate expiration, BigDecimal strike, OptionType optionType) {

    public LegKey {
        strike = normalizeStrike(strike);
    }

    public static LegKey of(String ticker, LocalDate expiration, BigDecimal strike, OptionType optionType) {
        return new LegKey(ticker, expiration, strike, optionType);
    }

    public static BigDecimal normalizeStrike(BigDecimal strike) {
        if (strike == null) {
            return null;
        }
        BigDecimal stripped = strike.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    /** Plain rendering without exponent or trailing zeros, e.g. 352.5 or 350. */
    public static String formatStrike(BigDecimal strike) {
        BigDecimal normalized = normalizeStrike(strike);
        return normalized == null ? "" : normalized.toPlainString();
    }

    @Override
    public String toString() {
        return ticker + "|" + expiration + "|" + formatStrike(strike) + "|" + optionType.getLabel();
    }
}
