package com.spreadbook.reconciliation;

import com.spreadbook.domain.enums.LegType;
import com.spreadbook.domain.enums.SpreadType;
import com.spreadbook.domain.model.LegKey;
import com.spreadbook.domain.model.PositionLeg;
import com.spreadbook.domain.model.SpreadLeg;
import com.spreadbook.domain.model.SpreadOrder;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the order-independent identity shared by spread orders and persisted positions.
 *
 * <p>Formats:
 * <ul>
 *   <li>cash: {@code CASH}</li>
 *   <li>stock: {@code AAPL|STOCK}</li>
 *   <li>options: {@code TSLA|2028-12-15|350/440|Call}, strikes ascending, tag = {@code IC},
 *       {@code LS}, {@code SS}, {@code LSg}, {@code SSg} or the bare option type</li>
 * </ul>
 *
 * <p>Spread orders and position legs must map to the same key for the same structure, otherwise
 * a re-import would create a duplicate position instead of merging. All functions are pure.
 */
public final class CanonicalKeys {

    public static final String CASH_KEY = "CASH";

    static final String STOCK_TAG = "STOCK";
    private static final String SEPARATOR = "|";

    private CanonicalKeys() {}

    public static String forOrder(SpreadOrder order) {
        SpreadType type = order.getType();
        if (type == SpreadType.CASH) {
            return CASH_KEY;
        }
        if (type == SpreadType.STOCK) {
            return stockKey(order.getTicker());
        }
        if (type.isMultiLeg()) {
            List<BigDecimal> strikes =
                    order.getLegs().stream().map(SpreadLeg::getStrike).toList();
            return optionKey(order.getTicker(), order.getExpiration(), strikes, type.getKeyTag());
        }
        List<BigDecimal> strikes = new ArrayList<>(2);
        if (order.getLowerStrike() != null) {
            strikes.add(order.getLowerStrike());
        }
        if (order.getUpperStrike() != null) {
            strikes.add(order.getUpperStrike());
        }
        return optionKey(
                order.getTicker(),
                order.getExpiration(),
                strikes,
                order.getOptionType().getLabel());
    }

    /**
     * Key of a stored position, derived from its legs only. Legs with quantity zero (closed out)
     * do not count towards the direction of a straddle or strangle.
     *
     * @throws IllegalArgumentException if there are no legs or they describe no known structure
     */
    public static String forLegs(List<PositionLeg> legs) {
        if (legs == null || legs.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a key for a position without legs");
        }
        PositionLeg first = legs.get(0);
        if (legs.size() == 1) {
            if (first.getLegType() == LegType.CASH || CASH_KEY.equals(first.getSymbol())) {
                return CASH_KEY;
            }
            if (first.getLegType() == LegType.STOCK || first.getStrike() == null) {
                return stockKey(first.getSymbol());
            }
        }

        List<BigDecimal> strikes = legs.stream().map(PositionLeg::getStrike).toList();
        return optionKey(first.getSymbol(), first.getExpiration(), strikes, tagForLegs(legs));
    }

    public static String stockKey(String ticker) {
        return ticker + SEPARATOR + STOCK_TAG;
    }

    public static boolean isStockKey(String key) {
        return key != null && key.endsWith(SEPARATOR + STOCK_TAG);
    }

    /** Ticker part of a stock key, e.g. {@code AAPL} for {@code AAPL|STOCK}. */
    public static String tickerOf(String key) {
        int separator = key.indexOf(SEPARATOR);
        return separator < 0 ? key : key.substring(0, separator);
    }

    /** ISO calendar date; the only expiration format that ever enters a key. */
    public static String normalizeExpiration(LocalDate expiration) {
        return expiration == null ? "" : expiration.toString();
    }

    static String optionKey(String ticker, LocalDate expiration, Collection<BigDecimal> strikes, String tag) {
        String joinedStrikes = strikes.stream()
                .filter(Objects::nonNull)
                .sorted()
                .map(LegKey::formatStrike)
                .collect(Collectors.joining("/"));
        return ticker + SEPARATOR + normalizeExpiration(expiration) + SEPARATOR + joinedStrikes + SEPARATOR + tag;
    }

    private static String tagForLegs(List<PositionLeg> legs) {
        Set<LegType> types = EnumSet.noneOf(LegType.class);
        legs.forEach(leg -> types.add(leg.getLegType()));
        boolean callsAndPuts = types.contains(LegType.CALL) && types.contains(LegType.PUT);

        if (legs.size() == 4 && callsAndPuts) {
            return SpreadType.IRON_CONDOR.getKeyTag();
        }
        if (legs.size() == 2 && callsAndPuts) {
            List<PositionLeg> open = legs.stream().filter(leg -> leg.getQuantity() != 0).toList();
            boolean allLong = !open.isEmpty() && open.stream().allMatch(PositionLeg::isLong);
            boolean allShort = !open.isEmpty() && open.stream().allMatch(PositionLeg::isShort);
            boolean sameStrike = sameStrike(legs.get(0).getStrike(), legs.get(1).getStrike());
            if (allLong) {
                return (sameStrike ? SpreadType.LONG_STRADDLE : SpreadType.LONG_STRANGLE).getKeyTag();
            }
            if (allShort) {
                return (sameStrike ? SpreadType.SHORT_STRADDLE : SpreadType.SHORT_STRANGLE).getKeyTag();
            }
        }
        if (types.size() == 1) {
            return types.iterator().next().getLabel();
        }
        throw new IllegalArgumentException("Legs " + types + " of " + legs.get(0).getSymbol()
                + " do not form a vertical, condor, straddle or strangle");
    }

    private static boolean sameStrike(BigDecimal a, BigDecimal b) {
        return a != null && b != null && a.compareTo(b) == 0;
    }
}
