package com.spreadbook.reconciliation;

import com.spreadbook.domain.enums.OptionType;
import com.spreadbook.domain.enums.Side;
import com.spreadbook.domain.enums.SpreadType;
import com.spreadbook.domain.model.SpreadLeg;
import com.spreadbook.domain.model.SpreadOrder;
import com.spreadbook.domain.model.Transaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pairs option-opening transactions into spread orders.
 *
 * <p>Opens are grouped by (trade date, ticker, expiration). Within a group:
 * <ol>
 *   <li>one long call, one short call, one long put and one short put of equal size
 *       become an IRON_CONDOR and nothing else is paired;</li>
 *   <li>a group of only longs (or only shorts) across calls and puts pairs its first call with its
 *       first put into a straddle (equal strikes) or strangle, at the smaller size;</li>
 *   <li>the rest is paired greedily per option type, longs against shorts in ascending strike
 *       order, into VERTICAL orders;</li>
 *   <li>whatever is left becomes NAKED_LONG / NAKED_SHORT.</li>
 * </ol>
 *
 * <p>A condor-shaped group with unequal sizes is not forced into a condor; it falls through to
 * vertical pairing. Quantities are conserved per group: the signed leg quantities of the emitted
 * orders sum to the signed quantities of the group's transactions. Prices pass through unchanged.
 *
 * <p>Pairing consumes a remaining-quantity cursor per opening transaction; transactions are never
 * mutated.
 */
@Component
public class LegPairingEngine {

    private static final Logger log = LoggerFactory.getLogger(LegPairingEngine.class);

    private static final Comparator<SpreadLeg> BY_STRIKE = Comparator.comparing(SpreadLeg::getStrike)
            .thenComparing(leg -> leg.getOptionType() == OptionType.CALL);

    /**
     * Pairs every opening transaction in the input; non-opening transactions are ignored.
     */
    public List<SpreadOrder> pair(Collection<Transaction> transactions) {
        Map<OpeningGroupKey, List<OpeningLeg>> groups = groupOpenings(transactions);

        List<SpreadOrder> spreadOrders = new ArrayList<>();
        for (Map.Entry<OpeningGroupKey, List<OpeningLeg>> entry : groups.entrySet()) {
            List<SpreadOrder> groupOrders = pairGroup(entry.getKey(), entry.getValue());
            log.debug(
                    "Paired group {} {} exp={}: {} opens -> {} orders",
                    entry.getKey().date(),
                    entry.getKey().ticker(),
                    entry.getKey().expiration(),
                    entry.getValue().size(),
                    groupOrders.size());
            spreadOrders.addAll(groupOrders);
        }

        log.info("Leg pairing: {} opening groups -> {} spread orders", groups.size(), spreadOrders.size());
        return spreadOrders;
    }

    Map<OpeningGroupKey, List<OpeningLeg>> groupOpenings(Collection<Transaction> transactions) {
        Map<OpeningGroupKey, List<OpeningLeg>> groups = new LinkedHashMap<>();
        int filtered = 0;
        for (Transaction transaction : transactions) {
            if (!transaction.isOpen()) {
                continue;
            }
            if (!isPairable(transaction)) {
                filtered++;
                continue;
            }
            OpeningGroupKey key = new OpeningGroupKey(
                    transaction.getDate(), transaction.getTicker(), transaction.getExpiration());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(new OpeningLeg(transaction));
        }
        if (filtered > 0) {
            log.warn("Leg pairing: ignored {} opening transactions with missing ticker, strike, type or quantity",
                    filtered);
        }
        return groups;
    }

    private List<SpreadOrder> pairGroup(OpeningGroupKey key, List<OpeningLeg> legs) {
        List<OpeningLeg> longCalls = select(legs, OptionType.CALL, Side.LONG);
        List<OpeningLeg> shortCalls = select(legs, OptionType.CALL, Side.SHORT);
        List<OpeningLeg> longPuts = select(legs, OptionType.PUT, Side.LONG);
        List<OpeningLeg> shortPuts = select(legs, OptionType.PUT, Side.SHORT);

        Optional<SpreadOrder> ironCondor = detectIronCondor(key, longCalls, shortCalls, longPuts, shortPuts);
        if (ironCondor.isPresent()) {
            return List.of(ironCondor.get());
        }

        List<SpreadOrder> orders = new ArrayList<>();
        boolean onlyLongs = shortCalls.isEmpty() && shortPuts.isEmpty();
        boolean onlyShorts = longCalls.isEmpty() && longPuts.isEmpty();
        if (onlyLongs && !longCalls.isEmpty() && !longPuts.isEmpty()) {
            orders.add(pairStraddle(key, longCalls.get(0), longPuts.get(0), Side.LONG));
        } else if (onlyShorts && !shortCalls.isEmpty() && !shortPuts.isEmpty()) {
            orders.add(pairStraddle(key, shortCalls.get(0), shortPuts.get(0), Side.SHORT));
        }

        orders.addAll(pairVerticals(key, OptionType.CALL, longCalls, shortCalls));
        orders.addAll(pairVerticals(key, OptionType.PUT, longPuts, shortPuts));
        return orders;
    }

    private Optional<SpreadOrder> detectIronCondor(
            OpeningGroupKey key,
            List<OpeningLeg> longCalls,
            List<OpeningLeg> shortCalls,
            List<OpeningLeg> longPuts,
            List<OpeningLeg> shortPuts) {
        if (longCalls.size() != 1 || shortCalls.size() != 1 || longPuts.size() != 1 || shortPuts.size() != 1) {
            return Optional.empty();
        }

        int quantity = longCalls.get(0).remaining();
        boolean equalSizes = shortCalls.get(0).remaining() == quantity
                && longPuts.get(0).remaining() == quantity
                && shortPuts.get(0).remaining() == quantity;
        if (!equalSizes) {
            log.debug("Condor-shaped group {} {} has unequal leg sizes, pairing as verticals", key.date(), key.ticker());
            return Optional.empty();
        }

        List<SpreadLeg> legs = new ArrayList<>(4);
        for (OpeningLeg leg : List.of(longPuts.get(0), shortPuts.get(0), shortCalls.get(0), longCalls.get(0))) {
            legs.add(leg.toSpreadLeg(quantity));
            leg.consume(quantity);
        }
        legs.sort(BY_STRIKE);

        return Optional.of(SpreadOrder.builder()
                .type(SpreadType.IRON_CONDOR)
                .ticker(key.ticker())
                .expiration(key.expiration())
                .date(key.date())
                .quantity(quantity)
                .legs(legs)
                .build());
    }

    private SpreadOrder pairStraddle(OpeningGroupKey key, OpeningLeg call, OpeningLeg put, Side side) {
        int quantity = Math.min(call.remaining(), put.remaining());
        boolean straddle = call.strike().compareTo(put.strike()) == 0;

        SpreadType type;
        if (side == Side.LONG) {
            type = straddle ? SpreadType.LONG_STRADDLE : SpreadType.LONG_STRANGLE;
        } else {
            type = straddle ? SpreadType.SHORT_STRADDLE : SpreadType.SHORT_STRANGLE;
        }

        List<SpreadLeg> legs = new ArrayList<>(List.of(put.toSpreadLeg(quantity), call.toSpreadLeg(quantity)));
        legs.sort(BY_STRIKE);
        call.consume(quantity);
        put.consume(quantity);

        return SpreadOrder.builder()
                .type(type)
                .ticker(key.ticker())
                .expiration(key.expiration())
                .date(key.date())
                .quantity(quantity)
                .legs(legs)
                .build();
    }

    private List<SpreadOrder> pairVerticals(
            OpeningGroupKey key, OptionType optionType, List<OpeningLeg> longs, List<OpeningLeg> shorts) {
        List<OpeningLeg> pendingLongs = byAscendingStrike(longs);
        List<OpeningLeg> pendingShorts = byAscendingStrike(shorts);
        List<SpreadOrder> orders = new ArrayList<>();

        int li = 0;
        int si = 0;
        while (li < pendingLongs.size() && si < pendingShorts.size()) {
            OpeningLeg longLeg = pendingLongs.get(li);
            OpeningLeg shortLeg = pendingShorts.get(si);
            int quantity = Math.min(longLeg.remaining(), shortLeg.remaining());

            orders.add(SpreadOrder.builder()
                    .type(SpreadType.VERTICAL)
                    .ticker(key.ticker())
                    .expiration(key.expiration())
                    .date(key.date())
                    .optionType(optionType)
                    .lowerStrike(longLeg.strike())
                    .upperStrike(shortLeg.strike())
                    .lowerPrice(longLeg.price())
                    .upperPrice(shortLeg.price())
                    .quantity(quantity)
                    .build());

            longLeg.consume(quantity);
            shortLeg.consume(quantity);
            if (longLeg.isExhausted()) {
                li++;
            }
            if (shortLeg.isExhausted()) {
                si++;
            }
        }

        for (; li < pendingLongs.size(); li++) {
            OpeningLeg longLeg = pendingLongs.get(li);
            orders.add(SpreadOrder.builder()
                    .type(SpreadType.NAKED_LONG)
                    .ticker(key.ticker())
                    .expiration(key.expiration())
                    .date(key.date())
                    .optionType(optionType)
                    .lowerStrike(longLeg.strike())
                    .lowerPrice(longLeg.price())
                    .quantity(longLeg.remaining())
                    .build());
            longLeg.consume(longLeg.remaining());
        }
        for (; si < pendingShorts.size(); si++) {
            OpeningLeg shortLeg = pendingShorts.get(si);
            orders.add(SpreadOrder.builder()
                    .type(SpreadType.NAKED_SHORT)
                    .ticker(key.ticker())
                    .expiration(key.expiration())
                    .date(key.date())
                    .optionType(optionType)
                    .upperStrike(shortLeg.strike())
                    .upperPrice(shortLeg.price())
                    .quantity(shortLeg.remaining())
                    .build());
            shortLeg.consume(shortLeg.remaining());
        }
        return orders;
    }

    private static boolean isPairable(Transaction transaction) {
        return transaction.getTicker() != null
                && !transaction.getTicker().isBlank()
                && transaction.getDate() != null
                && transaction.getExpiration() != null
                && transaction.getStrike() != null
                && transaction.getOptionType() != null
                && transaction.getQuantity() != 0;
    }

    private static List<OpeningLeg> select(List<OpeningLeg> legs, OptionType optionType, Side side) {
        return legs.stream()
                .filter(leg -> leg.optionType() == optionType && leg.side() == side)
                .toList();
    }

    private static List<OpeningLeg> byAscendingStrike(List<OpeningLeg> legs) {
        return legs.stream()
                .filter(leg -> !leg.isExhausted())
                .sorted(Comparator.comparing(OpeningLeg::strike))
                .toList();
    }

    record OpeningGroupKey(LocalDate date, String ticker, LocalDate expiration) {}

    /**
     * Remaining-quantity cursor over one opening transaction.
     */
    static final class OpeningLeg {

        private final Transaction source;
        private final Side side;
        private int remaining;

        OpeningLeg(Transaction source) {
            this.source = source;
            this.side = Side.ofSigned(source.getQuantity());
            this.remaining = Math.abs(source.getQuantity());
        }

        int remaining() {
            return remaining;
        }

        boolean isExhausted() {
            return remaining == 0;
        }

        void consume(int quantity) {
            if (quantity > remaining) {
                throw new IllegalStateException("Cannot consume " + quantity + " of " + remaining + " remaining");
            }
            remaining -= quantity;
        }

        Side side() {
            return side;
        }

        OptionType optionType() {
            return source.getOptionType();
        }

        BigDecimal strike() {
            return source.getStrike();
        }

        BigDecimal price() {
            return source.getPrice();
        }

        SpreadLeg toSpreadLeg(int quantity) {
            return SpreadLeg.builder()
                    .strike(source.getStrike())
                    .optionType(source.getOptionType())
                    .side(side)
                    .quantity(quantity)
                    .price(source.getPrice())
                    .build();
        }
    }
}
