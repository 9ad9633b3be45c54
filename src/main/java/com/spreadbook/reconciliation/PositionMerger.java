package com.spreadbook.reconciliation;

import com.spreadbook.config.ReconciliationConfig;
import com.spreadbook.domain.enums.LegType;
import com.spreadbook.domain.enums.SpreadType;
import com.spreadbook.domain.model.ClosingPrices;
import com.spreadbook.domain.model.LegKey;
import com.spreadbook.domain.model.MergeResult;
import com.spreadbook.domain.model.Position;
import com.spreadbook.domain.model.PositionLeg;
import com.spreadbook.domain.model.SpreadLeg;
import com.spreadbook.domain.model.SpreadOrder;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies pre-merged spread orders to the loaded position store snapshot.
 *
 * <p>Existing positions are mutated in place and reported once in
 * {@link MergeResult#getUpdatedPositions()}; orders without a stored counterpart become new
 * positions. Option orders pass a dedup gate: an order dated on or before the position's
 * {@code lastTxnDate} was already applied by an earlier import and is skipped.
 */
@Component
public class PositionMerger {

    private static final Logger log = LoggerFactory.getLogger(PositionMerger.class);

    /**
     * How STOCK order quantities are applied to an existing stock position.
     */
    public enum StockQuantities {
        /** Quantity is a change since the position's last transaction (update runs). */
        DELTA,
        /** Quantity is the full current holding (fresh and rebuild runs). */
        ABSOLUTE
    }

    private final ReconciliationConfig reconciliationConfig;

    public PositionMerger(ReconciliationConfig reconciliationConfig) {
        this.reconciliationConfig = reconciliationConfig;
    }

    public MergeResult merge(List<SpreadOrder> orders, Map<String, Position> existingPositions) {
        return merge(orders, existingPositions, StockQuantities.DELTA);
    }

    public MergeResult merge(
            List<SpreadOrder> orders, Map<String, Position> existingPositions, StockQuantities stockQuantities) {
        Map<String, Position> working = new HashMap<>(existingPositions);
        Set<String> createdKeys = new HashSet<>();
        Set<String> updatedKeys = new HashSet<>();
        List<Position> updatedPositions = new ArrayList<>();
        List<Position> newPositions = new ArrayList<>();
        int skipped = 0;

        for (SpreadOrder order : orders) {
            String key = CanonicalKeys.forOrder(order);
            Position position = working.get(key);

            if (position == null) {
                Position created = toPosition(key, order);
                working.put(key, created);
                createdKeys.add(key);
                newPositions.add(created);
                continue;
            }

            boolean applied = switch (order.getType()) {
                case STOCK -> applyStock(position, order, stockQuantities);
                case CASH -> applyCash(position, order);
                default -> applyOptions(position, order);
            };
            if (!applied) {
                skipped++;
                continue;
            }
            if (!createdKeys.contains(key) && updatedKeys.add(key)) {
                updatedPositions.add(position);
            }
        }

        log.info(
                "Position merge: {} orders -> {} updated, {} new, {} skipped",
                orders.size(),
                updatedPositions.size(),
                newPositions.size(),
                skipped);
        return MergeResult.builder()
                .updatedPositions(updatedPositions)
                .newPositions(newPositions)
                .skippedCount(skipped)
                .build();
    }

    /**
     * Fills resolved closing prices into option legs that have none yet. A stored closing price,
     * possibly entered by hand, is never replaced.
     */
    public void applyClosingPrices(Collection<Position> positions, ClosingPrices closingPrices) {
        for (Position position : positions) {
            for (PositionLeg leg : position.getLegs()) {
                LegKey legKey = leg.legKey();
                if (legKey != null && leg.getClosingPrice() == null) {
                    closingPrices.priceOf(legKey).ifPresent(leg::setClosingPrice);
                }
            }
        }
    }

    private boolean applyStock(Position position, SpreadOrder order, StockQuantities stockQuantities) {
        PositionLeg leg = position.firstLeg();
        if (leg == null) {
            leg = PositionLeg.builder().symbol(order.getTicker()).legType(LegType.STOCK).build();
            position.getLegs().add(leg);
        }
        if (stockQuantities == StockQuantities.DELTA) {
            if (order.getQuantity() == 0 && order.getDate() == null) {
                return false;
            }
            leg.setQuantity(leg.getQuantity() + order.getQuantity());
        } else {
            leg.setQuantity(order.getQuantity());
        }
        if (order.getPrice() != null) {
            leg.setAveragePrice(order.getPrice());
        }
        if (order.getDate() != null) {
            position.setLastTxnDate(SpreadPreMerger.later(position.getLastTxnDate(), order.getDate()));
        }
        return true;
    }

    private boolean applyCash(Position position, SpreadOrder order) {
        PositionLeg leg = position.firstLeg();
        if (leg == null) {
            position.getLegs().add(cashLeg(order));
        } else {
            leg.setAveragePrice(order.getPrice());
        }
        if (order.getDate() != null) {
            position.setLastTxnDate(SpreadPreMerger.later(position.getLastTxnDate(), order.getDate()));
        }
        return true;
    }

    private boolean applyOptions(Position position, SpreadOrder order) {
        LocalDate lastTxnDate = position.getLastTxnDate();
        if (lastTxnDate != null && order.getDate() != null && !order.getDate().isAfter(lastTxnDate)) {
            log.debug(
                    "Skipping {} dated {}: position {} already applied through {}",
                    order.getType(),
                    order.getDate(),
                    position.getCanonicalKey(),
                    lastTxnDate);
            return false;
        }

        for (SpreadLeg spreadLeg : order.toLegs()) {
            PositionLeg match = findLeg(position.getLegs(), spreadLeg);
            if (match == null) {
                position.getLegs().add(toPositionLeg(order, spreadLeg));
            } else {
                mergeLeg(match, spreadLeg);
            }
        }
        position.setLastTxnDate(SpreadPreMerger.later(lastTxnDate, order.getDate()));
        return true;
    }

    /**
     * Same-direction additions move the cost basis; opposite-direction fills reduce the position
     * and only reset the basis when the leg flips sides.
     */
    private void mergeLeg(PositionLeg leg, SpreadLeg spreadLeg) {
        int oldQuantity = leg.getQuantity();
        int delta = spreadLeg.signedQuantity();
        int newQuantity = oldQuantity + delta;

        if (oldQuantity == 0 || Integer.signum(oldQuantity) == Integer.signum(delta)) {
            leg.setAveragePrice(CostBasis.weightedAverage(
                    Math.abs(oldQuantity),
                    leg.getAveragePrice(),
                    spreadLeg.getQuantity(),
                    spreadLeg.getPrice(),
                    reconciliationConfig.getPriceScale()));
        } else if (newQuantity != 0 && Integer.signum(newQuantity) != Integer.signum(oldQuantity)) {
            leg.setAveragePrice(spreadLeg.getPrice());
        }
        leg.setQuantity(newQuantity);
    }

    private static PositionLeg findLeg(List<PositionLeg> legs, SpreadLeg spreadLeg) {
        LegType legType = spreadLeg.getOptionType().toLegType();
        PositionLeg sameStrikeAndType = null;
        for (PositionLeg leg : legs) {
            if (leg.getLegType() != legType
                    || leg.getStrike() == null
                    || leg.getStrike().compareTo(spreadLeg.getStrike()) != 0) {
                continue;
            }
            if (leg.getQuantity() == 0 || Integer.signum(leg.getQuantity()) == spreadLeg.getSide().sign()) {
                return leg;
            }
            if (sameStrikeAndType == null) {
                sameStrikeAndType = leg;
            }
        }
        return sameStrikeAndType;
    }

    private static Position toPosition(String key, SpreadOrder order) {
        List<PositionLeg> legs = new ArrayList<>();
        if (order.getType() == SpreadType.STOCK) {
            legs.add(PositionLeg.builder()
                    .symbol(order.getTicker())
                    .legType(LegType.STOCK)
                    .quantity(order.getQuantity())
                    .averagePrice(order.getPrice())
                    .build());
        } else if (order.getType() == SpreadType.CASH) {
            legs.add(cashLeg(order));
        } else {
            order.toLegs().forEach(spreadLeg -> legs.add(toPositionLeg(order, spreadLeg)));
        }

        return Position.builder()
                .canonicalKey(key)
                .spreadType(order.getType())
                .groupLabel(GroupLabels.forOrder(order))
                .lastTxnDate(order.getDate())
                .legs(legs)
                .build();
    }

    private static PositionLeg cashLeg(SpreadOrder order) {
        return PositionLeg.builder()
                .symbol(CanonicalKeys.CASH_KEY)
                .legType(LegType.CASH)
                .quantity(1)
                .averagePrice(order.getPrice())
                .build();
    }

    private static PositionLeg toPositionLeg(SpreadOrder order, SpreadLeg spreadLeg) {
        return PositionLeg.builder()
                .symbol(order.getTicker())
                .expiration(order.getExpiration())
                .strike(spreadLeg.getStrike())
                .legType(spreadLeg.getOptionType().toLegType())
                .quantity(spreadLeg.signedQuantity())
                .averagePrice(spreadLeg.getPrice())
                .build();
    }
}
