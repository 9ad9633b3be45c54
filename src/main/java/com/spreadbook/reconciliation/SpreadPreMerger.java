package com.spreadbook.reconciliation;

import com.spreadbook.config.ReconciliationConfig;
import com.spreadbook.domain.enums.SpreadType;
import com.spreadbook.domain.model.SpreadLeg;
import com.spreadbook.domain.model.SpreadOrder;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Collapses spread orders sharing a canonical key into one order per key.
 *
 * <p>The first occurrence is cloned and later occurrences are folded into the clone:
 * <ul>
 *   <li>date becomes the later of the two;</li>
 *   <li>STOCK: quantities add, price becomes the quantity-weighted average;</li>
 *   <li>multi-leg shapes: the per-leg quantity adds and each leg (matched by strike, type and
 *       side) gets the quantity-weighted average price;</li>
 *   <li>VERTICAL and naked: same-direction orders add quantities and weight the lower/upper
 *       prices where both define them. Opposite directions under one key (naked long vs naked
 *       short, bull vs bear vertical on the same strikes) net against each other;</li>
 *   <li>CASH: the latest balance wins.</li>
 * </ul>
 * Input orders are never mutated. Output order follows first appearance of each key.
 */
@Component
public class SpreadPreMerger {

    private static final Logger log = LoggerFactory.getLogger(SpreadPreMerger.class);

    private final ReconciliationConfig reconciliationConfig;

    public SpreadPreMerger(ReconciliationConfig reconciliationConfig) {
        this.reconciliationConfig = reconciliationConfig;
    }

    public List<SpreadOrder> preMerge(List<SpreadOrder> orders) {
        Map<String, SpreadOrder> merged = new LinkedHashMap<>();
        for (SpreadOrder order : orders) {
            String key = CanonicalKeys.forOrder(order);
            SpreadOrder existing = merged.get(key);
            if (existing == null) {
                merged.put(key, order.copy());
            } else {
                fold(existing, order);
            }
        }

        if (merged.size() < orders.size()) {
            log.info("Pre-merge: {} spread orders collapsed into {} distinct keys", orders.size(), merged.size());
        }
        return new ArrayList<>(merged.values());
    }

    private void fold(SpreadOrder target, SpreadOrder incoming) {
        boolean incomingIsNewer = isAfter(incoming.getDate(), target.getDate());
        target.setDate(later(target.getDate(), incoming.getDate()));

        switch (target.getType()) {
            case CASH -> {
                if (incomingIsNewer || target.getPrice() == null) {
                    target.setPrice(incoming.getPrice());
                }
            }
            case STOCK -> foldStock(target, incoming);
            case IRON_CONDOR, LONG_STRADDLE, SHORT_STRADDLE, LONG_STRANGLE, SHORT_STRANGLE ->
                    foldMultiLeg(target, incoming);
            case NAKED_LONG, NAKED_SHORT -> {
                if (target.getType() != incoming.getType()) {
                    netOpposite(target, incoming);
                } else {
                    foldFlat(target, incoming);
                }
            }
            default -> {
                if (sameLongStrike(target, incoming)) {
                    foldFlat(target, incoming);
                } else {
                    netOpposite(target, incoming);
                }
            }
        }
    }

    private void foldStock(SpreadOrder target, SpreadOrder incoming) {
        target.setPrice(CostBasis.weightedAverage(
                target.getQuantity(),
                target.getPrice(),
                incoming.getQuantity(),
                incoming.getPrice(),
                reconciliationConfig.getPriceScale()));
        target.setQuantity(target.getQuantity() + incoming.getQuantity());
    }

    private void foldFlat(SpreadOrder target, SpreadOrder incoming) {
        int scale = reconciliationConfig.getPriceScale();
        if (target.getLowerPrice() != null && incoming.getLowerPrice() != null) {
            target.setLowerPrice(CostBasis.weightedAverage(
                    target.getQuantity(), target.getLowerPrice(), incoming.getQuantity(), incoming.getLowerPrice(), scale));
        }
        if (target.getUpperPrice() != null && incoming.getUpperPrice() != null) {
            target.setUpperPrice(CostBasis.weightedAverage(
                    target.getQuantity(), target.getUpperPrice(), incoming.getQuantity(), incoming.getUpperPrice(), scale));
        }
        target.setQuantity(target.getQuantity() + incoming.getQuantity());
    }

    /**
     * Opposite directions under one key cancel out leg by leg; whichever side is larger survives
     * with the net quantity and keeps its own strikes and prices.
     */
    private void netOpposite(SpreadOrder target, SpreadOrder incoming) {
        int net = target.getQuantity() - incoming.getQuantity();
        if (net >= 0) {
            target.setQuantity(net);
            return;
        }
        target.setType(incoming.getType());
        target.setQuantity(-net);
        target.setLowerStrike(incoming.getLowerStrike());
        target.setLowerPrice(incoming.getLowerPrice());
        target.setUpperStrike(incoming.getUpperStrike());
        target.setUpperPrice(incoming.getUpperPrice());
    }

    private void foldMultiLeg(SpreadOrder target, SpreadOrder incoming) {
        int scale = reconciliationConfig.getPriceScale();
        List<SpreadLeg> mergedLegs = new ArrayList<>(target.getLegs().size());
        for (SpreadLeg leg : target.getLegs()) {
            SpreadLeg match = findLeg(incoming.getLegs(), leg);
            if (match == null) {
                mergedLegs.add(leg);
                continue;
            }
            mergedLegs.add(leg.toBuilder()
                    .quantity(leg.getQuantity() + match.getQuantity())
                    .price(CostBasis.weightedAverage(
                            leg.getQuantity(), leg.getPrice(), match.getQuantity(), match.getPrice(), scale))
                    .build());
        }
        target.setLegs(mergedLegs);
        target.setQuantity(target.getQuantity() + incoming.getQuantity());
    }

    /** The flat layout holds the long leg in {@code lowerStrike}. */
    private static boolean sameLongStrike(SpreadOrder target, SpreadOrder incoming) {
        if (target.getLowerStrike() == null || incoming.getLowerStrike() == null) {
            return target.getLowerStrike() == incoming.getLowerStrike();
        }
        return target.getLowerStrike().compareTo(incoming.getLowerStrike()) == 0;
    }

    private static SpreadLeg findLeg(List<SpreadLeg> legs, SpreadLeg wanted) {
        for (SpreadLeg leg : legs) {
            boolean sameSide = leg.getSide() == wanted.getSide() || wanted.getSide() == null;
            if (leg.getOptionType() == wanted.getOptionType()
                    && leg.getStrike().compareTo(wanted.getStrike()) == 0
                    && sameSide) {
                return leg;
            }
        }
        return null;
    }

    private static boolean isAfter(LocalDate candidate, LocalDate reference) {
        return candidate != null && (reference == null || candidate.isAfter(reference));
    }

    static LocalDate later(LocalDate a, LocalDate b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return b.isAfter(a) ? b : a;
    }
}
