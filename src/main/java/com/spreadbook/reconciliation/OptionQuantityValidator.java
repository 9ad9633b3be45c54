package com.spreadbook.reconciliation;

import com.spreadbook.config.ReconciliationConfig;
import com.spreadbook.domain.enums.SpreadType;
import com.spreadbook.domain.model.LegKey;
import com.spreadbook.domain.model.OptionHolding;
import com.spreadbook.domain.model.OptionQuantityMismatch;
import com.spreadbook.domain.model.PortfolioSnapshot;
import com.spreadbook.domain.model.SpreadLeg;
import com.spreadbook.domain.model.SpreadOrder;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cross-checks option quantities derived from the transaction history against the broker's
 * portfolio snapshot.
 *
 * <p>Per leg key the expected quantity is the sum of signed leg quantities of the pre-merged
 * spread orders. Keys where it differs from the snapshot are reported as mismatches. Snapshot
 * legs the history never produced (typically opened before the export window) come back as
 * single-leg naked orders so that the position store still holds them.
 */
@Component
public class OptionQuantityValidator {

    private static final Logger log = LoggerFactory.getLogger(OptionQuantityValidator.class);

    private final ReconciliationConfig reconciliationConfig;

    public OptionQuantityValidator(ReconciliationConfig reconciliationConfig) {
        this.reconciliationConfig = reconciliationConfig;
    }

    public record Outcome(List<OptionQuantityMismatch> mismatches, List<SpreadOrder> orphanOrders) {

        public static Outcome empty() {
            return new Outcome(List.of(), List.of());
        }
    }

    public Outcome validate(List<SpreadOrder> spreadOrders, PortfolioSnapshot snapshot) {
        if (snapshot == null || snapshot.getOptions() == null || snapshot.getOptions().isEmpty()) {
            return Outcome.empty();
        }

        Map<LegKey, Integer> expected = expectedQuantities(spreadOrders);
        Map<LegKey, Integer> actual = new LinkedHashMap<>();
        Map<LegKey, BigDecimal> pricePaid = new LinkedHashMap<>();
        for (OptionHolding holding : snapshot.getOptions()) {
            if (holding.getTicker() == null || holding.getStrike() == null || holding.getOptionType() == null) {
                continue;
            }
            LegKey legKey = holding.legKey();
            actual.merge(legKey, holding.getQuantity(), Integer::sum);
            pricePaid.putIfAbsent(legKey, holding.getPricePaid());
        }

        List<OptionQuantityMismatch> mismatches = new ArrayList<>();
        expected.forEach((legKey, expectedQuantity) -> {
            int actualQuantity = actual.getOrDefault(legKey, 0);
            if (actualQuantity != expectedQuantity) {
                log.warn("Option quantity mismatch for {}: transactions give {}, portfolio holds {}",
                        legKey, expectedQuantity, actualQuantity);
                mismatches.add(OptionQuantityMismatch.builder()
                        .legKey(legKey)
                        .expectedQuantity(expectedQuantity)
                        .actualQuantity(actualQuantity)
                        .build());
            }
        });

        LocalDate asOf = snapshot.getAsOf() != null ? snapshot.getAsOf() : reconciliationConfig.today();
        List<SpreadOrder> orphanOrders = new ArrayList<>();
        actual.forEach((legKey, quantity) -> {
            if (!expected.containsKey(legKey) && quantity != 0) {
                orphanOrders.add(orphanOrder(legKey, quantity, pricePaid.get(legKey), asOf));
            }
        });

        if (!orphanOrders.isEmpty()) {
            log.info("Portfolio snapshot holds {} option legs without transaction history", orphanOrders.size());
        }
        return new Outcome(mismatches, orphanOrders);
    }

    Map<LegKey, Integer> expectedQuantities(List<SpreadOrder> spreadOrders) {
        Map<LegKey, Integer> expected = new LinkedHashMap<>();
        for (SpreadOrder order : spreadOrders) {
            for (SpreadLeg leg : order.toLegs()) {
                LegKey legKey = LegKey.of(order.getTicker(), order.getExpiration(), leg.getStrike(), leg.getOptionType());
                expected.merge(legKey, leg.signedQuantity(), Integer::sum);
            }
        }
        return expected;
    }

    private static SpreadOrder orphanOrder(LegKey legKey, int quantity, BigDecimal pricePaid, LocalDate asOf) {
        SpreadOrder.SpreadOrderBuilder builder = SpreadOrder.builder()
                .ticker(legKey.ticker())
                .expiration(legKey.expiration())
                .date(asOf)
                .optionType(legKey.optionType())
                .quantity(Math.abs(quantity));
        if (quantity > 0) {
            builder.type(SpreadType.NAKED_LONG).lowerStrike(legKey.strike()).lowerPrice(pricePaid);
        } else {
            builder.type(SpreadType.NAKED_SHORT).upperStrike(legKey.strike()).upperPrice(pricePaid);
        }
        return builder.build();
    }
}
