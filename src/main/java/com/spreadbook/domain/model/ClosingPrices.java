package com.spreadbook.domain.model;

import com.spreadbook.domain.enums.ClosingPriceSource;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closing price per leg key for one run. A key that is absent is unresolved and needs a manual
 * price downstream.
 *
 * <p>Write-once per key: the first rule that resolves a leg wins and later rules cannot replace it.
 */
public class ClosingPrices {

    private final Map<LegKey, ClosingPrice> prices = new LinkedHashMap<>();
    private final Set<LegKey> openedLegs = new LinkedHashSet<>();

    /**
     * Records a price unless the key already has one.
     *
     * @return true if the price was recorded
     */
    public boolean resolve(LegKey legKey, BigDecimal price, ClosingPriceSource source) {
        if (prices.containsKey(legKey)) {
            return false;
        }
        prices.put(
                legKey,
                ClosingPrice.builder().legKey(legKey).price(price).source(source).build());
        return true;
    }

    public void markOpened(LegKey legKey) {
        openedLegs.add(legKey);
    }

    public boolean isResolved(LegKey legKey) {
        return prices.containsKey(legKey);
    }

    public Optional<BigDecimal> priceOf(LegKey legKey) {
        ClosingPrice closingPrice = prices.get(legKey);
        return closingPrice == null ? Optional.empty() : Optional.ofNullable(closingPrice.getPrice());
    }

    public Optional<ClosingPrice> get(LegKey legKey) {
        return Optional.ofNullable(prices.get(legKey));
    }

    /** Opened legs that no rule could price. */
    public List<LegKey> unresolvedLegs() {
        return openedLegs.stream().filter(legKey -> !prices.containsKey(legKey)).toList();
    }

    public List<ClosingPrice> asList() {
        return new ArrayList<>(prices.values());
    }

    public int size() {
        return prices.size();
    }
}
