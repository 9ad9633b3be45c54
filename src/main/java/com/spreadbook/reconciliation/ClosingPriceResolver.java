package com.spreadbook.reconciliation;

import com.spreadbook.config.ReconciliationConfig;
import com.spreadbook.domain.enums.ClosingPriceSource;
import com.spreadbook.domain.enums.OptionType;
import com.spreadbook.domain.model.ClosingPrices;
import com.spreadbook.domain.model.LegKey;
import com.spreadbook.domain.model.StockTransaction;
import com.spreadbook.domain.model.Transaction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Determines the exit price of every option leg touched by a run.
 *
 * <p>Rules are applied in priority order and a resolved leg is never overwritten:
 * <ol>
 *   <li>closed legs get the quantity-weighted average of their closing fills;</li>
 *   <li>exercised or assigned legs get their intrinsic value against the highest same-day stock
 *       fill of the underlying. Without such a fill the leg stays unresolved;</li>
 *   <li>legs that were opened, are still unresolved and expired before today are worth 0.</li>
 * </ol>
 */
@Component
public class ClosingPriceResolver {

    private static final Logger log = LoggerFactory.getLogger(ClosingPriceResolver.class);

    private final ReconciliationConfig reconciliationConfig;

    public ClosingPriceResolver(ReconciliationConfig reconciliationConfig) {
        this.reconciliationConfig = reconciliationConfig;
    }

    public ClosingPrices resolve(Collection<Transaction> transactions, Collection<StockTransaction> stockTransactions) {
        return resolve(transactions, stockTransactions, reconciliationConfig.today());
    }

    public ClosingPrices resolve(
            Collection<Transaction> transactions, Collection<StockTransaction> stockTransactions, LocalDate today) {
        ClosingPrices closingPrices = new ClosingPrices();

        resolveExplicitCloses(transactions, closingPrices);
        int unresolvedExercises = resolveExercises(transactions, stockTransactions, closingPrices);
        int expired = resolveExpired(transactions, closingPrices, today);

        log.info(
                "Closing prices: {} resolved ({} expired worthless), {} exercised/assigned legs without stock fill, {} unresolved",
                closingPrices.size(),
                expired,
                unresolvedExercises,
                closingPrices.unresolvedLegs().size());
        return closingPrices;
    }

    private void resolveExplicitCloses(Collection<Transaction> transactions, ClosingPrices closingPrices) {
        Map<LegKey, FillAverage> fills = new LinkedHashMap<>();
        for (Transaction transaction : transactions) {
            if (!transaction.isClosed() || !isAddressable(transaction) || transaction.getPrice() == null) {
                continue;
            }
            fills.computeIfAbsent(transaction.legKey(), k -> new FillAverage())
                    .add(Math.abs(transaction.getQuantity()), transaction.getPrice());
        }
        fills.forEach((legKey, average) -> average.value(reconciliationConfig.getClosingPriceScale())
                .ifPresent(price -> closingPrices.resolve(legKey, price, ClosingPriceSource.CLOSE_FILL)));
    }

    private int resolveExercises(
            Collection<Transaction> transactions,
            Collection<StockTransaction> stockTransactions,
            ClosingPrices closingPrices) {
        Map<StockFillKey, BigDecimal> maxStockPrice = new HashMap<>();
        for (StockTransaction stockTransaction : stockTransactions) {
            if (stockTransaction.getPrice() == null || stockTransaction.getDate() == null) {
                continue;
            }
            maxStockPrice.merge(
                    new StockFillKey(stockTransaction.getDate(), stockTransaction.getTicker()),
                    stockTransaction.getPrice(),
                    BigDecimal::max);
        }

        int withoutStockFill = 0;
        for (Transaction transaction : transactions) {
            if (!(transaction.isExercised() || transaction.isAssigned()) || !isAddressable(transaction)) {
                continue;
            }
            LegKey legKey = transaction.legKey();
            if (closingPrices.isResolved(legKey)) {
                continue;
            }
            BigDecimal underlying = maxStockPrice.get(new StockFillKey(transaction.getDate(), transaction.getTicker()));
            if (underlying == null) {
                log.debug("No same-day stock fill for exercised/assigned leg {}", legKey);
                withoutStockFill++;
                continue;
            }
            closingPrices.resolve(
                    legKey,
                    intrinsicValue(transaction.getOptionType(), transaction.getStrike(), underlying),
                    ClosingPriceSource.INTRINSIC_VALUE);
        }
        return withoutStockFill;
    }

    private int resolveExpired(Collection<Transaction> transactions, ClosingPrices closingPrices, LocalDate today) {
        int expired = 0;
        for (Transaction transaction : transactions) {
            if (!transaction.isOpen() || !isAddressable(transaction)) {
                continue;
            }
            LegKey legKey = transaction.legKey();
            closingPrices.markOpened(legKey);
            if (transaction.getExpiration().isBefore(today)
                    && closingPrices.resolve(
                            legKey, BigDecimal.ZERO.setScale(reconciliationConfig.getClosingPriceScale()),
                            ClosingPriceSource.EXPIRED_WORTHLESS)) {
                expired++;
            }
        }
        return expired;
    }

    BigDecimal intrinsicValue(OptionType optionType, BigDecimal strike, BigDecimal underlying) {
        BigDecimal value = optionType == OptionType.CALL ? underlying.subtract(strike) : strike.subtract(underlying);
        return value.max(BigDecimal.ZERO).setScale(reconciliationConfig.getClosingPriceScale(), RoundingMode.HALF_UP);
    }

    private static boolean isAddressable(Transaction transaction) {
        return transaction.getTicker() != null
                && transaction.getExpiration() != null
                && transaction.getStrike() != null
                && transaction.getOptionType() != null;
    }

    private record StockFillKey(LocalDate date, String ticker) {}

    private static final class FillAverage {

        private long quantity;
        private BigDecimal notional = BigDecimal.ZERO;

        void add(int fillQuantity, BigDecimal price) {
            quantity += fillQuantity;
            notional = notional.add(price.multiply(BigDecimal.valueOf(fillQuantity)));
        }

        Optional<BigDecimal> value(int scale) {
            if (quantity == 0) {
                return Optional.empty();
            }
            return Optional.of(notional.divide(BigDecimal.valueOf(quantity), scale, RoundingMode.HALF_UP));
        }
    }
}
