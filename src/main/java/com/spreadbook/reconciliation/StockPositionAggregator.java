package com.spreadbook.reconciliation;

import com.spreadbook.config.ReconciliationConfig;
import com.spreadbook.domain.enums.SpreadType;
import com.spreadbook.domain.model.PortfolioSnapshot;
import com.spreadbook.domain.model.Position;
import com.spreadbook.domain.model.SpreadOrder;
import com.spreadbook.domain.model.StockHolding;
import com.spreadbook.domain.model.StockTransaction;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns equity activity into STOCK (and CASH) spread orders.
 *
 * <p>Update runs use {@link #aggregate} to emit one signed delta per ticker, counting only stock
 * transactions strictly after the ticker's cutoff (the stored position's {@code lastTxnDate}).
 * Fresh and rebuild runs use {@link #fromSnapshot} to emit absolute holdings from the broker's
 * portfolio snapshot.
 */
@Component
public class StockPositionAggregator {

    private static final Logger log = LoggerFactory.getLogger(StockPositionAggregator.class);

    private final ReconciliationConfig reconciliationConfig;

    public StockPositionAggregator(ReconciliationConfig reconciliationConfig) {
        this.reconciliationConfig = reconciliationConfig;
    }

    /**
     * One STOCK order per ticker with qualifying transactions: summed signed quantity, latest date
     * and the price of the latest transaction.
     *
     * @param cutoffs per-ticker date; only transactions strictly after it count. Tickers without a
     *     cutoff count every transaction.
     */
    public List<SpreadOrder> aggregate(Collection<StockTransaction> stockTransactions, Map<String, LocalDate> cutoffs) {
        Map<String, SpreadOrder> byTicker = new LinkedHashMap<>();
        int ignored = 0;
        for (StockTransaction stockTransaction : stockTransactions) {
            if (stockTransaction.getTicker() == null || stockTransaction.getTicker().isBlank()) {
                ignored++;
                continue;
            }
            LocalDate cutoff = cutoffs.get(stockTransaction.getTicker());
            if (cutoff != null && (stockTransaction.getDate() == null || !stockTransaction.getDate().isAfter(cutoff))) {
                continue;
            }

            SpreadOrder order = byTicker.computeIfAbsent(stockTransaction.getTicker(), ticker -> SpreadOrder.builder()
                    .type(SpreadType.STOCK)
                    .ticker(ticker)
                    .build());
            order.setQuantity(order.getQuantity() + stockTransaction.getQuantity());
            if (order.getDate() == null
                    || (stockTransaction.getDate() != null && !stockTransaction.getDate().isBefore(order.getDate()))) {
                order.setDate(stockTransaction.getDate());
                if (stockTransaction.getPrice() != null) {
                    order.setPrice(stockTransaction.getPrice()
                            .setScale(reconciliationConfig.getPriceScale(), RoundingMode.HALF_UP));
                }
            }
        }
        if (ignored > 0) {
            log.warn("Stock aggregation: ignored {} stock transactions without ticker", ignored);
        }
        log.debug("Stock aggregation: {} tickers with activity after cutoff", byTicker.size());
        return new ArrayList<>(byTicker.values());
    }

    /** Latest transaction date per ticker. */
    public Map<String, LocalDate> latestStockDates(Collection<StockTransaction> stockTransactions) {
        Map<String, LocalDate> latest = new HashMap<>();
        for (StockTransaction stockTransaction : stockTransactions) {
            if (stockTransaction.getTicker() != null && stockTransaction.getDate() != null) {
                latest.merge(stockTransaction.getTicker(), stockTransaction.getDate(), SpreadPreMerger::later);
            }
        }
        return latest;
    }

    /** Per-ticker cutoffs taken from the stored stock positions' {@code lastTxnDate}. */
    public Map<String, LocalDate> stockCutoffs(Map<String, Position> existingPositions) {
        Map<String, LocalDate> cutoffs = new HashMap<>();
        existingPositions.forEach((key, position) -> {
            if (CanonicalKeys.isStockKey(key) && position.getLastTxnDate() != null) {
                cutoffs.put(CanonicalKeys.tickerOf(key), position.getLastTxnDate());
            }
        });
        return cutoffs;
    }

    /**
     * Absolute STOCK orders from the snapshot's holdings plus a CASH order for a positive balance.
     * Holdings are dated with the ticker's latest stock transaction, else the snapshot date.
     */
    public List<SpreadOrder> fromSnapshot(PortfolioSnapshot snapshot, Collection<StockTransaction> stockTransactions) {
        Map<String, LocalDate> latestDates = latestStockDates(stockTransactions);
        List<SpreadOrder> orders = new ArrayList<>();
        for (StockHolding holding : snapshot.getStocks()) {
            if (holding.getTicker() == null || holding.getTicker().isBlank()) {
                continue;
            }
            orders.add(SpreadOrder.builder()
                    .type(SpreadType.STOCK)
                    .ticker(holding.getTicker())
                    .date(latestDates.getOrDefault(holding.getTicker(), snapshot.getAsOf()))
                    .quantity(holding.getQuantity())
                    .price(holding.getPricePaid())
                    .build());
        }
        if (snapshot.hasCash()) {
            orders.add(SpreadOrder.builder()
                    .type(SpreadType.CASH)
                    .date(snapshot.getAsOf())
                    .price(snapshot.getCash())
                    .build());
        }
        log.info("Snapshot: {} stock holdings, cash {}", snapshot.getStocks().size(),
                snapshot.hasCash() ? snapshot.getCash().toPlainString() : "none");
        return orders;
    }
}
