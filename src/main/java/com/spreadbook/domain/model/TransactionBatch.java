package com.spreadbook.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Option and stock transactions read from one or more export files for a single run.
 */
@Value
@Builder
public class TransactionBatch {

    @Builder.Default
    List<Transaction> transactions = List.of();

    @Builder.Default
    List<StockTransaction> stockTransactions = List.of();

    public static TransactionBatch empty() {
        return TransactionBatch.builder().build();
    }

    /**
     * Unions several batches (one per export file), collapsing records that are identical in
     * every field. Overlapping exports of the same account repeat rows verbatim; distinct fills
     * that happen to share a date and leg differ in quantity, price or amount and are kept.
     * Decimals compare by value, so 350 and 350.00 are the same strike.
     */
    public static TransactionBatch union(List<TransactionBatch> batches) {
        Map<List<Object>, Transaction> transactions = new LinkedHashMap<>();
        Map<List<Object>, StockTransaction> stockTransactions = new LinkedHashMap<>();
        for (TransactionBatch batch : batches) {
            if (batch == null) {
                continue;
            }
            if (batch.getTransactions() != null) {
                batch.getTransactions().forEach(txn -> transactions.putIfAbsent(identity(txn), txn));
            }
            if (batch.getStockTransactions() != null) {
                batch.getStockTransactions().forEach(txn -> stockTransactions.putIfAbsent(identity(txn), txn));
            }
        }
        return TransactionBatch.builder()
                .transactions(new ArrayList<>(transactions.values()))
                .stockTransactions(new ArrayList<>(stockTransactions.values()))
                .build();
    }

    private static List<Object> identity(Transaction txn) {
        return Arrays.asList(
                txn.getDate(),
                txn.getTicker(),
                txn.getExpiration(),
                byValue(txn.getStrike()),
                txn.getOptionType(),
                txn.getQuantity(),
                byValue(txn.getPrice()),
                byValue(txn.getAmount()),
                txn.getCategory());
    }

    private static List<Object> identity(StockTransaction txn) {
        return Arrays.asList(
                txn.getDate(), txn.getTicker(), txn.getQuantity(), byValue(txn.getPrice()), byValue(txn.getAmount()));
    }

    private static BigDecimal byValue(BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros();
    }
}
