package com.spreadbook.reconciliation;

import com.spreadbook.domain.enums.ReconcileMode;
import com.spreadbook.domain.model.ClosingPrices;
import com.spreadbook.domain.model.MergeResult;
import com.spreadbook.domain.model.OptionQuantityMismatch;
import com.spreadbook.domain.model.PortfolioSnapshot;
import com.spreadbook.domain.model.Position;
import com.spreadbook.domain.model.ReconciliationResult;
import com.spreadbook.domain.model.SpreadOrder;
import com.spreadbook.domain.model.TransactionBatch;
import com.spreadbook.event.ReconciliationEvent;
import com.spreadbook.exception.BusinessException;
import com.spreadbook.exception.ErrorCode;
import com.spreadbook.reconciliation.PositionMerger.StockQuantities;
import com.spreadbook.repository.PositionStore;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Reconciles a batch of brokerage transactions into the position store.
 *
 * <p>A run loads the store, computes in memory and writes the store back once:
 * <ol>
 *   <li>stock orders: deltas since each ticker's stored high-water mark (UPDATE) or absolute
 *       holdings and cash from the portfolio snapshot (FRESH, REBUILD);</li>
 *   <li>leg pairing of option opens, then pre-merge by canonical key;</li>
 *   <li>closing price resolution over all option transactions;</li>
 *   <li>snapshot cross-check, adding snapshot-only option legs as naked orders (FRESH, REBUILD);</li>
 *   <li>merge into the loaded positions (REBUILD starts from an empty store);</li>
 *   <li>closing prices copied onto the touched legs, store written, {@link ReconciliationEvent}
 *       published.</li>
 * </ol>
 * A store failure aborts the run before the event is published and leaves the store as it was.
 */
@Service
public class TransactionReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(TransactionReconciliationService.class);

    private final LegPairingEngine legPairingEngine;
    private final SpreadPreMerger spreadPreMerger;
    private final ClosingPriceResolver closingPriceResolver;
    private final PositionMerger positionMerger;
    private final StockPositionAggregator stockPositionAggregator;
    private final OptionQuantityValidator optionQuantityValidator;
    private final PositionStore positionStore;
    private final ApplicationEventPublisher applicationEventPublisher;

    public TransactionReconciliationService(
            LegPairingEngine legPairingEngine,
            SpreadPreMerger spreadPreMerger,
            ClosingPriceResolver closingPriceResolver,
            PositionMerger positionMerger,
            StockPositionAggregator stockPositionAggregator,
            OptionQuantityValidator optionQuantityValidator,
            PositionStore positionStore,
            ApplicationEventPublisher applicationEventPublisher) {
        this.legPairingEngine = legPairingEngine;
        this.spreadPreMerger = spreadPreMerger;
        this.closingPriceResolver = closingPriceResolver;
        this.positionMerger = positionMerger;
        this.stockPositionAggregator = stockPositionAggregator;
        this.optionQuantityValidator = optionQuantityValidator;
        this.positionStore = positionStore;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Full run against the position store.
     *
     * @throws BusinessException if the batch is unusable for the mode
     * @throws com.spreadbook.exception.PositionStoreException if loading or saving fails
     */
    public ReconciliationResult reconcile(TransactionBatch batch, PortfolioSnapshot snapshot, ReconcileMode mode) {
        long startTime = System.currentTimeMillis();
        validate(batch, snapshot, mode);
        log.info(
                "Reconciliation started: mode={}, {} transactions, {} stock transactions, snapshot={}",
                mode,
                batch.getTransactions().size(),
                batch.getStockTransactions().size(),
                snapshot != null);

        Map<String, Position> existingPositions = mode == ReconcileMode.REBUILD ? Map.of() : positionStore.loadPositions();

        ReconciliationResult result = reconcile(batch, snapshot, existingPositions, mode);

        if (mode == ReconcileMode.REBUILD) {
            positionStore.replaceAll(result.getNewPositions());
        } else {
            positionStore.savePositions(result.getUpdatedPositions(), result.getNewPositions());
        }

        result.setDurationMs(System.currentTimeMillis() - startTime);
        log.info(
                "Reconciliation {} completed in {}ms: {} updated, {} added, {} skipped",
                result.getRunId(),
                result.getDurationMs(),
                result.getPositionsUpdated(),
                result.getPositionsAdded(),
                result.getSkippedCount());

        applicationEventPublisher.publishEvent(new ReconciliationEvent(this, result));
        return result;
    }

    /**
     * In-memory part of a run: no store access, no event. Existing positions are mutated in
     * place and reported in {@link ReconciliationResult#getUpdatedPositions()}.
     */
    public ReconciliationResult reconcile(
            TransactionBatch batch,
            PortfolioSnapshot snapshot,
            Map<String, Position> existingPositions,
            ReconcileMode mode) {
        validate(batch, snapshot, mode);
        boolean useSnapshot = mode != ReconcileMode.UPDATE && snapshot != null;

        List<SpreadOrder> rawOrders = new ArrayList<>(stockOrders(batch, snapshot, existingPositions, mode));
        rawOrders.addAll(legPairingEngine.pair(batch.getTransactions()));
        List<SpreadOrder> spreadOrders = spreadPreMerger.preMerge(rawOrders);

        ClosingPrices closingPrices =
                closingPriceResolver.resolve(batch.getTransactions(), batch.getStockTransactions());

        List<OptionQuantityMismatch> mismatches = List.of();
        if (useSnapshot) {
            OptionQuantityValidator.Outcome outcome = optionQuantityValidator.validate(spreadOrders, snapshot);
            mismatches = outcome.mismatches();
            spreadOrders.addAll(outcome.orphanOrders());
        }

        StockQuantities stockQuantities =
                mode == ReconcileMode.UPDATE ? StockQuantities.DELTA : StockQuantities.ABSOLUTE;
        MergeResult mergeResult = positionMerger.merge(spreadOrders, existingPositions, stockQuantities);
        positionMerger.applyClosingPrices(mergeResult.getUpdatedPositions(), closingPrices);
        positionMerger.applyClosingPrices(mergeResult.getNewPositions(), closingPrices);

        return ReconciliationResult.builder()
                .runId(UUID.randomUUID().toString())
                .mode(mode)
                .timestamp(LocalDateTime.now())
                .transactionsParsed(batch.getTransactions().size())
                .stockTransactionsParsed(batch.getStockTransactions().size())
                .spreadOrdersGenerated(spreadOrders.size())
                .existingPositionCount(existingPositions.size())
                .skippedCount(mergeResult.getSkippedCount())
                .updatedPositions(mergeResult.getUpdatedPositions())
                .newPositions(mergeResult.getNewPositions())
                .closingPrices(closingPrices.asList())
                .unresolvedLegs(closingPrices.unresolvedLegs())
                .quantityMismatches(mismatches)
                .build();
    }

    /**
     * Pairing and pre-merge only, for inspecting what an import would produce.
     */
    public List<SpreadOrder> previewSpreads(TransactionBatch batch) {
        List<SpreadOrder> spreadOrders = spreadPreMerger.preMerge(legPairingEngine.pair(batch.getTransactions()));
        log.info("Spread preview: {} transactions -> {} spread orders", batch.getTransactions().size(), spreadOrders.size());
        return spreadOrders;
    }

    private List<SpreadOrder> stockOrders(
            TransactionBatch batch,
            PortfolioSnapshot snapshot,
            Map<String, Position> existingPositions,
            ReconcileMode mode) {
        if (mode == ReconcileMode.UPDATE) {
            Map<String, LocalDate> cutoffs = stockPositionAggregator.stockCutoffs(existingPositions);
            return stockPositionAggregator.aggregate(batch.getStockTransactions(), cutoffs);
        }
        if (snapshot != null) {
            return stockPositionAggregator.fromSnapshot(snapshot, batch.getStockTransactions());
        }
        // no holdings to take absolutes from: the full history is the holding
        return stockPositionAggregator.aggregate(batch.getStockTransactions(), Map.of());
    }

    private void validate(TransactionBatch batch, PortfolioSnapshot snapshot, ReconcileMode mode) {
        if (batch == null || mode == null) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Transaction batch and mode are required");
        }
        if (mode == ReconcileMode.UPDATE && batch.getTransactions().isEmpty()) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Update runs need at least one option transaction",
                    Map.of("stockTransactions", batch.getStockTransactions().size()));
        }
        boolean empty = batch.getTransactions().isEmpty() && batch.getStockTransactions().isEmpty();
        if (mode != ReconcileMode.UPDATE && empty && snapshot == null) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, mode + " runs need transactions or a portfolio snapshot");
        }
    }
}
