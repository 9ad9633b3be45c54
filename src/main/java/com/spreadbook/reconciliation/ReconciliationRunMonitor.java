package com.spreadbook.reconciliation;

import com.spreadbook.domain.enums.ReconcileMode;
import com.spreadbook.domain.model.ReconciliationResult;
import com.spreadbook.event.ReconciliationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Logs the operator summary of each completed run and flags runs whose counts usually mean the
 * input or the dedup gate is broken:
 * <ul>
 *   <li>an update run against a non-empty store that produced orders but skipped none;</li>
 *   <li>a run where every spread order was skipped;</li>
 *   <li>option legs whose derived quantity disagrees with the broker snapshot.</li>
 * </ul>
 */
@Component
public class ReconciliationRunMonitor {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationRunMonitor.class);

    @EventListener
    @Order(15)
    public void onReconciliation(ReconciliationEvent event) {
        ReconciliationResult result = event.getResult();

        log.info(
                "Reconciliation {} [{}]: {} transactions, {} stock transactions, {} spread orders, "
                        + "{} positions updated, {} added, {} skipped, {} unresolved legs",
                result.getRunId(),
                result.getMode(),
                result.getTransactionsParsed(),
                result.getStockTransactionsParsed(),
                result.getSpreadOrdersGenerated(),
                result.getPositionsUpdated(),
                result.getPositionsAdded(),
                result.getSkippedCount(),
                result.getUnresolvedLegs().size());

        if (isSuspicious(result)) {
            log.warn(
                    "Reconciliation {} skipped nothing against {} stored positions; "
                            + "the import may overlap earlier exports without being deduplicated",
                    result.getRunId(),
                    result.getExistingPositionCount());
        }
        if (result.getSpreadOrdersGenerated() > 0 && result.getSkippedCount() >= result.getSpreadOrdersGenerated()) {
            log.warn(
                    "Reconciliation {} skipped all {} spread orders; nothing newer than the stored positions was imported",
                    result.getRunId(),
                    result.getSpreadOrdersGenerated());
        }
        if (result.hasQuantityMismatches()) {
            log.warn(
                    "Reconciliation {} found {} option legs whose quantity differs from the portfolio snapshot",
                    result.getRunId(),
                    result.getQuantityMismatches().size());
        }
    }

    public boolean isSuspicious(ReconciliationResult result) {
        return result.getMode() == ReconcileMode.UPDATE
                && result.getExistingPositionCount() > 0
                && result.getSpreadOrdersGenerated() > 0
                && result.getSkippedCount() == 0
                && result.getPositionsUpdated() > 0;
    }
}
