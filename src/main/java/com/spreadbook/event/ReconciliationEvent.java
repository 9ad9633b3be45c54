package com.spreadbook.event;

import com.spreadbook.domain.model.ReconciliationResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every completed reconciliation run, once the position store has been written.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>ReconciliationRunMonitor: logs the operator summary and warns on suspicious runs</li>
 *   <li>ReconciliationMetricsService: updates the reconciliation counters</li>
 * </ul>
 * Not published when the run fails; a failed run leaves the store untouched.
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationResult result;

    /**
     * @param source the component publishing this event
     * @param result the completed run's result
     */
    public ReconciliationEvent(Object source, ReconciliationResult result) {
        super(source);
        this.result = result;
    }

    public ReconciliationResult getResult() {
        return result;
    }
}
