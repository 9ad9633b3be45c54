package com.spreadbook.observability;

import com.spreadbook.domain.model.ReconciliationResult;
import com.spreadbook.event.ReconciliationEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for reconciliation runs:
 * <ul>
 *   <li><b>reconciliation.runs</b> (counter, tagged by mode): completed runs</li>
 *   <li><b>reconciliation.spread.orders</b> (counter): spread orders after pre-merge</li>
 *   <li><b>reconciliation.positions.added</b> (counter): new positions written</li>
 *   <li><b>reconciliation.positions.updated</b> (counter): existing positions changed</li>
 *   <li><b>reconciliation.skipped</b> (counter): orders skipped as already imported</li>
 *   <li><b>reconciliation.duration</b> (timer): wall time of a run including store I/O</li>
 * </ul>
 */
@Service
public class ReconciliationMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter spreadOrdersCounter;
    private final Counter positionsAddedCounter;
    private final Counter positionsUpdatedCounter;
    private final Counter skippedCounter;
    private final Timer durationTimer;

    public ReconciliationMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.spreadOrdersCounter = Counter.builder("reconciliation.spread.orders")
                .description("Spread orders produced by pairing and pre-merge")
                .register(meterRegistry);

        this.positionsAddedCounter = Counter.builder("reconciliation.positions.added")
                .description("Positions created by reconciliation runs")
                .register(meterRegistry);

        this.positionsUpdatedCounter = Counter.builder("reconciliation.positions.updated")
                .description("Existing positions changed by reconciliation runs")
                .register(meterRegistry);

        this.skippedCounter = Counter.builder("reconciliation.skipped")
                .description("Spread orders skipped because they were already applied")
                .register(meterRegistry);

        this.durationTimer = Timer.builder("reconciliation.duration")
                .description("Reconciliation run duration including store load and save")
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onReconciliationEvent(ReconciliationEvent event) {
        ReconciliationResult result = event.getResult();

        Counter.builder("reconciliation.runs")
                .description("Completed reconciliation runs")
                .tag("mode", result.getMode() != null ? result.getMode().name() : "UNKNOWN")
                .register(meterRegistry)
                .increment();

        spreadOrdersCounter.increment(result.getSpreadOrdersGenerated());
        positionsAddedCounter.increment(result.getPositionsAdded());
        positionsUpdatedCounter.increment(result.getPositionsUpdated());
        skippedCounter.increment(result.getSkippedCount());
        durationTimer.record(result.getDurationMs(), TimeUnit.MILLISECONDS);
    }
}
