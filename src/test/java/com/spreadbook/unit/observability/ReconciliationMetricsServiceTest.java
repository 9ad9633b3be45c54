package com.spreadbook.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.spreadbook.domain.enums.ReconcileMode;
import com.spreadbook.domain.model.Position;
import com.spreadbook.domain.model.ReconciliationResult;
import com.spreadbook.event.ReconciliationEvent;
import com.spreadbook.observability.ReconciliationMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for ReconciliationMetricsService: counters registered up front, updated from run events.
 */
class ReconciliationMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private ReconciliationMetricsService reconciliationMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        reconciliationMetricsService = new ReconciliationMetricsService(meterRegistry);
    }

    @Test
    @DisplayName("Counters exist at zero before any run")
    void countersRegisteredOnConstruction() {
        assertThat(meterRegistry.get("reconciliation.spread.orders").counter().count()).isZero();
        assertThat(meterRegistry.get("reconciliation.positions.added").counter().count()).isZero();
        assertThat(meterRegistry.get("reconciliation.positions.updated").counter().count()).isZero();
        assertThat(meterRegistry.get("reconciliation.skipped").counter().count()).isZero();
        assertThat(meterRegistry.get("reconciliation.duration").timer().count()).isZero();
    }

    @Test
    @DisplayName("A run event adds its counts and records the duration")
    void runEventUpdatesCounters() {
        ReconciliationResult result = ReconciliationResult.builder()
                .mode(ReconcileMode.UPDATE)
                .spreadOrdersGenerated(5)
                .skippedCount(2)
                .updatedPositions(List.of(new Position()))
                .newPositions(List.of(new Position(), new Position()))
                .durationMs(120)
                .build();

        reconciliationMetricsService.onReconciliationEvent(new ReconciliationEvent(this, result));
        reconciliationMetricsService.onReconciliationEvent(new ReconciliationEvent(this, result));

        assertThat(meterRegistry.get("reconciliation.spread.orders").counter().count()).isEqualTo(10.0);
        assertThat(meterRegistry.get("reconciliation.positions.added").counter().count()).isEqualTo(4.0);
        assertThat(meterRegistry.get("reconciliation.positions.updated").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("reconciliation.skipped").counter().count()).isEqualTo(4.0);
        assertThat(meterRegistry.get("reconciliation.duration").timer().count()).isEqualTo(2);
        assertThat(meterRegistry.get("reconciliation.duration").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(240.0);
    }

    @Test
    @DisplayName("reconciliation.runs is tagged by mode")
    void runsCounterTaggedByMode() {
        reconciliationMetricsService.onReconciliationEvent(new ReconciliationEvent(
                this, ReconciliationResult.builder().mode(ReconcileMode.FRESH).build()));
        reconciliationMetricsService.onReconciliationEvent(new ReconciliationEvent(
                this, ReconciliationResult.builder().mode(ReconcileMode.UPDATE).build()));
        reconciliationMetricsService.onReconciliationEvent(new ReconciliationEvent(
                this, ReconciliationResult.builder().mode(ReconcileMode.UPDATE).build()));

        assertThat(meterRegistry.get("reconciliation.runs").tag("mode", "UPDATE").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("reconciliation.runs").tag("mode", "FRESH").counter().count())
                .isEqualTo(1.0);
    }
}
