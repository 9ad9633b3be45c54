package com.spreadbook.domain.model;

import com.spreadbook.domain.enums.ReconcileMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one reconciliation run: what changed in the position store, what was skipped as
 * already imported, and the closing prices resolved for the run's legs.
 *
 * <p>The counters are what operators watch: a run over previously imported history that skips
 * nothing, or a run that updates nothing, usually points at a broken dedup gate or a normalizer
 * defect.
 */
@Data
@Builder
public class ReconciliationResult {

    private String runId;
    private ReconcileMode mode;
    private LocalDateTime timestamp;

    private int transactionsParsed;
    private int stockTransactionsParsed;
    private int spreadOrdersGenerated;
    private int existingPositionCount;
    private int skippedCount;

    @Builder.Default
    private List<Position> updatedPositions = new ArrayList<>();

    @Builder.Default
    private List<Position> newPositions = new ArrayList<>();

    @Builder.Default
    private List<ClosingPrice> closingPrices = new ArrayList<>();

    @Builder.Default
    private List<LegKey> unresolvedLegs = new ArrayList<>();

    @Builder.Default
    private List<OptionQuantityMismatch> quantityMismatches = new ArrayList<>();

    private long durationMs;

    public int getPositionsUpdated() {
        return updatedPositions != null ? updatedPositions.size() : 0;
    }

    public int getPositionsAdded() {
        return newPositions != null ? newPositions.size() : 0;
    }

    public boolean hasQuantityMismatches() {
        return quantityMismatches != null && !quantityMismatches.isEmpty();
    }
}
