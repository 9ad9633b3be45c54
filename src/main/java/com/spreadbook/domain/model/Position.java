package com.spreadbook.domain.model;

import com.spreadbook.domain.enums.SpreadType;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A persisted trading position: a vertical, condor, straddle/strangle, naked option, stock
 * holding or the cash balance, identified by its canonical key.
 *
 * <p>{@code lastTxnDate} is the high-water mark of transactions already applied to the position.
 * Re-imports carrying nothing newer are skipped, which is what makes repeated or overlapping
 * exports safe to import.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String canonicalKey;
    private SpreadType spreadType;
    private String groupLabel;
    private LocalDate lastTxnDate;

    @Builder.Default
    private List<PositionLeg> legs = new ArrayList<>();

    public PositionLeg firstLeg() {
        return legs.isEmpty() ? null : legs.get(0);
    }
}
