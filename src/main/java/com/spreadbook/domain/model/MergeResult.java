package com.spreadbook.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of merging spread orders into the position store snapshot.
 *
 * <p>{@code updatedPositions} are existing positions mutated in place (each listed once);
 * {@code newPositions} are positions to append; {@code skippedCount} counts orders that carried
 * nothing new (dedup gate or empty stock delta).
 */
@Data
@Builder
public class MergeResult {

    @Builder.Default
    private List<Position> updatedPositions = new ArrayList<>();

    @Builder.Default
    private List<Position> newPositions = new ArrayList<>();

    private int skippedCount;
}
