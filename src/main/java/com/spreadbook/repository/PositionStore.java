package com.spreadbook.repository;

import com.spreadbook.domain.model.Position;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent store of reconciled positions.
 *
 * <p>Read once at the start of a run and written once at the end. Writes are all-or-nothing:
 * implementations throw {@link com.spreadbook.exception.PositionStoreException} and leave the
 * previous state in place when a write fails.
 */
public interface PositionStore {

    /** All stored positions by canonical key, legs in stored order. */
    Map<String, Position> loadPositions();

    /** Rewrites the updated positions and inserts the created ones in one transaction. */
    void savePositions(List<Position> updatedPositions, List<Position> newPositions);

    /** Discards every stored position and stores the given ones in one transaction. */
    void replaceAll(List<Position> positions);

    Optional<Position> findByKey(String canonicalKey);
}
