package com.spreadbook.api.controller;

import com.spreadbook.domain.model.Position;
import com.spreadbook.exception.PositionNotFoundException;
import com.spreadbook.repository.PositionStore;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the reconciled position store.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/positions -- all stored positions, ordered by canonical key</li>
 *   <li>GET /api/positions/by-key?key=... -- one position by canonical key</li>
 * </ul>
 * Canonical keys contain {@code |} and {@code /}, so they are passed as a query parameter.
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final PositionStore positionStore;

    public PositionController(PositionStore positionStore) {
        this.positionStore = positionStore;
    }

    @GetMapping
    public ResponseEntity<List<Position>> listPositions() {
        return ResponseEntity.ok(new ArrayList<>(positionStore.loadPositions().values()));
    }

    @GetMapping("/by-key")
    public ResponseEntity<Position> getPosition(@RequestParam("key") String canonicalKey) {
        Position position = positionStore
                .findByKey(canonicalKey)
                .orElseThrow(() -> new PositionNotFoundException(canonicalKey));
        return ResponseEntity.ok(position);
    }
}
