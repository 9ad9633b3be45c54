package com.spreadbook.repository.jpa;

import com.spreadbook.domain.model.Position;
import com.spreadbook.domain.model.PositionLeg;
import com.spreadbook.entity.PositionEntity;
import com.spreadbook.entity.PositionLegEntity;
import com.spreadbook.exception.PositionStoreException;
import com.spreadbook.mapper.PositionMapper;
import com.spreadbook.reconciliation.CanonicalKeys;
import com.spreadbook.repository.PositionStore;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link PositionStore} backed by H2 through Spring Data JPA.
 *
 * <p>Loaded positions are keyed by the key derived from their legs. A row whose stored key
 * disagrees is re-keyed in memory and moved to the derived key the next time it is saved.
 *
 * <p>Saving rewrites each touched position's leg rows. Both write operations run in a single
 * transaction; any {@link DataAccessException} is rethrown as {@link PositionStoreException}
 * after the rollback.
 */
@Repository
public class JpaPositionStore implements PositionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPositionStore.class);

    private final PositionJpaRepository positionJpaRepository;
    private final PositionLegJpaRepository positionLegJpaRepository;
    private final PositionMapper positionMapper;

    public JpaPositionStore(
            PositionJpaRepository positionJpaRepository,
            PositionLegJpaRepository positionLegJpaRepository,
            PositionMapper positionMapper) {
        this.positionJpaRepository = positionJpaRepository;
        this.positionLegJpaRepository = positionLegJpaRepository;
        this.positionMapper = positionMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Position> loadPositions() {
        try {
            Map<String, List<PositionLegEntity>> legsByKey = positionLegJpaRepository
                    .findAllByOrderByCanonicalKeyAscLegOrderAsc()
                    .stream()
                    .collect(Collectors.groupingBy(
                            PositionLegEntity::getCanonicalKey, LinkedHashMap::new, Collectors.toList()));

            Map<String, Position> positions = new LinkedHashMap<>();
            for (PositionEntity entity : positionJpaRepository.findAllByOrderByCanonicalKeyAsc()) {
                Position position = toDomain(entity, legsByKey.getOrDefault(entity.getCanonicalKey(), List.of()));
                String key = derivedKey(position);
                if (!key.equals(entity.getCanonicalKey()) && positions.containsKey(key)) {
                    log.warn("Position {} derives key {} which is already taken, keeping stored key",
                            entity.getCanonicalKey(), key);
                    key = entity.getCanonicalKey();
                }
                position.setCanonicalKey(key);
                positions.put(key, position);
            }
            log.debug("Loaded {} positions from store", positions.size());
            return positions;
        } catch (DataAccessException e) {
            log.error("Failed to load positions: {}", e.getMessage(), e);
            throw new PositionStoreException("Failed to load positions", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Position> findByKey(String canonicalKey) {
        try {
            return positionJpaRepository
                    .findById(canonicalKey)
                    .map(entity -> toDomain(
                            entity, positionLegJpaRepository.findByCanonicalKeyOrderByLegOrderAsc(canonicalKey)));
        } catch (DataAccessException e) {
            throw new PositionStoreException("Failed to read position " + canonicalKey, e);
        }
    }

    @Override
    @Transactional
    public void savePositions(List<Position> updatedPositions, List<Position> newPositions) {
        List<Position> all = new ArrayList<>(updatedPositions.size() + newPositions.size());
        all.addAll(updatedPositions);
        all.addAll(newPositions);
        if (all.isEmpty()) {
            return;
        }
        try {
            write(all);
            log.info("Saved positions: {} updated, {} new", updatedPositions.size(), newPositions.size());
        } catch (DataAccessException e) {
            log.error("Failed to save positions, store left unchanged: {}", e.getMessage(), e);
            throw new PositionStoreException("Failed to save positions", e);
        }
    }

    @Override
    @Transactional
    public void replaceAll(List<Position> positions) {
        try {
            positionLegJpaRepository.deleteAllInBatch();
            positionJpaRepository.deleteAllInBatch();
            write(positions);
            log.info("Replaced position store with {} positions", positions.size());
        } catch (DataAccessException e) {
            log.error("Failed to replace positions, store left unchanged: {}", e.getMessage(), e);
            throw new PositionStoreException("Failed to replace positions", e);
        }
    }

    private void write(List<Position> positions) {
        LocalDateTime now = LocalDateTime.now();
        List<String> keys = positions.stream().map(Position::getCanonicalKey).toList();

        List<String> staleKeys = staleKeys(positions, keys);
        if (!staleKeys.isEmpty()) {
            log.info("Moving positions off stale keys {}", staleKeys);
            positionLegJpaRepository.deleteByCanonicalKeyIn(staleKeys);
            positionJpaRepository.deleteAllByIdInBatch(staleKeys);
        }

        Map<String, LocalDateTime> createdAt = positionJpaRepository
                .findAllById(keys)
                .stream()
                .filter(entity -> entity.getCreatedAt() != null)
                .collect(Collectors.toMap(PositionEntity::getCanonicalKey, PositionEntity::getCreatedAt));

        List<PositionEntity> positionEntities = new ArrayList<>(positions.size());
        List<PositionLegEntity> legEntities = new ArrayList<>();
        for (Position position : positions) {
            PositionEntity entity = positionMapper.toEntity(position);
            entity.setCreatedAt(createdAt.getOrDefault(position.getCanonicalKey(), now));
            entity.setUpdatedAt(now);
            positionEntities.add(entity);

            int legOrder = 0;
            for (PositionLeg leg : position.getLegs()) {
                PositionLegEntity legEntity = positionMapper.toLegEntity(leg);
                if (legEntity.getId() == null) {
                    legEntity.setId(UUID.randomUUID().toString());
                }
                legEntity.setCanonicalKey(position.getCanonicalKey());
                legEntity.setLegOrder(legOrder++);
                legEntities.add(legEntity);
            }
        }

        positionLegJpaRepository.deleteByCanonicalKeyIn(keys);
        positionJpaRepository.saveAllAndFlush(positionEntities);
        positionLegJpaRepository.saveAllAndFlush(legEntities);

        // new legs carry their row id from now on
        for (int i = 0, legIndex = 0; i < positions.size(); i++) {
            for (PositionLeg leg : positions.get(i).getLegs()) {
                leg.setSourceRowRef(legEntities.get(legIndex++).getId());
            }
        }
    }

    /**
     * Key derived from the legs. Positions without legs, or whose legs form no known structure,
     * keep the stored key.
     */
    private static String derivedKey(Position position) {
        String storedKey = position.getCanonicalKey();
        if (position.getLegs().isEmpty()) {
            return storedKey;
        }
        try {
            String key = CanonicalKeys.forLegs(position.getLegs());
            if (!key.equals(storedKey)) {
                log.warn("Position stored as {} has legs keyed {}, re-keying", storedKey, key);
            }
            return key;
        } catch (IllegalArgumentException e) {
            log.warn("Position {} keeps its stored key: {}", storedKey, e.getMessage());
            return storedKey;
        }
    }

    /** Stored keys that legs of these positions were loaded from but which are no longer written. */
    private List<String> staleKeys(List<Position> positions, List<String> keys) {
        List<String> rowRefs = positions.stream()
                .flatMap(position -> position.getLegs().stream())
                .map(PositionLeg::getSourceRowRef)
                .filter(Objects::nonNull)
                .toList();
        if (rowRefs.isEmpty()) {
            return List.of();
        }
        Set<String> written = new HashSet<>(keys);
        return positionLegJpaRepository.findAllById(rowRefs).stream()
                .map(PositionLegEntity::getCanonicalKey)
                .filter(key -> !written.contains(key))
                .distinct()
                .toList();
    }

    private Position toDomain(PositionEntity entity, List<PositionLegEntity> legEntities) {
        Position position = positionMapper.toDomain(entity);
        position.setLegs(new ArrayList<>(positionMapper.toDomainLegs(legEntities)));
        return position;
    }
}
