package com.spreadbook.repository.jpa;

import com.spreadbook.entity.PositionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table, keyed by canonical key.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {

    List<PositionEntity> findAllByOrderByCanonicalKeyAsc();
}
