package com.spreadbook.repository.jpa;

import com.spreadbook.entity.PositionLegEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the position_legs table.
 * Legs are rewritten as a whole per position: delete by canonical key, then insert the current
 * leg list.
 */
@Repository
public interface PositionLegJpaRepository extends JpaRepository<PositionLegEntity, String> {

    List<PositionLegEntity> findAllByOrderByCanonicalKeyAscLegOrderAsc();

    List<PositionLegEntity> findByCanonicalKeyOrderByLegOrderAsc(String canonicalKey);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM PositionLegEntity l WHERE l.canonicalKey IN :keys")
    int deleteByCanonicalKeyIn(@Param("keys") Collection<String> keys);
}
