package com.spreadbook.entity;

import com.spreadbook.domain.enums.SpreadType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions table. The canonical key is the primary key, so a structure can
 * only be stored once. Legs live in position_legs.
 */
@Entity
@Table(name = "positions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(name = "canonical_key", length = 160)
    private String canonicalKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "spread_type", columnDefinition = "varchar(20)")
    private SpreadType spreadType;

    @Column(name = "group_label", length = 120)
    private String groupLabel;

    /** High-water mark of applied transactions; drives the re-import dedup gate. */
    @Column(name = "last_txn_date")
    private LocalDate lastTxnDate;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
