package com.spreadbook.entity;

import com.spreadbook.domain.enums.LegType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the position_legs table.
 * Each row is one leg of a stored position (1 for stock, cash and naked options, 2 for verticals,
 * straddles and strangles, 4 for iron condors), ordered by {@code legOrder}.
 */
@Entity
@Table(name = "position_legs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionLegEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "canonical_key", length = 160)
    private String canonicalKey;

    @Column(name = "leg_order")
    private int legOrder;

    @Column(length = 20)
    private String symbol;

    private LocalDate expiration;

    @Column(precision = 12, scale = 4)
    private BigDecimal strike;

    @Enumerated(EnumType.STRING)
    @Column(name = "leg_type", columnDefinition = "varchar(10)")
    private LegType legType;

    /** Signed quantity: positive = long, negative = short. */
    private int quantity;

    @Column(name = "average_price", precision = 15, scale = 4)
    private BigDecimal averagePrice;

    @Column(name = "closing_price", precision = 15, scale = 4)
    private BigDecimal closingPrice;
}
