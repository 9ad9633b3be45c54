package com.spreadbook.domain.model;

import com.spreadbook.domain.enums.OptionType;
import com.spreadbook.domain.enums.Side;
import com.spreadbook.domain.enums.SpreadType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Intermediate result of leg pairing: a vertical, condor, straddle/strangle, naked leg, stock
 * holding or cash balance. Created and discarded within one reconciliation run.
 *
 * <p>Two layouts:
 * <ul>
 *   <li>Flat (VERTICAL, NAKED_LONG, NAKED_SHORT): {@code lowerStrike}/{@code lowerPrice} is the
 *       long leg, {@code upperStrike}/{@code upperPrice} the short leg, {@code quantity} the
 *       unsigned contract count. A naked long has no upper side; a naked short has no lower side.</li>
 *   <li>Multi-leg (IRON_CONDOR, straddles, strangles): {@code legs} sorted by ascending strike,
 *       {@code quantity} the per-leg contract count.</li>
 * </ul>
 * STOCK orders carry a signed {@code quantity} (delta or absolute holding) and {@code price};
 * CASH orders carry the balance in {@code price}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SpreadOrder {

    private SpreadType type;
    private String ticker;
    private LocalDate expiration;
    private LocalDate date;

    private OptionType optionType;
    private BigDecimal lowerStrike;
    private BigDecimal upperStrike;
    private BigDecimal lowerPrice;
    private BigDecimal upperPrice;

    private int quantity;

    /** Stock price or cash balance. */
    private BigDecimal price;

    @Builder.Default
    private List<SpreadLeg> legs = new ArrayList<>();

    /** Deep enough copy for merging: the leg list is copied, legs themselves are immutable. */
    public SpreadOrder copy() {
        return toBuilder().legs(new ArrayList<>(legs)).build();
    }

    /**
     * Option legs of this order in either layout. Empty for stock and cash.
     */
    public List<SpreadLeg> toLegs() {
        if (type == null || type == SpreadType.STOCK || type == SpreadType.CASH) {
            return List.of();
        }
        if (type.isMultiLeg()) {
            return legs;
        }
        List<SpreadLeg> flat = new ArrayList<>(2);
        if (type != SpreadType.NAKED_SHORT && lowerStrike != null) {
            flat.add(flatLeg(lowerStrike, Side.LONG, lowerPrice));
        }
        if (type != SpreadType.NAKED_LONG && upperStrike != null) {
            flat.add(flatLeg(upperStrike, Side.SHORT, upperPrice));
        }
        return flat;
    }

    /** Sum of signed option quantities across all legs. */
    public int signedOptionQuantity() {
        return toLegs().stream().mapToInt(SpreadLeg::signedQuantity).sum();
    }

    private SpreadLeg flatLeg(BigDecimal strike, Side side, BigDecimal legPrice) {
        return SpreadLeg.builder()
                .strike(strike)
                .optionType(optionType)
                .side(side)
                .quantity(quantity)
                .price(legPrice)
                .build();
    }
}
