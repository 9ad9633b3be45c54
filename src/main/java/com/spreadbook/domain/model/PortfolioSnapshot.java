package com.spreadbook.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Holdings reported by the broker at a point in time. Used by FRESH and REBUILD runs as the
 * source of absolute stock quantities and the cash balance, and to cross-check option quantities
 * derived from the transaction history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioSnapshot {

    private LocalDate asOf;

    @Builder.Default
    private List<StockHolding> stocks = new ArrayList<>();

    @Builder.Default
    private List<OptionHolding> options = new ArrayList<>();

    private BigDecimal cash;

    public boolean hasCash() {
        return cash != null && cash.signum() > 0;
    }
}
