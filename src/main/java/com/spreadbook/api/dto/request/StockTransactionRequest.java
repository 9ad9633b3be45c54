package com.spreadbook.api.dto.request;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StockTransactionRequest {

    private LocalDate date;
    private String ticker;

    /** Signed: positive = bought, negative = sold. */
    private int quantity;

    private BigDecimal price;
    private BigDecimal amount;
}
