package com.spreadbook.api.dto.request;

import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Broker holdings snapshot accompanying a FRESH or REBUILD run. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioRequest {

    private LocalDate asOf;

    @Valid
    @Builder.Default
    private List<StockHoldingRequest> stocks = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<OptionHoldingRequest> options = new ArrayList<>();

    private BigDecimal cash;
}
