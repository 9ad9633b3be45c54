package com.spreadbook.api.dto.request;

import com.spreadbook.domain.enums.ReconcileMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API request DTO for a reconciliation run.
 * One {@link TransactionSourceRequest} per export file; the portfolio snapshot is optional and
 * only read by FRESH and REBUILD runs.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconcileRequest {

    @NotNull
    private ReconcileMode mode;

    @Valid
    @Builder.Default
    private List<TransactionSourceRequest> sources = new ArrayList<>();

    @Valid
    private PortfolioRequest portfolio;
}
