package com.spreadbook.api.dto.request;

import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Normalized contents of one brokerage export file. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionSourceRequest {

    /** File name, for logging only. */
    private String name;

    @Valid
    @Builder.Default
    private List<TransactionRequest> transactions = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<StockTransactionRequest> stockTransactions = new ArrayList<>();
}
