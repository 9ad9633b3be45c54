package com.spreadbook.mapper;

import com.spreadbook.api.dto.request.OptionHoldingRequest;
import com.spreadbook.api.dto.request.PortfolioRequest;
import com.spreadbook.api.dto.request.StockHoldingRequest;
import com.spreadbook.api.dto.request.StockTransactionRequest;
import com.spreadbook.api.dto.request.TransactionRequest;
import com.spreadbook.api.dto.request.TransactionSourceRequest;
import com.spreadbook.domain.model.OptionHolding;
import com.spreadbook.domain.model.PortfolioSnapshot;
import com.spreadbook.domain.model.StockHolding;
import com.spreadbook.domain.model.StockTransaction;
import com.spreadbook.domain.model.Transaction;
import com.spreadbook.domain.model.TransactionBatch;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.NullValueMappingStrategy;

/**
 * MapStruct mapper from reconciliation request DTOs to the engine's input model.
 *
 * <p>Missing lists map to empty lists. Several sources are unioned into one batch, collapsing
 * rows repeated verbatim across overlapping exports.
 */
@Mapper(nullValueIterableMappingStrategy = NullValueMappingStrategy.RETURN_DEFAULT)
public interface ReconcileRequestMapper {

    Transaction toTransaction(TransactionRequest request);

    StockTransaction toStockTransaction(StockTransactionRequest request);

    TransactionBatch toBatch(TransactionSourceRequest source);

    StockHolding toStockHolding(StockHoldingRequest request);

    OptionHolding toOptionHolding(OptionHoldingRequest request);

    PortfolioSnapshot toSnapshot(PortfolioRequest request);

    default TransactionBatch toBatch(List<TransactionSourceRequest> sources) {
        if (sources == null || sources.isEmpty()) {
            return TransactionBatch.empty();
        }
        return TransactionBatch.union(sources.stream().map(this::toBatch).toList());
    }
}
