package com.spreadbook.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.spreadbook.api.dto.request.OptionHoldingRequest;
import com.spreadbook.api.dto.request.PortfolioRequest;
import com.spreadbook.api.dto.request.StockTransactionRequest;
import com.spreadbook.api.dto.request.TransactionRequest;
import com.spreadbook.api.dto.request.TransactionSourceRequest;
import com.spreadbook.domain.enums.OptionType;
import com.spreadbook.domain.enums.TransactionCategory;
import com.spreadbook.domain.model.PortfolioSnapshot;
import com.spreadbook.domain.model.Transaction;
import com.spreadbook.domain.model.TransactionBatch;
import com.spreadbook.mapper.ReconcileRequestMapper;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

/**
 * Unit tests for {@link ReconcileRequestMapper}.
 */
class ReconcileRequestMapperTest {

    private ReconcileRequestMapper reconcileRequestMapper;

    @BeforeEach
    void setUp() {
        reconcileRequestMapper = Mappers.getMapper(ReconcileRequestMapper.class);
    }

    @Test
    @DisplayName("toTransaction: every field is carried over")
    void mapsTransaction() {
        Transaction transaction = reconcileRequestMapper.toTransaction(TransactionRequest.builder()
                .date(LocalDate.of(2026, 3, 2))
                .ticker("TSLA")
                .expiration(LocalDate.of(2028, 12, 15))
                .strike(new BigDecimal("350"))
                .optionType(OptionType.CALL)
                .quantity(7)
                .price(new BigDecimal("223.50"))
                .amount(new BigDecimal("-156450.00"))
                .category(TransactionCategory.OPEN)
                .build());

        assertThat(transaction.getTicker()).isEqualTo("TSLA");
        assertThat(transaction.getExpiration()).isEqualTo(LocalDate.of(2028, 12, 15));
        assertThat(transaction.getOptionType()).isEqualTo(OptionType.CALL);
        assertThat(transaction.getQuantity()).isEqualTo(7);
        assertThat(transaction.getAmount()).isEqualByComparingTo("-156450.00");
        assertThat(transaction.getCategory()).isEqualTo(TransactionCategory.OPEN);
    }

    @Test
    @DisplayName("toBatch: overlapping exports are unioned, repeated rows kept once")
    void unionsSources() {
        TransactionRequest open = TransactionRequest.builder()
                .date(LocalDate.of(2026, 3, 2))
                .ticker("TSLA")
                .expiration(LocalDate.of(2028, 12, 15))
                .strike(new BigDecimal("350"))
                .optionType(OptionType.CALL)
                .quantity(7)
                .price(new BigDecimal("223.50"))
                .category(TransactionCategory.OPEN)
                .build();
        TransactionRequest laterOpen = TransactionRequest.builder()
                .date(LocalDate.of(2026, 4, 6))
                .ticker("TSLA")
                .expiration(LocalDate.of(2028, 12, 15))
                .strike(new BigDecimal("350"))
                .optionType(OptionType.CALL)
                .quantity(3)
                .price(new BigDecimal("230.00"))
                .category(TransactionCategory.OPEN)
                .build();
        StockTransactionRequest stock = StockTransactionRequest.builder()
                .date(LocalDate.of(2026, 3, 3))
                .ticker("AAPL")
                .quantity(10)
                .price(new BigDecimal("180.00"))
                .build();

        TransactionBatch batch = reconcileRequestMapper.toBatch(List.of(
                TransactionSourceRequest.builder()
                        .name("march.csv")
                        .transactions(List.of(open))
                        .stockTransactions(List.of(stock))
                        .build(),
                TransactionSourceRequest.builder()
                        .name("march-april.csv")
                        .transactions(List.of(open, laterOpen))
                        .stockTransactions(List.of(stock))
                        .build()));

        assertThat(batch.getTransactions()).extracting(Transaction::getQuantity).containsExactly(7, 3);
        assertThat(batch.getStockTransactions()).hasSize(1);
    }

    @Test
    @DisplayName("toBatch: no sources yields an empty batch")
    void noSources() {
        assertThat(reconcileRequestMapper.toBatch((List<TransactionSourceRequest>) null).getTransactions()).isEmpty();
        assertThat(reconcileRequestMapper.toBatch(new ArrayList<>()).getStockTransactions()).isEmpty();
    }

    @Test
    @DisplayName("toSnapshot: option holdings keep their signed quantity")
    void mapsSnapshot() {
        PortfolioSnapshot snapshot = reconcileRequestMapper.toSnapshot(PortfolioRequest.builder()
                .asOf(LocalDate.of(2026, 3, 5))
                .options(List.of(OptionHoldingRequest.builder()
                        .ticker("TSLA")
                        .expiration(LocalDate.of(2028, 12, 15))
                        .strike(new BigDecimal("440"))
                        .optionType(OptionType.CALL)
                        .quantity(-7)
                        .pricePaid(new BigDecimal("165.50"))
                        .build()))
                .cash(new BigDecimal("2500.00"))
                .build());

        assertThat(snapshot.getAsOf()).isEqualTo(LocalDate.of(2026, 3, 5));
        assertThat(snapshot.getOptions()).hasSize(1);
        assertThat(snapshot.getOptions().get(0).getQuantity()).isEqualTo(-7);
        assertThat(snapshot.getOptions().get(0).legKey().optionType()).isEqualTo(OptionType.CALL);
        assertThat(snapshot.getStocks()).isEmpty();
        assertThat(snapshot.hasCash()).isTrue();
    }
}
