package com.spreadbook.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;

import com.spreadbook.domain.enums.OptionType;
import com.spreadbook.domain.enums.Side;
import com.spreadbook.domain.enums.SpreadType;
import com.spreadbook.domain.enums.TransactionCategory;
import com.spreadbook.domain.model.SpreadLeg;
import com.spreadbook.domain.model.SpreadOrder;
import com.spreadbook.domain.model.Transaction;
import com.spreadbook.reconciliation.LegPairingEngine;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for LegPairingEngine covering verticals, iron condors, straddles/strangles, naked
 * leftovers, filtering and quantity conservation.
 */
class LegPairingEngineTest {

    private static final LocalDate TRADE_DATE = LocalDate.of(2026, 3, 2);
    private static final LocalDate EXPIRY = LocalDate.of(2028, 12, 15);

    private LegPairingEngine legPairingEngine;

    @BeforeEach
    void setUp() {
        legPairingEngine = new LegPairingEngine();
    }

    @Nested
    @DisplayName("Vertical pairing")
    class VerticalPairing {

        @Test
        @DisplayName("TSLA long 350 call and short 440 call pair into one vertical")
        void teslaCallVertical() {
            List<SpreadOrder> orders = legPairingEngine.pair(List.of(
                    open("TSLA", "350", OptionType.CALL, 7, "223.50"),
                    open("TSLA", "440", OptionType.CALL, -7, "165.50")));

            assertThat(orders).hasSize(1);
            SpreadOrder vertical = orders.get(0);
            assertThat(vertical.getType()).isEqualTo(SpreadType.VERTICAL);
            assertThat(vertical.getOptionType()).isEqualTo(OptionType.CALL);
            assertThat(vertical.getLowerStrike()).isEqualByComparingTo("350");
            assertThat(vertical.getUpperStrike()).isEqualByComparingTo("440");
            assertThat(vertical.getQuantity()).isEqualTo(7);
            assertThat(vertical.getLowerPrice()).isEqualByComparingTo("223.50");
            assertThat(vertical.getUpperPrice()).isEqualByComparingTo("165.50");
            assertThat(vertical.getDate()).isEqualTo(TRADE_DATE);
            assertThat(vertical.getExpiration()).isEqualTo(EXPIRY);
        }

        @Test
        @DisplayName("Unequal sizes pair at the smaller size and leave a naked remainder")
        void unequalSizesLeaveNakedRemainder() {
            List<SpreadOrder> orders = legPairingEngine.pair(List.of(
                    open("AMD", "100", OptionType.PUT, 5, "4.00"),
                    open("AMD", "110", OptionType.PUT, -3, "7.00")));

            assertThat(orders).extracting(SpreadOrder::getType)
                    .containsExactly(SpreadType.VERTICAL, SpreadType.NAKED_LONG);
            assertThat(orders.get(0).getQuantity()).isEqualTo(3);
            assertThat(orders.get(1).getQuantity()).isEqualTo(2);
            assertThat(orders.get(1).getLowerStrike()).isEqualByComparingTo("100");
            assertThat(orders.get(1).getUpperStrike()).isNull();
        }

        @Test
        @DisplayName("Greedy pairing walks both sides in ascending strike order")
        void greedyPairingAcrossSeveralLegs() {
            List<SpreadOrder> orders = legPairingEngine.pair(List.of(
                    open("SPY", "420", OptionType.CALL, 2, "9.00"),
                    open("SPY", "400", OptionType.CALL, 3, "15.00"),
                    open("SPY", "430", OptionType.CALL, -1, "6.00"),
                    open("SPY", "410", OptionType.CALL, -4, "12.00")));

            assertThat(orders).hasSize(3);
            assertThat(orders).allMatch(order -> order.getType() == SpreadType.VERTICAL);
            assertThat(orders.get(0).getLowerStrike()).isEqualByComparingTo("400");
            assertThat(orders.get(0).getUpperStrike()).isEqualByComparingTo("410");
            assertThat(orders.get(0).getQuantity()).isEqualTo(3);
            assertThat(orders.get(1).getLowerStrike()).isEqualByComparingTo("420");
            assertThat(orders.get(1).getUpperStrike()).isEqualByComparingTo("410");
            assertThat(orders.get(1).getQuantity()).isEqualTo(1);
            assertThat(orders.get(2).getLowerStrike()).isEqualByComparingTo("420");
            assertThat(orders.get(2).getUpperStrike()).isEqualByComparingTo("430");
            assertThat(orders.get(2).getQuantity()).isEqualTo(1);
        }

        @Test
        @DisplayName("Different trade dates are never paired together")
        void differentDatesStaySeparate() {
            Transaction longCall = open("TSLA", "350", OptionType.CALL, 1, "20.00");
            Transaction shortCall = Transaction.builder()
                    .date(TRADE_DATE.plusDays(1))
                    .ticker("TSLA")
                    .expiration(EXPIRY)
                    .strike(new BigDecimal("440"))
                    .optionType(OptionType.CALL)
                    .quantity(-1)
                    .price(new BigDecimal("10.00"))
                    .category(TransactionCategory.OPEN)
                    .build();

            List<SpreadOrder> orders = legPairingEngine.pair(List.of(longCall, shortCall));

            assertThat(orders).extracting(SpreadOrder::getType)
                    .containsExactly(SpreadType.NAKED_LONG, SpreadType.NAKED_SHORT);
        }
    }

    @Nested
    @DisplayName("Iron condor detection")
    class IronCondorDetection {

        @Test
        @DisplayName("Four equal legs become one iron condor sorted by strike")
        void fourEqualLegsFormCondor() {
            List<SpreadOrder> orders = legPairingEngine.pair(List.of(
                    open("SPY", "400", OptionType.CALL, -3, "5.00"),
                    open("SPY", "200", OptionType.PUT, 3, "1.00"),
                    open("SPY", "450", OptionType.CALL, 3, "2.00"),
                    open("SPY", "250", OptionType.PUT, -3, "3.00")));

            assertThat(orders).hasSize(1);
            SpreadOrder condor = orders.get(0);
            assertThat(condor.getType()).isEqualTo(SpreadType.IRON_CONDOR);
            assertThat(condor.getQuantity()).isEqualTo(3);
            assertThat(condor.getLegs()).extracting(SpreadLeg::getStrike)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(
                            new BigDecimal("200"), new BigDecimal("250"), new BigDecimal("400"), new BigDecimal("450"));
            assertThat(condor.getLegs()).extracting(SpreadLeg::getSide)
                    .containsExactly(Side.LONG, Side.SHORT, Side.SHORT, Side.LONG);
            assertThat(condor.getLegs()).allMatch(leg -> leg.getQuantity() == 3);
        }

        @Test
        @DisplayName("Unequal condor legs fall through to verticals")
        void unequalCondorFallsThrough() {
            List<SpreadOrder> orders = legPairingEngine.pair(List.of(
                    open("SPY", "200", OptionType.PUT, 3, "1.00"),
                    open("SPY", "250", OptionType.PUT, -3, "3.00"),
                    open("SPY", "400", OptionType.CALL, -2, "5.00"),
                    open("SPY", "450", OptionType.CALL, 2, "2.00")));

            assertThat(orders).extracting(SpreadOrder::getType)
                    .containsExactly(SpreadType.VERTICAL, SpreadType.VERTICAL);
            assertThat(orders).extracting(SpreadOrder::getOptionType)
                    .containsExactly(OptionType.CALL, OptionType.PUT);
        }
    }

    @Nested
    @DisplayName("Straddles and strangles")
    class StraddlesAndStrangles {

        @Test
        @DisplayName("Long call and long put at one strike form a long straddle")
        void longStraddle() {
            List<SpreadOrder> orders = legPairingEngine.pair(List.of(
                    open("NVDA", "120", OptionType.CALL, 2, "8.00"),
                    open("NVDA", "120", OptionType.PUT, 2, "7.00")));

            assertThat(orders).hasSize(1);
            assertThat(orders.get(0).getType()).isEqualTo(SpreadType.LONG_STRADDLE);
            assertThat(orders.get(0).getLegs()).extracting(SpreadLeg::getOptionType)
                    .containsExactly(OptionType.PUT, OptionType.CALL);
        }

        @Test
        @DisplayName("Short call and short put at different strikes form a short strangle")
        void shortStrangleWithRemainder() {
            List<SpreadOrder> orders = legPairingEngine.pair(List.of(
                    open("NVDA", "140", OptionType.CALL, -3, "4.00"),
                    open("NVDA", "100", OptionType.PUT, -2, "3.50")));

            assertThat(orders).extracting(SpreadOrder::getType)
                    .containsExactly(SpreadType.SHORT_STRANGLE, SpreadType.NAKED_SHORT);
            assertThat(orders.get(0).getQuantity()).isEqualTo(2);
            assertThat(orders.get(1).getQuantity()).isEqualTo(1);
            assertThat(orders.get(1).getUpperStrike()).isEqualByComparingTo("140");
        }

        @Test
        @DisplayName("Mixed long and short legs are never paired as a straddle")
        void mixedSidesSkipStraddle() {
            List<SpreadOrder> orders = legPairingEngine.pair(List.of(
                    open("NVDA", "120", OptionType.CALL, 1, "8.00"),
                    open("NVDA", "120", OptionType.PUT, -1, "7.00")));

            assertThat(orders).extracting(SpreadOrder::getType)
                    .containsExactly(SpreadType.NAKED_LONG, SpreadType.NAKED_SHORT);
        }
    }

    @Nested
    @DisplayName("Input handling")
    class InputHandling {

        @Test
        @DisplayName("Closes, exercises and malformed opens are ignored")
        void ignoresNonOpensAndMalformedRows() {
            Transaction close = Transaction.builder()
                    .date(TRADE_DATE)
                    .ticker("TSLA")
                    .expiration(EXPIRY)
                    .strike(new BigDecimal("350"))
                    .optionType(OptionType.CALL)
                    .quantity(-7)
                    .price(new BigDecimal("300.00"))
                    .category(TransactionCategory.CLOSE)
                    .build();
            Transaction blankTicker = open(" ", "350", OptionType.CALL, 1, "1.00");
            Transaction zeroQuantity = open("TSLA", "350", OptionType.CALL, 0, "1.00");

            assertThat(legPairingEngine.pair(List.of(close, blankTicker, zeroQuantity))).isEmpty();
        }

        @Test
        @DisplayName("Input transactions are not modified by pairing")
        void inputIsNotMutated() {
            Transaction longCall = open("TSLA", "350", OptionType.CALL, 7, "223.50");
            Transaction shortCall = open("TSLA", "440", OptionType.CALL, -4, "165.50");

            legPairingEngine.pair(List.of(longCall, shortCall));
            List<SpreadOrder> second = legPairingEngine.pair(List.of(longCall, shortCall));

            assertThat(longCall.getQuantity()).isEqualTo(7);
            assertThat(shortCall.getQuantity()).isEqualTo(-4);
            assertThat(second).hasSize(2);
        }

        @Test
        @DisplayName("Signed quantities are conserved per group")
        void quantityIsConserved() {
            List<Transaction> transactions = List.of(
                    open("QQQ", "300", OptionType.CALL, 4, "10.00"),
                    open("QQQ", "310", OptionType.CALL, -6, "6.00"),
                    open("QQQ", "320", OptionType.CALL, 1, "3.00"),
                    open("QQQ", "280", OptionType.PUT, -2, "4.00"),
                    open("QQQ", "270", OptionType.PUT, 5, "2.50"),
                    open("QQQ", "260", OptionType.PUT, -1, "1.50"));
            int inputSum = transactions.stream().mapToInt(Transaction::getQuantity).sum();

            List<SpreadOrder> orders = legPairingEngine.pair(transactions);

            int outputSum = orders.stream().mapToInt(SpreadOrder::signedOptionQuantity).sum();
            assertThat(outputSum).isEqualTo(inputSum);
        }
    }

    private static Transaction open(String ticker, String strike, OptionType optionType, int quantity, String price) {
        return Transaction.builder()
                .date(TRADE_DATE)
                .ticker(ticker)
                .expiration(EXPIRY)
                .strike(new BigDecimal(strike))
                .optionType(optionType)
                .quantity(quantity)
                .price(new BigDecimal(price))
                .amount(new BigDecimal(price).multiply(BigDecimal.valueOf(-100L * quantity)))
                .category(TransactionCategory.OPEN)
                .build();
    }
}
