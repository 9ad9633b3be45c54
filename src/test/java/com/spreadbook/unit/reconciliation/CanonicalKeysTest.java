package com.spreadbook.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.spreadbook.domain.enums.LegType;
import com.spreadbook.domain.enums.OptionType;
import com.spreadbook.domain.enums.Side;
import com.spreadbook.domain.enums.SpreadType;
import com.spreadbook.domain.model.PositionLeg;
import com.spreadbook.domain.model.SpreadLeg;
import com.spreadbook.domain.model.SpreadOrder;
import com.spreadbook.reconciliation.CanonicalKeys;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CanonicalKeysTest {

    private static final LocalDate EXPIRY = LocalDate.of(2028, 12, 15);

    @Nested
    @DisplayName("Spread order keys")
    class OrderKeys {

        @Test
        @DisplayName("Vertical key joins strikes ascending with the option type")
        void verticalKey() {
            SpreadOrder vertical = SpreadOrder.builder()
                    .type(SpreadType.VERTICAL)
                    .ticker("TSLA")
                    .expiration(EXPIRY)
                    .optionType(OptionType.CALL)
                    .lowerStrike(new BigDecimal("350.00"))
                    .upperStrike(new BigDecimal("440"))
                    .quantity(7)
                    .build();

            assertThat(CanonicalKeys.forOrder(vertical)).isEqualTo("TSLA|2028-12-15|350/440|Call");
        }

        @Test
        @DisplayName("Bear vertical with the long leg above the short leg sorts its strikes")
        void bearVerticalSortsStrikes() {
            SpreadOrder vertical = SpreadOrder.builder()
                    .type(SpreadType.VERTICAL)
                    .ticker("SPY")
                    .expiration(EXPIRY)
                    .optionType(OptionType.PUT)
                    .lowerStrike(new BigDecimal("410"))
                    .upperStrike(new BigDecimal("400"))
                    .quantity(1)
                    .build();

            assertThat(CanonicalKeys.forOrder(vertical)).isEqualTo("SPY|2028-12-15|400/410|Put");
        }

        @Test
        @DisplayName("Stock, cash and naked keys")
        void stockCashAndNakedKeys() {
            assertThat(CanonicalKeys.forOrder(SpreadOrder.builder().type(SpreadType.STOCK).ticker("AAPL").build()))
                    .isEqualTo("AAPL|STOCK");
            assertThat(CanonicalKeys.forOrder(SpreadOrder.builder().type(SpreadType.CASH).build()))
                    .isEqualTo("CASH");
            assertThat(CanonicalKeys.forOrder(SpreadOrder.builder()
                            .type(SpreadType.NAKED_SHORT)
                            .ticker("AMD")
                            .expiration(EXPIRY)
                            .optionType(OptionType.PUT)
                            .upperStrike(new BigDecimal("92.5"))
                            .build()))
                    .isEqualTo("AMD|2028-12-15|92.5|Put");
        }

        @Test
        @DisplayName("Iron condor key uses the IC tag")
        void ironCondorKey() {
            SpreadOrder condor = SpreadOrder.builder()
                    .type(SpreadType.IRON_CONDOR)
                    .ticker("SPY")
                    .expiration(EXPIRY)
                    .quantity(3)
                    .legs(List.of(
                            leg("450", OptionType.CALL, Side.LONG),
                            leg("200", OptionType.PUT, Side.LONG),
                            leg("400", OptionType.CALL, Side.SHORT),
                            leg("250", OptionType.PUT, Side.SHORT)))
                    .build();

            assertThat(CanonicalKeys.forOrder(condor)).isEqualTo("SPY|2028-12-15|200/250/400/450|IC");
        }
    }

    @Nested
    @DisplayName("Position keys")
    class PositionKeys {

        @Test
        @DisplayName("Iron condor legs derive the same key as the condor order in every leg order")
        void condorKeyIsOrderIndependent() {
            List<PositionLeg> legs = new ArrayList<>(List.of(
                    positionLeg("200", LegType.PUT, 3),
                    positionLeg("250", LegType.PUT, -3),
                    positionLeg("400", LegType.CALL, -3),
                    positionLeg("450", LegType.CALL, 3)));
            String expected = CanonicalKeys.forLegs(legs);
            Random random = new Random(42);

            for (int i = 0; i < 24; i++) {
                Collections.shuffle(legs, random);
                assertThat(CanonicalKeys.forLegs(legs)).isEqualTo(expected);
            }
            assertThat(expected).isEqualTo("SPY|2028-12-15|200/250/400/450|IC");
        }

        @Test
        @DisplayName("Straddle and strangle tags depend on direction and strikes")
        void straddleAndStrangleTags() {
            assertThat(CanonicalKeys.forLegs(List.of(
                            positionLeg("120", LegType.CALL, 2), positionLeg("120", LegType.PUT, 2))))
                    .isEqualTo("SPY|2028-12-15|120/120|LS");
            assertThat(CanonicalKeys.forLegs(List.of(
                            positionLeg("100", LegType.PUT, -1), positionLeg("140", LegType.CALL, -1))))
                    .isEqualTo("SPY|2028-12-15|100/140|SSg");
        }

        @Test
        @DisplayName("Vertical legs in either order give the vertical order's key")
        void verticalLegsMatchOrderKey() {
            List<PositionLeg> legs = List.of(positionLeg("440", LegType.CALL, -7), positionLeg("350", LegType.CALL, 7));

            assertThat(CanonicalKeys.forLegs(legs)).isEqualTo("SPY|2028-12-15|350/440|Call");
        }

        @Test
        @DisplayName("Stock and cash legs")
        void stockAndCashLegs() {
            PositionLeg stock = PositionLeg.builder().symbol("AAPL").legType(LegType.STOCK).quantity(100).build();
            PositionLeg cash = PositionLeg.builder().symbol("CASH").legType(LegType.CASH).quantity(1).build();

            assertThat(CanonicalKeys.forLegs(List.of(stock))).isEqualTo("AAPL|STOCK");
            assertThat(CanonicalKeys.forLegs(List.of(cash))).isEqualTo("CASH");
            assertThat(CanonicalKeys.isStockKey("AAPL|STOCK")).isTrue();
            assertThat(CanonicalKeys.tickerOf("AAPL|STOCK")).isEqualTo("AAPL");
        }

        @Test
        @DisplayName("A closed-out straddle leg does not change the straddle tag")
        void closedLegKeepsStraddleTag() {
            assertThat(CanonicalKeys.forLegs(List.of(
                            positionLeg("120", LegType.CALL, 2), positionLeg("120", LegType.PUT, 0))))
                    .isEqualTo("SPY|2028-12-15|120/120|LS");
        }

        @Test
        @DisplayName("A long call with a short put forms no known structure")
        void mixedDirectionsRejected() {
            assertThatThrownBy(() -> CanonicalKeys.forLegs(List.of(
                            positionLeg("120", LegType.CALL, 1), positionLeg("100", LegType.PUT, -1))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("A position without legs has no key")
        void emptyLegsRejected() {
            assertThatThrownBy(() -> CanonicalKeys.forLegs(List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static SpreadLeg leg(String strike, OptionType optionType, Side side) {
        return SpreadLeg.builder()
                .strike(new BigDecimal(strike))
                .optionType(optionType)
                .side(side)
                .quantity(3)
                .build();
    }

    private static PositionLeg positionLeg(String strike, LegType legType, int quantity) {
        return PositionLeg.builder()
                .symbol("SPY")
                .expiration(EXPIRY)
                .strike(new BigDecimal(strike))
                .legType(legType)
                .quantity(quantity)
                .build();
    }
}
