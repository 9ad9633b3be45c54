package com.spreadbook.reconciliation;

import com.spreadbook.domain.enums.SpreadType;
import com.spreadbook.domain.model.LegKey;
import com.spreadbook.domain.model.SpreadLeg;
import com.spreadbook.domain.model.SpreadOrder;
import java.math.BigDecimal;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Display names of new positions, e.g. {@code TSLA 2028-12-15 350/440 Call Vertical}. */
final class GroupLabels {

    private GroupLabels() {}

    static String forOrder(SpreadOrder order) {
        SpreadType type = order.getType();
        if (type == SpreadType.CASH) {
            return type.getDisplayName();
        }
        if (type == SpreadType.STOCK) {
            return order.getTicker() + " " + type.getDisplayName();
        }

        Stream<BigDecimal> strikes = type.isMultiLeg()
                ? order.getLegs().stream().map(SpreadLeg::getStrike)
                : Stream.of(order.getLowerStrike(), order.getUpperStrike());
        String joinedStrikes = strikes.filter(strike -> strike != null)
                .map(LegKey::normalizeStrike)
                .distinct()
                .sorted()
                .map(LegKey::formatStrike)
                .collect(Collectors.joining("/"));

        StringBuilder label = new StringBuilder()
                .append(order.getTicker())
                .append(' ')
                .append(CanonicalKeys.normalizeExpiration(order.getExpiration()))
                .append(' ')
                .append(joinedStrikes)
                .append(' ');
        if (!type.isMultiLeg() && order.getOptionType() != null) {
            label.append(order.getOptionType().getLabel()).append(' ');
        }
        return label.append(type.getDisplayName()).toString();
    }
}
