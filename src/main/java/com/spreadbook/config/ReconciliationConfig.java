package com.spreadbook.config;

import java.time.LocalDate;
import java.time.ZoneId;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the reconciliation engine.
 *
 * <p>Controls decimal scales of derived prices and the zone used to decide "today" when legs are
 * defaulted to expired worthless. Properties are read from the {@code spreadbook.reconciliation}
 * prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "spreadbook.reconciliation")
@Getter
@Setter
public class ReconciliationConfig {

    /** Scale of weighted-average entry prices. */
    private int priceScale = 4;

    /** Scale of resolved closing prices (fills, intrinsic values). */
    private int closingPriceScale = 2;

    /** Exchange zone; options expire at the close of the exchange's calendar day. */
    private String zoneId = "America/New_York";

    public LocalDate today() {
        return LocalDate.now(ZoneId.of(zoneId));
    }
}
