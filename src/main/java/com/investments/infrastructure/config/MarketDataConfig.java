package com.investments.infrastructure.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@ConfigMapping(prefix = "app.market-data")
public interface MarketDataConfig {

    /**
     * Maximum age of a stored exchange rate before the providers are called again
     */
    @WithDefault("24h")
    Duration rateFreshness();

    /**
     * Maximum age of today's stored price row before the quote provider is called again
     */
    @WithDefault("4h")
    Duration priceFreshness();

    /**
     * Days covered by a price series when no start date is given
     */
    @WithDefault("30")
    int defaultSeriesDays();

    /**
     * Ordered currency pairs kept fresh by the refresh scheduler
     */
    @WithDefault("CAD-USD,BRL-USD,CAD-BRL,USD-CAD,USD-BRL,BRL-CAD")
    List<String> trackedPairs();

    Refresh refresh();

    Cache cache();

    Symbols symbols();

    interface Refresh {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("2m")
        Duration initialDelay();

        @WithDefault("24h")
        Duration interval();

        /**
         * Retries after the first failed attempt of a cycle
         */
        @WithDefault("3")
        int maxRetries();

        /**
         * Delay before the first retry, doubled for each following one
         */
        @WithDefault("5m")
        Duration initialBackoff();
    }

    interface Cache {

        @WithDefault("1h")
        Duration ttl();
    }

    interface Symbols {

        /**
         * Extra aliases in the form {@code CCY:ALIAS=SYMBOL}, e.g. {@code CAD:ENBRIDGE=ENB.TO}
         */
        Optional<List<String>> aliases();
    }
}
