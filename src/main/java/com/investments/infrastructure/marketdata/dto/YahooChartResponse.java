package com.investments.infrastructure.marketdata.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Yahoo Finance chart API response. Indicator arrays are parallel to {@code timestamp} and may hold nulls.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record YahooChartResponse(
    @JsonProperty("chart") Chart chart
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chart(
        @JsonProperty("result") List<Result> result,
        @JsonProperty("error") ChartError error
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(
        @JsonProperty("meta") Meta meta,
        @JsonProperty("timestamp") List<Long> timestamp,
        @JsonProperty("indicators") Indicators indicators
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Meta(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("currency") String currency,
        @JsonProperty("exchangeName") String exchangeName,
        @JsonProperty("regularMarketPrice") BigDecimal regularMarketPrice
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Indicators(
        @JsonProperty("quote") List<Quote> quote
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Quote(
        @JsonProperty("open") List<BigDecimal> open,
        @JsonProperty("high") List<BigDecimal> high,
        @JsonProperty("low") List<BigDecimal> low,
        @JsonProperty("close") List<BigDecimal> close,
        @JsonProperty("volume") List<Long> volume
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChartError(
        @JsonProperty("code") String code,
        @JsonProperty("description") String description
    ) {
    }

    /**
     * First result of the chart, null when the response carries none
     */
    public Result firstResult() {
        if (chart == null || chart.result() == null || chart.result().isEmpty()) {
            return null;
        }
        return chart.result().get(0);
    }

    public boolean isError() {
        return chart != null && chart.error() != null;
    }
}
