package com.investments.infrastructure.marketdata.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

/**
 * ExchangeRate-API response with the rates of every currency against one base currency
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExchangeRateApiResponse(
    @JsonProperty("base") String base,
    @JsonProperty("date") String date,
    @JsonProperty("time_last_updated") Long timeLastUpdated,
    @JsonProperty("rates") Map<String, BigDecimal> rates
) {
}
