package com.investments.infrastructure.marketdata.client;

import com.investments.infrastructure.marketdata.dto.YahooChartResponse;
import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the Yahoo Finance chart API. Requests without a browser-like User-Agent are rejected.
 */
@RegisterRestClient(configKey = "yahoo-finance-api")
@ClientHeaderParam(name = "User-Agent", value = "Mozilla/5.0 (compatible; InvestmentsBot/1.0)")
public interface YahooFinanceClient {

    /**
     * Get a chart for a symbol, either for a relative {@code range} or between two unix timestamps.
     * Null parameters are left out of the query.
     * @param symbol Ticker (e.g., "SHOP.TO") or currency pair symbol (e.g., "CADUSD=X")
     * @param interval Bar size (e.g., "1d")
     */
    @GET
    @Path("/v8/finance/chart/{symbol}")
    @Produces(MediaType.APPLICATION_JSON)
    Uni<YahooChartResponse> getChart(
        @PathParam("symbol") String symbol,
        @QueryParam("interval") String interval,
        @QueryParam("range") String range,
        @QueryParam("period1") Long period1,
        @QueryParam("period2") Long period2
    );
}
