package com.investments.infrastructure.marketdata.client;

import com.investments.infrastructure.marketdata.dto.ExchangeRateApiResponse;
import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for ExchangeRate-API
 */
@RegisterRestClient(configKey = "exchange-rate-api")
public interface ExchangeRateApiClient {

    /**
     * Get the latest rates of all currencies against a base currency
     * @param base ISO currency code (e.g., "CAD")
     */
    @GET
    @Path("/v4/latest/{base}")
    @Produces(MediaType.APPLICATION_JSON)
    Uni<ExchangeRateApiResponse> getLatestRates(@PathParam("base") String base);
}
