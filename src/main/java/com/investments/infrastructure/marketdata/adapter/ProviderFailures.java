package com.investments.infrastructure.marketdata.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.investments.domain.exception.Errors;
import com.investments.domain.exception.ServiceException;

/**
 * Translates REST client failures into coded market data errors
 */
final class ProviderFailures {

    private ProviderFailures() {
    }

    static ServiceException translate(String provider, String subject, Throwable failure) {
        if (failure instanceof ServiceException serviceException) {
            return serviceException;
        }
        if (hasJsonCause(failure)) {
            return new ServiceException(
                    Errors.MarketData.PARSE_ERROR,
                    "Unreadable response from " + provider + " for " + subject,
                    failure
            );
        }
        return new ServiceException(
                Errors.MarketData.PROVIDER_UNAVAILABLE,
                provider + " unavailable for " + subject + ": " + failure.getMessage(),
                failure
        );
    }

    private static boolean hasJsonCause(Throwable failure) {
        Throwable cur = failure;
        while (cur != null) {
            if (cur instanceof JsonProcessingException) return true;
            cur = cur.getCause();
        }
        return false;
    }
}
