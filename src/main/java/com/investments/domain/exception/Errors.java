package com.investments.domain.exception;

public interface Errors {

    interface MarketData {
        String errorCode = "01";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error PROVIDER_UNAVAILABLE = new Error(errorCode + "02");
        Error PARSE_ERROR = new Error(errorCode + "03");
        Error PRICE_NOT_FOUND = new Error(errorCode + "04");
    }

    interface ExchangeRate {
        String errorCode = "02";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error NO_RATE_AVAILABLE = new Error(errorCode + "02");
    }

    interface SymbolMapping {
        String errorCode = "03";

        Error UNMAPPABLE_SYMBOL = new Error(errorCode + "01");
    }

    interface Persistence {
        String errorCode = "04";

        Error CONCURRENT_UPSERT = new Error(errorCode + "01");
    }

    interface Performance {
        String errorCode = "05";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error ACCOUNT_NOT_FOUND = new Error(errorCode + "02");
    }

    interface Cache {
        String errorCode = "06";

        Error INVALIDATION_FAILED = new Error(errorCode + "01");
    }
}
