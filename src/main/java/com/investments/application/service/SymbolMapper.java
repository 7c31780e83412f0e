package com.investments.application.service;

import com.investments.domain.exception.Errors;
import com.investments.domain.model.Currency;
import com.investments.domain.model.Holding;
import com.investments.infrastructure.config.MarketDataConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps free-text investment names to exchange-qualified ticker symbols.
 * Rules are applied in order and the first one that matches wins:
 * <ol>
 *     <li>a name already carrying a known exchange suffix is returned unchanged</li>
 *     <li>the alias table of the holding's currency</li>
 *     <li>the first token of the name, when it looks like a ticker, plus the currency's suffix</li>
 * </ol>
 */
@ApplicationScoped
@Slf4j
public class SymbolMapper {

    private static final List<String> KNOWN_SUFFIXES = List.of(".TO", ".V", ".NE", ".SA");
    private static final Pattern SEPARATORS = Pattern.compile("[ \\-:|]+");
    private static final Pattern TICKER_LIKE = Pattern.compile("^[A-Z0-9]{2,6}$");

    private final Map<Currency, Map<String, String>> aliases;

    @Inject
    public SymbolMapper(MarketDataConfig config) {
        this(config.symbols().aliases().orElse(List.of()));
    }

    SymbolMapper(List<String> aliasOverrides) {
        this.aliases = buildAliases(aliasOverrides);
    }

    public Optional<String> mapToSymbol(Holding holding) {
        return mapToSymbol(holding.name(), holding.currency());
    }

    public Optional<String> mapToSymbol(String name, Currency currency) {
        if (name == null || name.isBlank() || currency == null) {
            return Optional.empty();
        }

        String normalized = name.trim().toUpperCase(Locale.ROOT);

        if (hasKnownSuffix(normalized)) {
            return Optional.of(normalized);
        }

        List<String> words = tokenize(normalized);

        for (Map.Entry<String, String> alias : aliases.getOrDefault(currency, Map.of()).entrySet()) {
            if (containsWordRun(words, tokenize(alias.getKey()))) {
                return Optional.of(alias.getValue());
            }
        }

        if (!words.isEmpty() && TICKER_LIKE.matcher(words.get(0)).matches()) {
            return Optional.of(words.get(0) + currency.getExchangeSuffix());
        }

        log.debug("[{}] No symbol for '{}' in {}", Errors.SymbolMapping.UNMAPPABLE_SYMBOL.code(), name, currency);
        return Optional.empty();
    }

    private static boolean hasKnownSuffix(String name) {
        return KNOWN_SUFFIXES.stream().anyMatch(name::endsWith);
    }

    private static List<String> tokenize(String value) {
        return Arrays.stream(SEPARATORS.split(value))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    private static boolean containsWordRun(List<String> words, List<String> run) {
        return !run.isEmpty() && Collections.indexOfSubList(words, run) >= 0;
    }

    private static Map<Currency, Map<String, String>> buildAliases(List<String> overrides) {
        Map<Currency, Map<String, String>> table = new EnumMap<>(Currency.class);

        Map<String, String> cad = new LinkedHashMap<>();
        cad.put("SHOP", "SHOP.TO");
        cad.put("SHOPIFY", "SHOP.TO");
        cad.put("RY", "RY.TO");
        cad.put("ROYAL BANK", "RY.TO");
        cad.put("TD", "TD.TO");
        cad.put("CNR", "CNR.TO");
        cad.put("VFV", "VFV.TO");
        cad.put("XQQ", "XQQ.TO");
        cad.put("ZWB", "ZWB.TO");
        cad.put("BRE", "BRE.TO");
        table.put(Currency.CAD, cad);

        Map<String, String> brl = new LinkedHashMap<>();
        brl.put("PETR4", "PETR4.SA");
        brl.put("PETROBRAS", "PETR4.SA");
        brl.put("ITUB4", "ITUB4.SA");
        brl.put("ITAU", "ITUB4.SA");
        brl.put("RBRF11", "RBRF11.SA");
        brl.put("HGLG11", "HGLG11.SA");
        brl.put("BTLG11", "BTLG11.SA");
        table.put(Currency.BRL, brl);

        table.put(Currency.USD, new LinkedHashMap<>());

        for (String override : overrides) {
            parseOverride(override, table);
        }
        return table;
    }

    private static void parseOverride(String override, Map<Currency, Map<String, String>> table) {
        int colon = override.indexOf(':');
        int equals = override.indexOf('=');
        if (colon <= 0 || equals <= colon + 1 || equals == override.length() - 1) {
            log.warn("Ignoring malformed symbol alias '{}', expected CCY:ALIAS=SYMBOL", override);
            return;
        }

        Currency currency;
        try {
            currency = Currency.valueOf(override.substring(0, colon).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring symbol alias '{}' with unsupported currency", override);
            return;
        }

        String alias = override.substring(colon + 1, equals).trim().toUpperCase(Locale.ROOT);
        String symbol = override.substring(equals + 1).trim().toUpperCase(Locale.ROOT);
        table.get(currency).put(alias, symbol);
        log.info("Registered symbol alias {} -> {} for {}", alias, symbol, currency);
    }
}
