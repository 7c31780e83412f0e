package com.investments.application.service;

import com.investments.domain.model.Category;
import com.investments.domain.model.Currency;
import com.investments.domain.model.Holding;
import com.investments.infrastructure.config.MarketDataConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SymbolMapperTest {

    private final SymbolMapper symbolMapper = new SymbolMapper(List.of());

    @ParameterizedTest
    @CsvSource({
            "'VFV - S&P 500 ETF', CAD, VFV.TO",
            "PETR4, BRL, PETR4.SA",
            "AAPL, USD, AAPL",
            "'Royal Bank of Canada', CAD, RY.TO",
            "'Petrobras PN', BRL, PETR4.SA",
            "'Shopify Inc', CAD, SHOP.TO",
            "XEQT, CAD, XEQT.TO",
            "'BBAS3 | Banco do Brasil', BRL, BBAS3.SA",
            "'MSFT: Microsoft', USD, MSFT",
            "shop.to, CAD, SHOP.TO",
            "'  vfv  ', CAD, VFV.TO",
            "'RYAN Holdings', CAD, RYAN.TO",
            "'VFV ETF', USD, VFV"
    })
    void testMapToSymbol_Resolves(String name, Currency currency, String expected) {
        // When
        Optional<String> symbol = symbolMapper.mapToSymbol(name, currency);

        // Then
        assertEquals(Optional.of(expected), symbol);
    }

    @ParameterizedTest
    @CsvSource({
            "'Tesouro Selic 2029', BRL",
            "'Certificado de Deposito Bancario', BRL",
            "'Guaranteed Investment Certificate', CAD",
            "'S&P 500', USD",
            "'-', CAD"
    })
    void testMapToSymbol_Unmappable(String name, Currency currency) {
        // When
        Optional<String> symbol = symbolMapper.mapToSymbol(name, currency);

        // Then
        assertTrue(symbol.isEmpty());
    }

    @ParameterizedTest
    @NullAndEmptySource
    void testMapToSymbol_BlankName(String name) {
        assertTrue(symbolMapper.mapToSymbol(name, Currency.CAD).isEmpty());
    }

    @Test
    void testMapToSymbol_NullCurrency() {
        assertTrue(symbolMapper.mapToSymbol("AAPL", null).isEmpty());
    }

    @Test
    void testMapToSymbol_FromHolding() {
        // Given
        Holding holding = new Holding(1L, 10L, "ITAU UNIBANCO PN", new BigDecimal("100"), new BigDecimal("25.50"),
                Currency.BRL, Category.STOCKS, LocalDate.of(2023, 5, 2));

        // When
        Optional<String> symbol = symbolMapper.mapToSymbol(holding);

        // Then
        assertEquals(Optional.of("ITUB4.SA"), symbol);
    }

    @Test
    void testMapToSymbol_ConfiguredAliasOverridesHeuristic() {
        // Given
        SymbolMapper mapper = new SymbolMapper(List.of("CAD:Enbridge=ENB.TO", "usd:berkshire hathaway=BRK-B"));

        // When / Then
        assertEquals(Optional.of("ENB.TO"), mapper.mapToSymbol("Enbridge Inc", Currency.CAD));
        assertEquals(Optional.of("BRK-B"), mapper.mapToSymbol("Berkshire Hathaway Class B", Currency.USD));
        assertTrue(mapper.mapToSymbol("Enbridge Inc", Currency.USD).isEmpty());
    }

    @Test
    void testMapToSymbol_MalformedAliasesAreIgnored() {
        // Given
        SymbolMapper mapper = new SymbolMapper(List.of("ENBRIDGE", "EUR:SAP=SAP.DE", "CAD:=ENB.TO", "CAD:ENBRIDGE="));

        // When
        Optional<String> symbol = mapper.mapToSymbol("Enbridge Inc", Currency.CAD);

        // Then
        assertTrue(symbol.isEmpty());
        assertEquals(Optional.of("VFV.TO"), mapper.mapToSymbol("VFV", Currency.CAD));
    }

    @Test
    void testConstructor_ReadsAliasesFromConfig() {
        // Given
        MarketDataConfig config = mock(MarketDataConfig.class);
        MarketDataConfig.Symbols symbols = mock(MarketDataConfig.Symbols.class);
        when(config.symbols()).thenReturn(symbols);
        when(symbols.aliases()).thenReturn(Optional.of(List.of("BRL:VALE=VALE3.SA")));

        // When
        SymbolMapper mapper = new SymbolMapper(config);

        // Then
        assertEquals(Optional.of("VALE3.SA"), mapper.mapToSymbol("Vale ON", Currency.BRL));
    }
}
