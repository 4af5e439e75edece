package com.buyer.procurement.engine;

import com.buyer.procurement.dto.ConversionResult;
import com.buyer.procurement.exception.UnconvertibleCurrencyException;
import com.buyer.procurement.model.Forex;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CurrencyNormalizerTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);

    private static Forex rate(long id, String from, String to, String rate, LocalDate effective) {
        return new Forex(id, from, to, new BigDecimal(rate), effective);
    }

    @Test
    void convert_SameCurrency_ShouldReturnAmountWithUnitRate() {
        CurrencyNormalizer normalizer = new CurrencyNormalizer(List.of(), "USD");

        for (String currency : List.of("USD", "EUR", "XYZ")) {
            ConversionResult result = normalizer.convert(new BigDecimal("42.50"), currency, currency, TODAY);
            assertEquals(new BigDecimal("42.50"), result.amount());
            assertEquals(0, BigDecimal.ONE.compareTo(result.rate()));
            assertFalse(result.composed());
        }
    }

    @Test
    void convert_ShouldUseLatestRateNotNewerThanAsOf() {
        CurrencyNormalizer normalizer = new CurrencyNormalizer(List.of(
                rate(1, "EUR", "USD", "1.08", TODAY.minusDays(10)),
                rate(2, "EUR", "USD", "1.10", TODAY.minusDays(1)),
                rate(3, "EUR", "USD", "1.20", TODAY.plusDays(5))), "USD");

        ConversionResult result = normalizer.convert(new BigDecimal("100"), "EUR", "USD", TODAY);

        assertEquals(0, new BigDecimal("1.10").compareTo(result.rate()));
        assertEquals(0, new BigDecimal("110").compareTo(result.amount()));
    }

    @Test
    void convert_RateEffectiveOnAsOf_ShouldApply() {
        CurrencyNormalizer normalizer = new CurrencyNormalizer(List.of(
                rate(1, "EUR", "USD", "1.08", TODAY.minusDays(10)),
                rate(2, "EUR", "USD", "1.12", TODAY)), "USD");

        assertEquals(0, new BigDecimal("1.12").compareTo(normalizer.convert(BigDecimal.ONE, "eur", "usd", TODAY).rate()));
    }

    @Test
    void convert_WithoutDirectRate_ShouldComposeThroughReferenceCurrency() {
        CurrencyNormalizer normalizer = new CurrencyNormalizer(List.of(
                rate(1, "EUR", "USD", "1.10", TODAY.minusDays(3)),
                rate(2, "USD", "JPY", "150", TODAY.minusDays(3))), "USD");

        ConversionResult result = normalizer.convert(new BigDecimal("2"), "EUR", "JPY", TODAY);

        assertTrue(result.composed());
        assertEquals(0, new BigDecimal("165").compareTo(result.rate()));
        assertEquals(0, new BigDecimal("330").compareTo(result.amount()));
    }

    @Test
    void convert_MissingHop_ShouldThrowUnconvertible() {
        CurrencyNormalizer normalizer = new CurrencyNormalizer(List.of(
                rate(1, "EUR", "USD", "1.10", TODAY.minusDays(3))), "USD");

        assertThrows(UnconvertibleCurrencyException.class,
                () -> normalizer.convert(BigDecimal.TEN, "EUR", "JPY", TODAY));
        assertThrows(UnconvertibleCurrencyException.class,
                () -> normalizer.convert(BigDecimal.TEN, "GBP", "USD", TODAY));
    }

    @Test
    void convert_OnlyFutureRates_ShouldThrowUnconvertible() {
        CurrencyNormalizer normalizer = new CurrencyNormalizer(List.of(
                rate(1, "EUR", "USD", "1.10", TODAY.plusDays(1))), "USD");

        UnconvertibleCurrencyException ex = assertThrows(UnconvertibleCurrencyException.class,
                () -> normalizer.toReference(BigDecimal.TEN, "EUR", TODAY));
        assertEquals("EUR", ex.getFromCurrency());
        assertEquals("USD", ex.getToCurrency());
    }

    @Test
    void convert_MissingCurrencyCode_ShouldThrowUnconvertible() {
        CurrencyNormalizer normalizer = new CurrencyNormalizer(List.of(), "USD");

        assertThrows(UnconvertibleCurrencyException.class,
                () -> normalizer.toReference(BigDecimal.TEN, null, TODAY));
    }
}
