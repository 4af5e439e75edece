package com.buyer.procurement.engine;

import com.buyer.procurement.dto.ComparisonMatrix;
import com.buyer.procurement.dto.DegradationReason;
import com.buyer.procurement.dto.QuoteComparison;
import com.buyer.procurement.dto.QuoteSelection;
import com.buyer.procurement.model.AttributeDataType;
import com.buyer.procurement.model.Product;
import com.buyer.procurement.model.Quote;
import com.buyer.procurement.model.Specification;
import com.buyer.procurement.model.SpecificationAttribute;
import com.buyer.procurement.model.Vendor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static com.buyer.procurement.engine.EngineFixtures.TODAY;
import static org.junit.jupiter.api.Assertions.*;

class QuoteComparisonBuilderTest {

    private EngineFixtures fx;
    private Vendor usVendor;
    private Vendor euVendor;
    private Vendor ukVendor;
    private SpecificationAttribute ram;
    private Specification laptop;
    private Product compliant;
    private Product nonCompliant;

    @BeforeEach
    void setUp() {
        fx = new EngineFixtures();
        fx.rate("EUR", "USD", "1.10", TODAY.minusDays(2));
        usVendor = fx.vendor("US Supply", "USD");
        euVendor = fx.vendor("EU Supply", "EUR");
        ukVendor = fx.vendor("UK Supply", "GBP");
        ram = fx.numberAttribute("RAM", true, 16.0, null);
        laptop = fx.specification("Laptop", ram);
        compliant = fx.product("Pro", laptop, fx.number(ram, 32));
        nonCompliant = fx.product("Lite", laptop, fx.number(ram, 8));
    }

    private QuoteComparisonBuilder builder() {
        return new QuoteComparisonBuilder(fx.normalizer(), new ComplianceMatcher(), TODAY, 90);
    }

    @Test
    void buildForSpecification_ShouldSortByConvertedPriceWithUnconvertibleLast() {
        Quote usd = fx.quote(usVendor, compliant, "120.00");
        Quote eur = fx.quote(euVendor, compliant, "100.00");    // 110 USD
        Quote gbp = fx.quote(ukVendor, compliant, "50.00");     // no rate
        Quote cheap = fx.quote(usVendor, nonCompliant, "90.00");

        ComparisonMatrix matrix = builder().buildForSpecification(laptop, List.of(usd, eur, gbp, cheap), false);

        List<Long> order = matrix.quotes().stream().map(QuoteComparison::quoteId).collect(Collectors.toList());
        assertEquals(List.of(cheap.getId(), eur.getId(), usd.getId(), gbp.getId()), order);
        QuoteComparison last = matrix.quotes().get(3);
        assertFalse(last.convertible());
        assertNull(last.convertedPrice());
        assertEquals("USD", matrix.referenceCurrency());
        assertEquals(0, new BigDecimal("110").compareTo(matrix.quotes().get(1).convertedPrice()));
    }

    @Test
    void buildForSpecification_TiedPrices_ShouldPutEarlierQuoteDateFirst() {
        Quote newer = fx.quote(usVendor, compliant, "100.00", "USD", TODAY.minusDays(1), null);
        Quote older = fx.quote(euVendor, compliant, "100.00", "USD", TODAY.minusDays(30), null);

        ComparisonMatrix matrix = builder().buildForSpecification(laptop, List.of(newer, older), false);

        assertEquals(older.getId(), matrix.quotes().get(0).quoteId());
        assertEquals(newer.getId(), matrix.quotes().get(1).quoteId());
    }

    @Test
    void buildForProduct_WithExtras_ShouldCarryNonRequiredAttributes() {
        SpecificationAttribute color = fx.attribute("Color", AttributeDataType.TEXT, false);
        Specification spec = fx.specification("Laptop with color", ram, color);
        Product colored = fx.product("Colored", spec, fx.number(ram, 16), fx.text(color, "Blue"));
        Quote quote = fx.quote(usVendor, colored, "99.00");

        ComparisonMatrix withExtras = builder().buildForProduct(colored, List.of(quote), true);
        ComparisonMatrix withoutExtras = builder().buildForProduct(colored, List.of(quote), false);

        assertEquals(colored.getId(), withExtras.productId());
        assertEquals(1, withExtras.quotes().get(0).extraAttributes().size());
        assertEquals("Blue", withExtras.quotes().get(0).extraAttributes().get(0).value());
        assertTrue(withoutExtras.quotes().get(0).extraAttributes().isEmpty());
    }

    @Test
    void selectBest_ShouldSkipExpiredQuoteWhenValidOneExists() {
        Quote expired = fx.quote(usVendor, compliant, "80.00", "USD", TODAY.minusDays(20), TODAY.minusDays(1));
        Quote valid = fx.quote(euVendor, compliant, "150.00", "USD", TODAY.minusDays(20), TODAY.plusDays(30));
        QuoteComparisonBuilder builder = builder();

        QuoteSelection selection = QuoteComparisonBuilder.selectBest(List.of(
                builder.compare(expired, laptop, false), builder.compare(valid, laptop, false))).orElseThrow();

        assertEquals(valid.getId(), selection.quote().quoteId());
        assertFalse(selection.degraded());
        assertTrue(selection.reasons().isEmpty());
    }

    @Test
    void selectBest_OnlyExpiredQuote_ShouldBeDegraded() {
        Quote expired = fx.quote(usVendor, compliant, "80.00", "USD", TODAY.minusDays(20), TODAY.minusDays(1));

        QuoteSelection selection = QuoteComparisonBuilder.selectBest(
                List.of(builder().compare(expired, laptop, false))).orElseThrow();

        assertEquals(expired.getId(), selection.quote().quoteId());
        assertTrue(selection.degraded());
        assertEquals(List.of(DegradationReason.ONLY_EXPIRED_QUOTES), selection.reasons());
        assertEquals("only-expired-quotes", selection.reason());
    }

    @Test
    void selectBest_ValidUntilToday_ShouldNotCountAsExpired() {
        Quote lastDay = fx.quote(usVendor, compliant, "80.00", "USD", TODAY.minusDays(20), TODAY);

        QuoteSelection selection = QuoteComparisonBuilder.selectBest(
                List.of(builder().compare(lastDay, laptop, false))).orElseThrow();

        assertFalse(selection.degraded());
    }

    @Test
    void selectBest_NoCompliantQuote_ShouldPickCheapestAndFlag() {
        Quote cheap = fx.quote(usVendor, nonCompliant, "60.00");
        Quote pricey = fx.quote(euVendor, nonCompliant, "70.00", "USD", TODAY.minusDays(3), null);
        QuoteComparisonBuilder builder = builder();

        QuoteSelection selection = QuoteComparisonBuilder.selectBest(List.of(
                builder.compare(pricey, laptop, false), builder.compare(cheap, laptop, false))).orElseThrow();

        assertEquals(cheap.getId(), selection.quote().quoteId());
        assertEquals(List.of(DegradationReason.NO_COMPLIANT_QUOTE), selection.reasons());
    }

    @Test
    void selectBest_OnlyUnconvertibleQuotes_ShouldFlagNoConvertibleQuotes() {
        Quote gbp = fx.quote(ukVendor, compliant, "50.00");

        QuoteSelection selection = QuoteComparisonBuilder.selectBest(
                List.of(builder().compare(gbp, laptop, false))).orElseThrow();

        assertTrue(selection.degraded());
        assertEquals(List.of(DegradationReason.NO_CONVERTIBLE_QUOTES), selection.reasons());
    }

    @Test
    void selectBest_EmptyInput_ShouldReturnEmpty() {
        assertTrue(QuoteComparisonBuilder.selectBest(List.of()).isEmpty());
    }
}
