package com.buyer.procurement.engine;

import com.buyer.procurement.dto.DegradationReason;
import com.buyer.procurement.dto.QuoteComparison;
import com.buyer.procurement.model.BillOfMaterialsItem;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The comparison rows for one BOM item: all of them in store order, and the best
 * constraint tier in price order.
 */
public record ItemQuotes(BillOfMaterialsItem item, List<QuoteComparison> quotes, List<QuoteComparison> tier) {

    public static ItemQuotes of(BillOfMaterialsItem item, List<QuoteComparison> quotes) {
        return new ItemQuotes(item, List.copyOf(quotes), QuoteComparisonBuilder.bestTier(quotes));
    }

    public Long bomItemId() {
        return item.getId();
    }

    public Long specificationId() {
        return item.getSpecification().getId();
    }

    public String specificationName() {
        return item.getSpecification().getName();
    }

    public int quantity() {
        return item.getQuantity();
    }

    public boolean hasQuotes() {
        return !quotes.isEmpty();
    }

    public int tierRank() {
        return tier.isEmpty() ? -1 : QuoteComparisonBuilder.constraintRank(tier.get(0));
    }

    public List<DegradationReason> tierReasons() {
        return tier.isEmpty() ? List.of() : QuoteComparisonBuilder.reasonsFor(tierRank());
    }

    /** Whether a vendor can take this item over: its best tier is convertible and compliant. */
    public boolean coverable() {
        return !tier.isEmpty() && tier.get(0).convertible() && tier.get(0).compliant();
    }

    public long vendorCount() {
        return quotes.stream().map(QuoteComparison::vendorId).distinct().count();
    }

    public Optional<QuoteComparison> cheapestInTier(Predicate<QuoteComparison> filter) {
        return tier.stream().filter(filter).min(QuoteComparisonBuilder.PRICE_ORDER);
    }

    public BigDecimal lineCost(QuoteComparison quote) {
        if (quote == null || !quote.convertible()) {
            return BigDecimal.ZERO;
        }
        return quote.convertedPrice().multiply(BigDecimal.valueOf(quantity()));
    }
}
