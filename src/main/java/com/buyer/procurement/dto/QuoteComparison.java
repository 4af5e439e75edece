package com.buyer.procurement.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * One row of a comparison matrix. {@code convertedPrice} and {@code conversionRate}
 * are null when the quote's currency could not be normalized.
 */
public record QuoteComparison(
        Long quoteId,
        Long vendorId,
        String vendorName,
        Long productId,
        String productName,
        BigDecimal price,
        String currency,
        BigDecimal convertedPrice,
        BigDecimal conversionRate,
        LocalDate quoteDate,
        LocalDate validUntil,
        boolean expired,
        boolean stale,
        ComplianceResult compliance,
        List<ExtraAttribute> extraAttributes) {

    public boolean convertible() {
        return convertedPrice != null;
    }

    public boolean compliant() {
        return compliance == null || compliance.overallCompliant();
    }
}
