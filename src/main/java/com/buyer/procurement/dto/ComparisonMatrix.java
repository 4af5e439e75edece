package com.buyer.procurement.dto;

import java.time.LocalDate;
import java.util.List;

/** Quotes sorted by converted price ascending; unconvertible quotes trail the list. */
public record ComparisonMatrix(
        Long specificationId,
        String specificationName,
        Long productId,
        String referenceCurrency,
        LocalDate asOf,
        List<QuoteComparison> quotes) {
}
