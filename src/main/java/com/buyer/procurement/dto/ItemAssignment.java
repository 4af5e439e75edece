package com.buyer.procurement.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * The quote picked for one BOM line. {@code quote} is null when the line is
 * unfulfilled; {@code lineCost} is zero when the picked quote is not convertible
 * or the line has no quotes at all. A line left outside the vendor cover keeps the
 * cost of its cheapest pick.
 */
public record ItemAssignment(
        Long bomItemId,
        Long specificationId,
        String specificationName,
        int quantity,
        QuoteComparison quote,
        BigDecimal lineCost,
        boolean fulfilled,
        boolean degraded,
        List<String> caveats) {

    public Long vendorId() {
        return quote != null ? quote.vendorId() : null;
    }
}
