package com.buyer.procurement.dto;

import java.util.List;
import java.util.stream.Collectors;

public record QuoteSelection(
        QuoteComparison quote,
        boolean degraded,
        List<DegradationReason> reasons) {

    public String reason() {
        return reasons.stream().map(DegradationReason::getCode).collect(Collectors.joining(", "));
    }
}
