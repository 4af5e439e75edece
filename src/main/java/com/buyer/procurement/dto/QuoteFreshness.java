package com.buyer.procurement.dto;

public record QuoteFreshness(
        int totalQuotes,
        int freshQuotes,
        int staleQuotes,
        int expiredQuotes,
        long averageAgeDays) {
}
