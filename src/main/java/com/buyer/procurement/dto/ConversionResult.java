package com.buyer.procurement.dto;

import java.math.BigDecimal;

/**
 * Outcome of a currency conversion. {@code composed} is set when no direct rate
 * existed and the amount went through the reference currency.
 */
public record ConversionResult(
        BigDecimal amount,
        BigDecimal rate,
        String fromCurrency,
        String toCurrency,
        boolean composed) {
}
