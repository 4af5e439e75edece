package com.buyer.procurement.dto;

import java.math.BigDecimal;

public record SavingsLine(
        Long bomItemId,
        String specificationName,
        int quantity,
        BigDecimal baselineUnitPrice,
        BigDecimal bestUnitPrice,
        BigDecimal savingsPerUnit,
        BigDecimal lineSavings) {
}
