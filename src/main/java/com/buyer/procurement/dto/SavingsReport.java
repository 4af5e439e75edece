package com.buyer.procurement.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * {@code savingsPercent} is null when the baseline total is zero. The vendor and
 * category maps add up the line savings by the vendor of the lowest-cost pick and by
 * specification name. {@code consolidationSavings} is the estimated overhead avoided
 * by not dealing with every vendor able to supply the BOM.
 */
public record SavingsReport(
        BigDecimal bestTotal,
        BigDecimal baselineTotal,
        BigDecimal savings,
        BigDecimal savingsPercent,
        List<SavingsLine> lines,
        Map<String, BigDecimal> savingsByVendor,
        Map<String, BigDecimal> savingsByCategory,
        BigDecimal consolidationSavings) {
}
