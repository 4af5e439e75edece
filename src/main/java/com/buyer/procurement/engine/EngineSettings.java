package com.buyer.procurement.engine;

import java.math.BigDecimal;

/**
 * Tuning values for one engine run. Read from application settings by the service
 * layer and passed in so the engine never touches the store.
 */
public record EngineSettings(
        String referenceCurrency,
        int expiryWarningDays,
        BigDecimal concentrationThreshold,
        int staleQuoteDays,
        BigDecimal balancedCostWeight,
        BigDecimal balancedVendorWeight) {

    public static final String DEFAULT_REFERENCE_CURRENCY = "USD";
    public static final int DEFAULT_EXPIRY_WARNING_DAYS = 14;
    public static final BigDecimal DEFAULT_CONCENTRATION_THRESHOLD = new BigDecimal("0.60");
    public static final int DEFAULT_STALE_QUOTE_DAYS = 90;
    public static final BigDecimal DEFAULT_COST_WEIGHT = new BigDecimal("0.6");
    public static final BigDecimal DEFAULT_VENDOR_WEIGHT = new BigDecimal("0.4");

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_REFERENCE_CURRENCY, DEFAULT_EXPIRY_WARNING_DAYS,
                DEFAULT_CONCENTRATION_THRESHOLD, DEFAULT_STALE_QUOTE_DAYS, DEFAULT_COST_WEIGHT,
                DEFAULT_VENDOR_WEIGHT);
    }
}
