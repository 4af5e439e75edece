package com.buyer.procurement.dto;

public enum RiskKind {
    EXPIRING_QUOTE,
    NO_COMPLIANT_QUOTES,
    VENDOR_CONCENTRATION,
    BUDGET_OVERRUN,
    SINGLE_SOURCE,
    STALE_QUOTES,
    UNCONVERTIBLE_QUOTES
}
