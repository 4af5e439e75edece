package com.buyer.procurement.dto;

import com.fasterxml.jackson.annotation.JsonValue;

// Declaration order is ascending severity
public enum RiskSeverity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }
}
