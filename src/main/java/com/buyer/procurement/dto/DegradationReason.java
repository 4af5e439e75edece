package com.buyer.procurement.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DegradationReason {
    NO_CONVERTIBLE_QUOTES("no-convertible-quotes"),
    ONLY_EXPIRED_QUOTES("only-expired-quotes"),
    NO_COMPLIANT_QUOTE("no-compliant-quote"),
    CONSTRAINT_UNSATISFIABLE("constraint-unsatisfiable");

    private final String code;

    DegradationReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
