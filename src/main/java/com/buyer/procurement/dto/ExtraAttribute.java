package com.buyer.procurement.dto;

public record ExtraAttribute(
        Long specificationAttributeId,
        String name,
        String value,
        String unit) {
}
