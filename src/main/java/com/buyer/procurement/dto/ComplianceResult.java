package com.buyer.procurement.dto;

import java.util.List;
import java.util.Map;

/**
 * Per-attribute compliance of a product against a specification, keyed by
 * specification attribute id. Only required attributes drive {@code overallCompliant}.
 */
public record ComplianceResult(
        Map<Long, Boolean> perAttribute,
        boolean overallCompliant,
        List<ExtraAttribute> extraAttributes) {
}
