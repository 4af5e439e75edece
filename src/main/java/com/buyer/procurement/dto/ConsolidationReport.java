package com.buyer.procurement.dto;

import java.util.List;

public record ConsolidationReport(
        int totalBomItems,
        int fewestVendorsNeeded,
        List<VendorConsolidation> vendors) {
}
