package com.buyer.procurement.dto;

/**
 * Category averages over all ratings of a vendor. A category nobody rated stays null;
 * {@code overallAverage} is the mean of the categories that have an average.
 */
public record VendorRatingSummary(
        Long vendorId,
        int totalRatings,
        Double averagePrice,
        Double averageQuality,
        Double averageDelivery,
        Double averageService,
        Double overallAverage) {

    public static final double NEUTRAL_SCORE = 3.0;

    public static VendorRatingSummary unrated(Long vendorId) {
        return new VendorRatingSummary(vendorId, 0, null, null, null, null, null);
    }

    public double qualityScore() {
        return overallAverage != null ? overallAverage : NEUTRAL_SCORE;
    }
}
