package com.buyer.procurement.engine;

import com.buyer.procurement.dto.VendorRatingSummary;
import com.buyer.procurement.exception.InvalidStrategyException;
import com.buyer.procurement.model.BillOfMaterialsItem;
import com.buyer.procurement.model.Project;
import com.buyer.procurement.model.ProjectProcurementStrategy;
import com.buyer.procurement.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything one engine run reads, loaded up front by the caller. Never mutated
 * after construction, so scenario evaluations may share it across threads.
 *
 * @param strategy the project's persisted strategy, or null to evaluate with defaults
 */
public record ProcurementSnapshot(
        Project project,
        List<BomLine> lines,
        CurrencyNormalizer normalizer,
        Map<Long, VendorRatingSummary> ratings,
        ProjectProcurementStrategy strategy,
        LocalDate evaluationDate,
        EngineSettings settings) {

    private static final Logger logger = LoggerFactory.getLogger(ProcurementSnapshot.class);

    /** A BOM item with every quote for a product of its specification, in store order. */
    public record BomLine(BillOfMaterialsItem item, List<Quote> quotes) {
    }

    public double qualityScore(Long vendorId) {
        VendorRatingSummary summary = ratings.get(vendorId);
        return summary != null ? summary.qualityScore() : VendorRatingSummary.NEUTRAL_SCORE;
    }

    public VendorRatingSummary rating(Long vendorId) {
        VendorRatingSummary summary = ratings.get(vendorId);
        return summary != null ? summary : VendorRatingSummary.unrated(vendorId);
    }

    public Integer maxVendors() {
        return strategy != null ? strategy.getMaxVendors() : null;
    }

    public Double minVendorRating() {
        return strategy != null ? strategy.getMinVendorRating() : null;
    }

    public boolean allowPartialFulfill() {
        return strategy == null || strategy.isAllowPartialFulfill();
    }

    public boolean hasVendorConstraints() {
        return (maxVendors() != null && maxVendors() > 0) || minVendorRating() != null;
    }

    /** Falls back to the default strategy when the stored code is missing or unknown. */
    public StrategyType currentStrategy() {
        if (strategy == null || strategy.getStrategy() == null) {
            return StrategyType.DEFAULT;
        }
        try {
            return StrategyType.fromCode(strategy.getStrategy());
        } catch (InvalidStrategyException e) {
            logger.warn("Project {} has unknown stored strategy '{}'; evaluating with {}", project.getId(),
                    strategy.getStrategy(), StrategyType.DEFAULT.getCode());
            return StrategyType.DEFAULT;
        }
    }
}
