package com.buyer.procurement.engine;

import com.buyer.procurement.dto.BomItemAnalysis;
import com.buyer.procurement.dto.CategoryRisk;
import com.buyer.procurement.dto.ConsolidationReport;
import com.buyer.procurement.dto.ItemAssignment;
import com.buyer.procurement.dto.MitigationAction;
import com.buyer.procurement.dto.ProcurementComparison;
import com.buyer.procurement.dto.ProjectSummary;
import com.buyer.procurement.dto.QuoteComparison;
import com.buyer.procurement.dto.QuoteFreshness;
import com.buyer.procurement.dto.QuoteSelection;
import com.buyer.procurement.dto.RiskAssessment;
import com.buyer.procurement.dto.RiskFinding;
import com.buyer.procurement.dto.RiskKind;
import com.buyer.procurement.dto.RiskLevel;
import com.buyer.procurement.dto.RiskSeverity;
import com.buyer.procurement.dto.SavingsLine;
import com.buyer.procurement.dto.SavingsReport;
import com.buyer.procurement.dto.ScenarioResult;
import com.buyer.procurement.dto.StrategySettings;
import com.buyer.procurement.dto.VendorConsolidation;
import com.buyer.procurement.dto.VendorRatingSummary;
import com.buyer.procurement.dto.VendorRecommendation;
import com.buyer.procurement.model.Project;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Turns scenarios into recommendation records, risk findings, savings and
 * consolidation reports. Shares the evaluator's normalized quotes, so every report
 * built by one reporter describes the same snapshot.
 */
public class ProcurementReporter {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal HIGH_CONCENTRATION = new BigDecimal("0.80");
    private static final BigDecimal HIGH_OVERRUN_PERCENT = BigDecimal.valueOf(20);
    private static final BigDecimal MEDIUM_OVERRUN_PERCENT = BigDecimal.valueOf(10);
    private static final BigDecimal VENDOR_OVERHEAD = BigDecimal.valueOf(250);
    private static final double LOW_RATING = 3.0;
    private static final int LOW_DIVERSITY_ITEMS = 5;

    // Category weights of the overall risk score, in percent
    private static final int COVERAGE_WEIGHT = 30;
    private static final int TIMELINE_WEIGHT = 15;
    private static final int BUDGET_WEIGHT = 25;
    private static final int SUPPLY_CHAIN_WEIGHT = 20;
    private static final int QUALITY_WEIGHT = 10;

    private final ProcurementSnapshot snapshot;
    private final List<ItemQuotes> items;

    public ProcurementReporter(ScenarioEvaluator evaluator) {
        this.snapshot = evaluator.getSnapshot();
        this.items = evaluator.getItems();
    }

    /**
     * One record per vendor in the scenario, largest spend first.
     */
    public List<VendorRecommendation> recommendations(ScenarioResult scenario, StrategyType type) {
        Map<Long, List<ItemAssignment>> byVendor = new LinkedHashMap<>();
        for (ItemAssignment line : scenario.assignments()) {
            if (line.fulfilled() && line.vendorId() != null) {
                byVendor.computeIfAbsent(line.vendorId(), v -> new ArrayList<>()).add(line);
            }
        }

        List<VendorRecommendation> unranked = new ArrayList<>();
        for (Map.Entry<Long, List<ItemAssignment>> entry : byVendor.entrySet()) {
            List<ItemAssignment> lines = entry.getValue();
            BigDecimal total = ScenarioEvaluator.totalCost(lines);
            String vendorName = lines.get(0).quote().vendorName();
            List<Long> itemIds = lines.stream().map(ItemAssignment::bomItemId).collect(Collectors.toList());
            String rationale = rationale(type, entry.getKey(), lines);
            unranked.add(new VendorRecommendation(entry.getKey(), vendorName, total, lines.size(), itemIds,
                    rationale, 0));
        }
        unranked.sort(Comparator.comparing(VendorRecommendation::totalCost).reversed()
                .thenComparing(VendorRecommendation::vendorId));

        List<VendorRecommendation> ranked = new ArrayList<>();
        for (int i = 0; i < unranked.size(); i++) {
            VendorRecommendation r = unranked.get(i);
            ranked.add(new VendorRecommendation(r.vendorId(), r.vendorName(), r.totalCost(), r.itemCount(),
                    r.bomItemIds(), r.rationale(), i + 1));
        }
        return ranked;
    }

    private String rationale(StrategyType type, Long vendorId, List<ItemAssignment> lines) {
        int count = lines.size();
        String itemText = count == 1 ? "1 item" : count + " items";
        String text;
        switch (type) {
            case FEWEST_VENDORS:
                text = "consolidates " + itemText + " to reduce vendor count";
                break;
            case BALANCED:
                text = "best balance of cost and vendor count across " + itemText;
                break;
            case QUALITY_FOCUSED:
                text = String.format(Locale.ROOT, "highest-rated option (quality score %.1f/5) across %s",
                        snapshot.qualityScore(vendorId), itemText);
                break;
            default:
                text = "lowest total cost across " + itemText;
                break;
        }
        long degraded = lines.stream().filter(ItemAssignment::degraded).count();
        if (degraded > 0) {
            text += "; " + degraded + " selection(s) relax a constraint";
        }
        return text;
    }

    /**
     * Scans the scenario and its BOM for risk conditions. Findings never suppress one
     * another and come back grouped by kind in a fixed order.
     */
    public List<RiskFinding> assessRisks(ScenarioResult scenario) {
        List<RiskFinding> findings = new ArrayList<>();
        expiringQuotes(scenario, findings);
        missingCompliantQuotes(findings);
        vendorConcentration(scenario, findings);
        budgetOverrun(scenario, findings);
        singleSourceItems(findings);
        staleSelections(scenario, findings);
        unconvertibleQuotes(findings);
        return findings;
    }

    public static RiskSeverity overallRisk(List<RiskFinding> findings) {
        return findings.stream()
                .map(RiskFinding::severity)
                .max(Comparator.naturalOrder())
                .orElse(RiskSeverity.LOW);
    }

    /**
     * Wraps the findings for {@code scenario} with a per-category view and the
     * actions that would reduce it.
     *
     * <p>Each category is graded on its own: quote_coverage, timeline, budget,
     * supply_chain and quality. The overall score is their weighted sum (30/15/25/20/10),
     * where quote_coverage contributes the share of items without quotes and the others
     * the score of their level. A score of 75 or more is critical, 50 high, 25 medium.
     */
    public RiskAssessment riskAssessment(ScenarioResult scenario) {
        List<RiskFinding> findings = assessRisks(scenario);
        QuoteFreshness quoteFreshness = freshness();

        CategoryRisk coverage = coverageRisk();
        CategoryRisk timeline = timelineRisk(quoteFreshness);
        CategoryRisk budget = budgetRisk(scenario);
        CategoryRisk supplyChain = supplyChainRisk(scenario);
        CategoryRisk quality = qualityRisk(scenario);
        Map<String, CategoryRisk> categories = new LinkedHashMap<>();
        for (CategoryRisk category : List.of(coverage, timeline, budget, supplyChain, quality)) {
            categories.put(category.category(), category);
        }

        int score = (coverage.score() * COVERAGE_WEIGHT
                + timeline.score() * TIMELINE_WEIGHT
                + budget.score() * BUDGET_WEIGHT
                + supplyChain.score() * SUPPLY_CHAIN_WEIGHT
                + quality.score() * QUALITY_WEIGHT) / 100;

        List<MitigationAction> actions = mitigationActions(scenario, categories, quoteFreshness);
        List<String> highPriority = actions.stream()
                .filter(a -> a.priority().compareTo(RiskLevel.HIGH) >= 0)
                .map(MitigationAction::action)
                .collect(Collectors.toList());
        return new RiskAssessment(scenario.name(), score, RiskLevel.forScore(score), overallRisk(findings),
                categories, findings, actions, highPriority);
    }

    private CategoryRisk coverageRisk() {
        List<String> issues = new ArrayList<>();
        int uncovered = 0;
        int singleSource = 0;
        for (ItemQuotes item : items) {
            if (!item.hasQuotes()) {
                uncovered++;
                issues.add(item.specificationName() + " has no quotes");
            } else if (item.vendorCount() == 1) {
                singleSource++;
                issues.add(item.specificationName() + " is quoted by a single vendor");
            }
        }
        int total = items.size();
        int score = total > 0 ? uncovered * 100 / total : 0;
        RiskLevel level;
        String impact;
        if (uncovered > 0) {
            level = RiskLevel.CRITICAL;
            impact = "Project cannot proceed without quotes for all items";
        } else if (singleSource > total / 2) {
            level = RiskLevel.HIGH;
            impact = "Limited negotiation leverage and supply chain vulnerability";
        } else if (singleSource > 0) {
            level = RiskLevel.MEDIUM;
            impact = "Some items have limited vendor options";
        } else {
            level = RiskLevel.LOW;
            impact = "Good vendor diversity and quote coverage";
        }
        return new CategoryRisk("quote_coverage", level, score, uncovered + singleSource, issues, impact);
    }

    private CategoryRisk timelineRisk(QuoteFreshness quoteFreshness) {
        int affected = (int) items.stream()
                .filter(item -> item.quotes().stream().anyMatch(q -> q.expired() || q.stale()))
                .count();
        RiskLevel level;
        List<String> issues;
        if (quoteFreshness.expiredQuotes() > 0) {
            level = RiskLevel.HIGH;
            issues = List.of(quoteFreshness.expiredQuotes() + " quote(s) have expired and need renewal");
        } else if (quoteFreshness.staleQuotes() > 0) {
            level = RiskLevel.MEDIUM;
            issues = List.of(quoteFreshness.staleQuotes() + " quote(s) are becoming stale");
        } else {
            level = RiskLevel.LOW;
            issues = List.of();
        }
        return new CategoryRisk("timeline", level, level.getScore(), affected, issues,
                "Average quote age " + quoteFreshness.averageAgeDays() + " days");
    }

    /** Without a budget the category stays low and adds nothing to the overall score. */
    private CategoryRisk budgetRisk(ScenarioResult scenario) {
        Project project = snapshot.project();
        if (!project.hasBudget()) {
            return new CategoryRisk("budget", RiskLevel.LOW, 0, 0, List.of(), "No budget set");
        }
        BigDecimal overrun = scenario.totalCost().subtract(project.getBudget());
        RiskLevel level = budgetLevel(overrun, project.getBudget());
        if (level == RiskLevel.LOW) {
            return new CategoryRisk("budget", level, level.getScore(), 0, List.of(), "Projected cost within budget");
        }
        BigDecimal percent = overrun.multiply(HUNDRED).divide(project.getBudget(), MathContext.DECIMAL64);
        String issue = String.format("Projected overrun %s %s (%s%%)", overrun.toPlainString(),
                snapshot.settings().referenceCurrency(), percent.setScale(1, RoundingMode.HALF_UP).toPlainString());
        String impact = "Contingency of " + contingency(overrun, level).toPlainString() + " "
                + snapshot.settings().referenceCurrency() + " needed";
        return new CategoryRisk("budget", level, level.getScore(), 0, List.of(issue), impact);
    }

    private static RiskLevel budgetLevel(BigDecimal overrun, BigDecimal budget) {
        BigDecimal percent = overrun.multiply(HUNDRED).divide(budget, MathContext.DECIMAL64);
        if (percent.compareTo(HIGH_OVERRUN_PERCENT) > 0) {
            return RiskLevel.CRITICAL;
        }
        if (percent.compareTo(MEDIUM_OVERRUN_PERCENT) > 0) {
            return RiskLevel.HIGH;
        }
        return percent.signum() > 0 ? RiskLevel.MEDIUM : RiskLevel.LOW;
    }

    /** Overrun plus a buffer of 20%, 15% or 10% by level. */
    private static BigDecimal contingency(BigDecimal overrun, RiskLevel level) {
        BigDecimal factor;
        switch (level) {
            case CRITICAL:
                factor = new BigDecimal("1.20");
                break;
            case HIGH:
                factor = new BigDecimal("1.15");
                break;
            case MEDIUM:
                factor = new BigDecimal("1.10");
                break;
            default:
                return BigDecimal.ZERO;
        }
        return overrun.multiply(factor).setScale(2, RoundingMode.HALF_UP);
    }

    private CategoryRisk supplyChainRisk(ScenarioResult scenario) {
        int noQuotes = (int) items.stream().filter(item -> !item.hasQuotes()).count();
        int singleSource = (int) items.stream().filter(item -> item.vendorCount() == 1).count();
        boolean lowDiversity = scenario.vendorCount() < 2 && items.size() > LOW_DIVERSITY_ITEMS;

        List<String> issues = new ArrayList<>();
        if (noQuotes > 0) {
            issues.add(noQuotes + " item(s) without quotes");
        }
        if (singleSource > 0) {
            issues.add(singleSource + " single-source item(s)");
        }
        if (lowDiversity) {
            issues.add(scenario.vendorCount() + " vendor(s) for " + items.size() + " items");
        }
        RiskLevel level;
        if (noQuotes > 0) {
            level = RiskLevel.CRITICAL;
        } else if (singleSource > items.size() / 2) {
            level = RiskLevel.HIGH;
        } else if (lowDiversity) {
            level = RiskLevel.MEDIUM;
        } else {
            level = RiskLevel.LOW;
        }
        return new CategoryRisk("supply_chain", level, level.getScore(), noQuotes + singleSource, issues,
                "Depends on " + scenario.vendorCount() + " vendor(s)");
    }

    /** Looks at the vendors the scenario actually uses; unrated means no ratings on file. */
    private CategoryRisk qualityRisk(ScenarioResult scenario) {
        Map<Long, String> vendors = new LinkedHashMap<>();
        for (ItemAssignment line : scenario.assignments()) {
            if (line.fulfilled() && line.vendorId() != null) {
                vendors.putIfAbsent(line.vendorId(), line.quote().vendorName());
            }
        }
        List<String> issues = new ArrayList<>();
        int lowRated = 0;
        int unrated = 0;
        for (Map.Entry<Long, String> vendor : vendors.entrySet()) {
            VendorRatingSummary rating = snapshot.rating(vendor.getKey());
            if (rating.totalRatings() == 0 || rating.overallAverage() == null) {
                unrated++;
                issues.add(vendor.getValue() + " has no ratings");
            } else if (rating.overallAverage() < LOW_RATING) {
                lowRated++;
                issues.add(String.format(Locale.ROOT, "%s has low average rating (%.1f/5.0)", vendor.getValue(),
                        rating.overallAverage()));
            }
        }
        RiskLevel level;
        if (lowRated > 0) {
            level = RiskLevel.HIGH;
        } else if (unrated > vendors.size() / 2) {
            level = RiskLevel.MEDIUM;
        } else {
            level = RiskLevel.LOW;
        }
        return new CategoryRisk("quality", level, level.getScore(), lowRated + unrated, issues,
                lowRated + " low-rated and " + unrated + " unrated of " + vendors.size() + " vendor(s)");
    }

    private List<MitigationAction> mitigationActions(ScenarioResult scenario, Map<String, CategoryRisk> categories,
            QuoteFreshness quoteFreshness) {
        List<MitigationAction> actions = new ArrayList<>();
        if (categories.get("quote_coverage").level().compareTo(RiskLevel.HIGH) >= 0) {
            actions.add(new MitigationAction(RiskLevel.CRITICAL, "quote_coverage",
                    "Request quotes from additional vendors for items with no or limited quotes",
                    "Enables procurement and improves negotiation leverage", "medium", "immediate"));
        }
        if (quoteFreshness.expiredQuotes() > 0) {
            actions.add(new MitigationAction(RiskLevel.HIGH, "timeline",
                    "Renew " + quoteFreshness.expiredQuotes() + " expired quote(s) before proceeding with procurement",
                    "Ensures current pricing and availability", "low", "immediate"));
        }
        RiskLevel budgetLevel = categories.get("budget").level();
        if (budgetLevel.compareTo(RiskLevel.HIGH) >= 0) {
            BigDecimal overrun = scenario.totalCost().subtract(snapshot.project().getBudget());
            actions.add(new MitigationAction(RiskLevel.HIGH, "budget",
                    "Secure additional budget of " + contingency(overrun, budgetLevel).toPlainString() + " "
                            + snapshot.settings().referenceCurrency() + " or negotiate better pricing",
                    "Prevents project delays due to funding shortfall", "high", "short-term"));
        }
        long singleSource = items.stream().filter(item -> item.vendorCount() == 1).count();
        if (singleSource > 0) {
            actions.add(new MitigationAction(RiskLevel.MEDIUM, "supply_chain",
                    "Identify backup vendors for " + singleSource + " single-source item(s)",
                    "Reduces supply chain risk and improves resilience", "medium", "short-term"));
        }
        if (categories.get("quality").level() == RiskLevel.HIGH) {
            actions.add(new MitigationAction(RiskLevel.MEDIUM, "quality",
                    "Review low-rated vendors and consider alternatives with better track records",
                    "Reduces risk of quality issues and delays", "low", "immediate"));
        }
        return actions;
    }

    private void expiringQuotes(ScenarioResult scenario, List<RiskFinding> findings) {
        LocalDate today = snapshot.evaluationDate();
        LocalDate reference = snapshot.project().getDeadline() != null ? snapshot.project().getDeadline() : today;
        LocalDate horizon = reference.plusDays(snapshot.settings().expiryWarningDays());
        for (ItemAssignment line : scenario.assignments()) {
            QuoteComparison quote = line.quote();
            if (quote == null || quote.validUntil() == null || quote.validUntil().isAfter(horizon)) {
                continue;
            }
            boolean expired = quote.validUntil().isBefore(today);
            String message = String.format("Quote from %s for %s %s on %s", quote.vendorName(),
                    line.specificationName(), expired ? "expired" : "expires", quote.validUntil());
            findings.add(new RiskFinding(RiskKind.EXPIRING_QUOTE, expired ? RiskSeverity.HIGH : RiskSeverity.MEDIUM,
                    message, quote.vendorId(), List.of(line.bomItemId())));
        }
    }

    private void missingCompliantQuotes(List<RiskFinding> findings) {
        for (ItemQuotes item : items) {
            if (!item.hasQuotes()) {
                findings.add(new RiskFinding(RiskKind.NO_COMPLIANT_QUOTES, RiskSeverity.HIGH,
                        "No quotes for " + item.specificationName() + "; item excluded from totals", null,
                        List.of(item.bomItemId())));
            } else if (item.quotes().stream().noneMatch(QuoteComparison::compliant)) {
                findings.add(new RiskFinding(RiskKind.NO_COMPLIANT_QUOTES, RiskSeverity.MEDIUM,
                        "None of the " + item.quotes().size() + " quote(s) for " + item.specificationName()
                                + " meets the specification",
                        null, List.of(item.bomItemId())));
            }
        }
    }

    private void vendorConcentration(ScenarioResult scenario, List<RiskFinding> findings) {
        BigDecimal total = scenario.totalCost();
        if (total.signum() <= 0) {
            return;
        }
        Map<Long, BigDecimal> costByVendor = new TreeMap<>();
        Map<Long, String> names = new LinkedHashMap<>();
        Map<Long, List<Long>> itemsByVendor = new LinkedHashMap<>();
        for (ItemAssignment line : scenario.assignments()) {
            if (line.vendorId() == null || line.lineCost().signum() == 0) {
                continue;
            }
            costByVendor.merge(line.vendorId(), line.lineCost(), BigDecimal::add);
            names.putIfAbsent(line.vendorId(), line.quote().vendorName());
            itemsByVendor.computeIfAbsent(line.vendorId(), v -> new ArrayList<>()).add(line.bomItemId());
        }
        for (Map.Entry<Long, BigDecimal> entry : costByVendor.entrySet()) {
            BigDecimal share = entry.getValue().divide(total, MathContext.DECIMAL64);
            if (share.compareTo(snapshot.settings().concentrationThreshold()) <= 0) {
                continue;
            }
            String message = String.format(Locale.ROOT, "%s accounts for %s%% of total cost", names.get(entry.getKey()),
                    share.multiply(HUNDRED).setScale(1, RoundingMode.HALF_UP).toPlainString());
            RiskSeverity severity = share.compareTo(HIGH_CONCENTRATION) > 0 ? RiskSeverity.HIGH : RiskSeverity.MEDIUM;
            findings.add(new RiskFinding(RiskKind.VENDOR_CONCENTRATION, severity, message, entry.getKey(),
                    itemsByVendor.get(entry.getKey())));
        }
    }

    private void budgetOverrun(ScenarioResult scenario, List<RiskFinding> findings) {
        Project project = snapshot.project();
        if (!project.hasBudget() || scenario.totalCost().compareTo(project.getBudget()) <= 0) {
            return;
        }
        BigDecimal overrun = scenario.totalCost().subtract(project.getBudget());
        BigDecimal percent = overrun.multiply(HUNDRED).divide(project.getBudget(), MathContext.DECIMAL64);
        RiskSeverity severity = percent.compareTo(HIGH_OVERRUN_PERCENT) > 0 ? RiskSeverity.HIGH
                : percent.compareTo(MEDIUM_OVERRUN_PERCENT) > 0 ? RiskSeverity.MEDIUM : RiskSeverity.LOW;
        String message = String.format("Projected cost %s %s exceeds budget %s by %s (%s%%)",
                scenario.totalCost().toPlainString(), snapshot.settings().referenceCurrency(),
                project.getBudget().toPlainString(), overrun.toPlainString(),
                percent.setScale(1, RoundingMode.HALF_UP).toPlainString());
        findings.add(new RiskFinding(RiskKind.BUDGET_OVERRUN, severity, message, null, List.of()));
    }

    private void singleSourceItems(List<RiskFinding> findings) {
        for (ItemQuotes item : items) {
            if (item.vendorCount() == 1) {
                QuoteComparison only = item.quotes().get(0);
                findings.add(new RiskFinding(RiskKind.SINGLE_SOURCE, RiskSeverity.MEDIUM,
                        item.specificationName() + " is only quoted by " + only.vendorName(), only.vendorId(),
                        List.of(item.bomItemId())));
            }
        }
    }

    private void staleSelections(ScenarioResult scenario, List<RiskFinding> findings) {
        for (ItemAssignment line : scenario.assignments()) {
            QuoteComparison quote = line.quote();
            if (quote != null && quote.stale() && !quote.expired()) {
                findings.add(new RiskFinding(RiskKind.STALE_QUOTES, RiskSeverity.LOW,
                        "Quote from " + quote.vendorName() + " for " + line.specificationName() + " dates from "
                                + quote.quoteDate() + " and may no longer reflect current pricing",
                        quote.vendorId(), List.of(line.bomItemId())));
            }
        }
    }

    private void unconvertibleQuotes(List<RiskFinding> findings) {
        for (ItemQuotes item : items) {
            List<QuoteComparison> unconvertible = item.quotes().stream()
                    .filter(q -> !q.convertible())
                    .collect(Collectors.toList());
            if (unconvertible.isEmpty()) {
                continue;
            }
            String currencies = unconvertible.stream()
                    .map(q -> String.valueOf(q.currency()))
                    .distinct()
                    .collect(Collectors.joining(", "));
            findings.add(new RiskFinding(RiskKind.UNCONVERTIBLE_QUOTES, RiskSeverity.LOW,
                    unconvertible.size() + " quote(s) for " + item.specificationName() + " could not be converted to "
                            + snapshot.settings().referenceCurrency() + " (" + currencies + ")",
                    null, List.of(item.bomItemId())));
        }
    }

    /**
     * Compares the lowest-cost total with a naive baseline that takes the first
     * convertible quote on file for every item. Informational only.
     *
     * @param recommended the scenario whose vendor count is set against every vendor
     *                    able to supply the BOM for the consolidation estimate
     */
    public SavingsReport savings(ScenarioResult lowestCost, ScenarioResult recommended) {
        Map<Long, ItemAssignment> assigned = byItem(lowestCost);
        BigDecimal baselineTotal = BigDecimal.ZERO;
        List<SavingsLine> lines = new ArrayList<>();
        Map<String, BigDecimal> byVendor = new LinkedHashMap<>();
        Map<String, BigDecimal> byCategory = new LinkedHashMap<>();
        for (ItemQuotes item : items) {
            Optional<QuoteComparison> first = item.quotes().stream().filter(QuoteComparison::convertible).findFirst();
            if (first.isEmpty()) {
                continue;
            }
            BigDecimal baselineUnit = first.get().convertedPrice();
            baselineTotal = baselineTotal.add(item.lineCost(first.get()));

            ItemAssignment best = assigned.get(item.bomItemId());
            if (best != null && best.quote() != null && best.quote().convertible()) {
                BigDecimal bestUnit = best.quote().convertedPrice();
                BigDecimal perUnit = baselineUnit.subtract(bestUnit);
                BigDecimal lineSavings = perUnit.multiply(BigDecimal.valueOf(item.quantity()));
                lines.add(new SavingsLine(item.bomItemId(), item.specificationName(), item.quantity(), baselineUnit,
                        bestUnit, perUnit, lineSavings));
                byVendor.merge(best.quote().vendorName(), lineSavings, BigDecimal::add);
                byCategory.merge(item.specificationName(), lineSavings, BigDecimal::add);
            }
        }
        BigDecimal bestTotal = lowestCost.totalCost();
        BigDecimal savings = baselineTotal.subtract(bestTotal);
        BigDecimal percent = baselineTotal.signum() > 0
                ? savings.multiply(HUNDRED).divide(baselineTotal, MathContext.DECIMAL64)
                : null;

        int candidates = candidateVendors().size();
        BigDecimal consolidationSavings = candidates > recommended.vendorCount()
                ? VENDOR_OVERHEAD.multiply(BigDecimal.valueOf(candidates - recommended.vendorCount()))
                : BigDecimal.ZERO;
        return new SavingsReport(bestTotal, baselineTotal, savings, percent, lines, byVendor, byCategory,
                consolidationSavings);
    }

    /**
     * Which vendors could take over which items. Coverage is the same relation the
     * fewest_vendors cover uses.
     */
    public ConsolidationReport consolidation(ScenarioResult fewestVendors) {
        return new ConsolidationReport(items.size(), fewestVendors.vendorCount(), candidateVendors());
    }

    private List<VendorConsolidation> candidateVendors() {
        Map<Long, List<ItemQuotes>> coveredByVendor = new TreeMap<>();
        Map<Long, String> names = new LinkedHashMap<>();
        for (ItemQuotes item : items) {
            if (!item.coverable()) {
                continue;
            }
            for (QuoteComparison quote : item.tier()) {
                List<ItemQuotes> covered = coveredByVendor.computeIfAbsent(quote.vendorId(), v -> new ArrayList<>());
                if (covered.isEmpty() || covered.get(covered.size() - 1) != item) {
                    covered.add(item);
                }
                names.putIfAbsent(quote.vendorId(), quote.vendorName());
            }
        }

        List<VendorConsolidation> vendors = new ArrayList<>();
        for (Map.Entry<Long, List<ItemQuotes>> entry : coveredByVendor.entrySet()) {
            Long vendorId = entry.getKey();
            List<ItemQuotes> covered = entry.getValue();
            BigDecimal cost = BigDecimal.ZERO;
            int quantity = 0;
            double rankSum = 0;
            Set<Long> specifications = new HashSet<>();
            for (ItemQuotes item : covered) {
                QuoteComparison quote = item.cheapestInTier(q -> q.vendorId().equals(vendorId)).orElseThrow();
                cost = cost.add(item.lineCost(quote));
                quantity += item.quantity();
                rankSum += priceRank(item, vendorId);
                specifications.add(item.specificationId());
            }
            boolean shippingAdvantage = covered.size() * 2 > items.size();
            vendors.add(new VendorConsolidation(vendorId, names.get(vendorId),
                    covered.stream().map(ItemQuotes::bomItemId).collect(Collectors.toList()), specifications.size(),
                    quantity, cost, rankSum / covered.size(), shippingAdvantage, snapshot.rating(vendorId)));
        }
        vendors.sort(Comparator.comparing((VendorConsolidation v) -> v.bomItemIds().size()).reversed()
                .thenComparing(VendorConsolidation::totalCostIfUsed)
                .thenComparing(VendorConsolidation::vendorId));
        return vendors;
    }

    /** 1-based position of the vendor's cheapest offer among the distinct vendors in the item's tier. */
    private static int priceRank(ItemQuotes item, Long vendorId) {
        List<Long> vendorOrder = item.tier().stream()
                .map(QuoteComparison::vendorId)
                .distinct()
                .collect(Collectors.toList());
        return vendorOrder.indexOf(vendorId) + 1;
    }

    public QuoteFreshness freshness() {
        LocalDate today = snapshot.evaluationDate();
        Map<Long, QuoteComparison> distinct = new LinkedHashMap<>();
        items.forEach(item -> item.quotes().forEach(q -> distinct.putIfAbsent(q.quoteId(), q)));

        int fresh = 0;
        int stale = 0;
        int expired = 0;
        long ageSum = 0;
        for (QuoteComparison quote : distinct.values()) {
            if (quote.expired()) {
                expired++;
            } else if (quote.stale()) {
                stale++;
            } else {
                fresh++;
            }
            if (quote.quoteDate() != null) {
                ageSum += ChronoUnit.DAYS.between(quote.quoteDate(), today);
            }
        }
        long averageAge = distinct.isEmpty() ? 0 : ageSum / distinct.size();
        return new QuoteFreshness(distinct.size(), fresh, stale, expired, averageAge);
    }

    /**
     * Scores how exposed one BOM line is: no quotes +3, a single vendor +2, all quotes
     * stale +2 (more than half stale +1), best pick degraded +1.
     */
    public String itemRiskLevel(ItemQuotes item) {
        int score = 0;
        if (!item.hasQuotes()) {
            score += 3;
        } else {
            if (item.vendorCount() == 1) {
                score += 2;
            }
            long stale = item.quotes().stream().filter(QuoteComparison::stale).count();
            if (stale == item.quotes().size()) {
                score += 2;
            } else if (stale * 2 > item.quotes().size()) {
                score += 1;
            }
            if (!item.tierReasons().isEmpty()) {
                score += 1;
            }
        }
        if (score >= 5) {
            return "critical";
        }
        if (score >= 3) {
            return "high";
        }
        return score >= 1 ? "medium" : "low";
    }

    /** Sum of the most expensive convertible offer per item. */
    public BigDecimal worstCaseCost() {
        BigDecimal total = BigDecimal.ZERO;
        for (ItemQuotes item : items) {
            Optional<QuoteComparison> worst = item.quotes().stream()
                    .filter(QuoteComparison::convertible)
                    .max(Comparator.comparing(QuoteComparison::convertedPrice));
            if (worst.isPresent()) {
                total = total.add(item.lineCost(worst.get()));
            }
        }
        return total;
    }

    /**
     * Assembles the full analysis payload.
     *
     * @param scenarios all four scenarios in their fixed order
     * @param current   the strategy recommendations and risks are reported for
     */
    public ProcurementComparison comparison(List<ScenarioResult> scenarios, StrategyType current,
            StrategySettings strategy) {
        ScenarioResult lowest = find(scenarios, StrategyType.LOWEST_COST);
        ScenarioResult recommended = find(scenarios, current);
        Map<Long, ItemAssignment> lowestByItem = byItem(lowest);
        Map<Long, ItemAssignment> recommendedByItem = byItem(recommended);

        List<BomItemAnalysis> analyses = new ArrayList<>();
        for (ItemQuotes item : items) {
            QuoteSelection best = QuoteComparisonBuilder.selectBest(item.quotes()).orElse(null);
            ItemAssignment bestLine = lowestByItem.get(item.bomItemId());
            ItemAssignment recommendedLine = recommendedByItem.get(item.bomItemId());
            analyses.add(new BomItemAnalysis(item.bomItemId(), item.specificationId(), item.specificationName(),
                    item.quantity(), item.quotes().size(), (int) item.vendorCount(), best, recommendedLine,
                    bestLine != null ? bestLine.lineCost() : BigDecimal.ZERO,
                    recommendedLine != null ? recommendedLine.lineCost() : BigDecimal.ZERO, itemRiskLevel(item)));
        }

        Project project = snapshot.project();
        int covered = (int) items.stream().filter(ItemQuotes::hasQuotes).count();
        BigDecimal savingsPercent = project.hasBudget()
                ? recommended.savingsVsBudget().multiply(HUNDRED).divide(project.getBudget(), MathContext.DECIMAL64)
                : null;
        List<RiskFinding> risks = assessRisks(recommended);

        return new ProcurementComparison(
                ProjectSummary.of(project),
                strategy,
                snapshot.evaluationDate(),
                snapshot.settings().referenceCurrency(),
                analyses,
                items.size(),
                covered,
                items.size() - covered,
                lowest.totalCost(),
                recommended.totalCost(),
                worstCaseCost(),
                recommended.savingsVsBudget(),
                savingsPercent,
                recommendations(recommended, current),
                scenarios,
                risks,
                overallRisk(risks),
                freshness(),
                consolidation(find(scenarios, StrategyType.FEWEST_VENDORS)));
    }

    private static ScenarioResult find(List<ScenarioResult> scenarios, StrategyType type) {
        return scenarios.stream()
                .filter(s -> s.name().equals(type.getCode()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No " + type.getCode() + " scenario supplied"));
    }

    private static Map<Long, ItemAssignment> byItem(ScenarioResult scenario) {
        Map<Long, ItemAssignment> byItem = new LinkedHashMap<>();
        scenario.assignments().forEach(a -> byItem.put(a.bomItemId(), a));
        return byItem;
    }
}
