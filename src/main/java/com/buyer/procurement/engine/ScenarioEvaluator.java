package com.buyer.procurement.engine;

import com.buyer.procurement.dto.DegradationReason;
import com.buyer.procurement.dto.ItemAssignment;
import com.buyer.procurement.dto.QuoteComparison;
import com.buyer.procurement.dto.QuoteSelection;
import com.buyer.procurement.dto.ScenarioResult;
import com.buyer.procurement.dto.ScenarioState;
import com.buyer.procurement.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Computes a complete vendor assignment for a project's BOM under each strategy.
 *
 * <p>Quotes are normalized and checked once, when the evaluator is built; every
 * {@link #evaluate(StrategyType)} call after that only reads, so one evaluator can
 * serve concurrent evaluations of different strategies.
 *
 * <p>fewest_vendors is a greedy set cover, not an optimal one. Each round takes the
 * vendor covering the most still-uncovered items, then the one whose cover is
 * cheapest, then the lowest vendor id.
 */
public class ScenarioEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ScenarioEvaluator.class);

    public static final String NO_QUOTES = "no-quotes";
    public static final String NOT_COVERED = "not-covered-by-selected-vendors";
    public static final String PARTIAL_FULFILL = "fulfilled-outside-vendor-cover";

    private static final String BASIS_CONSTRAINED = "constrained";

    private final ProcurementSnapshot snapshot;
    private final List<ItemQuotes> items;

    public ScenarioEvaluator(ProcurementSnapshot snapshot) {
        this(snapshot, new ComplianceMatcher());
    }

    public ScenarioEvaluator(ProcurementSnapshot snapshot, ComplianceMatcher matcher) {
        this.snapshot = snapshot;
        QuoteComparisonBuilder builder = new QuoteComparisonBuilder(snapshot.normalizer(), matcher,
                snapshot.evaluationDate(), snapshot.settings().staleQuoteDays());
        this.items = snapshot.lines().stream()
                .map(line -> ItemQuotes.of(line.item(), line.quotes().stream()
                        .map(q -> builder.compare(q, line.item().getSpecification(), false))
                        .collect(Collectors.toList())))
                .collect(Collectors.toUnmodifiableList());
    }

    public ProcurementSnapshot getSnapshot() {
        return snapshot;
    }

    public List<ItemQuotes> getItems() {
        return items;
    }

    /** All four strategies in their fixed report order. */
    public List<ScenarioResult> evaluateAll() {
        return Arrays.stream(StrategyType.values())
                .map(this::evaluate)
                .collect(Collectors.toList());
    }

    public ScenarioResult evaluate(StrategyType type) {
        Project project = snapshot.project();
        ScenarioState state = ScenarioState.COLLECTING;
        logger.debug("Project {} {} scenario: {} ({} BOM items)", project.getId(), type.getCode(), state,
                items.size());

        state = ScenarioState.ASSIGNING;
        Assignment assignment;
        switch (type) {
            case LOWEST_COST:
                assignment = lowestCost();
                break;
            case FEWEST_VENDORS:
                assignment = fewestVendors();
                break;
            case BALANCED:
                assignment = balanced();
                break;
            case QUALITY_FOCUSED:
                assignment = qualityFocused();
                break;
            default:
                throw new IllegalStateException("Unhandled strategy " + type);
        }
        logger.debug("Project {} {} scenario: {}", project.getId(), type.getCode(), state);

        BigDecimal totalCost = totalCost(assignment.lines());
        boolean feasible = assignment.lines().stream().allMatch(ItemAssignment::fulfilled);
        state = feasible ? ScenarioState.SCORED : ScenarioState.INFEASIBLE;
        if (!feasible) {
            logger.warn("Project {} {} scenario is infeasible: {} of {} BOM items unfulfilled", project.getId(),
                    type.getCode(), assignment.lines().stream().filter(a -> !a.fulfilled()).count(),
                    assignment.lines().size());
        }
        BigDecimal savingsVsBudget = project.hasBudget() ? project.getBudget().subtract(totalCost) : BigDecimal.ZERO;

        return new ScenarioResult(type.getCode(), type.getLabel(), type.getDescription(), type.getTradeoffs(),
                state, totalCost, vendorCount(assignment.lines()), savingsVsBudget, assignment.lines(),
                assignment.caveats(), type == StrategyType.BALANCED ? assignment.basis() : null,
                assignment.score());
    }

    Assignment lowestCost() {
        List<ItemAssignment> lines = new ArrayList<>();
        for (ItemQuotes item : items) {
            Optional<QuoteSelection> best = QuoteComparisonBuilder.selectBest(item.quotes());
            lines.add(best.isPresent() ? assign(item, best.get(), List.of()) : unfulfilled(item, NO_QUOTES));
        }
        return new Assignment(StrategyType.LOWEST_COST.getCode(), lines, List.of(), null);
    }

    Assignment fewestVendors() {
        Map<Long, ItemQuotes> byId = new LinkedHashMap<>();
        items.forEach(item -> byId.put(item.bomItemId(), item));

        // vendor id -> (bom item id -> that vendor's cheapest best-tier quote)
        Map<Long, Map<Long, QuoteComparison>> offers = new TreeMap<>();
        Set<Long> uncovered = new LinkedHashSet<>();
        for (ItemQuotes item : items) {
            if (!item.coverable()) {
                continue;
            }
            uncovered.add(item.bomItemId());
            for (QuoteComparison quote : item.tier()) {
                offers.computeIfAbsent(quote.vendorId(), v -> new HashMap<>())
                        .putIfAbsent(item.bomItemId(), quote);
            }
        }

        Map<Long, QuoteComparison> chosen = new HashMap<>();
        Set<Long> selectedVendors = new HashSet<>();
        while (!uncovered.isEmpty()) {
            Long bestVendor = null;
            int bestCoverage = 0;
            BigDecimal bestCost = null;
            for (Map.Entry<Long, Map<Long, QuoteComparison>> offer : offers.entrySet()) {
                if (selectedVendors.contains(offer.getKey())) {
                    continue;
                }
                int coverage = 0;
                BigDecimal cost = BigDecimal.ZERO;
                for (Long itemId : uncovered) {
                    QuoteComparison quote = offer.getValue().get(itemId);
                    if (quote != null) {
                        coverage++;
                        cost = cost.add(byId.get(itemId).lineCost(quote));
                    }
                }
                if (coverage == 0) {
                    continue;
                }
                if (coverage > bestCoverage || (coverage == bestCoverage && cost.compareTo(bestCost) < 0)) {
                    bestVendor = offer.getKey();
                    bestCoverage = coverage;
                    bestCost = cost;
                }
            }
            if (bestVendor == null) {
                break;
            }
            selectedVendors.add(bestVendor);
            Map<Long, QuoteComparison> vendorOffers = offers.get(bestVendor);
            for (Long itemId : new ArrayList<>(uncovered)) {
                QuoteComparison quote = vendorOffers.get(itemId);
                if (quote != null) {
                    chosen.put(itemId, quote);
                    uncovered.remove(itemId);
                }
            }
        }

        List<ItemAssignment> lines = new ArrayList<>();
        for (ItemQuotes item : items) {
            QuoteComparison quote = chosen.get(item.bomItemId());
            if (quote != null) {
                lines.add(assign(item, tierSelection(item, quote, false), List.of()));
            } else if (!item.hasQuotes()) {
                lines.add(unfulfilled(item, NO_QUOTES));
            } else if (snapshot.allowPartialFulfill()) {
                QuoteSelection best = QuoteComparisonBuilder.selectBest(item.quotes()).orElseThrow();
                lines.add(assign(item, best, List.of(PARTIAL_FULFILL)));
            } else {
                lines.add(notCovered(item));
            }
        }

        List<ItemAssignment> perItem = lowestCost().lines();
        int coverVendors = vendorCount(lines);
        int perItemVendors = vendorCount(perItem);
        if (coverVendors > perItemVendors) {
            logger.debug("Vendor cover for project {} needs {} vendors, per-item picks need {}; using per-item picks",
                    snapshot.project().getId(), coverVendors, perItemVendors);
            return new Assignment(StrategyType.FEWEST_VENDORS.getCode(), perItem,
                    List.of("vendor cover needed " + coverVendors + " vendors; per-item selection needs "
                            + perItemVendors),
                    null);
        }
        return new Assignment(StrategyType.FEWEST_VENDORS.getCode(), lines, List.of(), null);
    }

    Assignment balanced() {
        List<Assignment> candidates = new ArrayList<>();
        Assignment lowest = lowestCost();
        candidates.add(lowest);
        candidates.add(fewestVendors());
        if (snapshot.hasVendorConstraints()) {
            candidates.add(constrained());
        }

        // Infeasible candidates only compete when nothing else is left
        List<Assignment> eligible = candidates.stream()
                .filter(c -> c.lines().stream().allMatch(ItemAssignment::fulfilled))
                .collect(Collectors.toList());
        if (eligible.isEmpty()) {
            eligible = candidates;
        }

        BigDecimal baseCost = totalCost(lowest.lines());
        BigDecimal baseVendors = BigDecimal.valueOf(vendorCount(lowest.lines()));
        EngineSettings settings = snapshot.settings();

        Assignment best = null;
        BigDecimal bestScore = null;
        for (Assignment candidate : eligible) {
            BigDecimal score = normalized(totalCost(candidate.lines()), baseCost)
                    .multiply(settings.balancedCostWeight())
                    .add(normalized(BigDecimal.valueOf(vendorCount(candidate.lines())), baseVendors)
                            .multiply(settings.balancedVendorWeight()));
            if (bestScore == null || score.compareTo(bestScore) < 0) {
                best = candidate;
                bestScore = score;
            }
        }

        List<String> caveats = new ArrayList<>(best.caveats());
        caveats.add("selected " + best.basis() + " assignment");
        return new Assignment(best.basis(), best.lines(), caveats, bestScore);
    }

    Assignment qualityFocused() {
        Comparator<QuoteComparison> order = StrategyType.QUALITY_FOCUSED.quoteOrder(snapshot::qualityScore);
        Predicate<QuoteComparison> meetsRating = meetsMinRating();

        List<ItemAssignment> lines = new ArrayList<>();
        for (ItemQuotes item : items) {
            if (!item.hasQuotes()) {
                lines.add(unfulfilled(item, NO_QUOTES));
                continue;
            }
            Optional<QuoteComparison> pick = item.tier().stream().filter(meetsRating).min(order);
            if (pick.isPresent()) {
                lines.add(assign(item, tierSelection(item, pick.get(), false), List.of()));
            } else {
                QuoteComparison fallback = item.tier().stream().min(order).orElseThrow();
                lines.add(assign(item, tierSelection(item, fallback, true), List.of()));
            }
        }
        return new Assignment(StrategyType.QUALITY_FOCUSED.getCode(), lines, List.of(), null);
    }

    /**
     * Per-item cheapest pick restricted to vendors meeting the minimum rating, then cut
     * down to at most {@code maxVendors} vendors. Lines that cannot honor a constraint
     * keep their unconstrained pick and are flagged.
     */
    Assignment constrained() {
        Predicate<QuoteComparison> meetsRating = meetsMinRating();
        Map<Long, ItemQuotes> byId = new LinkedHashMap<>();
        List<ItemAssignment> lines = new ArrayList<>();
        for (ItemQuotes item : items) {
            byId.put(item.bomItemId(), item);
            if (!item.hasQuotes()) {
                lines.add(unfulfilled(item, NO_QUOTES));
                continue;
            }
            Optional<QuoteComparison> pick = item.cheapestInTier(meetsRating);
            if (pick.isPresent()) {
                lines.add(assign(item, tierSelection(item, pick.get(), false), List.of()));
            } else {
                lines.add(assign(item, tierSelection(item, item.tier().get(0), true), List.of()));
            }
        }

        Integer maxVendors = snapshot.maxVendors();
        if (maxVendors != null && maxVendors > 0 && vendorCount(lines) > maxVendors) {
            Map<Long, BigDecimal> costByVendor = new HashMap<>();
            for (ItemAssignment line : lines) {
                if (line.vendorId() != null) {
                    costByVendor.merge(line.vendorId(), line.lineCost(), BigDecimal::add);
                }
            }
            Set<Long> kept = costByVendor.entrySet().stream()
                    .sorted(Map.Entry.<Long, BigDecimal>comparingByValue().reversed()
                            .thenComparing(Map.Entry.<Long, BigDecimal>comparingByKey()))
                    .limit(maxVendors)
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toSet());

            List<ItemAssignment> reassigned = new ArrayList<>();
            for (ItemAssignment line : lines) {
                if (line.vendorId() == null || kept.contains(line.vendorId())) {
                    reassigned.add(line);
                    continue;
                }
                ItemQuotes item = byId.get(line.bomItemId());
                Optional<QuoteComparison> move = item.cheapestInTier(q -> kept.contains(q.vendorId()));
                if (move.isPresent()) {
                    reassigned.add(assign(item, tierSelection(item, move.get(), false), List.of()));
                } else {
                    reassigned.add(flagUnsatisfiable(line));
                }
            }
            lines = reassigned;
        }
        return new Assignment(BASIS_CONSTRAINED, lines, List.of(), null);
    }

    private Predicate<QuoteComparison> meetsMinRating() {
        Double minRating = snapshot.minVendorRating();
        return q -> minRating == null || snapshot.qualityScore(q.vendorId()) >= minRating;
    }

    private QuoteSelection tierSelection(ItemQuotes item, QuoteComparison quote, boolean constraintRelaxed) {
        List<DegradationReason> reasons = new ArrayList<>(item.tierReasons());
        if (constraintRelaxed) {
            reasons.add(DegradationReason.CONSTRAINT_UNSATISFIABLE);
        }
        return new QuoteSelection(quote, !reasons.isEmpty(), reasons);
    }

    private ItemAssignment assign(ItemQuotes item, QuoteSelection selection, List<String> extraCaveats) {
        List<String> caveats = new ArrayList<>();
        selection.reasons().forEach(r -> caveats.add(r.getCode()));
        caveats.addAll(extraCaveats);
        return new ItemAssignment(item.bomItemId(), item.specificationId(), item.specificationName(),
                item.quantity(), selection.quote(), item.lineCost(selection.quote()), true, selection.degraded(),
                List.copyOf(caveats));
    }

    private ItemAssignment unfulfilled(ItemQuotes item, String caveat) {
        return new ItemAssignment(item.bomItemId(), item.specificationId(), item.specificationName(),
                item.quantity(), null, BigDecimal.ZERO, false, false, List.of(caveat));
    }

    /**
     * An item left outside the vendor cover still costs what its per-item pick would,
     * so the scenario total never drops below lowest_cost.
     */
    private ItemAssignment notCovered(ItemQuotes item) {
        QuoteSelection best = QuoteComparisonBuilder.selectBest(item.quotes()).orElseThrow();
        return new ItemAssignment(item.bomItemId(), item.specificationId(), item.specificationName(),
                item.quantity(), null, item.lineCost(best.quote()), false, false, List.of(NOT_COVERED));
    }

    private ItemAssignment flagUnsatisfiable(ItemAssignment line) {
        String code = DegradationReason.CONSTRAINT_UNSATISFIABLE.getCode();
        if (line.caveats().contains(code)) {
            return line;
        }
        List<String> caveats = new ArrayList<>(line.caveats());
        caveats.add(code);
        return new ItemAssignment(line.bomItemId(), line.specificationId(), line.specificationName(),
                line.quantity(), line.quote(), line.lineCost(), line.fulfilled(), true, List.copyOf(caveats));
    }

    static BigDecimal totalCost(List<ItemAssignment> lines) {
        return lines.stream().map(ItemAssignment::lineCost).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static int vendorCount(List<ItemAssignment> lines) {
        return (int) lines.stream()
                .filter(ItemAssignment::fulfilled)
                .map(ItemAssignment::vendorId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
    }

    private static BigDecimal normalized(BigDecimal value, BigDecimal base) {
        if (base.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return value.divide(base, MathContext.DECIMAL64);
    }

    /** An intermediate assignment; {@code basis} names the strategy or candidate that produced it. */
    record Assignment(String basis, List<ItemAssignment> lines, List<String> caveats, BigDecimal score) {
    }
}
