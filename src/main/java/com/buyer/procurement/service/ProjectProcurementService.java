package com.buyer.procurement.service;

import com.buyer.procurement.dto.ConsolidationReport;
import com.buyer.procurement.dto.ProcurementComparison;
import com.buyer.procurement.dto.RiskAssessment;
import com.buyer.procurement.dto.SavingsReport;
import com.buyer.procurement.dto.ScenarioResult;
import com.buyer.procurement.dto.StrategySettings;
import com.buyer.procurement.dto.VendorRatingSummary;
import com.buyer.procurement.dto.VendorRecommendation;
import com.buyer.procurement.engine.CurrencyNormalizer;
import com.buyer.procurement.engine.EngineSettings;
import com.buyer.procurement.engine.ProcurementReporter;
import com.buyer.procurement.engine.ProcurementSnapshot;
import com.buyer.procurement.engine.ProcurementSnapshot.BomLine;
import com.buyer.procurement.engine.ScenarioEvaluator;
import com.buyer.procurement.engine.StrategyType;
import com.buyer.procurement.exception.NotFoundException;
import com.buyer.procurement.model.BillOfMaterials;
import com.buyer.procurement.model.BillOfMaterialsItem;
import com.buyer.procurement.model.Project;
import com.buyer.procurement.model.ProjectProcurementStrategy;
import com.buyer.procurement.model.Quote;
import com.buyer.procurement.repository.BillOfMaterialsRepository;
import com.buyer.procurement.repository.ProjectRepository;
import com.buyer.procurement.repository.QuoteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Entry point for project-level procurement analysis. Each call loads a fresh
 * snapshot of the BOM, its quotes, forex rates and vendor ratings, then runs the
 * engine over it in memory.
 */
@Service
@Transactional
public class ProjectProcurementService {

    private static final Logger logger = LoggerFactory.getLogger(ProjectProcurementService.class);

    private final ProjectRepository projectRepository;
    private final BillOfMaterialsRepository billOfMaterialsRepository;
    private final QuoteRepository quoteRepository;
    private final ForexService forexService;
    private final VendorRatingService vendorRatingService;
    private final ProcurementStrategyService strategyService;
    private final SettingsService settingsService;
    private final Executor scenarioExecutor;
    private final Clock clock;

    public ProjectProcurementService(ProjectRepository projectRepository,
            BillOfMaterialsRepository billOfMaterialsRepository, QuoteRepository quoteRepository,
            ForexService forexService, VendorRatingService vendorRatingService,
            ProcurementStrategyService strategyService, SettingsService settingsService,
            @Qualifier("scenarioExecutor") Executor scenarioExecutor, Clock clock) {
        this.projectRepository = projectRepository;
        this.billOfMaterialsRepository = billOfMaterialsRepository;
        this.quoteRepository = quoteRepository;
        this.forexService = forexService;
        this.vendorRatingService = vendorRatingService;
        this.strategyService = strategyService;
        this.settingsService = settingsService;
        this.scenarioExecutor = scenarioExecutor;
        this.clock = clock;
    }

    /** All four scenarios, always in the order lowest_cost, fewest_vendors, balanced, quality_focused. */
    public List<ScenarioResult> compareScenarios(Long projectId) {
        ScenarioEvaluator evaluator = new ScenarioEvaluator(loadSnapshot(projectId));
        return evaluateAll(evaluator);
    }

    /**
     * Recommendations for the named strategy, or for the project's current one when
     * {@code strategyName} is null or blank.
     */
    public List<VendorRecommendation> generateVendorRecommendations(Long projectId, String strategyName) {
        StrategyType requested = strategyName != null && !strategyName.isBlank()
                ? StrategyType.fromCode(strategyName)
                : null;
        ProcurementSnapshot snapshot = loadSnapshot(projectId);
        StrategyType type = requested != null ? requested : snapshot.currentStrategy();

        ScenarioEvaluator evaluator = new ScenarioEvaluator(snapshot);
        ScenarioResult scenario = evaluator.evaluate(type);
        List<VendorRecommendation> recommendations = new ProcurementReporter(evaluator)
                .recommendations(scenario, type);
        logger.info("Project {}: {} vendor recommendation(s) for {}", projectId, recommendations.size(),
                type.getCode());
        return recommendations;
    }

    /** Risk findings and the weighted assessment for the project's current strategy assignment. */
    public RiskAssessment assessEnhancedProjectRisks(Long projectId) {
        ProcurementSnapshot snapshot = loadSnapshot(projectId);
        ScenarioEvaluator evaluator = new ScenarioEvaluator(snapshot);
        ScenarioResult scenario = evaluator.evaluate(snapshot.currentStrategy());
        RiskAssessment assessment = new ProcurementReporter(evaluator).riskAssessment(scenario);
        logger.info("Project {}: {} risk finding(s) under {}, score {} ({})", projectId,
                assessment.findings().size(), scenario.name(), assessment.riskScore(),
                assessment.riskLevel().getCode());
        return assessment;
    }

    /** Savings of the lowest-cost picks; consolidation is estimated against the current strategy. */
    public SavingsReport calculateProjectSavings(Long projectId) {
        ProcurementSnapshot snapshot = loadSnapshot(projectId);
        ScenarioEvaluator evaluator = new ScenarioEvaluator(snapshot);
        ScenarioResult lowest = evaluator.evaluate(StrategyType.LOWEST_COST);
        StrategyType current = snapshot.currentStrategy();
        ScenarioResult recommended = current == StrategyType.LOWEST_COST ? lowest : evaluator.evaluate(current);
        return new ProcurementReporter(evaluator).savings(lowest, recommended);
    }

    public ConsolidationReport getVendorConsolidationAnalysis(Long projectId) {
        ScenarioEvaluator evaluator = new ScenarioEvaluator(loadSnapshot(projectId));
        return new ProcurementReporter(evaluator).consolidation(evaluator.evaluate(StrategyType.FEWEST_VENDORS));
    }

    public ProcurementComparison getProjectProcurementComparison(Long projectId) {
        ProcurementSnapshot snapshot = loadSnapshot(projectId);
        ScenarioEvaluator evaluator = new ScenarioEvaluator(snapshot);
        List<ScenarioResult> scenarios = evaluateAll(evaluator);
        ProcurementComparison comparison = new ProcurementReporter(evaluator)
                .comparison(scenarios, snapshot.currentStrategy(), StrategySettings.of(snapshot.strategy()));
        logger.info("Project {}: analysis generated for {} BOM item(s), overall risk {}", projectId,
                comparison.totalBomItems(), comparison.overallRisk().getCode());
        return comparison;
    }

    /**
     * Loads everything one engine run needs. Lazy associations are resolved here, on
     * the request thread, when the evaluator builds its comparison rows.
     */
    ProcurementSnapshot loadSnapshot(Long projectId) {
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> new NotFoundException("Project", projectId));
        BillOfMaterials bom = billOfMaterialsRepository.findByProjectId(projectId)
                .orElseThrow(() -> new NotFoundException("Bill of materials for project", projectId));
        ProjectProcurementStrategy strategy = strategyService.getOrCreate(project);
        EngineSettings settings = settingsService.getEngineSettings();
        LocalDate today = LocalDate.now(clock);

        List<BomLine> lines = new ArrayList<>();
        Set<Long> vendorIds = new LinkedHashSet<>();
        for (BillOfMaterialsItem item : bom.getItems()) {
            List<Quote> quotes = quoteRepository.findByProductSpecificationIdOrderByIdAsc(
                    item.getSpecification().getId());
            quotes.forEach(q -> vendorIds.add(q.getVendor().getId()));
            lines.add(new BomLine(item, quotes));
        }
        Map<Long, VendorRatingSummary> ratings = vendorRatingService.summarize(vendorIds);
        CurrencyNormalizer normalizer = forexService.loadNormalizer(today, settings.referenceCurrency());

        logger.debug("Project {}: snapshot with {} BOM item(s), {} vendor(s), as of {}", projectId, lines.size(),
                vendorIds.size(), today);
        return new ProcurementSnapshot(project, lines, normalizer, ratings, strategy, today, settings);
    }

    private List<ScenarioResult> evaluateAll(ScenarioEvaluator evaluator) {
        List<CompletableFuture<ScenarioResult>> futures = Arrays.stream(StrategyType.values())
                .map(type -> CompletableFuture.supplyAsync(() -> evaluator.evaluate(type), scenarioExecutor))
                .collect(Collectors.toList());
        // Joined in strategy order, not completion order
        return futures.stream()
                .map(ProjectProcurementService::join)
                .collect(Collectors.toList());
    }

    private static ScenarioResult join(CompletableFuture<ScenarioResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
