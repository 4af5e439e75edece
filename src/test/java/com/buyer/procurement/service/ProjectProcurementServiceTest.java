package com.buyer.procurement.service;

import com.buyer.procurement.dto.ProcurementComparison;
import com.buyer.procurement.dto.RiskAssessment;
import com.buyer.procurement.dto.RiskFinding;
import com.buyer.procurement.dto.RiskKind;
import com.buyer.procurement.dto.RiskLevel;
import com.buyer.procurement.dto.SavingsReport;
import com.buyer.procurement.dto.ScenarioResult;
import com.buyer.procurement.dto.VendorRecommendation;
import com.buyer.procurement.engine.CurrencyNormalizer;
import com.buyer.procurement.engine.EngineSettings;
import com.buyer.procurement.exception.InvalidStrategyException;
import com.buyer.procurement.exception.NotFoundException;
import com.buyer.procurement.model.BillOfMaterials;
import com.buyer.procurement.model.BillOfMaterialsItem;
import com.buyer.procurement.model.Product;
import com.buyer.procurement.model.Project;
import com.buyer.procurement.model.ProjectProcurementStrategy;
import com.buyer.procurement.model.ProjectStatus;
import com.buyer.procurement.model.Quote;
import com.buyer.procurement.model.Specification;
import com.buyer.procurement.model.Vendor;
import com.buyer.procurement.repository.BillOfMaterialsRepository;
import com.buyer.procurement.repository.ProjectRepository;
import com.buyer.procurement.repository.QuoteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProjectProcurementServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);

    @Mock
    private ProjectRepository projectRepository;
    @Mock
    private BillOfMaterialsRepository billOfMaterialsRepository;
    @Mock
    private QuoteRepository quoteRepository;
    @Mock
    private ForexService forexService;
    @Mock
    private VendorRatingService vendorRatingService;
    @Mock
    private ProcurementStrategyService strategyService;
    @Mock
    private SettingsService settingsService;

    private ProjectProcurementService service;

    private Project project;
    private ProjectProcurementStrategy strategy;
    private Vendor northwind;
    private Vendor fabrikam;
    private Specification laptop;
    private Specification chair;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new ProjectProcurementService(projectRepository, billOfMaterialsRepository, quoteRepository,
                forexService, vendorRatingService, strategyService, settingsService, Runnable::run, clock);

        project = new Project();
        project.setId(1L);
        project.setName("Office Refresh");
        project.setBudget(new BigDecimal("1000"));
        project.setStatus(ProjectStatus.ACTIVE);

        strategy = new ProjectProcurementStrategy();
        strategy.setId(2L);
        strategy.setProject(project);
        strategy.setStrategy("balanced");

        northwind = vendor(3L, "Northwind");
        fabrikam = vendor(4L, "Fabrikam");
        laptop = specification(5L, "Laptop");
        chair = specification(6L, "Chair");
    }

    /** Laptop x2 only from Northwind at 300; chair from Fabrikam at 500 or Northwind at 550. */
    private void stubOverBudgetProject() {
        Product laptopProduct = product(7L, laptop);
        Product chairProduct = product(8L, chair);

        BillOfMaterials bom = new BillOfMaterials();
        bom.setId(9L);
        bom.setProject(project);
        bom.addItem(item(10L, laptop, 2));
        bom.addItem(item(11L, chair, 1));

        when(projectRepository.findById(1L)).thenReturn(Optional.of(project));
        when(billOfMaterialsRepository.findByProjectId(1L)).thenReturn(Optional.of(bom));
        when(strategyService.getOrCreate(project)).thenReturn(strategy);
        when(settingsService.getEngineSettings()).thenReturn(EngineSettings.defaults());
        when(quoteRepository.findByProductSpecificationIdOrderByIdAsc(5L))
                .thenReturn(List.of(quote(20L, northwind, laptopProduct, "300")));
        when(quoteRepository.findByProductSpecificationIdOrderByIdAsc(6L))
                .thenReturn(List.of(quote(21L, fabrikam, chairProduct, "500"),
                        quote(22L, northwind, chairProduct, "550")));
        when(vendorRatingService.summarize(anyCollection())).thenReturn(Map.of());
        when(forexService.loadNormalizer(TODAY, "USD")).thenReturn(new CurrencyNormalizer(List.of(), "USD"));
    }

    @Test
    void compareScenarios_ShouldReturnEveryStrategyInFixedOrder() {
        stubOverBudgetProject();

        List<ScenarioResult> scenarios = service.compareScenarios(1L);

        assertEquals(List.of("lowest_cost", "fewest_vendors", "balanced", "quality_focused"),
                scenarios.stream().map(ScenarioResult::name).collect(Collectors.toList()));
        assertEquals(0, new BigDecimal("1100").compareTo(scenarios.get(0).totalCost()));
        assertEquals(0, new BigDecimal("-100").compareTo(scenarios.get(0).savingsVsBudget()));
        assertEquals(1, scenarios.get(1).vendorCount());
    }

    @Test
    void compareScenarios_UnknownProject_ShouldThrowNotFound() {
        when(projectRepository.findById(1L)).thenReturn(Optional.empty());

        NotFoundException ex = assertThrows(NotFoundException.class, () -> service.compareScenarios(1L));

        assertEquals("Project", ex.getEntity());
        verifyNoInteractions(quoteRepository, strategyService);
    }

    @Test
    void compareScenarios_ProjectWithoutBom_ShouldThrowNotFound() {
        when(projectRepository.findById(1L)).thenReturn(Optional.of(project));
        when(billOfMaterialsRepository.findByProjectId(1L)).thenReturn(Optional.empty());

        NotFoundException ex = assertThrows(NotFoundException.class, () -> service.compareScenarios(1L));

        assertTrue(ex.getMessage().startsWith("Bill of materials"));
    }

    @Test
    void generateVendorRecommendations_UnknownStrategy_ShouldFailBeforeLoading() {
        assertThrows(InvalidStrategyException.class,
                () -> service.generateVendorRecommendations(1L, "cheapest"));

        verifyNoInteractions(projectRepository, billOfMaterialsRepository, quoteRepository);
    }

    @Test
    void generateVendorRecommendations_NoStrategyGiven_ShouldUseProjectStrategy() {
        strategy.setStrategy("fewest_vendors");
        stubOverBudgetProject();

        List<VendorRecommendation> recommendations = service.generateVendorRecommendations(1L, " ");

        assertEquals(1, recommendations.size());
        assertEquals(northwind.getId(), recommendations.get(0).vendorId());
        assertEquals("consolidates 2 items to reduce vendor count", recommendations.get(0).rationale());
    }

    @Test
    void generateVendorRecommendations_NamedStrategy_ShouldOverrideProjectStrategy() {
        stubOverBudgetProject();

        List<VendorRecommendation> recommendations = service.generateVendorRecommendations(1L, "LOWEST_COST");

        assertEquals(2, recommendations.size());
        assertEquals(northwind.getId(), recommendations.get(0).vendorId());
        assertEquals(1, recommendations.get(0).priority());
    }

    @Test
    void assessEnhancedProjectRisks_ShouldReportBudgetOverrunForLowestCost() {
        strategy.setStrategy("lowest_cost");
        stubOverBudgetProject();

        RiskAssessment assessment = service.assessEnhancedProjectRisks(1L);

        List<RiskFinding> risks = assessment.findings();
        assertEquals("lowest_cost", assessment.strategy());
        assertTrue(risks.stream().anyMatch(r -> r.kind() == RiskKind.BUDGET_OVERRUN));
        assertTrue(risks.stream().anyMatch(r -> r.kind() == RiskKind.SINGLE_SOURCE
                && northwind.getId().equals(r.vendorId())));
        // 1100 against 1000 is exactly 10% over
        assertEquals(RiskLevel.MEDIUM, assessment.categories().get("budget").level());
        assertEquals(RiskLevel.MEDIUM, assessment.categories().get("quality").level());
        assertEquals(26, assessment.riskScore());
        assertEquals(RiskLevel.MEDIUM, assessment.riskLevel());
        assertTrue(assessment.highPriorityActions().isEmpty());
    }

    @Test
    void calculateProjectSavings_ShouldEstimateConsolidationAgainstCurrentStrategy() {
        stubOverBudgetProject();

        SavingsReport report = service.calculateProjectSavings(1L);

        assertEquals(0, new BigDecimal("1100").compareTo(report.bestTotal()));
        assertEquals(0, BigDecimal.ZERO.compareTo(report.savings()));
        assertEquals(List.of("Northwind", "Fabrikam"), List.copyOf(report.savingsByVendor().keySet()));
        assertEquals(List.of("Laptop", "Chair"), List.copyOf(report.savingsByCategory().keySet()));
        // balanced settles on Northwind alone, two vendors could supply the BOM
        assertEquals(0, new BigDecimal("250").compareTo(report.consolidationSavings()));
    }

    @Test
    void getProjectProcurementComparison_ShouldSummarizeAllScenarios() {
        stubOverBudgetProject();

        ProcurementComparison comparison = service.getProjectProcurementComparison(1L);

        assertEquals(2, comparison.totalBomItems());
        assertEquals(2, comparison.coveredItems());
        assertEquals(4, comparison.scenarios().size());
        assertEquals("balanced", comparison.strategy().strategy());
        assertEquals(0, new BigDecimal("1100").compareTo(comparison.bestCaseCost()));
        assertEquals(0, new BigDecimal("1150").compareTo(comparison.recommendedCost()));
        assertEquals(0, new BigDecimal("1150").compareTo(comparison.worstCaseCost()));
        assertEquals(2, comparison.consolidation().vendors().size());
    }

    private static Vendor vendor(Long id, String name) {
        Vendor vendor = new Vendor();
        vendor.setId(id);
        vendor.setName(name);
        vendor.setCurrency("USD");
        return vendor;
    }

    private static Specification specification(Long id, String name) {
        Specification specification = new Specification();
        specification.setId(id);
        specification.setName(name);
        return specification;
    }

    private static Product product(Long id, Specification specification) {
        Product product = new Product();
        product.setId(id);
        product.setName(specification.getName() + " model");
        product.setSpecification(specification);
        return product;
    }

    private static BillOfMaterialsItem item(Long id, Specification specification, int quantity) {
        BillOfMaterialsItem item = new BillOfMaterialsItem();
        item.setId(id);
        item.setSpecification(specification);
        item.setQuantity(quantity);
        return item;
    }

    private static Quote quote(Long id, Vendor vendor, Product product, String price) {
        Quote quote = new Quote();
        quote.setId(id);
        quote.setVendor(vendor);
        quote.setProduct(product);
        quote.setPrice(new BigDecimal(price));
        quote.setQuoteDate(TODAY.minusDays(7));
        return quote;
    }
}
