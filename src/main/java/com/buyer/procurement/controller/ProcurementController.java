package com.buyer.procurement.controller;

import com.buyer.procurement.dto.ConsolidationReport;
import com.buyer.procurement.dto.ProcurementComparison;
import com.buyer.procurement.dto.RiskAssessment;
import com.buyer.procurement.dto.SavingsReport;
import com.buyer.procurement.dto.ScenarioResult;
import com.buyer.procurement.dto.StrategySettings;
import com.buyer.procurement.dto.StrategyUpdateRequest;
import com.buyer.procurement.dto.VendorRecommendation;
import com.buyer.procurement.service.ProcurementStrategyService;
import com.buyer.procurement.service.ProjectProcurementService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectId}/procurement")
public class ProcurementController {

    private final ProjectProcurementService procurementService;
    private final ProcurementStrategyService strategyService;

    public ProcurementController(ProjectProcurementService procurementService,
            ProcurementStrategyService strategyService) {
        this.procurementService = procurementService;
        this.strategyService = strategyService;
    }

    @GetMapping("/analysis")
    public ProcurementComparison analysis(@PathVariable Long projectId) {
        return procurementService.getProjectProcurementComparison(projectId);
    }

    @GetMapping("/scenarios")
    public List<ScenarioResult> scenarios(@PathVariable Long projectId) {
        return procurementService.compareScenarios(projectId);
    }

    @GetMapping("/recommendations")
    public List<VendorRecommendation> recommendations(@PathVariable Long projectId,
            @RequestParam(required = false) String strategy) {
        return procurementService.generateVendorRecommendations(projectId, strategy);
    }

    @GetMapping("/risks")
    public RiskAssessment risks(@PathVariable Long projectId) {
        return procurementService.assessEnhancedProjectRisks(projectId);
    }

    @GetMapping("/savings")
    public SavingsReport savings(@PathVariable Long projectId) {
        return procurementService.calculateProjectSavings(projectId);
    }

    @GetMapping("/consolidation")
    public ConsolidationReport consolidation(@PathVariable Long projectId) {
        return procurementService.getVendorConsolidationAnalysis(projectId);
    }

    @GetMapping("/strategy")
    public StrategySettings strategy(@PathVariable Long projectId) {
        return strategyService.getStrategy(projectId);
    }

    @PostMapping("/strategy")
    public StrategySettings updateStrategy(@PathVariable Long projectId, @RequestBody StrategyUpdateRequest request) {
        return strategyService.setStrategy(projectId, request.getStrategy());
    }
}
