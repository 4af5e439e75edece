package com.buyer.procurement.service;

import com.buyer.procurement.dto.StrategySettings;
import com.buyer.procurement.engine.StrategyType;
import com.buyer.procurement.exception.NotFoundException;
import com.buyer.procurement.model.Project;
import com.buyer.procurement.model.ProjectProcurementStrategy;
import com.buyer.procurement.repository.ProjectProcurementStrategyRepository;
import com.buyer.procurement.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the per-project "current strategy" marker: the only thing procurement
 * analysis ever writes.
 */
@Service
public class ProcurementStrategyService {

    private static final Logger logger = LoggerFactory.getLogger(ProcurementStrategyService.class);

    private final ProjectProcurementStrategyRepository strategyRepository;
    private final ProjectRepository projectRepository;
    private final AuditService auditService;

    public ProcurementStrategyService(ProjectProcurementStrategyRepository strategyRepository,
            ProjectRepository projectRepository, AuditService auditService) {
        this.strategyRepository = strategyRepository;
        this.projectRepository = projectRepository;
        this.auditService = auditService;
    }

    @Transactional
    public ProjectProcurementStrategy getOrCreate(Long projectId) {
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> new NotFoundException("Project", projectId));
        return getOrCreate(project);
    }

    @Transactional
    public ProjectProcurementStrategy getOrCreate(Project project) {
        return strategyRepository.findByProjectId(project.getId())
                .orElseGet(() -> {
                    ProjectProcurementStrategy strategy = new ProjectProcurementStrategy();
                    strategy.setProject(project);
                    strategy.setStrategy(StrategyType.DEFAULT.getCode());
                    strategy.setAllowPartialFulfill(true);
                    logger.info("Created default {} strategy for project {}", strategy.getStrategy(), project.getId());
                    return strategyRepository.save(strategy);
                });
    }

    @Transactional
    public StrategySettings getStrategy(Long projectId) {
        return StrategySettings.of(getOrCreate(projectId));
    }

    /**
     * Replaces the project's strategy name. Unknown names are rejected before the
     * project is looked up.
     */
    @Transactional
    public StrategySettings setStrategy(Long projectId, String strategyName) {
        StrategyType type = StrategyType.fromCode(strategyName);
        ProjectProcurementStrategy strategy = getOrCreate(projectId);
        String previous = strategy.getStrategy();
        strategy.setStrategy(type.getCode());
        ProjectProcurementStrategy saved = strategyRepository.save(strategy);

        auditService.log("SET_STRATEGY", "Project: " + projectId + ", Old: " + previous + ", New: " + type.getCode());
        logger.info("Project {} strategy changed from {} to {}", projectId, previous, type.getCode());
        return StrategySettings.of(saved);
    }
}
