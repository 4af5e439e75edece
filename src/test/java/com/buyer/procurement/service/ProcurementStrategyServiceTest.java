package com.buyer.procurement.service;

import com.buyer.procurement.dto.StrategySettings;
import com.buyer.procurement.exception.InvalidStrategyException;
import com.buyer.procurement.exception.NotFoundException;
import com.buyer.procurement.model.Project;
import com.buyer.procurement.model.ProjectProcurementStrategy;
import com.buyer.procurement.repository.ProjectProcurementStrategyRepository;
import com.buyer.procurement.repository.ProjectRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProcurementStrategyServiceTest {

    @Mock
    private ProjectProcurementStrategyRepository strategyRepository;
    @Mock
    private ProjectRepository projectRepository;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private ProcurementStrategyService strategyService;

    private Project project;

    @BeforeEach
    void setUp() {
        project = new Project();
        project.setId(1L);
        project.setName("Office Refresh");
    }

    @Test
    void getOrCreate_NoStoredStrategy_ShouldCreateBalancedDefault() {
        when(projectRepository.findById(1L)).thenReturn(Optional.of(project));
        when(strategyRepository.findByProjectId(1L)).thenReturn(Optional.empty());
        when(strategyRepository.save(any(ProjectProcurementStrategy.class))).thenAnswer(i -> i.getArguments()[0]);

        ProjectProcurementStrategy strategy = strategyService.getOrCreate(1L);

        assertEquals("balanced", strategy.getStrategy());
        assertTrue(strategy.isAllowPartialFulfill());
        assertSame(project, strategy.getProject());
        verify(strategyRepository).save(strategy);
    }

    @Test
    void getOrCreate_StoredStrategy_ShouldNotSave() {
        ProjectProcurementStrategy stored = strategyFor("fewest_vendors");
        when(strategyRepository.findByProjectId(1L)).thenReturn(Optional.of(stored));

        assertSame(stored, strategyService.getOrCreate(project));
        verify(strategyRepository, never()).save(any());
    }

    @Test
    void getStrategy_UnknownProject_ShouldThrowNotFound() {
        when(projectRepository.findById(99L)).thenReturn(Optional.empty());

        NotFoundException ex = assertThrows(NotFoundException.class, () -> strategyService.getStrategy(99L));
        assertEquals("Project", ex.getEntity());
    }

    @Test
    void setStrategy_ShouldNormalizeSaveAndAudit() {
        ProjectProcurementStrategy stored = strategyFor("lowest_cost");
        when(projectRepository.findById(1L)).thenReturn(Optional.of(project));
        when(strategyRepository.findByProjectId(1L)).thenReturn(Optional.of(stored));
        when(strategyRepository.save(stored)).thenReturn(stored);

        StrategySettings settings = strategyService.setStrategy(1L, " Quality_Focused ");

        assertEquals("quality_focused", settings.strategy());
        assertEquals(Long.valueOf(1L), settings.projectId());
        verify(auditService).log("SET_STRATEGY", "Project: 1, Old: lowest_cost, New: quality_focused");
    }

    @Test
    void setStrategy_InvalidName_ShouldFailBeforeTouchingStore() {
        assertThrows(InvalidStrategyException.class, () -> strategyService.setStrategy(1L, "cheapest"));

        verifyNoInteractions(projectRepository, strategyRepository, auditService);
    }

    private ProjectProcurementStrategy strategyFor(String name) {
        ProjectProcurementStrategy strategy = new ProjectProcurementStrategy();
        strategy.setId(5L);
        strategy.setProject(project);
        strategy.setStrategy(name);
        return strategy;
    }
}
