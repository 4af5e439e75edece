package com.buyer.procurement.repository;

import com.buyer.procurement.exception.InvalidStrategyException;
import com.buyer.procurement.model.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.core.NestedExceptionUtils;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class ProjectProcurementStrategyRepositoryTest {

    @Autowired
    private ProjectProcurementStrategyRepository strategyRepository;
    @Autowired
    private ProjectRepository projectRepository;
    @Autowired
    private BillOfMaterialsRepository billOfMaterialsRepository;
    @Autowired
    private AppSettingRepository appSettingRepository;

    @Test
    void findByProjectId_ShouldReturnStoredStrategy() {
        Project project = project("Office Refresh");
        ProjectProcurementStrategy strategy = new ProjectProcurementStrategy();
        strategy.setProject(project);
        strategy.setStrategy("fewest_vendors");
        strategy.setMaxVendors(2);
        strategyRepository.save(strategy);

        Optional<ProjectProcurementStrategy> found = strategyRepository.findByProjectId(project.getId());

        assertTrue(found.isPresent());
        assertEquals("fewest_vendors", found.get().getStrategy());
        assertEquals(Integer.valueOf(2), found.get().getMaxVendors());
        assertTrue(strategyRepository.findByProjectId(project.getId() + 1).isEmpty());
    }

    @Test
    void save_ShouldStoreCanonicalStrategyCode() {
        Project project = project("Warehouse");
        ProjectProcurementStrategy strategy = new ProjectProcurementStrategy();
        strategy.setProject(project);
        strategy.setStrategy(" Quality_Focused ");

        strategyRepository.save(strategy);

        assertEquals("quality_focused", strategy.getStrategy());
    }

    @Test
    void save_UnknownStrategy_ShouldBeRejected() {
        Project project = project("Depot");
        ProjectProcurementStrategy strategy = new ProjectProcurementStrategy();
        strategy.setProject(project);
        strategy.setStrategy("cheapest");

        RuntimeException ex = assertThrows(RuntimeException.class, () -> strategyRepository.save(strategy));

        assertInstanceOf(InvalidStrategyException.class, NestedExceptionUtils.getMostSpecificCause(ex));
    }

    @Test
    void findBomByProjectId_ShouldReturnItsBill() {
        Project project = project("Lab Fit-out");
        BillOfMaterials bom = new BillOfMaterials();
        bom.setProject(project);
        bom.setNotes("phase 1");
        billOfMaterialsRepository.save(bom);

        Optional<BillOfMaterials> found = billOfMaterialsRepository.findByProjectId(project.getId());

        assertTrue(found.isPresent());
        assertEquals("phase 1", found.get().getNotes());
    }

    @Test
    void findBySettingKey_ShouldMatchExactKey() {
        appSettingRepository.save(new AppSetting("reference_currency", "EUR"));

        assertEquals("EUR", appSettingRepository.findBySettingKey("reference_currency")
                .map(AppSetting::getSettingValue).orElse(null));
        assertTrue(appSettingRepository.findBySettingKey("stale_quote_days").isEmpty());
    }

    private Project project(String name) {
        Project project = new Project();
        project.setName(name);
        project.setBudget(new BigDecimal("20000"));
        project.setStatus(ProjectStatus.ACTIVE);
        return projectRepository.save(project);
    }
}
