package com.buyer.procurement.repository;

import com.buyer.procurement.model.ProjectProcurementStrategy;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Optional;

public interface ProjectProcurementStrategyRepository extends JpaRepository<ProjectProcurementStrategy, Long> {
    Optional<ProjectProcurementStrategy> findByProjectId(Long projectId);
}
