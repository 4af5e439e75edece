package com.buyer.procurement.repository;

import com.buyer.procurement.model.BillOfMaterials;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Optional;

public interface BillOfMaterialsRepository extends JpaRepository<BillOfMaterials, Long> {
    Optional<BillOfMaterials> findByProjectId(Long projectId);
}
