package com.buyer.procurement.repository;

import com.buyer.procurement.model.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Optional;

public interface SpecificationRepository extends JpaRepository<Specification, Long> {
    Optional<Specification> findByName(String name);
}
