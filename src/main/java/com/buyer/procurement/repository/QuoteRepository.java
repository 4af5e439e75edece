package com.buyer.procurement.repository;

import com.buyer.procurement.model.Quote;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface QuoteRepository extends JpaRepository<Quote, Long> {
    // Store order (id ascending) matters: the naive savings baseline takes the first quote per item
    List<Quote> findByProductSpecificationIdOrderByIdAsc(Long specificationId);

    List<Quote> findByProductIdOrderByIdAsc(Long productId);
}
