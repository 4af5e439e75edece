package com.buyer.procurement.repository;

import com.buyer.procurement.model.VendorRating;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface VendorRatingRepository extends JpaRepository<VendorRating, Long> {
    List<VendorRating> findByVendorId(Long vendorId);
}
