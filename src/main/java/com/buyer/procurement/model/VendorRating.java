package com.buyer.procurement.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

/** Performance scores for a vendor on a 1-5 scale. Any category may be left unrated. */
@Entity
@Table(name = "vendor_ratings")
@Data
public class VendorRating {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "vendor_id", nullable = false)
    private Vendor vendor;

    private Integer priceRating;
    private Integer qualityRating;
    private Integer deliveryRating;
    private Integer serviceRating;

    @Column(length = 1000)
    private String comments;

    private String ratedBy;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
