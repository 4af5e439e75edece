package com.buyer.procurement.model;

import com.buyer.procurement.engine.StrategyType;
import com.buyer.procurement.exception.InvalidStrategyException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * The selection strategy a project is currently evaluated with. At most one per
 * project, created on first access.
 */
@Entity
@Table(name = "project_procurement_strategies")
@Data
public class ProjectProcurementStrategy {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne
    @JoinColumn(name = "project_id", unique = true, nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Project project;

    // lowest_cost, fewest_vendors, balanced, quality_focused
    @Column(nullable = false, length = 30)
    private String strategy;

    private Integer maxVendors;

    // 1-5 scale, null when no threshold applies
    private Double minVendorRating;

    private boolean allowPartialFulfill = true;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        strategy = storedCode();
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        strategy = storedCode();
        updatedAt = LocalDateTime.now();
    }

    // Only canonical codes reach the table
    private String storedCode() {
        try {
            return StrategyType.fromCode(strategy).getCode();
        } catch (InvalidStrategyException e) {
            throw new IllegalStateException("Cannot store procurement strategy '" + strategy + "'", e);
        }
    }
}
