package com.buyer.procurement.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "projects")
@Data
public class Project {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String name;

    @Column(length = 2000)
    private String description;

    // Zero means no budget constraint
    @Column(precision = 19, scale = 4)
    private BigDecimal budget = BigDecimal.ZERO;

    private LocalDate deadline;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProjectStatus status;

    @OneToOne(mappedBy = "project", cascade = CascadeType.ALL)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private BillOfMaterials billOfMaterials;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (status == null) {
            status = ProjectStatus.PLANNING;
        }
        if (budget == null) {
            budget = BigDecimal.ZERO;
        }
        if (budget.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalStateException("Project budget cannot be negative.");
        }
    }

    public boolean hasBudget() {
        return budget != null && budget.compareTo(BigDecimal.ZERO) > 0;
    }
}
