package com.buyer.procurement.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * An attribute a product must (or may) declare to satisfy a specification,
 * e.g. "RAM" in GB with a minimum of 8. Bounds only apply to NUMBER attributes;
 * a null bound means that side is unbounded.
 */
@Entity
@Table(name = "specification_attributes")
@Data
public class SpecificationAttribute {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "specification_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Specification specification;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AttributeDataType dataType = AttributeDataType.TEXT;

    @Column(length = 50)
    private String unit;

    private boolean required;

    private Double minValue;

    private Double maxValue;

    @Column(length = 1000)
    private String description;

    @PrePersist
    @PreUpdate
    protected void validateBounds() {
        if (minValue != null && maxValue != null && minValue > maxValue) {
            throw new IllegalStateException("Attribute " + name + " has min value " + minValue
                    + " greater than max value " + maxValue);
        }
    }
}
