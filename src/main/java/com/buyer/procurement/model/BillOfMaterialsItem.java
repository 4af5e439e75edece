package com.buyer.procurement.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Entity
@Table(name = "bill_of_materials_items", uniqueConstraints = {
        @UniqueConstraint(columnNames = { "bill_of_materials_id", "specification_id" })
})
@Data
public class BillOfMaterialsItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "bill_of_materials_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private BillOfMaterials billOfMaterials;

    @ManyToOne
    @JoinColumn(name = "specification_id", nullable = false)
    private Specification specification;

    @Column(nullable = false)
    private Integer quantity;

    @Column(length = 1000)
    private String notes;

    @PrePersist
    @PreUpdate
    protected void validateQuantity() {
        if (quantity == null || quantity <= 0) {
            throw new IllegalStateException("BOM item quantity must be positive, got " + quantity);
        }
    }
}
