package com.buyer.procurement.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Optional;

@Entity
@Table(name = "product_attributes")
@Data
public class ProductAttribute {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "product_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Product product;

    @ManyToOne
    @JoinColumn(name = "specification_attribute_id", nullable = false)
    private SpecificationAttribute specificationAttribute;

    // Exactly one of these is expected to be populated
    private Double valueNumber;

    @Column(length = 500)
    private String valueText;

    private Boolean valueBoolean;

    /**
     * The type of the single populated value slot, or empty when no slot or
     * more than one slot is populated.
     */
    public Optional<AttributeDataType> populatedType() {
        int populated = 0;
        AttributeDataType type = null;
        if (valueNumber != null) {
            populated++;
            type = AttributeDataType.NUMBER;
        }
        if (valueText != null) {
            populated++;
            type = AttributeDataType.TEXT;
        }
        if (valueBoolean != null) {
            populated++;
            type = AttributeDataType.BOOLEAN;
        }
        return populated == 1 ? Optional.of(type) : Optional.empty();
    }

    public String displayValue() {
        if (valueNumber != null) {
            return valueNumber.toString();
        }
        if (valueBoolean != null) {
            return valueBoolean.toString();
        }
        return valueText;
    }
}
