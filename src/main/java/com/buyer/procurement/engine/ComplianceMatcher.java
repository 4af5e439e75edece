package com.buyer.procurement.engine;

import com.buyer.procurement.dto.ComplianceResult;
import com.buyer.procurement.dto.ExtraAttribute;
import com.buyer.procurement.model.AttributeDataType;
import com.buyer.procurement.model.Product;
import com.buyer.procurement.model.ProductAttribute;
import com.buyer.procurement.model.Specification;
import com.buyer.procurement.model.SpecificationAttribute;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a product's attribute values against a specification's declared attributes.
 */
public class ComplianceMatcher {

    public ComplianceResult evaluate(Specification specification, Product product) {
        Map<Long, ProductAttribute> offered = new HashMap<>();
        for (ProductAttribute attribute : product.getAttributes()) {
            if (attribute.getSpecificationAttribute() != null) {
                offered.putIfAbsent(attribute.getSpecificationAttribute().getId(), attribute);
            }
        }

        Map<Long, Boolean> perAttribute = new LinkedHashMap<>();
        boolean overallCompliant = true;
        List<SpecificationAttribute> declared = specification != null
                ? specification.getAttributes()
                : List.of();
        for (SpecificationAttribute attribute : declared) {
            ProductAttribute value = offered.get(attribute.getId());
            boolean compliant = attributeCompliant(attribute, value);
            perAttribute.put(attribute.getId(), compliant);
            if (attribute.isRequired() && !compliant) {
                overallCompliant = false;
            }
        }

        Set<Long> requiredIds = declared.stream()
                .filter(SpecificationAttribute::isRequired)
                .map(SpecificationAttribute::getId)
                .collect(Collectors.toSet());
        List<ExtraAttribute> extras = new ArrayList<>();
        for (ProductAttribute attribute : product.getAttributes()) {
            SpecificationAttribute definition = attribute.getSpecificationAttribute();
            if (definition == null || requiredIds.contains(definition.getId())) {
                continue;
            }
            extras.add(new ExtraAttribute(definition.getId(), definition.getName(), attribute.displayValue(),
                    definition.getUnit()));
        }

        return new ComplianceResult(perAttribute, overallCompliant, extras);
    }

    boolean attributeCompliant(SpecificationAttribute attribute, ProductAttribute value) {
        if (value == null) {
            // Nothing offered: only a problem when the attribute is required
            return !attribute.isRequired();
        }
        AttributeDataType declaredType = attribute.getDataType() != null ? attribute.getDataType()
                : AttributeDataType.TEXT;
        if (value.populatedType().filter(declaredType::equals).isEmpty()) {
            return false;
        }
        switch (declaredType) {
            case NUMBER:
                double number = value.getValueNumber();
                if (attribute.getMinValue() != null && number < attribute.getMinValue()) {
                    return false;
                }
                return attribute.getMaxValue() == null || number <= attribute.getMaxValue();
            case TEXT:
                return !value.getValueText().isBlank();
            default:
                return true;
        }
    }
}
