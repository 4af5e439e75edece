package com.buyer.procurement.engine;

import com.buyer.procurement.dto.VendorRatingSummary;
import com.buyer.procurement.engine.ProcurementSnapshot.BomLine;
import com.buyer.procurement.model.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Builds detached entities with explicit ids for engine tests. */
class EngineFixtures {

    static final LocalDate TODAY = LocalDate.of(2026, 3, 2);

    private long nextId = 1;

    private final List<Forex> rates = new ArrayList<>();
    private final Map<Long, VendorRatingSummary> ratings = new HashMap<>();
    private final List<BomLine> lines = new ArrayList<>();

    Vendor vendor(String name, String currency) {
        Vendor v = new Vendor();
        v.setId(nextId++);
        v.setName(name);
        v.setCurrency(currency);
        return v;
    }

    SpecificationAttribute numberAttribute(String name, boolean required, Double min, Double max) {
        SpecificationAttribute a = new SpecificationAttribute();
        a.setId(nextId++);
        a.setName(name);
        a.setDataType(AttributeDataType.NUMBER);
        a.setRequired(required);
        a.setMinValue(min);
        a.setMaxValue(max);
        return a;
    }

    SpecificationAttribute attribute(String name, AttributeDataType type, boolean required) {
        SpecificationAttribute a = new SpecificationAttribute();
        a.setId(nextId++);
        a.setName(name);
        a.setDataType(type);
        a.setRequired(required);
        return a;
    }

    Specification specification(String name, SpecificationAttribute... attributes) {
        Specification s = new Specification();
        s.setId(nextId++);
        s.setName(name);
        for (SpecificationAttribute a : attributes) {
            s.addAttribute(a);
        }
        return s;
    }

    Product product(String name, Specification specification, ProductAttribute... values) {
        Product p = new Product();
        p.setId(nextId++);
        p.setName(name);
        p.setSpecification(specification);
        for (ProductAttribute v : values) {
            p.addAttribute(v);
        }
        return p;
    }

    ProductAttribute number(SpecificationAttribute attribute, double value) {
        ProductAttribute v = new ProductAttribute();
        v.setId(nextId++);
        v.setSpecificationAttribute(attribute);
        v.setValueNumber(value);
        return v;
    }

    ProductAttribute text(SpecificationAttribute attribute, String value) {
        ProductAttribute v = new ProductAttribute();
        v.setId(nextId++);
        v.setSpecificationAttribute(attribute);
        v.setValueText(value);
        return v;
    }

    ProductAttribute flag(SpecificationAttribute attribute, boolean value) {
        ProductAttribute v = new ProductAttribute();
        v.setId(nextId++);
        v.setSpecificationAttribute(attribute);
        v.setValueBoolean(value);
        return v;
    }

    Quote quote(Vendor vendor, Product product, String price) {
        return quote(vendor, product, price, vendor.getCurrency(), TODAY.minusDays(10), null);
    }

    Quote quote(Vendor vendor, Product product, String price, String currency, LocalDate quoteDate,
            LocalDate validUntil) {
        Quote q = new Quote();
        q.setId(nextId++);
        q.setVendor(vendor);
        q.setProduct(product);
        q.setPrice(new BigDecimal(price));
        q.setCurrency(currency);
        q.setQuoteDate(quoteDate);
        q.setValidUntil(validUntil);
        return q;
    }

    Forex rate(String from, String to, String rate, LocalDate effectiveDate) {
        Forex f = new Forex(nextId++, from, to, new BigDecimal(rate), effectiveDate);
        rates.add(f);
        return f;
    }

    void rating(Vendor vendor, double overall) {
        ratings.put(vendor.getId(), new VendorRatingSummary(vendor.getId(), 1, overall, overall, overall, overall,
                overall));
    }

    Project project(String budget, LocalDate deadline) {
        Project p = new Project();
        p.setId(nextId++);
        p.setName("Project " + p.getId());
        p.setBudget(new BigDecimal(budget));
        p.setDeadline(deadline);
        p.setStatus(ProjectStatus.ACTIVE);
        return p;
    }

    BillOfMaterialsItem line(Specification specification, int quantity, Quote... quotes) {
        BillOfMaterialsItem item = new BillOfMaterialsItem();
        item.setId(nextId++);
        item.setSpecification(specification);
        item.setQuantity(quantity);
        lines.add(new BomLine(item, List.of(quotes)));
        return item;
    }

    ProjectProcurementStrategy strategy(Project project, String name, Integer maxVendors, Double minRating,
            boolean allowPartialFulfill) {
        ProjectProcurementStrategy s = new ProjectProcurementStrategy();
        s.setId(nextId++);
        s.setProject(project);
        s.setStrategy(name);
        s.setMaxVendors(maxVendors);
        s.setMinVendorRating(minRating);
        s.setAllowPartialFulfill(allowPartialFulfill);
        return s;
    }

    CurrencyNormalizer normalizer() {
        return new CurrencyNormalizer(rates, "USD");
    }

    ProcurementSnapshot snapshot(Project project) {
        return snapshot(project, null);
    }

    ProcurementSnapshot snapshot(Project project, ProjectProcurementStrategy strategy) {
        return new ProcurementSnapshot(project, List.copyOf(lines), normalizer(), Map.copyOf(ratings), strategy,
                TODAY, EngineSettings.defaults());
    }
}
