package com.buyer.procurement.config;

import com.buyer.procurement.model.*;
import com.buyer.procurement.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Seeds a small demo catalog: vendors in three currencies, forex rates, two
 * specifications with typed attributes, competing products and quotes, vendor
 * ratings, and one project whose BOM exercises every report.
 */
@Configuration
@ConditionalOnProperty(name = "procurement.seed-sample-data", havingValue = "true")
public class DataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    @Bean
    CommandLineRunner init(BrandRepository brandRepo,
            VendorRepository vendorRepo,
            SpecificationRepository specRepo,
            ProductRepository productRepo,
            QuoteRepository quoteRepo,
            ForexRepository forexRepo,
            VendorRatingRepository ratingRepo,
            ProjectRepository projectRepo,
            BillOfMaterialsRepository bomRepo,
            Clock clock) {
        return args -> {
            if (projectRepo.findByName("Office Refresh").isPresent()) {
                return;
            }
            LocalDate today = LocalDate.now(clock);

            // Rates
            if (forexRepo.count() == 0) {
                forexRepo.save(new Forex(null, "EUR", "USD", new BigDecimal("1.08"), today.minusDays(30)));
                forexRepo.save(new Forex(null, "EUR", "USD", new BigDecimal("1.10"), today.minusDays(5)));
                forexRepo.save(new Forex(null, "USD", "EUR", new BigDecimal("0.91"), today.minusDays(5)));
                // No GBP rate on purpose: quotes in GBP show up as unconvertible
            }

            // Vendors
            Vendor northwind = vendor(vendorRepo, "Northwind Supply", "USD", null);
            Vendor contoso = vendor(vendorRepo, "Contoso Components", "EUR", "CONTOSO10");
            Vendor fabrikam = vendor(vendorRepo, "Fabrikam Industrial", "USD", null);
            Vendor tailspin = vendor(vendorRepo, "Tailspin Traders", "GBP", null);

            Brand acme = brandRepo.findByName("Acme").orElseGet(() -> {
                Brand b = new Brand();
                b.setName("Acme");
                return brandRepo.save(b);
            });
            Brand globex = brandRepo.findByName("Globex").orElseGet(() -> {
                Brand b = new Brand();
                b.setName("Globex");
                return brandRepo.save(b);
            });

            // Specifications
            Specification laptopSpec = specRepo.findByName("Laptop 14in").orElseGet(() -> {
                Specification s = new Specification();
                s.setName("Laptop 14in");
                s.setDescription("Standard issue developer laptop");
                s.addAttribute(attribute("RAM", AttributeDataType.NUMBER, "GB", true, 16.0, null));
                s.addAttribute(attribute("Storage", AttributeDataType.NUMBER, "GB", true, 512.0, null));
                s.addAttribute(attribute("Color", AttributeDataType.TEXT, null, false, null, null));
                return specRepo.save(s);
            });
            Specification chairSpec = specRepo.findByName("Office Chair").orElseGet(() -> {
                Specification s = new Specification();
                s.setName("Office Chair");
                s.addAttribute(attribute("Ergonomic", AttributeDataType.BOOLEAN, null, true, null, null));
                s.addAttribute(attribute("Max Load", AttributeDataType.NUMBER, "kg", true, 120.0, null));
                return specRepo.save(s);
            });
            Specification dockSpec = specRepo.findByName("USB-C Dock").orElseGet(() -> {
                Specification s = new Specification();
                s.setName("USB-C Dock");
                s.addAttribute(attribute("Ports", AttributeDataType.NUMBER, null, true, 6.0, null));
                return specRepo.save(s);
            });

            // Products
            Product proBook = product("Acme ProBook 14", "ACM-PB14", acme, laptopSpec);
            value(proBook, laptopSpec, "RAM", 32.0, null, null);
            value(proBook, laptopSpec, "Storage", 1024.0, null, null);
            value(proBook, laptopSpec, "Color", null, "Silver", null);
            proBook = productRepo.save(proBook);

            Product air = product("Globex Air 14", "GLX-AIR14", globex, laptopSpec);
            value(air, laptopSpec, "RAM", 8.0, null, null);
            value(air, laptopSpec, "Storage", 256.0, null, null);
            air = productRepo.save(air);

            Product ergoSeat = product("Acme ErgoSeat", "ACM-ERGO", acme, chairSpec);
            value(ergoSeat, chairSpec, "Ergonomic", null, null, Boolean.TRUE);
            value(ergoSeat, chairSpec, "Max Load", 150.0, null, null);
            ergoSeat = productRepo.save(ergoSeat);

            // Quotes
            quote(quoteRepo, northwind, proBook, "1450.00", "USD", today.minusDays(20), today.plusDays(60));
            quote(quoteRepo, contoso, proBook, "1290.00", "EUR", today.minusDays(10), today.plusDays(10));
            quote(quoteRepo, fabrikam, air, "780.00", "USD", today.minusDays(5), null);
            quote(quoteRepo, tailspin, proBook, "1100.00", "GBP", today.minusDays(3), null);
            quote(quoteRepo, northwind, ergoSeat, "310.00", "USD", today.minusDays(120), null);
            quote(quoteRepo, fabrikam, ergoSeat, "295.00", "USD", today.minusDays(15), today.minusDays(1));

            // Ratings
            rating(ratingRepo, northwind, 4, 5, 4, 5);
            rating(ratingRepo, contoso, 5, 3, 3, null);
            rating(ratingRepo, fabrikam, 3, 4, null, 4);

            // Project with BOM
            Project project = new Project();
            project.setName("Office Refresh");
            project.setDescription("Replace laptops and chairs for the platform team");
            project.setBudget(new BigDecimal("20000"));
            project.setDeadline(today.plusDays(45));
            project.setStatus(ProjectStatus.ACTIVE);
            project = projectRepo.save(project);

            BillOfMaterials bom = new BillOfMaterials();
            bom.setProject(project);
            bom.addItem(bomItem(laptopSpec, 10));
            bom.addItem(bomItem(chairSpec, 10));
            bom.addItem(bomItem(dockSpec, 10));
            bomRepo.save(bom);

            logger.info("Seeded sample procurement data: project '{}' with {} BOM items", project.getName(),
                    bom.getItems().size());
        };
    }

    private static Vendor vendor(VendorRepository repo, String name, String currency, String discountCode) {
        return repo.findByName(name).orElseGet(() -> {
            Vendor v = new Vendor();
            v.setName(name);
            v.setCurrency(currency);
            v.setDiscountCode(discountCode);
            return repo.save(v);
        });
    }

    private static SpecificationAttribute attribute(String name, AttributeDataType type, String unit,
            boolean required, Double min, Double max) {
        SpecificationAttribute a = new SpecificationAttribute();
        a.setName(name);
        a.setDataType(type);
        a.setUnit(unit);
        a.setRequired(required);
        a.setMinValue(min);
        a.setMaxValue(max);
        return a;
    }

    private static Product product(String name, String sku, Brand brand, Specification spec) {
        Product p = new Product();
        p.setName(name);
        p.setSku(sku);
        p.setBrand(brand);
        p.setSpecification(spec);
        return p;
    }

    private static void value(Product product, Specification spec, String attributeName, Double number,
            String text, Boolean flag) {
        SpecificationAttribute definition = spec.getAttributes().stream()
                .filter(a -> a.getName().equals(attributeName))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No attribute " + attributeName + " on " + spec.getName()));
        ProductAttribute value = new ProductAttribute();
        value.setSpecificationAttribute(definition);
        value.setValueNumber(number);
        value.setValueText(text);
        value.setValueBoolean(flag);
        product.addAttribute(value);
    }

    private static void quote(QuoteRepository repo, Vendor vendor, Product product, String price, String currency,
            LocalDate quoteDate, LocalDate validUntil) {
        Quote q = new Quote();
        q.setVendor(vendor);
        q.setProduct(product);
        q.setPrice(new BigDecimal(price));
        q.setCurrency(currency);
        q.setQuoteDate(quoteDate);
        q.setValidUntil(validUntil);
        repo.save(q);
    }

    private static void rating(VendorRatingRepository repo, Vendor vendor, Integer price, Integer quality,
            Integer delivery, Integer service) {
        VendorRating r = new VendorRating();
        r.setVendor(vendor);
        r.setPriceRating(price);
        r.setQualityRating(quality);
        r.setDeliveryRating(delivery);
        r.setServiceRating(service);
        r.setRatedBy("seed");
        repo.save(r);
    }

    private static BillOfMaterialsItem bomItem(Specification spec, int quantity) {
        BillOfMaterialsItem item = new BillOfMaterialsItem();
        item.setSpecification(spec);
        item.setQuantity(quantity);
        return item;
    }
}
