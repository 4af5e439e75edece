package com.buyer.procurement.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

@Entity
@Table(name = "quotes")
@Data
public class Quote {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "vendor_id", nullable = false)
    private Vendor vendor;

    @ManyToOne
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    // Unit price in the quote's own currency
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal price;

    @Column(length = 3)
    private String currency;

    @Column(nullable = false)
    private LocalDate quoteDate;

    private LocalDate validUntil;

    @Column(length = 2000)
    private String notes;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (quoteDate == null) {
            quoteDate = LocalDate.now();
        }
        if (price == null || price.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalStateException("Quote price must be positive, got " + price);
        }
    }

    /** Quote currency, falling back to the vendor's currency when the quote has none. */
    public String effectiveCurrency() {
        if (currency != null && !currency.isBlank()) {
            return currency.trim().toUpperCase();
        }
        return vendor != null && vendor.getCurrency() != null ? vendor.getCurrency().trim().toUpperCase() : null;
    }

    public boolean isExpired(LocalDate asOf) {
        return validUntil != null && validUntil.isBefore(asOf);
    }

    /**
     * Expired quotes are stale. A quote with a validity date that has not passed
     * is never stale; one without a validity date goes stale after {@code staleAfterDays}.
     */
    public boolean isStale(LocalDate asOf, int staleAfterDays) {
        if (isExpired(asOf)) {
            return true;
        }
        if (validUntil != null) {
            return false;
        }
        return ChronoUnit.DAYS.between(quoteDate, asOf) > staleAfterDays;
    }
}
