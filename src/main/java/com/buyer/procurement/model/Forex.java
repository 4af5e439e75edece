package com.buyer.procurement.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A directed exchange rate: one unit of {@code fromCurrency} buys {@code rate}
 * units of {@code toCurrency} from {@code effectiveDate} on.
 */
@Entity
@Table(name = "forex", indexes = @Index(name = "idx_forex_pair", columnList = "from_currency, to_currency"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Forex {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 3)
    private String fromCurrency;

    @Column(nullable = false, length = 3)
    private String toCurrency;

    @Column(nullable = false, precision = 19, scale = 8)
    private BigDecimal rate;

    @Column(nullable = false)
    private LocalDate effectiveDate;

    @PrePersist
    protected void onCreate() {
        fromCurrency = fromCurrency.trim().toUpperCase();
        toCurrency = toCurrency.trim().toUpperCase();
        if (rate == null || rate.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalStateException("Forex rate must be positive, got " + rate);
        }
        if (effectiveDate == null) {
            effectiveDate = LocalDate.now();
        }
    }
}
