package com.buyer.procurement.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "vendors")
@Data
public class Vendor {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String name;

    // ISO 4217 code, e.g. USD, EUR
    @Column(nullable = false, length = 3)
    private String currency;

    @Column(length = 50)
    private String discountCode;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (currency != null) {
            currency = currency.trim().toUpperCase();
        }
    }
}
