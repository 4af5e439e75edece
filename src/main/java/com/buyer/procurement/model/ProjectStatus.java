package com.buyer.procurement.model;

public enum ProjectStatus {
    PLANNING,
    ACTIVE,
    COMPLETED,
    CANCELLED
}
