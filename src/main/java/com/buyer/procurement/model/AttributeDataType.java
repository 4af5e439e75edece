package com.buyer.procurement.model;

public enum AttributeDataType {
    NUMBER,
    TEXT,
    BOOLEAN
}
