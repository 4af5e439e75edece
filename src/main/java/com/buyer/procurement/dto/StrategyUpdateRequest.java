package com.buyer.procurement.dto;

import lombok.Data;

@Data
public class StrategyUpdateRequest {
    private String strategy;
}
