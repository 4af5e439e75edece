package com.buyer.procurement.dto;

public enum ScenarioState {
    COLLECTING,
    ASSIGNING,
    SCORED,
    INFEASIBLE
}
