package com.buyer.procurement.exception;

public class InvalidStrategyException extends ProcurementException {

    private final String strategy;

    public InvalidStrategyException(String strategy) {
        super("Unknown procurement strategy '" + strategy
                + "'. Expected one of: lowest_cost, fewest_vendors, balanced, quality_focused");
        this.strategy = strategy;
    }

    public String getStrategy() {
        return strategy;
    }
}
