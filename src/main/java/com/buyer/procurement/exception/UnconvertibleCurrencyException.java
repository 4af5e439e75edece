package com.buyer.procurement.exception;

/**
 * No usable rate exists for a currency pair on the requested date. Callers that
 * aggregate prices recover from this per quote instead of failing the whole report.
 */
public class UnconvertibleCurrencyException extends ProcurementException {

    private final String fromCurrency;
    private final String toCurrency;

    public UnconvertibleCurrencyException(String fromCurrency, String toCurrency, String detail) {
        super("Cannot convert " + fromCurrency + " to " + toCurrency + ": " + detail);
        this.fromCurrency = fromCurrency;
        this.toCurrency = toCurrency;
    }

    public String getFromCurrency() {
        return fromCurrency;
    }

    public String getToCurrency() {
        return toCurrency;
    }
}
