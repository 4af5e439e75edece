package com.buyer.procurement.exception;

public class ProcurementException extends RuntimeException {

    public ProcurementException(String message) {
        super(message);
    }
}
