package com.buyer.procurement.dto;

public record ApiError(String error, String message, String path) {
}
