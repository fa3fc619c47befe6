package com.myscrollr.delivery.model.dto;

public record ErrorResponse(String status, String error) {}
