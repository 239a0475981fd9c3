package com.specsim.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
