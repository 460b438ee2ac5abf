package com.namingtool.dto.response;

public record ValidateNameResponse(
    boolean valid,
    String name,
    String message
) {}
