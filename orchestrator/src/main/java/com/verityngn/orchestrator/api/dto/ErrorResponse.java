package com.verityngn.orchestrator.api.dto;

/** Body of every 4xx response. */
public record ErrorResponse(String error, String message) {}
