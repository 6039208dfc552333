package com.example.posematch_backend.dto.web;

public record ErrorResponse(String error, String code, String message) {
}
