package com.example.pairing.api.response;

public record FieldViolation(String field, String message) {}
