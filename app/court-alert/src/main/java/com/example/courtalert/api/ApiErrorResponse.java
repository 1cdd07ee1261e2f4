package com.example.courtalert.api;

public record ApiErrorResponse(String code, String message) {}
