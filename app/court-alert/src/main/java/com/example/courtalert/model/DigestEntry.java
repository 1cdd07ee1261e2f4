package com.example.courtalert.model;

public record DigestEntry(ConsolidatedWindow window, String sourceName) {}
