package com.fleet.diagnostics.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
