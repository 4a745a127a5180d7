package com.pipeline.dag.api;

public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
