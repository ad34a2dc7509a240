package com.ethnicthv.domain.processor.diagnostic;

public enum Severity {
    /** Blocks generation for the declaration and fails the build. */
    ERROR,
    WARNING
}
