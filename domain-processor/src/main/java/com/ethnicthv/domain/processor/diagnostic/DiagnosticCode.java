package com.ethnicthv.domain.processor.diagnostic;

import java.util.Locale;

/**
 * Stable diagnostic codes. {@code VO0xx} covers equality contracts, {@code EN0xx} enumerations.
 */
public enum DiagnosticCode {
    VO001("not-extensible", Severity.ERROR),
    VO002("missing-strategy", Severity.WARNING),
    VO003("missing-companion-equals", Severity.ERROR),
    VO004("missing-companion-hash", Severity.ERROR),
    VO005("multiple-strategies", Severity.ERROR),
    VO006("sequence-on-non-sequence", Severity.ERROR),
    VO007("strategy-outside-contract", Severity.ERROR),
    VO008("contract-without-base-shape", Severity.ERROR),
    VO009("duplicate-companion-names", Severity.ERROR),
    VO010("mutable-property", Severity.WARNING),
    VO011("mutable-field", Severity.WARNING),
    VO012("extra-member-in-wrapper", Severity.WARNING),
    VO013("duplicate-order", Severity.WARNING),
    VO014("unnecessary-contract-marker", Severity.WARNING),
    VO015("strategy-on-unsupported-member", Severity.ERROR),

    EN001("duplicate-value", Severity.ERROR),
    EN002("duplicate-name", Severity.ERROR),
    EN003("not-extensible", Severity.ERROR);

    private final String title;
    private final Severity severity;

    DiagnosticCode(String title, Severity severity) {
        this.title = title;
        this.severity = severity;
    }

    public String title() {
        return title;
    }

    public Severity severity() {
        return severity;
    }

    /**
     * Parses a code such as {@code vo002} or {@code VO002}; returns {@code null} if unknown.
     */
    public static DiagnosticCode parse(String text) {
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (DiagnosticCode code : values()) {
            if (code.name().equals(normalized)) return code;
        }
        return null;
    }
}
