package com.ethnicthv.domain.processor.diagnostic;

import com.ethnicthv.domain.processor.model.SourceLocation;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * A single finding against a declaration.
 */
public record Diagnostic(DiagnosticCode code, String message, SourceLocation location, List<SourceLocation> relatedLocations) {

    public Diagnostic {
        relatedLocations = List.copyOf(relatedLocations);
    }

    public static Diagnostic of(DiagnosticCode code, SourceLocation location, String fmt, Object... args) {
        return new Diagnostic(code, String.format(Locale.ROOT, fmt, args), location, List.of());
    }

    public Diagnostic withRelated(List<SourceLocation> related) {
        return new Diagnostic(code, message, location, related);
    }

    public Severity severity() {
        return code.severity();
    }

    public boolean isError() {
        return code.severity() == Severity.ERROR;
    }

    /**
     * {@code [CODE] message (related: a, b)}; the related part is omitted when empty.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(code.name()).append("] ").append(message);
        if (!relatedLocations.isEmpty()) {
            sb.append(" (related: ")
                    .append(relatedLocations.stream().map(SourceLocation::description).collect(Collectors.joining(", ")))
                    .append(')');
        }
        return sb.toString();
    }
}
