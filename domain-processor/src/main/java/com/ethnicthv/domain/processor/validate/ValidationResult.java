package com.ethnicthv.domain.processor.validate;

import com.ethnicthv.domain.processor.diagnostic.Diagnostic;
import com.ethnicthv.domain.processor.model.EqualityContract;

import java.util.List;
import java.util.Optional;

/**
 * Diagnostics for a host plus its contract; the contract is present only when no diagnostic is an error.
 */
public record ValidationResult(List<Diagnostic> diagnostics, Optional<EqualityContract> contract) {

    public ValidationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
