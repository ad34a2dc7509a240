package com.ethnicthv.domain.processor.diagnostic;

import com.ethnicthv.domain.processor.ProcessorOptions;

import javax.annotation.processing.Messager;
import javax.tools.Diagnostic.Kind;
import java.util.Collection;

/**
 * Sink turning {@link Diagnostic}s into compiler messages attached to the offending element.
 * Warnings listed in {@code domainbase.disabledWarnings} are dropped; errors always go through.
 */
public final class DiagnosticReporter {
    private final Messager messager;
    private final ProcessorOptions options;

    public DiagnosticReporter(Messager messager, ProcessorOptions options) {
        this.messager = messager;
        this.options = options;
    }

    public void report(Diagnostic diagnostic) {
        if (!diagnostic.isError() && options.isWarningDisabled(diagnostic.code())) return;
        Kind kind = diagnostic.isError() ? Kind.ERROR : Kind.WARNING;
        if (diagnostic.location() != null && diagnostic.location().element() != null) {
            messager.printMessage(kind, diagnostic.render(), diagnostic.location().element());
        } else {
            messager.printMessage(kind, diagnostic.render());
        }
    }

    public void reportAll(Collection<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) report(d);
    }
}
