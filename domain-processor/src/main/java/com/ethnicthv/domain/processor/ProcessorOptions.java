package com.ethnicthv.domain.processor;

import com.ethnicthv.domain.processor.diagnostic.DiagnosticCode;
import com.ethnicthv.domain.processor.diagnostic.Severity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Processor configuration read from {@code -A} options.
 * <ul>
 *     <li>{@code domainbase.verbose}: print progress notes (default {@code false})</li>
 *     <li>{@code domainbase.disabledWarnings}: comma separated warning codes to suppress</li>
 *     <li>{@code domainbase.generatedAnnotation}: emit {@code @Generated} on generated types (default {@code true})</li>
 * </ul>
 */
public final class ProcessorOptions {
    public static final String VERBOSE = "domainbase.verbose";
    public static final String DISABLED_WARNINGS = "domainbase.disabledWarnings";
    public static final String GENERATED_ANNOTATION = "domainbase.generatedAnnotation";

    public static final Set<String> SUPPORTED = Set.of(VERBOSE, DISABLED_WARNINGS, GENERATED_ANNOTATION);

    private final boolean verbose;
    private final Set<DiagnosticCode> disabledWarnings;
    private final boolean generatedAnnotation;

    private ProcessorOptions(boolean verbose, Set<DiagnosticCode> disabledWarnings, boolean generatedAnnotation) {
        this.verbose = verbose;
        this.disabledWarnings = Collections.unmodifiableSet(disabledWarnings);
        this.generatedAnnotation = generatedAnnotation;
    }

    public static ProcessorOptions defaults() {
        return new ProcessorOptions(false, EnumSet.noneOf(DiagnosticCode.class), true);
    }

    /**
     * Unknown codes in {@code domainbase.disabledWarnings} are returned through {@code unknownCodes}
     * so the caller can report them.
     */
    public static ProcessorOptions from(Map<String, String> options, Set<String> unknownCodes) {
        boolean verbose = Boolean.parseBoolean(options.getOrDefault(VERBOSE, "false"));
        boolean generated = !"false".equalsIgnoreCase(options.getOrDefault(GENERATED_ANNOTATION, "true").trim());
        EnumSet<DiagnosticCode> disabled = EnumSet.noneOf(DiagnosticCode.class);
        String raw = options.get(DISABLED_WARNINGS);
        if (raw != null) {
            for (String part : raw.split(",")) {
                if (part.isBlank()) continue;
                DiagnosticCode code = DiagnosticCode.parse(part);
                if (code == null) {
                    unknownCodes.add(part.trim());
                } else {
                    disabled.add(code);
                }
            }
        }
        return new ProcessorOptions(verbose, disabled, generated);
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean generatedAnnotation() {
        return generatedAnnotation;
    }

    public Set<DiagnosticCode> disabledWarnings() {
        return disabledWarnings;
    }

    /** Errors are never considered disabled. */
    public boolean isWarningDisabled(DiagnosticCode code) {
        return code.severity() != Severity.ERROR && disabledWarnings.contains(code);
    }
}
