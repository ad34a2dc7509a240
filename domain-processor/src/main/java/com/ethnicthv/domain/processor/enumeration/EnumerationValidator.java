package com.ethnicthv.domain.processor.enumeration;

import com.ethnicthv.domain.processor.diagnostic.Diagnostic;
import com.ethnicthv.domain.processor.diagnostic.DiagnosticCode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Duplicate checks over literal constants, plus the marker placement rule. Each duplicate is reported
 * on the later constant with the first one holding the key attached.
 */
public final class EnumerationValidator {

    public List<Diagnostic> validate(EnumerationDeclaration declaration) {
        List<Diagnostic> out = new ArrayList<>();
        if (declaration.marked() && (!declaration.enumerationSubclass() || !declaration.reachable())) {
            out.add(Diagnostic.of(DiagnosticCode.EN003, declaration.location(),
                    "The enumeration '%s' must be a non-private, static (if nested) subclass of Enumeration to generate its lookup table",
                    declaration.simpleName()));
        }

        Map<Integer, EnumerationEntry> byValue = new HashMap<>();
        Map<String, EnumerationEntry> byName = new HashMap<>();
        for (EnumerationEntry entry : declaration.entries()) {
            EnumerationEntry firstWithValue = byValue.putIfAbsent(entry.value(), entry);
            if (firstWithValue != null) {
                out.add(Diagnostic.of(DiagnosticCode.EN001, entry.location(),
                        "The enumeration '%s' has duplicate value '%d'. Values must be unique within an enumeration type",
                        declaration.simpleName(), entry.value())
                        .withRelated(List.of(firstWithValue.location())));
            }
            EnumerationEntry firstWithName = byName.putIfAbsent(entry.name(), entry);
            if (firstWithName != null) {
                out.add(Diagnostic.of(DiagnosticCode.EN002, entry.location(),
                        "The enumeration '%s' has duplicate name '%s'. Names must be unique within an enumeration type",
                        declaration.simpleName(), entry.name())
                        .withRelated(List.of(firstWithName.location())));
            }
        }
        return out;
    }
}
