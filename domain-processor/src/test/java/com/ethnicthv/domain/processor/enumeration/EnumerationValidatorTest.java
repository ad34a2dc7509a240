package com.ethnicthv.domain.processor.enumeration;

import com.ethnicthv.domain.processor.diagnostic.Diagnostic;
import com.ethnicthv.domain.processor.diagnostic.DiagnosticCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.ethnicthv.domain.processor.enumeration.EnumerationFixtures.enumeration;
import static org.junit.jupiter.api.Assertions.*;

class EnumerationValidatorTest {
    private final EnumerationValidator validator = new EnumerationValidator();

    private static List<DiagnosticCode> codes(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::code).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Unique constants pass")
    void unique() {
        EnumerationDeclaration decl = enumeration("Status")
                .constant("PENDING", 1, "Pending")
                .constant("SHIPPED", 2, "Shipped")
                .build();

        assertTrue(validator.validate(decl).isEmpty());
    }

    @Test
    @DisplayName("Duplicate value and duplicate name are reported independently")
    void duplicateValueAndName() {
        EnumerationDeclaration decl = enumeration("Status")
                .constant("ACTIVE", 1, "Active")
                .constant("ENABLED", 1, "Enabled")
                .constant("LIVE", 2, "Active")
                .build();

        List<Diagnostic> diagnostics = validator.validate(decl);

        assertEquals(List.of(DiagnosticCode.EN001, DiagnosticCode.EN002), codes(diagnostics));
        assertEquals("Status.ENABLED", diagnostics.get(0).location().description());
        assertEquals("Status.ACTIVE", diagnostics.get(0).relatedLocations().get(0).description());
        assertEquals("Status.LIVE", diagnostics.get(1).location().description());
        assertEquals("[EN002] The enumeration 'Status' has duplicate name 'Active'. Names must be unique within an enumeration type (related: Status.ACTIVE)",
                diagnostics.get(1).render());
    }

    @Test
    @DisplayName("Every later duplicate points back to the first constant")
    void eachDuplicatePairReported() {
        EnumerationDeclaration decl = enumeration("Level")
                .constant("A", -1, "A")
                .constant("B", -1, "B")
                .constant("C", -1, "C")
                .build();

        List<Diagnostic> diagnostics = validator.validate(decl);

        assertEquals(List.of(DiagnosticCode.EN001, DiagnosticCode.EN001), codes(diagnostics));
        for (Diagnostic d : diagnostics) {
            assertEquals("Level.A", d.relatedLocations().get(0).description());
        }
    }

    @Test
    @DisplayName("Names compare case-sensitively")
    void namesAreCaseSensitive() {
        EnumerationDeclaration decl = enumeration("Status")
                .constant("UPPER", 1, "Active")
                .constant("LOWER", 2, "active")
                .build();

        assertTrue(validator.validate(decl).isEmpty());
    }

    @Test
    @DisplayName("Non-literal constants are not statically checked")
    void nonLiteralSkipped() {
        EnumerationDeclaration decl = enumeration("Planet")
                .constant("EARTH", 3, "Earth")
                .constant("COMPUTED", null, null)
                .constant("HALF", 3, null)
                .build();

        assertTrue(validator.validate(decl).isEmpty());
        assertEquals(1, decl.entries().size());
        assertEquals(3, decl.constants().size());
    }

    @Test
    @DisplayName("Marker on a host that cannot carry a table")
    void notExtensible() {
        assertEquals(List.of(DiagnosticCode.EN003), codes(validator.validate(enumeration("Color").notSubclass().build())));
        assertEquals(List.of(DiagnosticCode.EN003), codes(validator.validate(enumeration("Color").unreachable().build())));
        assertTrue(validator.validate(enumeration("Color").unmarked().unreachable().build()).isEmpty());
    }

    @Test
    @DisplayName("Duplicates are found on unmarked subclasses too")
    void unmarkedStillChecked() {
        EnumerationDeclaration decl = enumeration("Status").unmarked()
                .constant("A", 1, "A")
                .constant("B", 1, "B")
                .build();

        assertEquals(List.of(DiagnosticCode.EN001), codes(validator.validate(decl)));
    }

    @Test
    @DisplayName("Private constants take part in duplicate detection")
    void privateConstantsChecked() {
        EnumerationDeclaration decl = enumeration("Status")
                .constant("ACTIVE", 1, "Active")
                .privateConstant("HIDDEN", 1, "Active")
                .build();

        List<Diagnostic> diagnostics = validator.validate(decl);

        assertEquals(List.of(DiagnosticCode.EN001, DiagnosticCode.EN002), codes(diagnostics));
        assertEquals("Status.HIDDEN", diagnostics.get(0).location().description());
        assertEquals(1, decl.tableConstants().size());
    }
}
