package com.ethnicthv.domain.processor.enumeration;

import com.ethnicthv.domain.processor.model.GeneratedSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.ethnicthv.domain.processor.enumeration.EnumerationFixtures.enumeration;
import static org.junit.jupiter.api.Assertions.*;

class EnumerationTableSynthesizerTest {
    private static final String GENERATOR = "com.ethnicthv.domain.processor.EnumerationProcessor";

    @Test
    @DisplayName("Lookup class exposes the full accessor surface")
    void accessorSurface() {
        GeneratedSource source = new EnumerationTableSynthesizer(GENERATOR, true, false).synthesize(enumeration("Status")
                .constant("PENDING", 1, "Pending")
                .constant("SHIPPED", 2, "Shipped")
                .build());
        String src = source.content();

        assertEquals("com.acme.StatusValues", source.qualifiedName());
        assertTrue(src.contains("public final class StatusValues {"), src);
        assertTrue(src.contains("public static java.util.Collection<com.acme.Status> getAll()"), src);
        assertTrue(src.contains("public static com.acme.Status fromValue(int value)"), src);
        assertTrue(src.contains("public static com.acme.Status fromName(java.lang.String name)"), src);
        assertTrue(src.contains("public static java.util.Optional<com.acme.Status> tryFromValue(int value)"), src);
        assertTrue(src.contains("public static java.util.Optional<com.acme.Status> tryFromName(java.lang.String name)"), src);
        assertTrue(src.contains("throw new java.util.NoSuchElementException("), src);
        assertTrue(src.contains("all.sort(java.util.Comparator.comparingInt(com.acme.Status::getValue));"), src);
    }

    @Test
    @DisplayName("Non-literal constants are still part of the table")
    void includesNonLiteralConstants() {
        String src = new EnumerationTableSynthesizer(GENERATOR, true, false).synthesize(enumeration("Planet")
                .constant("EARTH", 3, "Earth")
                .constant("COMPUTED", null, null)
                .build()).content();

        assertTrue(src.contains("all.add(com.acme.Planet.EARTH);"), src);
        assertTrue(src.contains("all.add(com.acme.Planet.COMPUTED);"), src);
        assertTrue(src.contains("throw new java.lang.IllegalStateException(\"Duplicate value \""), src);
    }

    @Test
    @DisplayName("Visibility follows the host")
    void visibility() {
        String src = new EnumerationTableSynthesizer(GENERATOR, false, false).synthesize(enumeration("Internal")
                .packagePrivate()
                .constant("ONE", 1, "One")
                .build()).content();

        assertTrue(src.startsWith("package com.acme;\n\n@SuppressWarnings(\"all\")\nfinal class InternalValues {"), src);
    }

    @Test
    @DisplayName("Output is deterministic")
    void deterministic() {
        EnumerationTableSynthesizer synthesizer = new EnumerationTableSynthesizer(GENERATOR, true, false);
        EnumerationDeclaration decl = enumeration("Status").constant("A", 1, "A").constant("B", 2, "B").build();

        assertEquals(synthesizer.synthesize(decl).content(), synthesizer.synthesize(decl).content());
    }

    @Test
    @DisplayName("Private constants stay out of the table")
    void skipsPrivateConstants() {
        String src = new EnumerationTableSynthesizer(GENERATOR, true, false).synthesize(enumeration("Status")
                .constant("ACTIVE", 1, "Active")
                .privateConstant("HIDDEN", 2, "Hidden")
                .build()).content();

        assertTrue(src.contains("all.add(com.acme.Status.ACTIVE);"), src);
        assertFalse(src.contains("HIDDEN"), src);
    }

    @Test
    @DisplayName("JSON converter needs both the request and Jackson")
    void jsonConverter() {
        EnumerationDeclaration requested = enumeration("Status").constant("ACTIVE", 1, "Active").build();
        EnumerationDeclaration declined = enumeration("Status").withoutJsonConverter().constant("ACTIVE", 1, "Active").build();

        String src = new EnumerationTableSynthesizer(GENERATOR, true, true).synthesize(requested).content();
        assertTrue(src.contains("public static final class ValueSerializer extends com.fasterxml.jackson.databind.JsonSerializer<com.acme.Status> {"), src);
        assertTrue(src.contains("gen.writeNumber(item.getValue());"), src);
        assertTrue(src.contains("return tryFromValue(p.getIntValue()).orElse(null);"), src);
        assertTrue(src.contains("return tryFromName(p.getText()).orElse(null);"), src);
        assertTrue(src.contains("module.addDeserializer(com.acme.Status.class, new ValueDeserializer());"), src);

        assertFalse(new EnumerationTableSynthesizer(GENERATOR, true, true).synthesize(declined).content().contains("jsonModule"));
        assertFalse(new EnumerationTableSynthesizer(GENERATOR, true, false).synthesize(requested).content().contains("jsonModule"));
    }
}
