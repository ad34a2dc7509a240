package com.ethnicthv.domain.processor.enumeration;

import com.ethnicthv.domain.processor.model.GeneratedSource;

/**
 * Emits {@code <Flat>Values}: every non-private constant sorted by value, with O(1) lookups by value and
 * by name. Tables are built once in a static initializer, which fails with {@link IllegalStateException}
 * if two constants share a value or a name at runtime.
 * <p>
 * When the host asks for it and Jackson is on the processing classpath, the class also carries a
 * serializer writing the value, a deserializer accepting a value or a name, and {@code jsonModule()}
 * registering both.
 */
public final class EnumerationTableSynthesizer {
    private static final String JACKSON_CORE = "com.fasterxml.jackson.core.";
    private static final String JACKSON_DATABIND = "com.fasterxml.jackson.databind.";

    private final String generatorName;
    private final boolean generatedAnnotation;
    private final boolean jacksonAvailable;

    public EnumerationTableSynthesizer(String generatorName, boolean generatedAnnotation, boolean jacksonAvailable) {
        this.generatorName = generatorName;
        this.generatedAnnotation = generatedAnnotation;
        this.jacksonAvailable = jacksonAvailable;
    }

    public boolean emitsJsonConverter(EnumerationDeclaration declaration) {
        return jacksonAvailable && declaration.jsonConverter();
    }

    public GeneratedSource synthesize(EnumerationDeclaration declaration) {
        String type = declaration.qualifiedName();
        String simple = declaration.flatName() + EnumerationDeclaration.GENERATED_SUFFIX;
        StringBuilder sb = new StringBuilder();

        if (!declaration.packageName().isEmpty()) {
            sb.append("package ").append(declaration.packageName()).append(";\n\n");
        }
        if (generatedAnnotation) {
            sb.append("@javax.annotation.processing.Generated(\"").append(generatorName).append("\")\n");
        }
        sb.append("@SuppressWarnings(\"all\")\n");
        sb.append(declaration.publicType() ? "public " : "").append("final class ").append(simple).append(" {\n");
        sb.append("    private static final java.util.List<").append(type).append("> ALL;\n");
        sb.append("    private static final java.util.Map<java.lang.Integer, ").append(type).append("> BY_VALUE;\n");
        sb.append("    private static final java.util.Map<java.lang.String, ").append(type).append("> BY_NAME;\n\n");

        sb.append("    static {\n");
        sb.append("        java.util.List<").append(type).append("> all = new java.util.ArrayList<>();\n");
        for (EnumerationConstant c : declaration.tableConstants()) {
            sb.append("        all.add(").append(type).append('.').append(c.fieldName()).append(");\n");
        }
        sb.append("        all.sort(java.util.Comparator.comparingInt(").append(type).append("::getValue));\n");
        sb.append("        java.util.Map<java.lang.Integer, ").append(type).append("> byValue = new java.util.HashMap<>();\n");
        sb.append("        java.util.Map<java.lang.String, ").append(type).append("> byName = new java.util.HashMap<>();\n");
        sb.append("        for (").append(type).append(" item : all) {\n");
        sb.append("            if (byValue.putIfAbsent(item.getValue(), item) != null) {\n");
        sb.append("                throw new java.lang.IllegalStateException(\"Duplicate value \" + item.getValue() + \" in ")
                .append(type).append("\");\n");
        sb.append("            }\n");
        sb.append("            if (byName.putIfAbsent(item.getName(), item) != null) {\n");
        sb.append("                throw new java.lang.IllegalStateException(\"Duplicate name '\" + item.getName() + \"' in ")
                .append(type).append("\");\n");
        sb.append("            }\n");
        sb.append("        }\n");
        sb.append("        ALL = java.util.Collections.unmodifiableList(all);\n");
        sb.append("        BY_VALUE = java.util.Collections.unmodifiableMap(byValue);\n");
        sb.append("        BY_NAME = java.util.Collections.unmodifiableMap(byName);\n");
        sb.append("    }\n\n");

        sb.append("    private ").append(simple).append("() {\n");
        sb.append("    }\n\n");

        sb.append("    /** All constants ordered by value. */\n");
        sb.append("    public static java.util.Collection<").append(type).append("> getAll() {\n");
        sb.append("        return ALL;\n");
        sb.append("    }\n\n");

        appendLookup(sb, type, "fromValue", "tryFromValue", "int", "BY_VALUE", "value");
        appendLookup(sb, type, "fromName", "tryFromName", "java.lang.String", "BY_NAME", "name");
        if (emitsJsonConverter(declaration)) {
            appendJsonConverter(sb, type, simple);
        }
        sb.setLength(sb.length() - 1);
        sb.append("}\n");
        return new GeneratedSource(declaration.generatedQualifiedName(), sb.toString());
    }

    private static void appendLookup(StringBuilder sb, String type, String from, String tryFrom, String keyType, String table, String key) {
        sb.append("    public static ").append(type).append(' ').append(from).append('(').append(keyType).append(' ').append(key).append(") {\n");
        sb.append("        ").append(type).append(" item = ").append(table).append(".get(").append(key).append(");\n");
        sb.append("        if (item == null) {\n");
        sb.append("            throw new java.util.NoSuchElementException(\"No ").append(type)
                .append(" with ").append(key).append(" \" + ").append(key).append(");\n");
        sb.append("        }\n");
        sb.append("        return item;\n");
        sb.append("    }\n\n");
        sb.append("    public static java.util.Optional<").append(type).append("> ").append(tryFrom)
                .append('(').append(keyType).append(' ').append(key).append(") {\n");
        sb.append("        return java.util.Optional.ofNullable(").append(table).append(".get(").append(key).append("));\n");
        sb.append("    }\n\n");
    }

    private static void appendJsonConverter(StringBuilder sb, String type, String simple) {
        sb.append("    /** Writes the constant as its value. */\n");
        sb.append("    public static final class ValueSerializer extends ").append(JACKSON_DATABIND)
                .append("JsonSerializer<").append(type).append("> {\n");
        sb.append("        @java.lang.Override\n");
        sb.append("        public void serialize(").append(type).append(" item, ").append(JACKSON_CORE).append("JsonGenerator gen, ")
                .append(JACKSON_DATABIND).append("SerializerProvider serializers) throws java.io.IOException {\n");
        sb.append("            gen.writeNumber(item.getValue());\n");
        sb.append("        }\n");
        sb.append("    }\n\n");

        sb.append("    /** Reads a constant from its value or its name; unknown input reads as {@code null}. */\n");
        sb.append("    public static final class ValueDeserializer extends ").append(JACKSON_DATABIND)
                .append("JsonDeserializer<").append(type).append("> {\n");
        sb.append("        @java.lang.Override\n");
        sb.append("        public ").append(type).append(" deserialize(").append(JACKSON_CORE).append("JsonParser p, ")
                .append(JACKSON_DATABIND).append("DeserializationContext ctxt) throws java.io.IOException {\n");
        sb.append("            ").append(JACKSON_CORE).append("JsonToken token = p.currentToken();\n");
        sb.append("            if (token == ").append(JACKSON_CORE).append("JsonToken.VALUE_NUMBER_INT) {\n");
        sb.append("                if (p.getNumberType() != ").append(JACKSON_CORE).append("JsonParser.NumberType.INT) return null;\n");
        sb.append("                return tryFromValue(p.getIntValue()).orElse(null);\n");
        sb.append("            }\n");
        sb.append("            if (token == ").append(JACKSON_CORE).append("JsonToken.VALUE_STRING) {\n");
        sb.append("                return tryFromName(p.getText()).orElse(null);\n");
        sb.append("            }\n");
        sb.append("            return null;\n");
        sb.append("        }\n");
        sb.append("    }\n\n");

        sb.append("    /** Module registering {@link ValueSerializer} and {@link ValueDeserializer}. */\n");
        sb.append("    public static ").append(JACKSON_DATABIND).append("Module jsonModule() {\n");
        sb.append("        ").append(JACKSON_DATABIND).append("module.SimpleModule module = new ").append(JACKSON_DATABIND)
                .append("module.SimpleModule(\"").append(simple).append("\");\n");
        sb.append("        module.addSerializer(").append(type).append(".class, new ValueSerializer());\n");
        sb.append("        module.addDeserializer(").append(type).append(".class, new ValueDeserializer());\n");
        sb.append("        return module;\n");
        sb.append("    }\n\n");
    }
}
