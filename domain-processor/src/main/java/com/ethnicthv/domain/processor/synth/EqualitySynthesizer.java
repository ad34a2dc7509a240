package com.ethnicthv.domain.processor.synth;

import com.ethnicthv.domain.processor.TypeNames;
import com.ethnicthv.domain.processor.model.*;

import java.util.StringJoiner;

/**
 * Emits the {@code <Flat>__ValueObject} subclass for a validated contract. Output depends only on the
 * contract, so the same declaration always yields byte-identical source.
 */
public final class EqualitySynthesizer {
    private final String generatorName;
    private final boolean generatedAnnotation;

    public EqualitySynthesizer(String generatorName, boolean generatedAnnotation) {
        this.generatorName = generatorName;
        this.generatedAnnotation = generatedAnnotation;
    }

    public GeneratedSource synthesize(EqualityContract contract) {
        HostDeclaration host = contract.host();
        String generated = host.generatedSimpleName();
        StringBuilder sb = new StringBuilder();

        if (!host.packageName().isEmpty()) {
            sb.append("package ").append(host.packageName()).append(";\n\n");
        }
        if (generatedAnnotation) {
            sb.append("@javax.annotation.processing.Generated(\"").append(generatorName).append("\")\n");
        }
        sb.append("@SuppressWarnings(\"all\")\n");
        sb.append("final class ").append(generated).append(host.typeParameters())
                .append(" extends ").append(host.qualifiedName()).append(host.typeArguments()).append(" {\n");

        for (ConstructorSignature ctor : host.constructors()) {
            appendConstructor(sb, generated, ctor);
        }

        String self = host.selfType();
        sb.append("    @Override\n");
        sb.append("    protected boolean equalsCore(").append(self).append(" other) {\n");
        for (ContractEntry e : contract.entries()) {
            appendEntryComment(sb, e);
            sb.append("        if (!").append(equalsExpression(host, e)).append(") return false;\n");
        }
        sb.append("        return true;\n");
        sb.append("    }\n\n");

        sb.append("    @Override\n");
        sb.append("    protected int hashCodeCore() {\n");
        sb.append("        int hash = 1;\n");
        for (ContractEntry e : contract.entries()) {
            appendEntryComment(sb, e);
            sb.append("        hash = 31 * hash + ").append(hashExpression(host, e)).append(";\n");
        }
        sb.append("        return hash;\n");
        sb.append("    }\n");
        sb.append("}\n");
        return new GeneratedSource(host.generatedQualifiedName(), sb.toString());
    }

    private static void appendConstructor(StringBuilder sb, String generated, ConstructorSignature ctor) {
        StringJoiner params = new StringJoiner(", ");
        StringJoiner args = new StringJoiner(", ");
        int count = ctor.parameters().size();
        for (int i = 0; i < count; i++) {
            ConstructorSignature.Parameter p = ctor.parameters().get(i);
            String type = p.type();
            if (ctor.varargs() && i == count - 1 && type.endsWith("[]")) {
                type = type.substring(0, type.length() - 2) + "...";
            }
            params.add(type + " " + p.name());
            args.add(p.name());
        }
        sb.append("    ");
        if (!ctor.typeParameters().isEmpty()) sb.append(ctor.typeParameters()).append(' ');
        sb.append(generated).append('(').append(params).append(')');
        if (!ctor.thrownTypes().isEmpty()) {
            sb.append(" throws ").append(String.join(", ", ctor.thrownTypes()));
        }
        sb.append(" {\n");
        sb.append("        super(").append(args).append(");\n");
        sb.append("    }\n\n");
    }

    private static void appendEntryComment(StringBuilder sb, ContractEntry e) {
        sb.append("        // order ").append(e.strategy().order()).append(": ").append(e.member().name()).append('\n');
    }

    // ---------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------
    static String equalsExpression(HostDeclaration host, ContractEntry e) {
        Member m = e.member();
        String a = "this." + m.accessExpression();
        String b = "other." + m.accessExpression();
        EqualityStrategy s = e.strategy();
        if (s instanceof EqualityStrategy.Custom) {
            return host.qualifiedName() + "." + e.companion().equalsName() + "(" + a + ", " + b + ")";
        }
        if (s instanceof EqualityStrategy.Sequence seq) {
            return TypeNames.SEQUENCE_COMPARISON + ".sequenceEquals(" + a + ", " + b + ", "
                    + seq.orderMatters() + ", " + seq.deepEquality() + ")";
        }
        switch (m.type().category()) {
            case PRIMITIVE:
                if (m.type().name().equals("float")) return "(java.lang.Float.compare(" + a + ", " + b + ") == 0)";
                if (m.type().name().equals("double")) return "(java.lang.Double.compare(" + a + ", " + b + ") == 0)";
                return "(" + a + " == " + b + ")";
            case PRIMITIVE_ARRAY:
                return "java.util.Arrays.equals(" + a + ", " + b + ")";
            case REFERENCE_ARRAY:
                return "java.util.Arrays.deepEquals(" + a + ", " + b + ")";
            default:
                return "java.util.Objects.equals(" + a + ", " + b + ")";
        }
    }

    static String hashExpression(HostDeclaration host, ContractEntry e) {
        Member m = e.member();
        String a = "this." + m.accessExpression();
        EqualityStrategy s = e.strategy();
        if (s instanceof EqualityStrategy.Custom) {
            return host.qualifiedName() + "." + e.companion().hashCodeName() + "(" + a + ")";
        }
        if (s instanceof EqualityStrategy.Sequence seq) {
            return TypeNames.SEQUENCE_COMPARISON + ".sequenceHashCode(" + a + ", "
                    + seq.orderMatters() + ", " + seq.deepEquality() + ")";
        }
        switch (m.type().category()) {
            case PRIMITIVE:
                return boxName(m.type().name()) + ".hashCode(" + a + ")";
            case PRIMITIVE_ARRAY:
                return "java.util.Arrays.hashCode(" + a + ")";
            case REFERENCE_ARRAY:
                return "java.util.Arrays.deepHashCode(" + a + ")";
            default:
                return "java.util.Objects.hashCode(" + a + ")";
        }
    }

    private static String boxName(String primitive) {
        switch (primitive) {
            case "boolean": return "java.lang.Boolean";
            case "byte": return "java.lang.Byte";
            case "short": return "java.lang.Short";
            case "char": return "java.lang.Character";
            case "long": return "java.lang.Long";
            case "float": return "java.lang.Float";
            case "double": return "java.lang.Double";
            default: return "java.lang.Integer";
        }
    }
}
