package com.ethnicthv.domain.processor.validate;

import com.ethnicthv.domain.processor.diagnostic.Diagnostic;
import com.ethnicthv.domain.processor.diagnostic.DiagnosticCode;
import com.ethnicthv.domain.processor.model.*;

import java.util.*;

/**
 * Applies the structural rules to a {@link HostDeclaration}. Every independently detectable violation
 * is reported in one pass; any error means no contract.
 */
public final class ContractValidator {

    public ValidationResult validate(HostDeclaration host) {
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (host.shape() == HostShape.WRAPPER) {
            checkWrapper(host, diagnostics);
            return new ValidationResult(diagnostics, Optional.empty());
        }
        if (!host.marked()) {
            checkOutsideContract(host, diagnostics);
            return new ValidationResult(diagnostics, Optional.empty());
        }

        if (host.shape() != HostShape.VALUE_OBJECT || host.selfType() == null) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.VO008, host.location(),
                    "'%s' is marked @ValueObjectType but does not extend ValueObject<T>", host.simpleName()));
        } else if (!host.selfTypeIsHost()) {
            // covers subclasses of another contract host as well as ValueObject<SomethingElse>
            diagnostics.add(Diagnostic.of(DiagnosticCode.VO008, host.location(),
                    "'%s' is marked @ValueObjectType but its ValueObject type argument is %s. It must extend ValueObject<%s> directly",
                    host.simpleName(), host.selfType(), host.simpleName()));
        }
        if (!host.extensible()) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.VO001, host.location(),
                    "Value object '%s' must be an abstract, non-private, static (if nested) class with a non-private constructor so its equality can be generated",
                    host.simpleName()));
        }
        checkMisplaced(host, diagnostics);

        List<ContractEntry> entries = new ArrayList<>();
        Map<String, Member> customBySuffix = new HashMap<>();
        for (Member m : host.members()) {
            ContractEntry entry = checkMember(host, m, customBySuffix, diagnostics);
            if (entry != null) entries.add(entry);
        }
        checkOrderCollisions(host, entries, diagnostics);

        if (diagnostics.stream().anyMatch(Diagnostic::isError)) {
            return new ValidationResult(diagnostics, Optional.empty());
        }
        entries.sort(Comparator
                .comparingInt((ContractEntry e) -> e.strategy().order())
                .thenComparingInt(e -> e.member().declarationPosition()));
        return new ValidationResult(diagnostics, Optional.of(new EqualityContract(host, entries)));
    }

    // ---------------------------------------------------------------------
    // Host-level rules
    // ---------------------------------------------------------------------
    private static void checkWrapper(HostDeclaration host, List<Diagnostic> out) {
        if (host.marked()) {
            out.add(Diagnostic.of(DiagnosticCode.VO014, host.location(),
                    "'%s' extends SimpleValueObject. @ValueObjectType is unnecessary and ignored", host.simpleName()));
        }
        for (Member m : host.members()) {
            out.add(Diagnostic.of(DiagnosticCode.VO012, m.location(),
                    "Simple value object '%s' should not declare additional %s '%s'. Only the wrapped value takes part in equality",
                    host.simpleName(), m.kind().displayName(), m.name()));
        }
        checkMisplaced(host, out);
    }

    private static void checkMisplaced(HostDeclaration host, List<Diagnostic> out) {
        for (MisplacedStrategy m : host.misplacedStrategies()) {
            out.add(Diagnostic.of(DiagnosticCode.VO015, m.location(),
                    "%s on method '%s()' is invalid. Only fields and properties are supported",
                    String.join(", ", m.annotationNames()), m.methodName()));
        }
    }

    private static void checkOutsideContract(HostDeclaration host, List<Diagnostic> out) {
        for (Member m : host.members()) {
            for (EqualityStrategy s : m.strategies()) {
                out.add(Diagnostic.of(DiagnosticCode.VO007, m.location(),
                        "The %s '%s' has %s but '%s' is not marked @ValueObjectType",
                        m.kind().displayName(), m.name(), s.annotationName(), host.simpleName()));
            }
        }
        for (MisplacedStrategy ms : host.misplacedStrategies()) {
            for (String anno : ms.annotationNames()) {
                out.add(Diagnostic.of(DiagnosticCode.VO007, ms.location(),
                        "The method '%s()' has %s but '%s' is not marked @ValueObjectType",
                        ms.methodName(), anno, host.simpleName()));
            }
        }
    }

    // ---------------------------------------------------------------------
    // Member-level rules
    // ---------------------------------------------------------------------
    private static ContractEntry checkMember(HostDeclaration host, Member m, Map<String, Member> customBySuffix, List<Diagnostic> out) {
        List<EqualityStrategy> strategies = m.strategies();
        if (strategies.isEmpty()) {
            if (!m.ignorableByPolicy()) {
                out.add(Diagnostic.of(DiagnosticCode.VO002, m.location(),
                        "The %s '%s' in value object '%s' should have an equality annotation",
                        m.kind().displayName(), m.name(), host.simpleName()));
            }
            return null;
        }
        if (strategies.size() > 1) {
            out.add(Diagnostic.of(DiagnosticCode.VO005, m.location(),
                    "The %s '%s' in value object '%s' has multiple equality annotations; only one of @IncludeInEquality, @CustomEquality, @SequenceEquality or @IgnoreEquality is allowed",
                    m.kind().displayName(), m.name(), host.simpleName()));
            return null;
        }
        EqualityStrategy strategy = strategies.get(0);
        if (strategy instanceof EqualityStrategy.Ignore) return null;

        if (!m.isReadable()) {
            out.add(Diagnostic.of(DiagnosticCode.VO015, m.location(),
                    "%s on private field '%s' is invalid. Expose it through a non-private field or accessor",
                    strategy.annotationName(), m.name()));
            return null;
        }

        if (m.kind() == MemberKind.FIELD && !m.finalField()) {
            out.add(Diagnostic.of(DiagnosticCode.VO011, m.location(),
                    "The field '%s' in value object '%s' should be final to enforce immutability", m.name(), host.simpleName()));
        } else if (m.kind() == MemberKind.PROPERTY && (!m.finalField() || m.setterDeclared())) {
            out.add(Diagnostic.of(DiagnosticCode.VO010, m.location(),
                    "The property '%s' in value object '%s' should be backed by a final field without a setter to enforce immutability",
                    m.name(), host.simpleName()));
        }

        if (strategy instanceof EqualityStrategy.Sequence && !m.type().category().isSequenceLike()) {
            out.add(Diagnostic.of(DiagnosticCode.VO006, m.location(),
                    "The %s '%s' has @SequenceEquality but its type %s is not an Iterable or array. Consider @IncludeInEquality instead",
                    m.kind().displayName(), m.name(), m.type().name()));
            return null;
        }

        CompanionFunctionRef companion = null;
        if (strategy instanceof EqualityStrategy.Custom) {
            companion = CompanionFunctionRef.forMember(m.name());
            Member previous = customBySuffix.putIfAbsent(companion.suffix(), m);
            if (previous != null) {
                out.add(Diagnostic.of(DiagnosticCode.VO009, m.location(),
                        "The members '%s' and '%s' would use the same companion names %s/%s. Rename one of them",
                        previous.name(), m.name(), companion.equalsName(), companion.hashCodeName())
                        .withRelated(List.of(previous.location())));
            }
            if (!hasCompanion(host, companion.equalsName(), 2, "boolean")) {
                out.add(Diagnostic.of(DiagnosticCode.VO003, m.location(),
                        "The %s '%s' has @CustomEquality but is missing the required method: static boolean %s(%s a, %s b)",
                        m.kind().displayName(), m.name(), companion.equalsName(), m.type().name(), m.type().name()));
            }
            if (!hasCompanion(host, companion.hashCodeName(), 1, "int")) {
                out.add(Diagnostic.of(DiagnosticCode.VO004, m.location(),
                        "The %s '%s' has @CustomEquality but is missing the required method: static int %s(%s value)",
                        m.kind().displayName(), m.name(), companion.hashCodeName(), m.type().name()));
            }
        }
        return new ContractEntry(m, strategy, companion);
    }

    private static boolean hasCompanion(HostDeclaration host, String name, int parameters, String returnType) {
        for (CompanionMethod method : host.methods()) {
            if (method.matches(name, parameters, returnType)) return true;
        }
        return false;
    }

    /**
     * One warning per explicit order value shared by several participating members, on the second
     * member of the group with the others attached.
     */
    private static void checkOrderCollisions(HostDeclaration host, List<ContractEntry> entries, List<Diagnostic> out) {
        Map<Integer, List<Member>> byOrder = new LinkedHashMap<>();
        for (ContractEntry e : entries) {
            if (!e.strategy().explicitOrder()) continue;
            byOrder.computeIfAbsent(e.strategy().order(), k -> new ArrayList<>()).add(e.member());
        }
        for (Map.Entry<Integer, List<Member>> group : byOrder.entrySet()) {
            List<Member> members = group.getValue();
            if (members.size() < 2) continue;
            Member reported = members.get(1);
            List<SourceLocation> related = new ArrayList<>();
            for (Member m : members) {
                if (m != reported) related.add(m.location());
            }
            out.add(Diagnostic.of(DiagnosticCode.VO013, reported.location(),
                    "The %s '%s' in value object '%s' has the same order value (%d) as another member. Evaluation order falls back to declaration order",
                    reported.kind().displayName(), reported.name(), host.simpleName(), group.getKey())
                    .withRelated(related));
        }
    }
}
