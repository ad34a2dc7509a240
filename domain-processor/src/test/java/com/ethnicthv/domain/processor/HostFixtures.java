package com.ethnicthv.domain.processor;

import com.ethnicthv.domain.processor.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-built {@link HostDeclaration}s for exercising the pure pipeline stages without javac.
 */
public final class HostFixtures {
    private final String simpleName;
    private boolean marked = true;
    private HostShape shape = HostShape.VALUE_OBJECT;
    private boolean extensible = true;
    private String foreignSelfType;
    private final List<Member> members = new ArrayList<>();
    private final List<MisplacedStrategy> misplaced = new ArrayList<>();
    private final List<CompanionMethod> methods = new ArrayList<>();
    private final List<ConstructorSignature> constructors = new ArrayList<>();

    private HostFixtures(String simpleName) {
        this.simpleName = simpleName;
    }

    public static HostFixtures host(String simpleName) {
        return new HostFixtures(simpleName);
    }

    // ---------------------------------------------------------------------
    // Strategies
    // ---------------------------------------------------------------------
    public static EqualityStrategy include() {
        return new EqualityStrategy.Include(0, false);
    }
    public static EqualityStrategy include(int order) {
        return new EqualityStrategy.Include(order, true);
    }
    public static EqualityStrategy custom() {
        return new EqualityStrategy.Custom(0, false);
    }
    public static EqualityStrategy custom(int order) {
        return new EqualityStrategy.Custom(order, true);
    }
    public static EqualityStrategy sequence(boolean orderMatters, boolean deepEquality) {
        return new EqualityStrategy.Sequence(0, false, orderMatters, deepEquality);
    }
    public static EqualityStrategy ignore() {
        return new EqualityStrategy.Ignore();
    }

    // ---------------------------------------------------------------------
    // Host facts
    // ---------------------------------------------------------------------
    public HostFixtures unmarked() {
        this.marked = false;
        return this;
    }
    public HostFixtures shape(HostShape shape) {
        this.shape = shape;
        return this;
    }
    public HostFixtures notExtensible() {
        this.extensible = false;
        return this;
    }
    public HostFixtures selfType(String qualifiedName) {
        this.foreignSelfType = qualifiedName;
        return this;
    }

    // ---------------------------------------------------------------------
    // Members
    // ---------------------------------------------------------------------
    public HostFixtures field(String name, String type, TypeCategory category, EqualityStrategy... strategies) {
        return add(name, MemberKind.FIELD, type, category, true, false, name, false, strategies);
    }
    public HostFixtures mutableField(String name, String type, TypeCategory category, EqualityStrategy... strategies) {
        return add(name, MemberKind.FIELD, type, category, false, false, name, false, strategies);
    }
    public HostFixtures property(String name, String type, TypeCategory category, boolean finalField, boolean setter, EqualityStrategy... strategies) {
        String accessor = "get" + Character.toUpperCase(name.charAt(0)) + name.substring(1) + "()";
        return add(name, MemberKind.PROPERTY, type, category, finalField, setter, accessor, false, strategies);
    }
    public HostFixtures unreadableField(String name, String type, TypeCategory category, EqualityStrategy... strategies) {
        return add(name, MemberKind.FIELD, type, category, true, false, null, false, strategies);
    }
    public HostFixtures transientField(String name, String type, TypeCategory category) {
        return add(name, MemberKind.FIELD, type, category, false, false, name, true);
    }

    private HostFixtures add(String name, MemberKind kind, String type, TypeCategory category, boolean finalField,
                             boolean setter, String access, boolean ignorable, EqualityStrategy... strategies) {
        members.add(new Member(name, kind, new MemberType(type, category), members.size(), List.of(strategies),
                finalField, setter, access, ignorable, SourceLocation.of(simpleName + "." + name)));
        return this;
    }

    public HostFixtures misplaced(String methodName, String... annotations) {
        misplaced.add(new MisplacedStrategy(methodName, List.of(annotations), SourceLocation.of(simpleName + "." + methodName + "()")));
        return this;
    }

    public HostFixtures method(String name, int parameters, String returnType) {
        methods.add(new CompanionMethod(name, parameters, returnType, true, false));
        return this;
    }

    public HostFixtures method(CompanionMethod method) {
        methods.add(method);
        return this;
    }

    public HostFixtures constructor(ConstructorSignature signature) {
        constructors.add(signature);
        return this;
    }

    public HostDeclaration build() {
        return new HostDeclaration(
                "com.acme." + simpleName,
                simpleName,
                "com.acme",
                simpleName,
                marked,
                shape,
                extensible,
                shape != HostShape.VALUE_OBJECT ? null
                        : foreignSelfType != null ? foreignSelfType : "com.acme." + simpleName,
                shape == HostShape.VALUE_OBJECT && foreignSelfType == null,
                "",
                "",
                members,
                misplaced,
                methods,
                constructors,
                SourceLocation.of(simpleName));
    }
}
