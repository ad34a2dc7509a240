package com.ethnicthv.domain.processor.classify;

import com.ethnicthv.domain.processor.TypeNames;
import com.ethnicthv.domain.processor.model.*;

import javax.lang.model.element.*;
import javax.lang.model.type.ArrayType;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.*;
import java.util.stream.Collectors;

import static com.ethnicthv.domain.processor.BaseProcessor.*;

/**
 * Reads a host type's declaration into a {@link HostDeclaration}. Only the declaration is inspected:
 * instance fields become members, strategy annotations are read from annotation mirrors, and
 * methods are collected as companion candidates.
 */
public final class MemberClassifier {
    private final Elements elements;
    private final Types types;

    public MemberClassifier(Elements elements, Types types) {
        this.elements = elements;
        this.types = types;
    }

    public HostDeclaration classify(TypeElement host) {
        String qualifiedName = host.getQualifiedName().toString();
        String simpleName = host.getSimpleName().toString();
        String packageName = elements.getPackageOf(host).getQualifiedName().toString();

        DeclaredType valueObjectSuper = null;
        HostShape shape = HostShape.OTHER;
        if (host.getKind() == ElementKind.CLASS) {
            // directSupertypes substitutes type arguments along the way, superclass first
            TypeMirror current = host.asType();
            while (true) {
                List<? extends TypeMirror> supers = types.directSupertypes(current);
                if (supers.isEmpty() || supers.get(0).getKind() != TypeKind.DECLARED) break;
                DeclaredType sup = (DeclaredType) supers.get(0);
                String name = ((TypeElement) sup.asElement()).getQualifiedName().toString();
                if (name.equals(TypeNames.SIMPLE_VALUE_OBJECT)) {
                    shape = HostShape.WRAPPER;
                    break;
                }
                if (name.equals(TypeNames.VALUE_OBJECT)) {
                    shape = HostShape.VALUE_OBJECT;
                    valueObjectSuper = sup;
                    break;
                }
                current = sup;
            }
        }
        String selfType = null;
        boolean selfTypeIsHost = false;
        if (valueObjectSuper != null && valueObjectSuper.getTypeArguments().size() == 1) {
            TypeMirror typeArgument = valueObjectSuper.getTypeArguments().get(0);
            selfType = typeArgument.toString();
            selfTypeIsHost = types.isSameType(typeArgument, host.asType());
        }

        List<ExecutableElement> methods = ElementFilter.methodsIn(host.getEnclosedElements());
        List<Member> members = new ArrayList<>();
        int position = 0;
        for (VariableElement field : ElementFilter.fieldsIn(host.getEnclosedElements())) {
            if (field.getModifiers().contains(Modifier.STATIC)) continue;
            members.add(classifyField(host, field, methods, position++));
        }

        List<MisplacedStrategy> misplaced = new ArrayList<>();
        List<CompanionMethod> companions = new ArrayList<>();
        for (ExecutableElement method : methods) {
            List<String> found = new ArrayList<>();
            for (String anno : TypeNames.STRATEGY_ANNOTATIONS) {
                AnnotationMirror am = getAnnotation(method, anno);
                if (am != null) found.add("@" + annotationSimpleName(am));
            }
            String methodName = method.getSimpleName().toString();
            if (!found.isEmpty()) {
                misplaced.add(new MisplacedStrategy(methodName, found,
                        new SourceLocation(simpleName + "." + methodName + "()", method)));
            }
            companions.add(new CompanionMethod(methodName, method.getParameters().size(),
                    method.getReturnType().toString(),
                    method.getModifiers().contains(Modifier.STATIC),
                    method.getModifiers().contains(Modifier.PRIVATE)));
        }

        List<ConstructorSignature> constructors = new ArrayList<>();
        for (ExecutableElement ctor : ElementFilter.constructorsIn(host.getEnclosedElements())) {
            if (ctor.getModifiers().contains(Modifier.PRIVATE)) continue;
            constructors.add(toSignature(ctor));
        }

        return new HostDeclaration(
                qualifiedName,
                simpleName,
                packageName,
                flatName(host),
                hasAnnotation(host, TypeNames.VALUE_OBJECT_TYPE),
                shape,
                isExtensible(host, constructors),
                selfType,
                selfTypeIsHost,
                typeParameterClause(host.getTypeParameters(), true),
                typeParameterClause(host.getTypeParameters(), false),
                members,
                misplaced,
                companions,
                constructors,
                new SourceLocation(simpleName, host));
    }

    // ---------------------------------------------------------------------
    // Members
    // ---------------------------------------------------------------------
    private Member classifyField(TypeElement host, VariableElement field, List<ExecutableElement> methods, int position) {
        String name = field.getSimpleName().toString();
        Set<Modifier> mods = field.getModifiers();
        TypeMirror type = field.asType();

        ExecutableElement accessor = findAccessor(name, type, methods);
        boolean setter = methods.stream().anyMatch(m -> !m.getModifiers().contains(Modifier.STATIC)
                && m.getParameters().size() == 1
                && m.getSimpleName().contentEquals("set" + capitalize(name)));

        String access;
        if (!mods.contains(Modifier.PRIVATE)) {
            access = name;
        } else if (accessor != null) {
            access = accessor.getSimpleName() + "()";
        } else {
            access = null;
        }

        boolean ignorable = mods.contains(Modifier.TRANSIENT)
                || elements.getOrigin(field) == Elements.Origin.SYNTHETIC;

        return new Member(
                name,
                accessor != null ? MemberKind.PROPERTY : MemberKind.FIELD,
                new MemberType(type.toString(), categorize(type)),
                position,
                readStrategies(field),
                mods.contains(Modifier.FINAL),
                setter,
                access,
                ignorable,
                new SourceLocation(host.getSimpleName() + "." + name, field));
    }

    private ExecutableElement findAccessor(String name, TypeMirror type, List<ExecutableElement> methods) {
        String cap = capitalize(name);
        List<String> candidates = new ArrayList<>();
        candidates.add("get" + cap);
        if (type.getKind() == TypeKind.BOOLEAN) candidates.add("is" + cap);
        candidates.add(name);
        for (String candidate : candidates) {
            for (ExecutableElement m : methods) {
                if (!m.getSimpleName().contentEquals(candidate)) continue;
                Set<Modifier> mods = m.getModifiers();
                if (mods.contains(Modifier.STATIC) || mods.contains(Modifier.PRIVATE)) continue;
                if (!m.getParameters().isEmpty()) continue;
                if (!types.isSameType(m.getReturnType(), type)) continue;
                return m;
            }
        }
        return null;
    }

    private List<EqualityStrategy> readStrategies(Element e) {
        List<EqualityStrategy> out = new ArrayList<>();
        for (AnnotationMirror am : e.getAnnotationMirrors()) {
            String fqn = ((TypeElement) am.getAnnotationType().asElement()).getQualifiedName().toString();
            int order = readInt(am, "order", 0);
            boolean explicit = isExplicit(am, "order");
            switch (fqn) {
                case TypeNames.INCLUDE_IN_EQUALITY -> out.add(new EqualityStrategy.Include(order, explicit));
                case TypeNames.IGNORE_EQUALITY -> out.add(new EqualityStrategy.Ignore());
                case TypeNames.SEQUENCE_EQUALITY -> out.add(new EqualityStrategy.Sequence(order, explicit,
                        readBoolean(am, "orderMatters", true), readBoolean(am, "deepEquality", true)));
                case TypeNames.CUSTOM_EQUALITY -> out.add(new EqualityStrategy.Custom(order, explicit));
                default -> { }
            }
        }
        return out;
    }

    TypeCategory categorize(TypeMirror type) {
        if (type.getKind().isPrimitive()) return TypeCategory.PRIMITIVE;
        if (type.getKind() == TypeKind.ARRAY) {
            return ((ArrayType) type).getComponentType().getKind().isPrimitive()
                    ? TypeCategory.PRIMITIVE_ARRAY
                    : TypeCategory.REFERENCE_ARRAY;
        }
        if (type.getKind() != TypeKind.DECLARED && type.getKind() != TypeKind.TYPEVAR) return TypeCategory.REFERENCE;
        TypeMirror erased = types.erasure(type);
        if (isSubtypeOf(erased, "java.lang.CharSequence")) return TypeCategory.TEXT;
        if (isSubtypeOf(erased, "java.lang.Iterable")) return TypeCategory.SEQUENCE;
        return TypeCategory.REFERENCE;
    }

    private boolean isSubtypeOf(TypeMirror erased, String fqn) {
        TypeElement target = elements.getTypeElement(fqn);
        return target != null && types.isAssignable(erased, types.erasure(target.asType()));
    }

    // ---------------------------------------------------------------------
    // Host facts
    // ---------------------------------------------------------------------

    /**
     * A generated subclass can complete the host when the host is an abstract class reachable from its
     * package, static if nested, with at least one non-private constructor.
     */
    private static boolean isExtensible(TypeElement host, List<ConstructorSignature> constructors) {
        if (host.getKind() != ElementKind.CLASS) return false;
        if (!host.getModifiers().contains(Modifier.ABSTRACT)) return false;
        if (!isReachable(host)) return false;
        return !constructors.isEmpty();
    }

    /**
     * Not private, not inside a private type, and static when nested.
     */
    public static boolean isReachable(TypeElement type) {
        Element current = type;
        while (current instanceof TypeElement te) {
            Set<Modifier> mods = te.getModifiers();
            if (mods.contains(Modifier.PRIVATE)) return false;
            Element enclosing = te.getEnclosingElement();
            boolean nested = enclosing instanceof TypeElement;
            if (nested && te.getKind() == ElementKind.CLASS && !mods.contains(Modifier.STATIC)) return false;
            if (!nested && enclosing.getKind() != ElementKind.PACKAGE) return false;
            current = enclosing;
        }
        return true;
    }

    /**
     * Nesting path joined with {@code _}: {@code Outer.Inner} becomes {@code Outer_Inner}.
     */
    public static String flatName(TypeElement type) {
        Deque<String> parts = new ArrayDeque<>();
        Element current = type;
        while (current instanceof TypeElement te) {
            parts.addFirst(te.getSimpleName().toString());
            current = te.getEnclosingElement();
        }
        return String.join("_", parts);
    }

    private ConstructorSignature toSignature(ExecutableElement ctor) {
        List<ConstructorSignature.Parameter> params = new ArrayList<>();
        for (VariableElement p : ctor.getParameters()) {
            params.add(new ConstructorSignature.Parameter(p.asType().toString(), p.getSimpleName().toString()));
        }
        List<String> thrown = ctor.getThrownTypes().stream().map(TypeMirror::toString).collect(Collectors.toList());
        return new ConstructorSignature(typeParameterClause(ctor.getTypeParameters(), true), params, ctor.isVarArgs(), thrown);
    }

    static String typeParameterClause(List<? extends TypeParameterElement> params, boolean withBounds) {
        if (params.isEmpty()) return "";
        StringJoiner sj = new StringJoiner(", ", "<", ">");
        for (TypeParameterElement p : params) {
            StringBuilder sb = new StringBuilder(p.getSimpleName());
            if (withBounds) {
                List<String> bounds = new ArrayList<>();
                for (TypeMirror b : p.getBounds()) {
                    String s = b.toString();
                    if (!s.equals("java.lang.Object")) bounds.add(s);
                }
                if (!bounds.isEmpty()) sb.append(" extends ").append(String.join(" & ", bounds));
            }
            sj.add(sb);
        }
        return sj.toString();
    }

    static String capitalize(String name) {
        if (name.isEmpty()) return name;
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
