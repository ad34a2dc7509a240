package com.ethnicthv.domain.processor.enumeration;

import com.ethnicthv.domain.processor.TypeNames;
import com.ethnicthv.domain.processor.classify.MemberClassifier;
import com.ethnicthv.domain.processor.model.SourceLocation;
import com.sun.source.tree.*;
import com.sun.source.util.Trees;

import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.*;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.ethnicthv.domain.processor.BaseProcessor.*;

/**
 * Reads enumeration constants and their literal constructor arguments. Argument values come from the
 * source trees, so extraction needs javac's {@link Trees}; without it every constant is treated as
 * non-literal.
 */
public final class EnumerationExtractor {
    private final Elements elements;
    private final Types types;
    private final Trees trees;

    public EnumerationExtractor(ProcessingEnvironment env) {
        this.elements = env.getElementUtils();
        this.types = env.getTypeUtils();
        this.trees = treesOrNull(env);
    }

    private static Trees treesOrNull(ProcessingEnvironment env) {
        try {
            return Trees.instance(env);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    public boolean hasSourceTrees() {
        return trees != null;
    }

    public boolean isEnumerationSubclass(TypeElement type) {
        TypeElement base = elements.getTypeElement(TypeNames.ENUMERATION);
        if (base == null || type.getKind() != ElementKind.CLASS) return false;
        if (type.getQualifiedName().contentEquals(TypeNames.ENUMERATION)) return false;
        return types.isSubtype(types.erasure(type.asType()), types.erasure(base.asType()));
    }

    public EnumerationDeclaration extract(TypeElement host) {
        TypeMirror hostType = types.erasure(host.asType());
        List<EnumerationConstant> constants = new ArrayList<>();
        int position = 0;
        for (VariableElement field : ElementFilter.fieldsIn(host.getEnclosedElements())) {
            Set<Modifier> mods = field.getModifiers();
            if (!mods.contains(Modifier.STATIC) || !mods.contains(Modifier.FINAL)) continue;
            if (!types.isSameType(types.erasure(field.asType()), hostType)) continue;
            boolean referenceable = !mods.contains(Modifier.PRIVATE);
            // without trees a private constant can be neither checked nor listed
            if (!referenceable && trees == null) continue;

            SourceLocation location = new SourceLocation(host.getSimpleName() + "." + field.getSimpleName(), field);
            Integer value = null;
            String name = null;
            if (trees != null) {
                NewClassTree init = constructorCall(field);
                if (init == null) continue;
                List<? extends ExpressionTree> args = init.getArguments();
                value = intLiteral(args.get(0));
                name = stringLiteral(args.get(1));
            }
            constants.add(new EnumerationConstant(field.getSimpleName().toString(), value, name, referenceable, position++, location));
        }

        return new EnumerationDeclaration(
                host.getQualifiedName().toString(),
                host.getSimpleName().toString(),
                elements.getPackageOf(host).getQualifiedName().toString(),
                MemberClassifier.flatName(host),
                hasAnnotation(host, TypeNames.ENUMERATION_TYPE),
                isEnumerationSubclass(host),
                MemberClassifier.isReachable(host),
                isPublic(host),
                jsonConverterRequested(host),
                constants,
                new SourceLocation(host.getSimpleName().toString(), host));
    }

    /**
     * The {@code new Host(a, b, ...)} initializer of a field, or {@code null} if the field is initialized
     * any other way or with fewer than two arguments.
     */
    private NewClassTree constructorCall(VariableElement field) {
        Tree tree = trees.getTree(field);
        if (!(tree instanceof VariableTree vt)) return null;
        ExpressionTree init = vt.getInitializer();
        while (init instanceof ParenthesizedTree pt) init = pt.getExpression();
        if (!(init instanceof NewClassTree nc)) return null;
        return nc.getArguments().size() >= 2 ? nc : null;
    }

    static Integer intLiteral(ExpressionTree expr) {
        if (expr instanceof ParenthesizedTree pt) return intLiteral(pt.getExpression());
        if (expr instanceof LiteralTree lt && lt.getValue() instanceof Integer i) return i;
        if (expr instanceof UnaryTree ut && ut.getKind() == Tree.Kind.UNARY_MINUS
                && ut.getExpression() instanceof LiteralTree lt && lt.getValue() instanceof Integer i) {
            return -i;
        }
        return null;
    }

    static String stringLiteral(ExpressionTree expr) {
        if (expr instanceof ParenthesizedTree pt) return stringLiteral(pt.getExpression());
        if (expr instanceof LiteralTree lt && lt.getValue() instanceof String s) return s;
        return null;
    }

    private static boolean jsonConverterRequested(TypeElement host) {
        AnnotationMirror marker = getAnnotation(host, TypeNames.ENUMERATION_TYPE);
        return marker != null && readBoolean(marker, "generateJsonConverter", true);
    }

    private static boolean isPublic(TypeElement type) {
        Element current = type;
        while (current instanceof TypeElement te) {
            if (!te.getModifiers().contains(Modifier.PUBLIC)) return false;
            current = te.getEnclosingElement();
        }
        return true;
    }
}
