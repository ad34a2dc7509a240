package com.ethnicthv.domain.processor;

import com.ethnicthv.domain.processor.diagnostic.DiagnosticReporter;
import com.ethnicthv.domain.processor.model.GeneratedSource;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.*;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import javax.tools.JavaFileObject;
import java.io.IOException;
import java.io.Writer;
import java.util.*;

/**
 * Shared base annotation processor providing common utilities for
 * ValueObjectProcessor and EnumerationProcessor to reduce duplication.
 */
public abstract class BaseProcessor extends AbstractProcessor {
    protected Elements elementUtils;
    protected Types typeUtils;
    protected ProcessorOptions options = ProcessorOptions.defaults();
    protected DiagnosticReporter reporter;

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.elementUtils = processingEnv.getElementUtils();
        this.typeUtils = processingEnv.getTypeUtils();
        Set<String> unknownCodes = new LinkedHashSet<>();
        this.options = ProcessorOptions.from(processingEnv.getOptions(), unknownCodes);
        this.reporter = new DiagnosticReporter(processingEnv.getMessager(), options);
        for (String code : unknownCodes) {
            warning("Unknown diagnostic code '%s' in -A%s", code, ProcessorOptions.DISABLED_WARNINGS);
        }
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public Set<String> getSupportedOptions() {
        return ProcessorOptions.SUPPORTED;
    }

    // ---------------------------------------------------------------------
    // Messaging helpers
    // ---------------------------------------------------------------------
    protected void error(Element e, String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                String.format(Locale.ROOT, fmt, args), e);
    }
    protected void warning(String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.WARNING,
                String.format(Locale.ROOT, fmt, args));
    }
    /** Progress output, only printed with {@code -Adomainbase.verbose=true}. */
    protected void note(String fmt, Object... args) {
        if (!options.verbose()) return;
        processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE,
                String.format(Locale.ROOT, fmt, args));
    }

    // ---------------------------------------------------------------------
    // Element helpers
    // ---------------------------------------------------------------------
    protected TypeElement getTypeElement(String fqn) {
        return elementUtils.getTypeElement(fqn);
    }

    /**
     * All types declared in this round's root elements, nested types included, outer before inner.
     */
    protected List<TypeElement> collectTypes(RoundEnvironment roundEnv) {
        List<TypeElement> out = new ArrayList<>();
        for (Element root : roundEnv.getRootElements()) {
            collectTypes(root, out);
        }
        return out;
    }

    private static void collectTypes(Element e, List<TypeElement> out) {
        if (!(e instanceof TypeElement te)) return;
        out.add(te);
        for (Element enclosed : te.getEnclosedElements()) {
            collectTypes(enclosed, out);
        }
    }

    /**
     * Writes a generated source file, originating from {@code origin}. Failures are reported as errors
     * on the originating element.
     */
    protected boolean writeSource(GeneratedSource source, Element origin) {
        try {
            JavaFileObject file = processingEnv.getFiler().createSourceFile(source.qualifiedName(), origin);
            try (Writer w = file.openWriter()) {
                w.write(source.content());
            }
            note("Generated %s", source.qualifiedName());
            return true;
        } catch (IOException ex) {
            error(origin, "Failed to generate %s: %s", source.qualifiedName(), ex.getMessage());
            return false;
        }
    }

    // ---------------------------------------------------------------------
    // Annotation mirror utilities (static for easy import)
    // ---------------------------------------------------------------------
    public static boolean hasAnnotation(Element e, String fqn) {
        return getAnnotation(e, fqn) != null;
    }
    public static AnnotationMirror getAnnotation(Element e, String fqn) {
        for (AnnotationMirror am : e.getAnnotationMirrors()) {
            if (((TypeElement) am.getAnnotationType().asElement()).getQualifiedName().contentEquals(fqn)) return am;
        }
        return null;
    }
    public static String annotationSimpleName(AnnotationMirror am) {
        return am.getAnnotationType().asElement().getSimpleName().toString();
    }
    /** Whether {@code name} was written explicitly; defaults are not part of the element values. */
    public static boolean isExplicit(AnnotationMirror am, String name) {
        return readValue(am, name) != null;
    }
    public static int readInt(AnnotationMirror am, String name, int defaultValue) {
        Object v = readValue(am, name);
        return v instanceof Integer i ? i : defaultValue;
    }
    public static boolean readBoolean(AnnotationMirror am, String name, boolean defaultValue) {
        Object v = readValue(am, name);
        return v instanceof Boolean b ? b : defaultValue;
    }
    private static Object readValue(AnnotationMirror am, String name) {
        if (am == null) return null;
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> e : am.getElementValues().entrySet()) {
            if (e.getKey().getSimpleName().contentEquals(name)) return e.getValue().getValue();
        }
        return null;
    }
}
