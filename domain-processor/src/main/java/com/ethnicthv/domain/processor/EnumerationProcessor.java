package com.ethnicthv.domain.processor;

import com.ethnicthv.domain.processor.diagnostic.Diagnostic;
import com.ethnicthv.domain.processor.enumeration.EnumerationConstant;
import com.ethnicthv.domain.processor.enumeration.EnumerationDeclaration;
import com.ethnicthv.domain.processor.enumeration.EnumerationExtractor;
import com.ethnicthv.domain.processor.enumeration.EnumerationTableSynthesizer;
import com.ethnicthv.domain.processor.enumeration.EnumerationValidator;
import com.google.auto.service.AutoService;

import javax.annotation.processing.*;
import javax.lang.model.element.TypeElement;
import java.util.*;

/**
 * Annotation processor that checks {@code Enumeration} subclasses for duplicate values and names and
 * generates a {@code <Flat>Values} lookup class for each valid {@code @EnumerationType} host.
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes("*")
public class EnumerationProcessor extends BaseProcessor {
    private EnumerationExtractor extractor;
    private final EnumerationValidator validator = new EnumerationValidator();
    private EnumerationTableSynthesizer synthesizer;
    private final Set<String> processed = new HashSet<>();

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------
    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.extractor = new EnumerationExtractor(processingEnv);
        boolean jackson = getTypeElement(TypeNames.JACKSON_SERIALIZER) != null;
        this.synthesizer = new EnumerationTableSynthesizer(getClass().getName(), options.generatedAnnotation(), jackson);
        if (!extractor.hasSourceTrees()) {
            note("Source trees unavailable; enumeration constants will not be checked for duplicates");
        }
        note("EnumerationProcessor init");
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        for (TypeElement type : collectTypes(roundEnv)) {
            boolean marked = hasAnnotation(type, TypeNames.ENUMERATION_TYPE);
            if (!marked && !extractor.isEnumerationSubclass(type)) continue;
            if (!processed.add(type.getQualifiedName().toString())) continue;
            processEnumeration(type);
        }
        return false;
    }

    private void processEnumeration(TypeElement type) {
        EnumerationDeclaration declaration = extractor.extract(type);
        for (EnumerationConstant c : declaration.constants()) {
            if (c.isLiteral()) continue;
            if (c.referenceable()) {
                note("Constant %s has non-literal arguments; checked at class initialization", c.location());
            } else {
                note("Constant %s is private and has non-literal arguments; not checked for duplicates", c.location());
            }
        }
        List<Diagnostic> diagnostics = validator.validate(declaration);
        reporter.reportAll(diagnostics);
        if (!declaration.marked()) return;
        if (diagnostics.stream().anyMatch(Diagnostic::isError)) {
            note("No lookup table generated for %s", declaration.qualifiedName());
            return;
        }
        if (declaration.jsonConverter() && !synthesizer.emitsJsonConverter(declaration)) {
            note("Jackson not found on the classpath; no JSON converter generated for %s", declaration.qualifiedName());
        }
        writeSource(synthesizer.synthesize(declaration), type);
    }
}
