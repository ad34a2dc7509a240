package com.ethnicthv.domain.processor;

import com.ethnicthv.domain.processor.classify.MemberClassifier;
import com.ethnicthv.domain.processor.model.EqualityContract;
import com.ethnicthv.domain.processor.model.HostDeclaration;
import com.ethnicthv.domain.processor.synth.EqualitySynthesizer;
import com.ethnicthv.domain.processor.validate.ContractValidator;
import com.ethnicthv.domain.processor.validate.ValidationResult;
import com.google.auto.service.AutoService;

import javax.annotation.processing.*;
import javax.lang.model.element.TypeElement;
import java.util.*;

/**
 * Annotation processor that validates equality contracts and generates, for each valid
 * {@code @ValueObjectType} host, a {@code <Flat>__ValueObject} subclass implementing
 * {@code equalsCore} and {@code hashCodeCore} from the member annotations.
 * <p>
 * Every type in the round is inspected, not only marked ones: strategy annotations outside a
 * marked host and extra members on {@code SimpleValueObject} subclasses are diagnosed too.
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes("*")
public class ValueObjectProcessor extends BaseProcessor {
    private MemberClassifier classifier;
    private final ContractValidator validator = new ContractValidator();
    private EqualitySynthesizer synthesizer;
    // Hosts already handled in an earlier round
    private final Set<String> processed = new HashSet<>();

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------
    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.classifier = new MemberClassifier(elementUtils, typeUtils);
        this.synthesizer = new EqualitySynthesizer(getClass().getName(), options.generatedAnnotation());
        note("ValueObjectProcessor init");
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        if (getTypeElement(TypeNames.VALUE_OBJECT) == null) {
            note("%s not on the classpath; skipping round", TypeNames.VALUE_OBJECT);
            return false;
        }
        List<TypeElement> types = collectTypes(roundEnv);
        note("Processing round: types=%d over=%s", types.size(), roundEnv.processingOver());
        for (TypeElement type : types) {
            if (!processed.add(type.getQualifiedName().toString())) continue;
            processHost(type);
        }
        return false;
    }

    private void processHost(TypeElement type) {
        HostDeclaration host = classifier.classify(type);
        ValidationResult result = validator.validate(host);
        reporter.reportAll(result.diagnostics());
        if (result.contract().isEmpty()) {
            if (host.marked()) note("No equality generated for %s (%d diagnostics)", host.qualifiedName(), result.diagnostics().size());
            return;
        }
        EqualityContract contract = result.contract().get();
        note("Generating %s with %d entries", host.generatedQualifiedName(), contract.entries().size());
        writeSource(synthesizer.synthesize(contract), type);
    }
}
