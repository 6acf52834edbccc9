package com.partialspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.partialspec.config.PartialSpecProperties;
import com.partialspec.dto.request.GenerateRequest;
import com.partialspec.dto.response.DetectionReport;
import com.partialspec.dto.response.GenerateReport;
import com.partialspec.exception.PartialSpecException;
import com.partialspec.model.AffectedOperations;
import com.partialspec.model.Baseline;
import com.partialspec.model.OutputFiles;
import com.partialspec.model.PartialSpecInput;
import com.partialspec.model.PartialSpecResult;
import com.partialspec.service.api.BaselineLoader;
import com.partialspec.service.api.ChangeDetector;
import com.partialspec.service.api.DocumentLoader;
import com.partialspec.service.api.OutputSerializer;
import com.partialspec.service.api.PartialSpecGenerator;
import com.partialspec.service.api.PartialSpecWorkflow;
import com.partialspec.service.api.StructureChecker;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * The file-based front of the engine. All artifacts are read up front; the generator then
 * works purely in memory, and output is written only once everything before it succeeded.
 */
@Service
@Slf4j
public class PartialSpecWorkflowImpl implements PartialSpecWorkflow {

    private final DocumentLoader documentLoader;
    private final BaselineLoader baselineLoader;
    private final ChangeDetector changeDetector;
    private final PartialSpecGenerator generator;
    private final StructureChecker structureChecker;
    private final OutputSerializer outputSerializer;
    private final PartialSpecProperties properties;

    public PartialSpecWorkflowImpl(DocumentLoader documentLoader,
                                   BaselineLoader baselineLoader,
                                   ChangeDetector changeDetector,
                                   PartialSpecGenerator generator,
                                   StructureChecker structureChecker,
                                   OutputSerializer outputSerializer,
                                   PartialSpecProperties properties) {
        this.documentLoader = documentLoader;
        this.baselineLoader = baselineLoader;
        this.changeDetector = changeDetector;
        this.generator = generator;
        this.structureChecker = structureChecker;
        this.outputSerializer = outputSerializer;
        this.properties = properties;
    }

    @Override
    public GenerateReport generate(GenerateRequest request) {
        Artifacts artifacts = resolve(request);
        List<String> warnings = new ArrayList<>();
        PartialSpecInput input = loadInputs(artifacts, warnings);

        PartialSpecResult result = generator.generate(input);
        warnings.addAll(result.warnings());

        if (properties.isStructureCheck()) {
            structureChecker.check(result.document())
                    .forEach(message -> warnings.add("Structure check: " + message));
        }

        OutputFiles files = outputSerializer.write(result.document(), artifacts.outputDir());
        return new GenerateReport(result, outputSerializer.summarize(result.document()), warnings, files);
    }

    @Override
    public DetectionReport detect(GenerateRequest request) {
        Artifacts artifacts = resolve(request);
        PartialSpecInput input = loadInputs(artifacts, new ArrayList<>());
        AffectedOperations affected = changeDetector.detect(input.diff(), input.before(), input.after());
        return new DetectionReport(affected, input.baseline());
    }

    @Override
    public Baseline loadBaseline(GenerateRequest request) {
        return baselineLoader.load(resolve(request).baseline());
    }

    private PartialSpecInput loadInputs(Artifacts artifacts, List<String> warnings) {
        log.info("Baseline: {}", artifacts.baseline());
        log.info("Before spec: {}", artifacts.before());
        log.info("After spec: {}", artifacts.after());

        Baseline baseline = baselineLoader.load(artifacts.baseline());

        JsonNode diff = documentLoader.loadDiff(artifacts.diff()).orElseGet(() -> {
            log.info("No diff found at {}; relying on deep comparison only.", artifacts.diff());
            return MissingNode.getInstance();
        });

        Optional<ObjectNode> before = documentLoader.loadInterfaceDocument(artifacts.before());
        if (before.isEmpty()) {
            log.warn("No before document found at {}. Every operation will be treated as new.", artifacts.before());
            warnings.add("No before document was found at " + artifacts.before() + "; every operation is treated as new.");
        }

        ObjectNode after = documentLoader.loadInterfaceDocument(artifacts.after())
                .orElseThrow(() -> new PartialSpecException("Could not load the after document from " + artifacts.after()));

        return new PartialSpecInput(baseline, diff,
                before.map(JsonNode.class::cast).orElseGet(JsonNodeFactory.instance::objectNode), after);
    }

    private Artifacts resolve(GenerateRequest request) {
        Path artifactDir = Path.of(firstNonNull(request.artifactDir(), properties.getArtifactDir()));
        Path outputDir = request.outputDir() != null
                ? Path.of(request.outputDir())
                : properties.getOutputDir() != null ? Path.of(properties.getOutputDir()) : artifactDir;
        return new Artifacts(
                artifactDir.resolve(firstNonNull(request.baseline(), properties.getBaselineFile())),
                artifactDir.resolve(firstNonNull(request.diff(), properties.getDiffFile())),
                documentLoader.resolveInterfaceDocument(artifactDir, firstNonNull(request.before(), properties.getBeforeDocument())),
                documentLoader.resolveInterfaceDocument(artifactDir, firstNonNull(request.after(), properties.getAfterDocument())),
                outputDir);
    }

    private static String firstNonNull(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private record Artifacts(Path baseline, Path diff, Path before, Path after, Path outputDir) {
    }
}
