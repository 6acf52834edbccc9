package com.partialspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.partialspec.config.PartialSpecProperties;
import com.partialspec.exception.PartialSpecException;
import com.partialspec.model.AffectedOperations;
import com.partialspec.model.AssembledPaths;
import com.partialspec.model.Baseline;
import com.partialspec.model.ClosureResult;
import com.partialspec.model.Decision;
import com.partialspec.model.DecisionType;
import com.partialspec.model.PartialSpecInput;
import com.partialspec.model.PartialSpecResult;
import com.partialspec.service.api.ChangeDetector;
import com.partialspec.service.api.ComponentClosureResolver;
import com.partialspec.service.api.PartialSpecGenerator;
import com.partialspec.service.api.SpecAssembler;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Composes detection, assembly and closure resolution into one pass.
 * <p>
 * Inputs are only read; the output document is built from fresh nodes and deep copies, and
 * every step iterates in a fixed order, so re-running on the same inputs yields an equal document.
 */
@Service
@Slf4j
public class PartialSpecGeneratorImpl implements PartialSpecGenerator {

    static final String DEFAULT_OPENAPI_VERSION = "3.0.0";

    private final ChangeDetector changeDetector;
    private final SpecAssembler specAssembler;
    private final ComponentClosureResolver closureResolver;
    private final PartialSpecProperties properties;

    public PartialSpecGeneratorImpl(ChangeDetector changeDetector,
                                    SpecAssembler specAssembler,
                                    ComponentClosureResolver closureResolver,
                                    PartialSpecProperties properties) {
        this.changeDetector = changeDetector;
        this.specAssembler = specAssembler;
        this.closureResolver = closureResolver;
        this.properties = properties;
    }

    @Override
    public PartialSpecResult generate(PartialSpecInput input) {
        JsonNode after = input.after();
        if (after == null || !after.isObject()) {
            throw new PartialSpecException("The after document is required and must be a mapping.");
        }
        JsonNode before = input.before() != null ? input.before() : JsonNodeFactory.instance.objectNode();
        JsonNode diff = input.diff() != null ? input.diff() : MissingNode.getInstance();
        Baseline baseline = input.baseline() != null ? input.baseline() : Baseline.missing();

        log.info("Step 1: detecting changes (diff + deep comparison)...");
        AffectedOperations affected = changeDetector.detect(diff, before, after);

        log.info("Step 2: filtering against {} legacy operations and copying from the after document...", baseline.size());
        AssembledPaths assembled = specAssembler.assemble(affected, baseline, after);

        log.info("Step 3: building the minimal component table...");
        ClosureResult closure = closureResolver.resolve(assembled.paths(), after);

        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.put("openapi", after.path("openapi").asText(DEFAULT_OPENAPI_VERSION));
        ObjectNode info = document.putObject("info");
        info.put("title", properties.getOutputTitle());
        info.put("version", properties.getOutputVersion());
        document.set("paths", assembled.paths());
        document.set("components", closure.components());

        return new PartialSpecResult(document, affected, assembled.decisions(),
                closure.unresolvedReferences(), warningsFor(baseline, assembled.decisions(), closure));
    }

    private List<String> warningsFor(Baseline baseline, List<Decision> decisions, ClosureResult closure) {
        List<String> warnings = new ArrayList<>();
        if (!baseline.present()) {
            warnings.add("No legacy baseline was found; every changed operation is strictly checked.");
        }
        for (Decision decision : decisions) {
            if (decision.type() == DecisionType.LEGACY_REMOVED) {
                warnings.add("Legacy operation " + decision.key() + " was removed from the after document.");
            }
        }
        for (String ref : closure.unresolvedReferences()) {
            warnings.add("Unresolved reference left in the partial spec: " + ref);
        }
        return warnings;
    }
}
