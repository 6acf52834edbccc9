package com.partialspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.partialspec.config.PartialSpecProperties;
import com.partialspec.model.AffectedOperations;
import com.partialspec.model.AssembledPaths;
import com.partialspec.model.Baseline;
import com.partialspec.model.Decision;
import com.partialspec.model.DecisionType;
import com.partialspec.model.HttpMethod;
import com.partialspec.model.OperationKey;
import com.partialspec.service.api.SpecAssembler;
import com.partialspec.util.DocumentTrees;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies the baseline filter to the affected operations and copies the survivors from the
 * after document.
 * <p>
 * The decision depends only on the key: legacy keys are ignored, everything else is included.
 * Operation bodies are copied as they are, so {@code $ref} pointers survive and the closure
 * resolver can later pull in exactly the components they name.
 */
@Service
@Slf4j
public class SpecAssemblerImpl implements SpecAssembler {

    static final String DEFAULT_RESPONSE_DESCRIPTION = "Default response";

    /** Path item fields that operations depend on and that travel with them. */
    private static final List<String> SHARED_PATH_FIELDS = List.of("parameters", "servers");

    private static final Pattern SUCCESS_STATUS = Pattern.compile("2(\\d\\d|XX)", Pattern.CASE_INSENSITIVE);

    private final PartialSpecProperties properties;

    public SpecAssemblerImpl(PartialSpecProperties properties) {
        this.properties = properties;
    }

    @Override
    public AssembledPaths assemble(AffectedOperations affected, Baseline baseline, JsonNode after) {
        Map<OperationKey, JsonNode> current = DocumentTrees.operations(after);
        List<Decision> decisions = new ArrayList<>();
        Set<OperationKey> included = new HashSet<>();

        for (OperationKey key : affected.keys()) {
            Decision decision = decide(key, affected, baseline, current.containsKey(key));
            decisions.add(decision);
            if (decision.type() == DecisionType.INCLUDE) {
                included.add(key);
            }
            if (decision.type() == DecisionType.LEGACY_REMOVED) {
                log.warn(decision.toLogLine());
            } else {
                log.info(decision.toLogLine());
            }
        }

        ObjectNode paths = copyIncluded(DocumentTrees.paths(after), included);
        log.info("Included {} of {} affected operations.", included.size(), affected.size());
        return new AssembledPaths(paths, decisions);
    }

    private Decision decide(OperationKey key, AffectedOperations affected, Baseline baseline, boolean presentInAfter) {
        String detectedBy = " (detected by: " + affected.describeSources(key) + ")";
        if (baseline.contains(key)) {
            return presentInAfter
                    ? new Decision(key, DecisionType.IGNORE, "legacy operation in baseline, reported as non-blocking" + detectedBy)
                    : new Decision(key, DecisionType.LEGACY_REMOVED, "legacy operation was removed from the after document" + detectedBy);
        }
        return presentInAfter
                ? new Decision(key, DecisionType.INCLUDE, "changed operation not in baseline" + detectedBy)
                : new Decision(key, DecisionType.REMOVED, "operation no longer exists in the after document" + detectedBy);
    }

    /**
     * Walks the after document in source order so the output keeps its path and verb ordering.
     */
    private ObjectNode copyIncluded(JsonNode afterPaths, Set<OperationKey> included) {
        ObjectNode paths = JsonNodeFactory.instance.objectNode();
        Set<OperationKey> copied = new HashSet<>();
        for (Map.Entry<String, JsonNode> pathEntry : afterPaths.properties()) {
            String path = pathEntry.getKey();
            JsonNode pathItem = pathEntry.getValue();
            if (!pathItem.isObject()) {
                continue;
            }
            ObjectNode target = null;
            for (Map.Entry<String, JsonNode> field : pathItem.properties()) {
                Optional<HttpMethod> method = HttpMethod.fromToken(field.getKey());
                if (method.isEmpty()) {
                    continue;
                }
                OperationKey key = new OperationKey(method.get(), path);
                if (!included.contains(key) || !copied.add(key)) {
                    continue;
                }
                if (target == null) {
                    target = paths.putObject(path);
                    copySharedFields(pathItem, target);
                }
                target.set(field.getKey(), copyOperation(field.getValue()));
            }
        }
        return paths;
    }

    private void copySharedFields(JsonNode pathItem, ObjectNode target) {
        for (String name : SHARED_PATH_FIELDS) {
            JsonNode value = pathItem.get(name);
            if (value != null) {
                target.set(name, value.deepCopy());
            }
        }
    }

    private JsonNode copyOperation(JsonNode operation) {
        JsonNode copy = operation.deepCopy();
        if (properties.isSynthesizeDefaultResponse() && copy.isObject() && !hasSuccessResponse(copy)) {
            ObjectNode body = (ObjectNode) copy;
            JsonNode responses = body.get("responses");
            ObjectNode target = responses != null && responses.isObject()
                    ? (ObjectNode) responses
                    : body.putObject("responses");
            target.putObject("default").put("description", DEFAULT_RESPONSE_DESCRIPTION);
        }
        return copy;
    }

    static boolean hasSuccessResponse(JsonNode operation) {
        JsonNode responses = operation.path("responses");
        if (!responses.isObject()) {
            return false;
        }
        for (Map.Entry<String, JsonNode> response : responses.properties()) {
            String status = response.getKey();
            if ("default".equals(status) || SUCCESS_STATUS.matcher(status).matches()) {
                return true;
            }
        }
        return false;
    }
}
