package com.partialspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.partialspec.model.AffectedOperations;
import com.partialspec.model.DetectionSource;
import com.partialspec.model.HttpMethod;
import com.partialspec.model.OperationKey;
import com.partialspec.service.api.ChangeDetector;
import com.partialspec.util.DocumentTrees;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * A two-phase {@link ChangeDetector}.
 * <p>
 * The diff artifact is trusted for what it reports, but diff tools apply their own change
 * grammar and routinely skip description, summary or example edits. The second phase therefore
 * compares every operation of the new document with the old one, so no edit goes unnoticed.
 */
@Service
@Slf4j
public class ChangeDetectorImpl implements ChangeDetector {

    static final String PATHS_PREFIX = "paths.";

    private static final List<String> DIFF_BUCKETS = List.of(
            "breakingDifferences", "nonBreakingDifferences", "unclassifiedDifferences");

    private static final List<String> ENTITY_DETAILS = List.of(
            "destinationSpecEntityDetails", "sourceSpecEntityDetails");

    @Override
    public AffectedOperations detect(JsonNode diff, JsonNode before, JsonNode after) {
        AffectedOperations.Builder affected = AffectedOperations.builder();

        int fromDiff = detectFromDiff(diff, before, after, affected);
        log.info("Structural diff points at {} operations.", fromDiff);

        int fromComparison = detectByComparison(before, after, affected);
        log.info("Deep comparison flagged {} new or modified operations.", fromComparison);

        AffectedOperations result = affected.build();
        log.info("Total affected operations (diff + deep comparison): {}", result.size());
        return result;
    }

    /**
     * Phase 1: maps each entity location of the diff artifact to the operation that owns it.
     */
    private int detectFromDiff(JsonNode diff, JsonNode before, JsonNode after, AffectedOperations.Builder affected) {
        List<String> knownPaths = knownPathsLongestFirst(before, after);
        Set<OperationKey> found = new TreeSet<>();
        for (JsonNode entry : diffEntries(diff)) {
            for (String location : locationsOf(entry)) {
                Set<OperationKey> keys = keysForLocation(location, knownPaths, before, after);
                if (keys.isEmpty()) {
                    log.debug("Diff location '{}' does not belong to an operation.", location);
                }
                found.addAll(keys);
            }
        }
        found.forEach(key -> affected.add(key, DetectionSource.DIFF));
        return found.size();
    }

    /**
     * Phase 2: flags every operation of {@code after} that is new, or whose canonical body
     * differs from its counterpart in {@code before}.
     */
    private int detectByComparison(JsonNode before, JsonNode after, AffectedOperations.Builder affected) {
        Map<OperationKey, JsonNode> previous = DocumentTrees.operations(before);
        int flagged = 0;
        for (Map.Entry<OperationKey, JsonNode> operation : DocumentTrees.operations(after).entrySet()) {
            OperationKey key = operation.getKey();
            JsonNode old = previous.get(key);
            if (old == null) {
                affected.add(key, DetectionSource.NEW_OPERATION);
                flagged++;
            } else if (!DocumentTrees.structurallyEqual(old, operation.getValue())) {
                affected.add(key, DetectionSource.MODIFIED_OPERATION);
                flagged++;
            }
        }
        return flagged;
    }

    /**
     * Accepts the bucketed layout, a flat {@code differences} array, or a bare array of entries.
     */
    private List<JsonNode> diffEntries(JsonNode diff) {
        List<JsonNode> entries = new ArrayList<>();
        if (diff == null) {
            return entries;
        }
        switch (diff.getNodeType()) {
            case ARRAY:
                diff.forEach(entries::add);
                break;
            case OBJECT:
                for (String bucket : DIFF_BUCKETS) {
                    JsonNode items = diff.path(bucket);
                    if (items.isArray()) {
                        items.forEach(entries::add);
                    }
                }
                if (entries.isEmpty() && diff.path("differences").isArray()) {
                    diff.path("differences").forEach(entries::add);
                }
                break;
            default:
                break;
        }
        return entries;
    }

    private List<String> locationsOf(JsonNode entry) {
        List<String> locations = new ArrayList<>();
        if (!entry.isObject()) {
            return locations;
        }
        for (String side : ENTITY_DETAILS) {
            JsonNode details = entry.path(side);
            if (!details.isArray()) {
                continue;
            }
            for (JsonNode detail : details) {
                JsonNode location = detail.path("location");
                if (location.isTextual() && !location.asText().isEmpty()) {
                    locations.add(location.asText());
                }
            }
        }
        return locations;
    }

    /**
     * Derives the operation keys a location such as {@code paths./pet/{petId}.get.parameters[0]}
     * belongs to. Tokens below the verb are discarded. A location that stops at the path level
     * covers every operation declared under that path in either document.
     */
    Set<OperationKey> keysForLocation(String location, List<String> knownPaths, JsonNode before, JsonNode after) {
        Set<OperationKey> keys = new LinkedHashSet<>();
        if (!location.startsWith(PATHS_PREFIX)) {
            return keys;
        }
        String remainder = location.substring(PATHS_PREFIX.length());
        String path = matchPath(remainder, knownPaths);
        if (path.isEmpty()) {
            return keys;
        }
        String rest = remainder.substring(path.length());
        if (rest.startsWith(".")) {
            rest = rest.substring(1);
        }
        int dot = rest.indexOf('.');
        String token = dot < 0 ? rest : rest.substring(0, dot);

        Optional<HttpMethod> method = HttpMethod.fromToken(token);
        if (method.isPresent()) {
            keys.add(new OperationKey(method.get(), path));
            return keys;
        }
        keys.addAll(DocumentTrees.operationsUnder(after, path).keySet());
        keys.addAll(DocumentTrees.operationsUnder(before, path).keySet());
        return keys;
    }

    /**
     * Path keys may themselves contain dots ({@code /v1.0/pets}), so the location is matched
     * against the longest known path it continues with. Unknown paths end at the next dot.
     */
    private static String matchPath(String remainder, List<String> knownPaths) {
        for (String known : knownPaths) {
            if (remainder.equals(known) || remainder.startsWith(known + ".")) {
                return known;
            }
        }
        int dot = remainder.indexOf('.');
        return dot < 0 ? remainder : remainder.substring(0, dot);
    }

    static List<String> knownPathsLongestFirst(JsonNode before, JsonNode after) {
        Set<String> paths = new LinkedHashSet<>();
        DocumentTrees.paths(after).fieldNames().forEachRemaining(paths::add);
        DocumentTrees.paths(before).fieldNames().forEachRemaining(paths::add);
        List<String> sorted = new ArrayList<>(paths);
        sorted.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        return sorted;
    }
}
