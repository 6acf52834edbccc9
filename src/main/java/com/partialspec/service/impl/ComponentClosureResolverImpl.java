package com.partialspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.partialspec.model.ClosureResult;
import com.partialspec.model.ComponentPointer;
import com.partialspec.service.api.ComponentClosureResolver;
import com.partialspec.util.DocumentTrees;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Breadth-first resolution of the components reachable from a set of paths.
 * <p>
 * Every reference string is enqueued at most once, which bounds the work by the number of
 * distinct references and makes mutually referencing schemas terminate. Definitions are
 * copied unchanged, so the references inside them stay references too.
 */
@Service
@Slf4j
public class ComponentClosureResolverImpl implements ComponentClosureResolver {

    static final String SCHEMAS = "schemas";

    @Override
    public ClosureResult resolve(JsonNode paths, JsonNode after) {
        JsonNode available = after.path("components");
        Map<String, Set<String>> reachable = new HashMap<>();
        List<String> unresolved = new ArrayList<>();

        Set<String> enqueued = new LinkedHashSet<>();
        DocumentTrees.collectReferences(paths, enqueued);
        Deque<String> worklist = new ArrayDeque<>(enqueued);
        Set<String> resolved = new HashSet<>();

        while (!worklist.isEmpty()) {
            String ref = worklist.poll();
            if (!resolved.add(ref)) {
                continue;
            }
            Optional<ComponentPointer> pointer = ComponentPointer.parse(ref);
            if (pointer.isEmpty()) {
                log.warn("Reference {} does not point into the local component table; left as is.", ref);
                unresolved.add(ref);
                continue;
            }
            JsonNode table = available.path(pointer.get().type());
            if (!table.isObject() || !table.has(pointer.get().name())) {
                log.warn("Reference {} not found in the after document.", ref);
                unresolved.add(ref);
                continue;
            }
            reachable.computeIfAbsent(pointer.get().type(), t -> new HashSet<>()).add(pointer.get().name());

            Set<String> discovered = new LinkedHashSet<>();
            DocumentTrees.collectReferences(table.get(pointer.get().name()), discovered);
            for (String next : discovered) {
                if (enqueued.add(next)) {
                    worklist.add(next);
                }
            }
        }

        ObjectNode components = copyReachable(available, reachable);
        int kept = reachable.values().stream().mapToInt(Set::size).sum();
        log.info("Pruned components. Kept {} referenced components, {} unresolved references.", kept, unresolved.size());
        return new ClosureResult(components, unresolved);
    }

    /**
     * Copies the reachable definitions in the after document's order. {@code schemas} is
     * always present so an empty result is still a well-formed component table.
     */
    private ObjectNode copyReachable(JsonNode available, Map<String, Set<String>> reachable) {
        ObjectNode components = JsonNodeFactory.instance.objectNode();
        components.putObject(SCHEMAS);
        for (Map.Entry<String, JsonNode> typeEntry : available.properties()) {
            Set<String> names = reachable.get(typeEntry.getKey());
            if (names == null) {
                continue;
            }
            ObjectNode target = components.has(typeEntry.getKey())
                    ? (ObjectNode) components.get(typeEntry.getKey())
                    : components.putObject(typeEntry.getKey());
            for (Map.Entry<String, JsonNode> definition : typeEntry.getValue().properties()) {
                if (names.contains(definition.getKey())) {
                    target.set(definition.getKey(), definition.getValue().deepCopy());
                }
            }
        }
        return components;
    }
}
