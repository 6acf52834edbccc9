package com.partialspec.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.partialspec.model.HttpMethod;
import com.partialspec.model.OperationKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only helpers over interface documents held as Jackson trees.
 * <p>
 * Every traversal switches on {@link JsonNode#getNodeType()}, treating the tree as a
 * tagged union of mapping, sequence and scalar nodes. None of these methods modifies
 * its argument.
 */
public final class DocumentTrees {

    public static final String REF_FIELD = "$ref";

    private static final String SCHEMAS_POINTER = "#/components/schemas/";

    private DocumentTrees() {
    }

    /**
     * @return The document's {@code paths} mapping, or an empty mapping when it has none.
     */
    public static JsonNode paths(JsonNode document) {
        JsonNode paths = document == null ? null : document.get("paths");
        return paths != null && paths.isObject() ? paths : JsonNodeFactory.instance.objectNode();
    }

    /**
     * Lists every operation of a document in source order: paths as declared, then the
     * operations of each path item as declared. Verb fields are matched case-insensitively.
     */
    public static Map<OperationKey, JsonNode> operations(JsonNode document) {
        Map<OperationKey, JsonNode> operations = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> pathEntry : paths(document).properties()) {
            collectOperations(pathEntry.getKey(), pathEntry.getValue(), operations);
        }
        return operations;
    }

    /**
     * Lists the operations declared under one path key.
     */
    public static Map<OperationKey, JsonNode> operationsUnder(JsonNode document, String path) {
        Map<OperationKey, JsonNode> operations = new LinkedHashMap<>();
        JsonNode pathItem = paths(document).get(path);
        if (pathItem != null) {
            collectOperations(path, pathItem, operations);
        }
        return operations;
    }

    private static void collectOperations(String path, JsonNode pathItem, Map<OperationKey, JsonNode> sink) {
        if (!pathItem.isObject()) {
            return;
        }
        for (Map.Entry<String, JsonNode> field : pathItem.properties()) {
            Optional<HttpMethod> method = HttpMethod.fromToken(field.getKey());
            method.ifPresent(m -> sink.putIfAbsent(new OperationKey(m, path), field.getValue()));
        }
    }

    /**
     * Turns a discriminator mapping value into a reference string. A bare schema name such as
     * {@code Dog} stands for {@code #/components/schemas/Dog}; pointers and external
     * references are kept as written.
     */
    static String mappingReference(String target) {
        if (target.startsWith("#") || target.contains("/")) {
            return target;
        }
        return SCHEMAS_POINTER + target.replace("~", "~0");
    }

    /**
     * Returns a copy of the tree with the fields of every mapping sorted by name,
     * recursively. Two documents that differ only in key order canonicalize to equal trees.
     */
    public static JsonNode canonicalize(JsonNode node) {
        switch (node.getNodeType()) {
            case OBJECT: {
                List<String> names = new ArrayList<>();
                node.fieldNames().forEachRemaining(names::add);
                Collections.sort(names);
                ObjectNode sorted = JsonNodeFactory.instance.objectNode();
                for (String name : names) {
                    sorted.set(name, canonicalize(node.get(name)));
                }
                return sorted;
            }
            case ARRAY: {
                ArrayNode copy = JsonNodeFactory.instance.arrayNode();
                for (JsonNode element : node) {
                    copy.add(canonicalize(element));
                }
                return copy;
            }
            default:
                return node;
        }
    }

    /**
     * Exact structural equality after canonicalization. Any difference, including
     * description or example text, makes two operation bodies unequal.
     */
    public static boolean structurallyEqual(JsonNode left, JsonNode right) {
        return canonicalize(left).equals(canonicalize(right));
    }

    /**
     * Adds every reference string found in the tree to {@code sink}, in traversal order.
     * A reference is the textual value of a {@code $ref} field, or a target listed in a
     * {@code discriminator.mapping}.
     */
    public static void collectReferences(JsonNode node, Set<String> sink) {
        switch (node.getNodeType()) {
            case OBJECT: {
                JsonNode ref = node.get(REF_FIELD);
                if (ref != null && ref.isTextual()) {
                    sink.add(ref.asText());
                }
                JsonNode mapping = node.path("discriminator").path("mapping");
                if (mapping.isObject()) {
                    for (JsonNode target : mapping) {
                        if (target.isTextual() && !target.asText().isEmpty()) {
                            sink.add(mappingReference(target.asText()));
                        }
                    }
                }
                for (Map.Entry<String, JsonNode> field : node.properties()) {
                    collectReferences(field.getValue(), sink);
                }
                break;
            }
            case ARRAY:
                for (JsonNode element : node) {
                    collectReferences(element, sink);
                }
                break;
            default:
                break;
        }
    }
}
