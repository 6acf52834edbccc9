package com.partialspec.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A light structural check of an emitted document. Rule compliance is left to the external lint tool.
 */
public interface StructureChecker {

    /**
     * @return The parser's messages about the document; empty when it parsed cleanly.
     */
    List<String> check(JsonNode document);
}
