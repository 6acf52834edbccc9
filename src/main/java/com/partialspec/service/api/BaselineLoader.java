package com.partialspec.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.partialspec.model.Baseline;
import java.nio.file.Path;

/**
 * Extracts the legacy operation keys from a baseline document.
 */
public interface BaselineLoader {

    /**
     * Collects one key per verb field under every path of the document. Path-level fields
     * that are not verbs ({@code parameters}, {@code summary}, ...) are ignored.
     *
     * @param baselineDocument The baseline document; only its {@code paths} are consulted.
     * @return The baseline, marked as present.
     */
    Baseline load(JsonNode baselineDocument);

    /**
     * Reads and extracts a baseline file.
     *
     * @param baselineFile The baseline artifact.
     * @return The baseline, or an empty baseline marked as missing when the file does not exist.
     * @throws com.partialspec.exception.DocumentParseException if the file is malformed.
     */
    Baseline load(Path baselineFile);
}
