package com.partialspec.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.partialspec.model.OutputFiles;
import com.partialspec.model.PartialSpecSummary;
import java.nio.file.Path;

/**
 * Renders a partial spec in its JSON and YAML forms.
 */
public interface OutputSerializer {

    String toJson(JsonNode document);

    /**
     * @return The YAML form, or the JSON form when YAML writing fails (JSON is valid YAML).
     */
    String toYaml(JsonNode document);

    /**
     * Writes both forms into {@code outputDirectory}, creating it if needed.
     *
     * @throws com.partialspec.exception.PartialSpecException if a file cannot be written.
     */
    OutputFiles write(JsonNode document, Path outputDirectory);

    PartialSpecSummary summarize(JsonNode document);
}
