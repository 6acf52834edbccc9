package com.partialspec.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads input artifacts from disk, telling a missing artifact apart from a malformed one.
 */
public interface DocumentLoader {

    /**
     * Loads an interface description (before, after or baseline document).
     *
     * @param file A {@code .json}, {@code .yaml} or {@code .yml} file.
     * @return The document, or an empty Optional if the file does not exist or is blank.
     * @throws com.partialspec.exception.DocumentParseException if the file is not well-formed
     *         or its top level is not a mapping.
     */
    Optional<ObjectNode> loadInterfaceDocument(Path file);

    /**
     * Loads the structural diff artifact. Any banner text printed before the JSON body is skipped.
     *
     * @return The diff, or an empty Optional if the file is absent, blank or holds no JSON body.
     * @throws com.partialspec.exception.DocumentParseException if the JSON body is malformed.
     */
    Optional<JsonNode> loadDiff(Path file);

    /**
     * Resolves an interface document name inside a directory. A name with a recognised extension
     * is used as is; a base name resolves to {@code <base>.yaml} when that exists, else {@code <base>.json}.
     */
    Path resolveInterfaceDocument(Path directory, String name);
}
