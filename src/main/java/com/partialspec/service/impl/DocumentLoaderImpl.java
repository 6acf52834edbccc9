package com.partialspec.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.partialspec.exception.DocumentParseException;
import com.partialspec.service.api.DocumentLoader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Loads JSON and YAML artifacts with Jackson, picking the format from the file extension.
 */
@Service
@Slf4j
public class DocumentLoaderImpl implements DocumentLoader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ObjectMapper jsonMapper;
    private final YAMLMapper yamlMapper;

    public DocumentLoaderImpl(ObjectMapper jsonMapper, YAMLMapper yamlMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<ObjectNode> loadInterfaceDocument(Path file) {
        Optional<String> content = readContent(file);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        log.info("Loading {} document: {}", isYaml(file) ? "YAML" : "JSON", file);
        JsonNode root = parse(file, content.get());
        if (!root.isObject()) {
            throw new DocumentParseException(file, "expected a mapping at the top level but found " + root.getNodeType());
        }
        return Optional.of((ObjectNode) root);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Diff tools sometimes print status lines before the JSON body, so everything before the
     * line that opens it is dropped. Text without any JSON body counts as
     * "no differences".
     */
    @Override
    public Optional<JsonNode> loadDiff(Path file) {
        Optional<String> content = readContent(file);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        String text = content.get();
        if (!isYaml(file)) {
            int start = jsonBodyStart(text);
            if (start < 0) {
                log.warn("Diff artifact {} holds no JSON body; continuing without it.", file);
                return Optional.empty();
            }
            text = text.substring(start);
        }
        JsonNode root = parse(file, text);
        if (!root.isObject() && !root.isArray()) {
            throw new DocumentParseException(file, "expected a mapping or a sequence but found " + root.getNodeType());
        }
        return Optional.of(root);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Path resolveInterfaceDocument(Path directory, String name) {
        Path named = directory.resolve(name);
        if (hasKnownExtension(name)) {
            return named;
        }
        Path yaml = directory.resolve(name + ".yaml");
        if (Files.exists(yaml)) {
            return yaml;
        }
        return directory.resolve(name + ".json");
    }

    private Optional<String> readContent(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("Artifact not found: {}", file);
            return Optional.empty();
        }
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
                text = text.substring(1);
            }
            return text.isBlank() ? Optional.empty() : Optional.of(text);
        } catch (IOException e) {
            throw new DocumentParseException(file, "the file could not be read", e);
        }
    }

    private JsonNode parse(Path file, String text) {
        ObjectMapper mapper = isYaml(file) ? yamlMapper : jsonMapper;
        try {
            JsonNode root = mapper.readTree(text);
            if (root == null || root.isMissingNode()) {
                throw new DocumentParseException(file, "the document is empty");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new DocumentParseException(file, e.getOriginalMessage(), e);
        }
    }

    /**
     * Finds the first line that opens the JSON body. A line opens it when it starts with
     * <code>{</code>, or with <code>[</code> followed by a value or the end of the line, so log
     * tags such as <code>[INFO]</code> are skipped. Falls back to the first <code>{</code> anywhere.
     */
    private static int jsonBodyStart(String text) {
        int lineStart = 0;
        while (lineStart < text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            int first = skipWhitespace(text, lineStart, lineEnd);
            if (first < lineEnd && opensJson(text, first, lineEnd)) {
                return first;
            }
            lineStart = lineEnd + 1;
        }
        return text.indexOf('{');
    }

    private static boolean opensJson(String text, int at, int lineEnd) {
        char c = text.charAt(at);
        if (c == '{') {
            return true;
        }
        if (c != '[') {
            return false;
        }
        int next = skipWhitespace(text, at + 1, lineEnd);
        return next == lineEnd || "{[]\"".indexOf(text.charAt(next)) >= 0;
    }

    private static int skipWhitespace(String text, int from, int to) {
        int i = from;
        while (i < to && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static boolean hasKnownExtension(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".json") || lower.endsWith(".yaml") || lower.endsWith(".yml");
    }
}
