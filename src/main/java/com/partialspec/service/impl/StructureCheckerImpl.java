package com.partialspec.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partialspec.exception.PartialSpecException;
import com.partialspec.service.api.StructureChecker;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the emitted document through swagger-parser without resolving references, so the
 * document is checked exactly as written.
 */
@Service
@Slf4j
public class StructureCheckerImpl implements StructureChecker {

    private final ObjectMapper jsonMapper;

    public StructureCheckerImpl(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    @Override
    public List<String> check(JsonNode document) {
        String content;
        try {
            content = jsonMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new PartialSpecException("Failed to render the partial spec for the structure check", e);
        }

        ParseOptions options = new ParseOptions();
        options.setResolve(false);
        SwaggerParseResult result = new OpenAPIV3Parser().readContents(content, null, options);

        List<String> messages = new ArrayList<>();
        if (result == null) {
            messages.add("The partial spec could not be parsed as an OpenAPI document.");
        } else {
            if (result.getMessages() != null) {
                messages.addAll(result.getMessages());
            }
            if (result.getOpenAPI() == null) {
                messages.add("The partial spec could not be parsed as an OpenAPI document.");
            }
        }
        messages.forEach(message -> log.warn("Structure check: {}", message));
        return messages;
    }
}
