package com.partialspec.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.partialspec.config.PartialSpecProperties;
import com.partialspec.exception.PartialSpecException;
import com.partialspec.model.HttpMethod;
import com.partialspec.model.OutputFiles;
import com.partialspec.model.PartialSpecSummary;
import com.partialspec.service.api.OutputSerializer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class OutputSerializerImpl implements OutputSerializer {

    private final ObjectMapper jsonMapper;
    private final YAMLMapper yamlMapper;
    private final PartialSpecProperties properties;

    public OutputSerializerImpl(ObjectMapper jsonMapper, YAMLMapper yamlMapper, PartialSpecProperties properties) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
        this.properties = properties;
    }

    @Override
    public String toJson(JsonNode document) {
        try {
            return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new PartialSpecException("Failed to render the partial spec as JSON", e);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String toYaml(JsonNode document) {
        try {
            return yamlMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            log.warn("Could not render the partial spec as YAML, writing JSON instead. Error: {}", e.getMessage());
            return toJson(document);
        }
    }

    @Override
    public OutputFiles write(JsonNode document, Path outputDirectory) {
        Path json = outputDirectory.resolve(properties.getJsonOutputFile());
        Path yaml = outputDirectory.resolve(properties.getYamlOutputFile());
        String jsonText = toJson(document);
        String yamlText = toYaml(document);
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(json, jsonText, StandardCharsets.UTF_8);
            Files.writeString(yaml, yamlText, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write the partial spec to {}", outputDirectory, e);
            throw new PartialSpecException("Failed to write the partial spec to " + outputDirectory, e);
        }
        log.info("Saved partial spec to {} and {}", json, yaml);
        return new OutputFiles(json, yaml);
    }

    @Override
    public PartialSpecSummary summarize(JsonNode document) {
        JsonNode paths = document.path("paths");
        int operations = 0;
        for (JsonNode pathItem : paths) {
            for (Map.Entry<String, JsonNode> field : pathItem.properties()) {
                if (HttpMethod.fromToken(field.getKey()).isPresent()) {
                    operations++;
                }
            }
        }
        JsonNode components = document.path("components");
        int componentCount = 0;
        for (JsonNode table : components) {
            componentCount += table.size();
        }
        return new PartialSpecSummary(paths.size(), operations,
                components.path("schemas").size(), componentCount);
    }
}
