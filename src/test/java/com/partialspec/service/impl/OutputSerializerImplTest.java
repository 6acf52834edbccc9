package com.partialspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.partialspec.config.PartialSpecProperties;
import com.partialspec.model.OutputFiles;
import com.partialspec.model.PartialSpecSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import java.nio.file.Files;
import java.nio.file.Path;
import static com.partialspec.TestDocuments.json;
import static org.assertj.core.api.Assertions.assertThat;

class OutputSerializerImplTest {

    private static final JsonNode DOCUMENT = json("{'openapi': '3.0.3',"
            + "'info': {'title': 'Changed-Only API Spec', 'version': '1.0.0'},"
            + "'paths': {'/pet': {'parameters': [], 'get': {}, 'put': {}}, '/store': {'post': {}}},"
            + "'components': {'schemas': {'Pet': {}, 'Tag': {}}, 'parameters': {'Id': {}}}}");

    @TempDir
    Path dir;

    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final YAMLMapper yamlMapper = YAMLMapper.builder().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER).build();

    private OutputSerializerImpl serializer;

    @BeforeEach
    void setUp() {
        serializer = new OutputSerializerImpl(jsonMapper, yamlMapper, new PartialSpecProperties());
    }

    @Test
    void write_shouldProduceEquivalentJsonAndYamlFiles() throws Exception {
        OutputFiles files = serializer.write(DOCUMENT, dir.resolve("out"));

        assertThat(files.json()).isEqualTo(dir.resolve("out").resolve("partial_spec.json"));
        assertThat(files.yaml()).isEqualTo(dir.resolve("out").resolve("partial_spec.yaml"));
        assertThat(jsonMapper.readTree(Files.readString(files.json()))).isEqualTo(DOCUMENT);
        assertThat(yamlMapper.readTree(Files.readString(files.yaml()))).isEqualTo(DOCUMENT);
    }

    @Test
    void toYaml_shouldKeepKeyOrderAndOmitTheDocumentMarker() {
        String yaml = serializer.toYaml(DOCUMENT);

        assertThat(yaml).startsWith("openapi:");
        assertThat(yaml.indexOf("/pet")).isLessThan(yaml.indexOf("/store"));
    }

    @Test
    void write_shouldHonourConfiguredFileNames() {
        PartialSpecProperties properties = new PartialSpecProperties();
        properties.setJsonOutputFile("changed.json");
        properties.setYamlOutputFile("changed.yml");

        OutputFiles files = new OutputSerializerImpl(jsonMapper, yamlMapper, properties).write(DOCUMENT, dir);

        assertThat(files.json()).exists().hasFileName("changed.json");
        assertThat(files.yaml()).exists().hasFileName("changed.yml");
    }

    @Test
    void summarize_shouldCountPathsOperationsAndComponents() {
        PartialSpecSummary summary = serializer.summarize(DOCUMENT);

        assertThat(summary).isEqualTo(new PartialSpecSummary(2, 3, 2, 3));
        assertThat(summary.toString()).isEqualTo("paths=2, operations=3, schemas=2, components=3");
    }
}
