package com.partialspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.partialspec.exception.DocumentParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentLoaderImplTest {

    @TempDir
    Path dir;

    private DocumentLoaderImpl loader;

    @BeforeEach
    void setUp() {
        loader = new DocumentLoaderImpl(new ObjectMapper(), new YAMLMapper());
    }

    @Test
    void loadInterfaceDocument_shouldReadJson() throws IOException {
        Path file = write("api.json", "{\"openapi\": \"3.0.1\", \"paths\": {}}");

        Optional<ObjectNode> document = loader.loadInterfaceDocument(file);

        assertThat(document).isPresent();
        assertThat(document.get().path("openapi").asText()).isEqualTo("3.0.1");
    }

    @Test
    void loadInterfaceDocument_shouldReadYaml() throws IOException {
        Path file = write("api.yaml", "openapi: 3.0.3\npaths:\n  /pet:\n    get:\n      responses: {}\n");

        ObjectNode document = loader.loadInterfaceDocument(file).orElseThrow();

        assertThat(document.path("paths").path("/pet").has("get")).isTrue();
    }

    @Test
    void loadInterfaceDocument_shouldStripByteOrderMark() throws IOException {
        Path file = write("api.json", "\uFEFF{\"openapi\": \"3.0.0\"}");

        assertThat(loader.loadInterfaceDocument(file)).isPresent();
    }

    @Test
    void loadInterfaceDocument_shouldReturnEmptyForMissingOrBlankFiles() throws IOException {
        Path blank = write("blank.json", "  \n");

        assertThat(loader.loadInterfaceDocument(dir.resolve("absent.json"))).isEmpty();
        assertThat(loader.loadInterfaceDocument(blank)).isEmpty();
    }

    @Test
    void loadInterfaceDocument_shouldFailOnMalformedContent() throws IOException {
        Path file = write("broken.json", "{\"openapi\": ");

        DocumentParseException e = assertThrows(DocumentParseException.class, () -> loader.loadInterfaceDocument(file));
        assertThat(e.getSource()).isEqualTo(file);
        assertThat(e.getMessage()).startsWith("Could not parse " + file);
    }

    @Test
    void loadInterfaceDocument_shouldRejectNonMappingRoots() throws IOException {
        Path file = write("list.yaml", "- a\n- b\n");

        assertThrows(DocumentParseException.class, () -> loader.loadInterfaceDocument(file));
    }

    @Test
    void loadDiff_shouldSkipBannerBeforeTheJsonBody() throws IOException {
        Path file = write("diff.json", "Comparing swagger_main.json with swagger_head.json\n"
                + "{\"breakingDifferences\": []}");

        Optional<JsonNode> diff = loader.loadDiff(file);

        assertThat(diff).isPresent();
        assertThat(diff.get().has("breakingDifferences")).isTrue();
    }

    @Test
    void loadDiff_shouldSkipBannerLinesContainingBrackets() throws IOException {
        Path file = write("diff.json", "[INFO] openapi-diff 0.24.1 comparing [swagger_main.json] with [swagger_head.json]\n"
                + "{\"breakingDifferences\": [{\"destinationSpecEntityDetails\": []}]}");

        JsonNode diff = loader.loadDiff(file).orElseThrow();

        assertThat(diff.path("breakingDifferences").size()).isEqualTo(1);
    }

    @Test
    void loadDiff_shouldKeepBareArraysAfterABanner() throws IOException {
        Path file = write("diff.json", "[WARN] no bucket layout\n[\n  {\"destinationSpecEntityDetails\": []}\n]");

        JsonNode diff = loader.loadDiff(file).orElseThrow();

        assertThat(diff.isArray()).isTrue();
        assertThat(diff.size()).isEqualTo(1);
    }

    @Test
    void loadDiff_shouldTreatTextWithoutJsonAsNoDifferences() throws IOException {
        Path file = write("diff.json", "No differences found\n");

        assertThat(loader.loadDiff(file)).isEmpty();
        assertThat(loader.loadDiff(dir.resolve("missing.json"))).isEmpty();
    }

    @Test
    void loadDiff_shouldAcceptBareArrays() throws IOException {
        Path file = write("diff.json", "[{\"destinationSpecEntityDetails\": []}]");

        assertThat(loader.loadDiff(file).orElseThrow().isArray()).isTrue();
    }

    @Test
    void resolveInterfaceDocument_shouldPreferYamlThenJson() throws IOException {
        assertThat(loader.resolveInterfaceDocument(dir, "swagger_head")).isEqualTo(dir.resolve("swagger_head.json"));

        write("swagger_head.yaml", "openapi: 3.0.0\n");

        assertThat(loader.resolveInterfaceDocument(dir, "swagger_head")).isEqualTo(dir.resolve("swagger_head.yaml"));
        assertThat(loader.resolveInterfaceDocument(dir, "other.json")).isEqualTo(dir.resolve("other.json"));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content, StandardCharsets.UTF_8);
    }
}
