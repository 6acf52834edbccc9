package com.partialspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.partialspec.config.PartialSpecProperties;
import com.partialspec.exception.PartialSpecException;
import com.partialspec.model.Baseline;
import com.partialspec.model.Decision;
import com.partialspec.model.DecisionType;
import com.partialspec.model.OperationKey;
import com.partialspec.model.PartialSpecInput;
import com.partialspec.model.PartialSpecResult;
import com.partialspec.util.DocumentTrees;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import java.util.Set;
import static com.partialspec.TestDocuments.fixture;
import static com.partialspec.TestDocuments.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PartialSpecGeneratorImplTest {

    private PartialSpecGeneratorImpl generator;
    private Baseline baseline;

    @BeforeEach
    void setUp() {
        PartialSpecProperties properties = new PartialSpecProperties();
        generator = new PartialSpecGeneratorImpl(
                new ChangeDetectorImpl(),
                new SpecAssemblerImpl(properties),
                new ComponentClosureResolverImpl(),
                properties);
        baseline = new BaselineLoaderImpl(null).load(fixture("petstore/swagger_baseline.json"));
    }

    @Test
    void generate_shouldKeepOnlyNonLegacyChangesAndTheirComponents() {
        PartialSpecResult result = generator.generate(petstoreInput());
        ObjectNode document = result.document();

        assertThat(document.path("openapi").asText()).isEqualTo("3.0.3");
        assertThat(document.path("info").path("title").asText()).isEqualTo("Changed-Only API Spec");
        assertThat(document.path("info").path("version").asText()).isEqualTo("1.0.0");

        assertThat(document.path("paths").fieldNames()).toIterable().containsExactly(
                "/pet/findByStatus", "/store/order", "/store/order/{orderId}", "/products");
        assertThat(document.path("paths").path("/pet/findByStatus").fieldNames()).toIterable().containsExactly("patch");
        assertThat(document.path("components").path("schemas").fieldNames()).toIterable()
                .containsExactly("Pet", "Category", "Tag", "Order", "Product");
        assertThat(document.path("components").path("parameters").fieldNames()).toIterable()
                .containsExactly("OrderId");

        assertThat(result.decisionsOf(DecisionType.IGNORE)).extracting(Decision::key).containsExactly(
                OperationKey.of("post", "/pet"), OperationKey.of("get", "/pet/findByStatus"));
        assertThat(result.decisionsOf(DecisionType.INCLUDE)).hasSize(4);
        assertThat(result.unresolvedReferences()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void generate_shouldNeverEmitABaselineOperation() {
        PartialSpecResult result = generator.generate(petstoreInput());

        Set<OperationKey> emitted = DocumentTrees.operations(result.document()).keySet();
        assertThat(emitted).doesNotContainAnyElementsOf(baseline.operations());
        assertThat(emitted).allSatisfy(key -> assertThat(result.affected().contains(key)).isTrue());
    }

    @Test
    void generate_shouldBeIdempotentAndLeaveItsInputsUntouched() {
        PartialSpecInput input = petstoreInput();
        String afterBefore = input.after().toString();

        JsonNode first = generator.generate(input).document();
        JsonNode second = generator.generate(input).document();

        assertThat(second).isEqualTo(first);
        assertThat(second.toString()).isEqualTo(first.toString());
        assertThat(input.after().toString()).isEqualTo(afterBefore);
    }

    @Test
    void generate_shouldEmitAnEmptySkeletonWhenNothingChanged() {
        ObjectNode after = fixture("petstore/swagger_head.json");

        PartialSpecResult result = generator.generate(new PartialSpecInput(baseline, null, after.deepCopy(), after));

        assertThat(result.document().path("paths").size()).isZero();
        assertThat(result.document().path("components").path("schemas").isObject()).isTrue();
        assertThat(result.document().path("components").path("schemas").size()).isZero();
        assertThat(result.decisions()).isEmpty();
    }

    @Test
    void generate_shouldTreatEveryOperationAsChangedWithoutBeforeOrBaseline() {
        ObjectNode after = json("{'paths': {'/a': {'get': {'responses': {'200': {'description': 'OK'}}}}}}");

        PartialSpecResult result = generator.generate(new PartialSpecInput(null, null, null, after));

        assertThat(result.document().path("openapi").asText()).isEqualTo("3.0.0");
        assertThat(result.document().path("paths").path("/a").has("get")).isTrue();
        assertThat(result.warnings()).containsExactly(
                "No legacy baseline was found; every changed operation is strictly checked.");
    }

    @Test
    void generate_shouldWarnAboutRemovedLegacyOperations() {
        ObjectNode before = json("{'paths': {'/old': {'get': {}}}}");
        ObjectNode after = json("{'paths': {}}");
        JsonNode diff = json("{'breakingDifferences': [{'sourceSpecEntityDetails': [{'location': 'paths./old.get'}]}]}");
        Baseline legacy = Baseline.of(Set.of(OperationKey.of("get", "/old")));

        PartialSpecResult result = generator.generate(new PartialSpecInput(legacy, diff, before, after));

        assertThat(result.decisionsOf(DecisionType.LEGACY_REMOVED)).hasSize(1);
        assertThat(result.warnings()).containsExactly("Legacy operation GET@/old was removed from the after document.");
        assertThat(result.document().path("paths").size()).isZero();
    }

    @Test
    void generate_shouldRequireAnAfterDocument() {
        assertThrows(PartialSpecException.class,
                () -> generator.generate(new PartialSpecInput(baseline, null, json("{}"), null)));
    }

    private PartialSpecInput petstoreInput() {
        return new PartialSpecInput(baseline,
                fixture("petstore/diff.json"),
                fixture("petstore/swagger_main.json"),
                fixture("petstore/swagger_head.json"));
    }
}
