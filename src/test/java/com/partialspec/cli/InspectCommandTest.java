package com.partialspec.cli;

import com.partialspec.dto.request.GenerateRequest;
import com.partialspec.dto.response.DetectionReport;
import com.partialspec.model.AffectedOperations;
import com.partialspec.model.Baseline;
import com.partialspec.model.DetectionSource;
import com.partialspec.model.OperationKey;
import com.partialspec.service.api.PartialSpecWorkflow;
import org.junit.jupiter.api.*;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.shell.test.ShellTestClient;
import org.springframework.shell.test.autoconfigure.ShellTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ShellTest
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestPropertySource(properties = { "spring.shell.jline.terminal.dumb=true" })
class InspectCommandTest {

    @MockitoBean
    private PartialSpecWorkflow workflow;

    @Autowired
    private ShellTestClient client;

    private ShellTestClient.InteractiveShellSession session;

    @BeforeAll
    public void startShellSession() {
        session = client.interactive().run();
        await().atMost(Duration.ofSeconds(30)).untilAsserted(() ->
                assertThat(session.screen().toString()).contains("shell:>")
        );
    }

    @AfterAll
    public void stopShellSession() {
        if (session != null) {
            session.write("exit");
        }
    }

    @BeforeEach
    void setUp() {
        Mockito.reset(workflow);
    }

    @Test
    void baselineCommand_listsLegacyOperations() {
        when(workflow.loadBaseline(any(GenerateRequest.class))).thenReturn(Baseline.of(Set.of(
                OperationKey.of("get", "/pet"), OperationKey.of("post", "/pet"))));

        session.write(String.format("baseline --file swagger_baseline.json%n"));

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            String screen = session.screen().toString();
            assertThat(screen).contains("Legacy operations (2):");
            assertThat(screen).contains("GET@/pet");
            assertThat(screen).contains("POST@/pet");
        });
    }

    @Test
    void baselineCommand_whenBaselineIsMissing_warns() {
        when(workflow.loadBaseline(any(GenerateRequest.class))).thenReturn(Baseline.missing());

        session.write(String.format("baseline -d missing%n"));

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() ->
                assertThat(session.screen().toString()).contains("No baseline found.")
        );
    }

    @Test
    void affectedCommand_marksLegacyAndStrictOperations() {
        OperationKey legacy = OperationKey.of("get", "/pet/findByStatus");
        OperationKey strict = OperationKey.of("patch", "/pet/findByStatus");
        AffectedOperations affected = AffectedOperations.builder()
                .add(legacy, DetectionSource.MODIFIED_OPERATION)
                .add(strict, DetectionSource.NEW_OPERATION)
                .build();
        when(workflow.detect(any(GenerateRequest.class)))
                .thenReturn(new DetectionReport(affected, Baseline.of(Set.of(legacy))));

        session.write(String.format("affected%n"));

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
            String screen = session.screen().toString();
            assertThat(screen).contains("Affected operations (2):");
            assertThat(screen).contains("GET@/pet/findByStatus");
            assertThat(screen).contains("[legacy]");
            assertThat(screen).contains("[strict]");
            assertThat(screen).contains("new operation");
        });
    }
}
