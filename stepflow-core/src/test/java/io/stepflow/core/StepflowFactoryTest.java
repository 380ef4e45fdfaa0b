package io.stepflow.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stepflow.core.event.Event;
import io.stepflow.core.event.EventFilter;
import io.stepflow.core.execution.ExecutionResult;
import io.stepflow.core.execution.ExecutionStatus;
import io.stepflow.core.reliability.InputSchemas;
import io.stepflow.core.reliability.ParameterSchema;
import io.stepflow.core.reliability.ReliabilityOptions;
import io.stepflow.core.tool.ToolDefinition;
import io.stepflow.core.tool.ToolDefinition.ParameterDef;
import io.stepflow.core.workflow.ToolConfig;
import io.stepflow.core.workflow.Workflow;
import io.stepflow.core.workflow.step.ActionStep;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StepflowFactoryTest {

    private StepflowEnvironment environment;

    @BeforeEach
    void setUp() {
        ToolDefinition crm =
                ToolDefinition.builder(
                                "crm",
                                config ->
                                        (method, inputs) ->
                                                Map.of(
                                                        "method", method,
                                                        "region", config.get("region"),
                                                        "token", config.get("token"),
                                                        "name", inputs.get("name")))
                        .config(Map.of("region", "eu", "token", "${secret:vault://crm}"))
                        .operation(
                                "contacts.create",
                                List.of(ParameterDef.required("name", "string", "Contact name")))
                        .build();
        environment =
                StepflowFactory.builder()
                        .config(
                                StepflowConfig.builder()
                                        .threadPoolSize(2)
                                        .reliability(
                                                ReliabilityOptions.builder().maxRetries(0).build())
                                        .build())
                        .secretProvider("vault", path -> "tok-" + path)
                        .tool(crm)
                        .build();
    }

    @AfterEach
    void tearDown() {
        environment.close();
    }

    private ExecutionResult run(Workflow workflow, Map<String, Object> inputs) {
        return environment.getEngine().execute(workflow, inputs);
    }

    @Test
    void shouldRunToolCallsThroughRegisteredClients() {
        Workflow workflow =
                Workflow.builder()
                        .id("onboard")
                        .steps(
                                List.of(
                                        ActionStep.of(
                                                "create",
                                                "crm.contacts.create",
                                                Map.of("name", "{{ name }}"),
                                                "contact")))
                        .build();

        ExecutionResult result = run(workflow, Map.of("name", "ada"));

        assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(result.variables())
                .containsEntry(
                        "contact",
                        Map.of(
                                "method", "contacts.create",
                                "region", "eu",
                                "token", "tok-crm",
                                "name", "ada"));
    }

    @Test
    void shouldMergeAliasConfigOverToolConfig() {
        Workflow workflow =
                Workflow.builder()
                        .id("onboard-us")
                        .tools(Map.of("crm_us", new ToolConfig("crm", Map.of("region", "us"))))
                        .steps(
                                List.of(
                                        ActionStep.of(
                                                "create",
                                                "crm_us.contacts.create",
                                                Map.of("name", "bo"),
                                                "contact")))
                        .build();

        ExecutionResult result = run(workflow, Map.of());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.variables().get("contact"))
                .isEqualTo(
                        Map.of(
                                "method", "contacts.create",
                                "region", "us",
                                "token", "tok-crm",
                                "name", "bo"));
    }

    @Test
    void shouldValidateInputsAgainstDeclaredParameters() {
        Workflow workflow =
                Workflow.builder()
                        .id("onboard")
                        .steps(
                                List.of(
                                        ActionStep.of(
                                                "create", "crm.contacts.create", Map.of(), null)))
                        .build();

        ExecutionResult result = run(workflow, Map.of());

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.error()).contains("name: name is required");
    }

    @Test
    void shouldFailRunForUnknownTool() {
        Workflow workflow =
                Workflow.builder()
                        .id("unknown")
                        .steps(List.of(ActionStep.of("call", "jira.issues.create", Map.of())))
                        .build();

        ExecutionResult result = run(workflow, Map.of());

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.error()).contains("Unknown tool: jira");
    }

    @Test
    void shouldExposeWiredComponents() {
        assertThat(environment.getToolRegistry().contains("crm")).isTrue();
        assertThat(environment.getSecretResolver().getSecret("vault://x")).isEqualTo("tok-x");
        assertThat(environment.getConfig().getThreadPoolSize()).isEqualTo(2);
        assertThat(environment.getCheckpointStore()).isNotNull();
        assertThat(environment.getEventSources().status()).isEmpty();
        assertThat(environment.getReliability().getDefaults().getMaxRetries()).isZero();
    }

    @Test
    void shouldMergeReferenceSchemasUnderConfiguredOnes() {
        ParameterSchema custom = ParameterSchema.of(ParameterDef.required("x", "string", "x"));
        StepflowConfig config =
                StepflowConfig.builder()
                        .reliability(
                                ReliabilityOptions.builder()
                                        .inputSchema("slack.chat.postMessage", custom)
                                        .build())
                        .build();

        ReliabilityOptions merged = StepflowFactory.reliabilityDefaults(config);

        assertThat(merged.getInputSchemas())
                .containsEntry("slack.chat.postMessage", custom)
                .containsEntry(
                        "github.issues.create", InputSchemas.REFERENCE.get("github.issues.create"));
    }

    @Test
    void shouldLeaveSuppliedExecutorRunningOnClose() {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            StepflowFactory.builder().executorService(pool).build().close();

            assertThat(pool.isShutdown()).isFalse();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldFailEventWaitsOnClose() {
        StepflowEnvironment other = StepflowFactory.createEnvironment();
        CompletableFuture<Event> wait =
                other.getEventSources().waitForEventAsync(EventFilter.ANY, 0);

        other.close();

        assertThat(wait).isCompletedExceptionally();
        assertThatThrownBy(wait::join).hasRootCauseMessage("Event source manager stopped");
    }
}
