package io.stepflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stepflow.core.workflow.ErrorHandling;
import io.stepflow.core.workflow.ToolConfig;
import io.stepflow.core.workflow.Workflow;
import io.stepflow.core.workflow.WorkflowInput;
import io.stepflow.core.workflow.step.ActionStep;
import io.stepflow.core.workflow.step.ForEachStep;
import io.stepflow.core.workflow.step.IfStep;
import io.stepflow.core.workflow.step.ParallelStep;
import io.stepflow.core.workflow.step.StepErrorPolicy;
import io.stepflow.core.workflow.step.SwitchStep;
import io.stepflow.core.workflow.step.TryStep;
import io.stepflow.core.workflow.step.WhileStep;
import io.stepflow.core.workflow.step.WorkflowStep;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WorkflowSerializerTest {

    private static Workflow workflowWith(WorkflowStep... steps) {
        return Workflow.builder().id("test").steps(List.of(steps)).build();
    }

    private static Workflow roundTrip(Workflow workflow) {
        return WorkflowSerializer.fromJson(WorkflowSerializer.toJson(workflow));
    }

    private static ActionStep noop(String id) {
        return ActionStep.of(id, "workflow.noop", Map.of());
    }

    @Test
    void roundTrip_workflowHeader() {
        Workflow original =
                Workflow.builder()
                        .id("issue-triage")
                        .name("Issue triage")
                        .version("2.1.0")
                        .description("Labels new issues")
                        .inputs(
                                List.of(
                                        WorkflowInput.required("repo", "string"),
                                        WorkflowInput.optional("limit", "number", 10)))
                        .tools(
                                Map.of(
                                        "gh",
                                        new ToolConfig(
                                                "github",
                                                Map.of("token", "${secret:env://GH_TOKEN}"))))
                        .errorHandling(ErrorHandling.CONTINUE)
                        .steps(List.of(noop("start")))
                        .build();

        Workflow restored = roundTrip(original);

        assertThat(restored.getId()).isEqualTo("issue-triage");
        assertThat(restored.getName()).isEqualTo("Issue triage");
        assertThat(restored.getVersion()).isEqualTo("2.1.0");
        assertThat(restored.getDescription()).isEqualTo("Labels new issues");
        assertThat(restored.getInputs()).isEqualTo(original.getInputs());
        assertThat(restored.getTools()).isEqualTo(original.getTools());
        assertThat(restored.getErrorHandling()).isEqualTo(ErrorHandling.CONTINUE);
        assertThat(restored.getSteps()).isEqualTo(original.getSteps());
    }

    @Test
    void roundTrip_actionStep() {
        ActionStep step =
                ActionStep.builder("post", "slack.chat.postMessage")
                        .name("Post summary")
                        .inputs(Map.of("channel", "#ops", "blocks", List.of(Map.of("n", 1))))
                        .outputVariable("posted")
                        .conditions(List.of("{{ enabled }}"))
                        .errorPolicy(new StepErrorPolicy(2, true))
                        .timeoutMs(5_000L)
                        .build();

        assertThat(roundTrip(workflowWith(step)).getSteps()).containsExactly(step);
    }

    @Test
    void roundTrip_controlFlowSteps() {
        IfStep branch =
                new IfStep("check", "{{ ready }}", List.of(noop("yes")), List.of(noop("no")));
        ForEachStep loop =
                new ForEachStep(
                        "each", "{{ issues }}", "issue", "i", List.of(noop("label")), "out");
        WhileStep poll = new WhileStep("poll", "{{ !done }}", List.of(noop("tick")), 20);
        SwitchStep route =
                new SwitchStep(
                        "route",
                        "{{ kind }}",
                        Map.of("bug", List.of(noop("triage")), "docs", List.of(noop("assign"))),
                        List.of(noop("ignore")));
        TryStep guarded =
                new TryStep(
                        "guarded",
                        List.of(noop("risky")),
                        List.of(noop("recover")),
                        List.of(noop("cleanup")));

        Workflow restored = roundTrip(workflowWith(branch, loop, poll, route, guarded));

        assertThat(restored.getSteps()).containsExactly(branch, loop, poll, route, guarded);
    }

    @Test
    void roundTrip_parallelStep() {
        ParallelStep fanOut =
                new ParallelStep(
                        "fan",
                        ParallelStep.Mode.MAP,
                        Map.of("items", "{{ repos }}", "concurrency", 3),
                        "results");

        ParallelStep restored = (ParallelStep) roundTrip(workflowWith(fanOut)).getSteps().get(0);

        assertThat(restored.mode()).isEqualTo(ParallelStep.Mode.MAP);
        assertThat(restored.spec()).isEqualTo(fanOut.spec());
        assertThat(restored.outputVariable()).isEqualTo("results");
    }

    @Test
    void toJson_writesLowercaseDiscriminatorsAndOmitsDefaults() {
        String json = WorkflowSerializer.toJson(workflowWith(noop("start")));

        assertThat(json)
                .contains("\"type\" : \"action\"")
                .contains("\"errorHandling\" : \"stop\"")
                .doesNotContain("errorPolicy")
                .doesNotContain("timeoutMs")
                .doesNotContain("description");
    }

    @Test
    void fromJson_acceptsTimeoutAndContinueOnErrorAliases() {
        String json =
                """
                {
                  "id": "aliases",
                  "unknownField": true,
                  "steps": [
                    {"id": "call", "type": "action", "action": "crm.sync",
                     "timeout": "30s", "continueOnError": true}
                  ]
                }
                """;

        ActionStep step = (ActionStep) WorkflowSerializer.fromJson(json).getSteps().get(0);

        assertThat(step.timeoutMs()).isEqualTo(30_000L);
        assertThat(step.errorPolicy()).isEqualTo(new StepErrorPolicy(0, true));
    }

    @Test
    void fromJson_rejectsUnknownStepType() {
        String json = "{\"id\": \"bad\", \"steps\": [{\"id\": \"x\", \"type\": \"loop\"}]}";

        assertThatThrownBy(() -> WorkflowSerializer.fromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown step type 'loop' for step 'x'");
    }

    @Test
    void fromJson_rejectsMissingRequiredFields() {
        String json = "{\"id\": \"bad\", \"steps\": [{\"id\": \"x\", \"type\": \"if\"}]}";

        assertThatThrownBy(() -> WorkflowSerializer.fromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing 'condition' in if step 'x'");
    }

    @Test
    void fromJson_readsStepsNestedSeveralLevelsDeep() {
        String json =
                """
                {"id": "nested", "steps": [
                  {"id": "gate", "type": "if", "condition": "{{ ready }}", "then": [
                    {"id": "each", "type": "for_each", "items": "{{ repos }}", "steps": [
                      {"id": "guard", "type": "try",
                       "try": [
                         {"id": "route", "type": "switch", "expression": "{{ item.kind }}",
                          "cases": {"bug": [
                            {"id": "label", "type": "action", "action": "github.issues.label"}
                          ]}}
                       ],
                       "catch": [{"id": "note", "type": "action", "action": "workflow.log"}]}
                    ]}
                  ]}
                ]}
                """;

        IfStep gate = (IfStep) WorkflowSerializer.fromJson(json).getSteps().get(0);

        ForEachStep each = (ForEachStep) gate.thenSteps().get(0);
        TryStep guard = (TryStep) each.steps().get(0);
        SwitchStep route = (SwitchStep) guard.trySteps().get(0);
        assertThat(route.cases().get("bug"))
                .containsExactly(ActionStep.of("label", "github.issues.label", Map.of()));
        assertThat(guard.catchSteps()).extracting(WorkflowStep::id).containsExactly("note");
    }

    @Test
    void fromJson_reportsMissingFieldInNestedStep() {
        String json =
                """
                {"id": "bad", "steps": [
                  {"id": "outer", "type": "try", "try": [{"id": "inner", "type": "while"}]}
                ]}
                """;

        assertThatThrownBy(() -> WorkflowSerializer.fromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing 'condition' in while step 'inner'");
    }

    @Test
    void fromJson_runsBuilderValidation() {
        String json =
                """
                {"id": "dup", "steps": [
                  {"id": "a", "type": "action", "action": "workflow.noop"},
                  {"id": "a", "type": "action", "action": "workflow.noop"}
                ]}
                """;

        assertThatThrownBy(() -> WorkflowSerializer.fromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate step id 'a' in workflow");
    }
}
