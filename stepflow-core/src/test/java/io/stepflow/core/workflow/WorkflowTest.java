package io.stepflow.core.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stepflow.core.workflow.step.ActionStep;
import io.stepflow.core.workflow.step.ForEachStep;
import io.stepflow.core.workflow.step.IfStep;
import io.stepflow.core.workflow.step.StepType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class WorkflowTest {

    @Test
    void shouldApplyDefaults() {
        Workflow workflow = Workflow.builder().id("sync").build();

        assertThat(workflow.getName()).isEqualTo("sync");
        assertThat(workflow.getVersion()).isEqualTo("1.0.0");
        assertThat(workflow.getErrorHandling()).isEqualTo(ErrorHandling.STOP);
        assertThat(workflow.getSteps()).isEmpty();
        assertThat(workflow.getTools()).isEmpty();
    }

    @Test
    void shouldRequireId() {
        assertThatThrownBy(() -> Workflow.builder().build())
                .isInstanceOf(NullPointerException.class)
                .hasMessage("Workflow ID required");
    }

    @Test
    void shouldRejectDuplicateStepIdsInNestedBlocks() {
        IfStep branch =
                new IfStep(
                        "check",
                        "{{ ready }}",
                        List.of(ActionStep.of("notify", "workflow.noop", Map.of())),
                        List.of(
                                ForEachStep.of(
                                        "each",
                                        "{{ items }}",
                                        List.of(
                                                ActionStep.of(
                                                        "notify", "workflow.noop", Map.of())))));

        assertThatThrownBy(() -> Workflow.builder().id("dup").steps(List.of(branch)).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Duplicate step id 'notify' in workflow");
    }

    @Test
    void shouldDefensivelyCopyCollections() {
        Workflow workflow =
                Workflow.builder()
                        .id("sync")
                        .inputs(List.of(WorkflowInput.required("repo", "string")))
                        .tools(Map.of("gh", new ToolConfig("github", null)))
                        .build();

        assertThatThrownBy(() -> workflow.getInputs().add(WorkflowInput.required("x", null)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(workflow.getTools().get("gh").config()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(StepType.class)
    void shouldRoundTripStepTypeWireNames(StepType type) {
        assertThat(StepType.fromWireName(type.wireName())).isEqualTo(type);
    }

    @Test
    void shouldParseErrorHandlingLeniently() {
        assertThat(ErrorHandling.fromWireName(null)).isEqualTo(ErrorHandling.STOP);
        assertThat(ErrorHandling.fromWireName(" Continue ")).isEqualTo(ErrorHandling.CONTINUE);
        assertThatThrownBy(() -> StepType.fromWireName("loop"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown step type: loop");
    }
}
