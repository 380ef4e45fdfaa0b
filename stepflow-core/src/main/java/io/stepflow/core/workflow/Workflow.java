package io.stepflow.core.workflow;

import io.stepflow.core.workflow.step.WorkflowStep;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable workflow definition: declared inputs, tool bindings and the ordered step tree.
///
/// Workflows are constructed via the builder pattern and validated on build.
///
/// ### Validation
/// - `id` is required
/// - every step id in the tree, nested steps included, is unique
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see io.stepflow.core.execution.WorkflowEngine for execution logic
/// @see WorkflowStep for the step hierarchy
public final class Workflow {

    private final String id;
    private final String name;
    private final String version;
    private final String description;
    private final List<WorkflowInput> inputs;
    private final Map<String, ToolConfig> tools;
    private final List<WorkflowStep> steps;
    private final ErrorHandling errorHandling;

    private Workflow(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Workflow ID required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.version = builder.version;
        this.description = builder.description;
        this.inputs = List.copyOf(builder.inputs);
        this.tools = Map.copyOf(builder.tools);
        this.steps = List.copyOf(builder.steps);
        this.errorHandling =
                builder.errorHandling != null ? builder.errorHandling : ErrorHandling.STOP;

        validate();
    }

    private void validate() {
        Set<String> seen = new HashSet<>();
        steps.forEach(step -> collectIds(step, seen));
    }

    private static void collectIds(WorkflowStep step, Set<String> seen) {
        if (!seen.add(step.id())) {
            throw new IllegalStateException("Duplicate step id '" + step.id() + "' in workflow");
        }
        step.children().forEach(child -> collectIds(child, seen));
    }

    /// Returns the unique workflow identifier.
    ///
    /// @return workflow ID, never null
    public String getId() {
        return id;
    }

    /// Returns the display name, defaulting to the id.
    public String getName() {
        return name;
    }

    /// Returns the version string (default "1.0.0").
    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    /// @return declared inputs, never null (may be empty)
    public List<WorkflowInput> getInputs() {
        return inputs;
    }

    /// @return tool alias to binding, never null (may be empty)
    public Map<String, ToolConfig> getTools() {
        return tools;
    }

    /// @return top-level steps in execution order, never null
    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public ErrorHandling getErrorHandling() {
        return errorHandling;
    }

    /// Creates a new workflow builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing immutable Workflow instances.
    ///
    /// Required field: `id`.
    public static final class Builder {
        private String id;
        private String name;
        private String version = "1.0.0";
        private String description;
        private List<WorkflowInput> inputs = List.of();
        private Map<String, ToolConfig> tools = Map.of();
        private List<WorkflowStep> steps = List.of();
        private ErrorHandling errorHandling = ErrorHandling.STOP;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder inputs(List<WorkflowInput> inputs) {
            this.inputs = List.copyOf(inputs);
            return this;
        }

        public Builder tools(Map<String, ToolConfig> tools) {
            this.tools = Map.copyOf(tools);
            return this;
        }

        public Builder steps(List<WorkflowStep> steps) {
            this.steps = List.copyOf(steps);
            return this;
        }

        public Builder errorHandling(ErrorHandling errorHandling) {
            this.errorHandling = errorHandling;
            return this;
        }

        /// Builds the workflow.
        ///
        /// @return immutable workflow, never null
        /// @throws NullPointerException if `id` is missing
        /// @throws IllegalStateException if step ids are not unique
        public Workflow build() {
            return new Workflow(this);
        }
    }
}
