package io.stepflow.core.execution.action;

import io.stepflow.core.exception.ValidationException;
import java.util.Objects;
import java.util.Set;

/// Classified form of a step's action name.
///
/// ### Supported action types
/// - {@link CoreOperation} - pure data operations under `core.*`
/// - {@link WorkflowOperation} - run control under `workflow.*`
/// - {@link ParallelOperation} - fan-out under `parallel.*`
/// - {@link EventOperation} - event-source operations under `event.*`
/// - {@link ToolCall} - everything else, `<tool>.<method.path>` on a registered tool
///
/// Classification is a prefix lookup; no reflection is involved and reserved namespaces never
/// fall through to tool lookup.
public abstract sealed class Action {

    public static final Set<String> CORE_OPERATIONS =
            Set.of(
                    "set",
                    "transform",
                    "extract",
                    "format",
                    "aggregate",
                    "compare",
                    "rename_keys",
                    "limit",
                    "sort",
                    "crypto",
                    "datetime",
                    "parse",
                    "compress",
                    "decompress");

    public static final Set<String> WORKFLOW_OPERATIONS =
            Set.of("set_outputs", "sleep", "fail", "log", "timestamp", "noop");

    public static final Set<String> PARALLEL_OPERATIONS = Set.of("spawn", "map");

    public static final Set<String> EVENT_OPERATIONS =
            Set.of("connect", "wait", "disconnect", "send", "status");

    private final String actionName;

    private Action(String actionName) {
        this.actionName = actionName;
    }

    /// Returns the full action name as written in the workflow.
    ///
    /// @return action name, never null
    public String getActionName() {
        return actionName;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + actionName + "]";
    }

    /// Base of the built-in namespaces, which carry a single operation name.
    public abstract static sealed class BuiltinAction extends Action
            permits CoreOperation, WorkflowOperation, ParallelOperation, EventOperation {

        private final String operation;

        private BuiltinAction(String actionName, String operation) {
            super(actionName);
            this.operation = operation;
        }

        /// Returns the operation name without its namespace, for example `set_outputs`.
        public String getOperation() {
            return operation;
        }
    }

    public static final class CoreOperation extends BuiltinAction {
        public CoreOperation(String operation) {
            super("core." + operation, operation);
        }
    }

    public static final class WorkflowOperation extends BuiltinAction {
        public WorkflowOperation(String operation) {
            super("workflow." + operation, operation);
        }
    }

    public static final class ParallelOperation extends BuiltinAction {
        public ParallelOperation(String operation) {
            super("parallel." + operation, operation);
        }
    }

    public static final class EventOperation extends BuiltinAction {
        public EventOperation(String operation) {
            super("event." + operation, operation);
        }
    }

    /// Call of a method on a registered tool client.
    ///
    /// For `slack.chat.postMessage` the tool is `slack` and the method `chat.postMessage`.
    public static final class ToolCall extends Action {
        private final String tool;
        private final String method;

        public ToolCall(String tool, String method) {
            super(tool + "." + method);
            this.tool = Objects.requireNonNull(tool, "tool must not be null");
            this.method = Objects.requireNonNull(method, "method must not be null");
        }

        /// Returns the tool name or workflow alias.
        public String getTool() {
            return tool;
        }

        /// Returns the dotted method path on the tool client.
        public String getMethod() {
            return method;
        }
    }

    /// Parses an action name.
    ///
    /// ### Supported Formats
    /// - `core.<op>`, `workflow.<op>`, `parallel.<op>`, `event.<op>` - built-in operations;
    ///   an unknown operation in these namespaces is rejected
    /// - `<tool>.<method.path>` - tool invocation
    ///
    /// @param actionName action name, not null
    /// @return classified action, never null
    /// @throws ValidationException if the name is blank, has no method part, or names an
    ///     unknown built-in operation
    public static Action fromString(String actionName) {
        Objects.requireNonNull(actionName, "actionName must not be null");
        String name = actionName.trim();
        int dot = name.indexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            throw new ValidationException(
                    "Invalid action '" + actionName + "': expected <namespace>.<operation>");
        }
        String namespace = name.substring(0, dot);
        String rest = name.substring(dot + 1);
        return switch (namespace) {
            case "core" -> new CoreOperation(requireKnown(name, rest, CORE_OPERATIONS));
            case "workflow" ->
                    new WorkflowOperation(requireKnown(name, rest, WORKFLOW_OPERATIONS));
            case "parallel" ->
                    new ParallelOperation(requireKnown(name, rest, PARALLEL_OPERATIONS));
            case "event" -> new EventOperation(requireKnown(name, rest, EVENT_OPERATIONS));
            default -> new ToolCall(namespace, rest);
        };
    }

    private static String requireKnown(String name, String operation, Set<String> known) {
        if (!known.contains(operation)) {
            throw new ValidationException("Unknown operation: " + name);
        }
        return operation;
    }
}
