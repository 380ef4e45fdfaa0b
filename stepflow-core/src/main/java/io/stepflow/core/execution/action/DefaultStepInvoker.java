package io.stepflow.core.execution.action;

import io.stepflow.core.execution.ExecutionContext;
import io.stepflow.core.reliability.CallOptions;
import io.stepflow.core.reliability.ParameterSchema;
import io.stepflow.core.reliability.ReliabilityOptions;
import io.stepflow.core.reliability.ReliabilityWrapper;
import io.stepflow.core.tool.ToolClient;
import io.stepflow.core.tool.ToolDefinition;
import io.stepflow.core.tool.ToolRegistry;
import io.stepflow.core.workflow.ToolConfig;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// {@link StepInvoker} that loads clients from a {@link ToolRegistry} and runs every call
/// through the {@link ReliabilityWrapper}.
///
/// ### Tool resolution
/// The first segment of the action names either a registered tool or an alias declared in the
/// workflow's `tools` section. An alias maps to a registered tool and contributes config that
/// is merged over the tool definition's config before the client is created. Breaker and
/// rate-limiter state is keyed by the registered tool name, so aliases of one tool share it.
///
/// When the tool definition declares parameters for the called method, they become the input
/// schema of the call, in addition to the wrapper's reference schemas.
public class DefaultStepInvoker implements StepInvoker {

    private static final Logger logger = Logger.getLogger(DefaultStepInvoker.class.getName());

    private final ToolRegistry tools;
    private final ReliabilityWrapper reliability;

    public DefaultStepInvoker(ToolRegistry tools, ReliabilityWrapper reliability) {
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.reliability = Objects.requireNonNull(reliability, "reliability must not be null");
    }

    @Override
    public Object invoke(
            Action.ToolCall call, Map<String, Object> inputs, ExecutionContext context) {
        Objects.requireNonNull(call, "call must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(context, "context must not be null");

        ToolConfig alias = context.getWorkflow().getTools().get(call.getTool());
        String toolName = alias != null && alias.tool() != null ? alias.tool() : call.getTool();
        Map<String, Object> overrides = alias != null ? alias.config() : Map.of();
        String method = call.getMethod();
        String actionPath = toolName + "." + method;

        ToolClient client = tools.load(toolName, overrides);
        ReliabilityOptions options = optionsFor(toolName, method, actionPath);
        logger.fine("Invoking " + actionPath + " for run " + context.getRunId());
        return reliability.call(
                toolName,
                actionPath,
                inputs,
                () -> client.invoke(method, inputs),
                options,
                CallOptions.NONE);
    }

    private ReliabilityOptions optionsFor(String toolName, String method, String actionPath) {
        ReliabilityOptions defaults = reliability.getDefaults();
        Optional<List<ToolDefinition.ParameterDef>> parameters =
                tools.get(toolName).map(definition -> definition.operations().get(method));
        if (parameters.isEmpty()) {
            return defaults;
        }
        return defaults.toBuilder()
                .inputSchema(actionPath, new ParameterSchema(parameters.get()))
                .build();
    }
}
