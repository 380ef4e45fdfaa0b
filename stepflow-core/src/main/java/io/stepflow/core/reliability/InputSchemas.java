package io.stepflow.core.reliability;

import io.stepflow.core.tool.ToolDefinition.ParameterDef;
import java.util.Map;

/// Input schemas for a few widely used SaaS actions, keyed by `<service>.<method path>`.
public final class InputSchemas {

    public static final Map<String, InputSchema> REFERENCE =
            Map.of(
                    "github.issues.create",
                    ParameterSchema.of(
                            ParameterDef.required("owner", "string", "Repository owner"),
                            ParameterDef.required("repo", "string", "Repository name"),
                            ParameterDef.required("title", "string", "Issue title"),
                            ParameterDef.optional("body", "string", "Issue body", null),
                            ParameterDef.optional("assignees", "array", "Assignee logins", null),
                            ParameterDef.optional("labels", "array", "Label names", null),
                            ParameterDef.optional("milestone", "number", "Milestone number", null)),
                    "github.issues.update",
                    ParameterSchema.of(
                            ParameterDef.required("owner", "string", "Repository owner"),
                            ParameterDef.required("repo", "string", "Repository name"),
                            ParameterDef.required("issue_number", "integer", "Issue number"),
                            ParameterDef.optional("title", "string", "Issue title", null),
                            ParameterDef.optional("body", "string", "Issue body", null),
                            ParameterDef.optional("state", "string", "open or closed", null)),
                    "slack.chat.postMessage",
                    ParameterSchema.of(
                            ParameterDef.required("channel", "string", "Channel id or name"),
                            ParameterDef.optional("text", "string", "Message text", null),
                            ParameterDef.optional("blocks", "array", "Block Kit blocks", null),
                            ParameterDef.optional("thread_ts", "string", "Parent thread", null)),
                    "gmail.users.messages.send",
                    ParameterSchema.of(
                            ParameterDef.required("userId", "string", "Mailbox owner"),
                            ParameterDef.required("requestBody", "object", "Raw message body")),
                    "gmail.users.messages.get",
                    ParameterSchema.of(
                            ParameterDef.required("userId", "string", "Mailbox owner"),
                            ParameterDef.required("id", "string", "Message id"),
                            ParameterDef.optional("format", "string", "Response format", null)));

    private InputSchemas() {}
}
