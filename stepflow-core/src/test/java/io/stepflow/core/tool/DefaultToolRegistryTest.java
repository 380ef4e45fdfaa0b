package io.stepflow.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stepflow.core.exception.SecretNotFoundException;
import io.stepflow.core.exception.ToolInvocationException;
import io.stepflow.core.tool.ToolDefinition.ParameterDef;
import io.stepflow.core.tool.secret.EnvironmentSecretProvider;
import io.stepflow.core.tool.secret.SecretResolver;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DefaultToolRegistryTest {

    private DefaultToolRegistry registry;
    private List<Map<String, Object>> seenConfigs;
    private AtomicInteger created;

    @BeforeEach
    void setUp() {
        SecretResolver secrets = new SecretResolver(Duration.ofMinutes(1));
        secrets.registerProvider(
                "env", new EnvironmentSecretProvider("", Map.of("GITHUB_TOKEN", "ghp_1")::get));
        registry = new DefaultToolRegistry(secrets);
        seenConfigs = new CopyOnWriteArrayList<>();
        created = new AtomicInteger();
    }

    private ToolDefinition github(Map<String, Object> config) {
        return ToolDefinition.builder(
                        "github",
                        resolved -> {
                            created.incrementAndGet();
                            seenConfigs.add(resolved);
                            Object org = resolved.getOrDefault("org", "none");
                            return (method, inputs) ->
                                    Map.of("method", method, "inputs", inputs, "org", org);
                        })
                .description("GitHub REST API")
                .config(config)
                .operation(
                        "issues.create",
                        List.of(
                                ParameterDef.required("repo", "string", "Repository"),
                                ParameterDef.optional("labels", "array", "Labels", List.of())))
                .build();
    }

    private static Map<String, Object> createIssue(ToolClient client) throws Exception {
        return (Map<String, Object>) client.invoke("issues.create", Map.of());
    }

    @Nested
    class Registration {

        @Test
        void shouldRegisterAndLookUpTools() {
            registry.register(github(Map.of()));

            assertThat(registry.contains("github")).isTrue();
            assertThat(registry.get("github")).hasValueSatisfying(
                    tool -> assertThat(tool.description()).isEqualTo("GitHub REST API"));
            assertThat(registry.all()).extracting(ToolDefinition::name).containsExactly("github");
        }

        @Test
        void shouldExposeRequiredParameterNames() {
            ToolDefinition tool = github(Map.of());

            assertThat(tool.requiredParameterNames("issues.create")).containsExactly("repo");
            assertThat(tool.requiredParameterNames("issues.delete")).isEmpty();
        }

        @Test
        void shouldRejectBlankName() {
            assertThatThrownBy(() -> ToolDefinition.simple(" ", config -> null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("name must not be blank");
        }

        @Test
        void shouldRemoveTool() {
            registry.register(github(Map.of()));

            assertThat(registry.remove("github")).isTrue();
            assertThat(registry.remove("github")).isFalse();
            assertThat(registry.contains("github")).isFalse();
        }
    }

    @Nested
    class Loading {

        @Test
        void shouldResolveSecretsBeforeCreatingClient() throws Exception {
            registry.register(
                    github(Map.of("token", "${secret:env://GITHUB_TOKEN}", "timeout", 30)));

            ToolClient client = registry.load("github");

            assertThat(seenConfigs).containsExactly(Map.of("token", "ghp_1", "timeout", 30));
            assertThat(client.invoke("issues.create", Map.of("repo", "x")))
                    .isEqualTo(
                            Map.of(
                                    "method", "issues.create",
                                    "inputs", Map.of("repo", "x"),
                                    "org", "none"));
        }

        @Test
        void shouldCacheClientPerOverrideSet() throws Exception {
            registry.register(github(Map.of("org", "acme")));

            ToolClient first = registry.load("github");
            ToolClient again = registry.load("github");
            ToolClient overridden = registry.load("github", Map.of("org", "other"));
            registry.load("github", Map.of("org", "other"));

            assertThat(again).isSameAs(first);
            assertThat(created).hasValue(2);
            assertThat(seenConfigs.get(1)).containsEntry("org", "other");
            assertThat(createIssue(overridden)).containsEntry("org", "other");
        }

        @Test
        void shouldEvictCachedClientsOnReregister() throws Exception {
            registry.register(github(Map.of()));
            registry.load("github");

            registry.register(github(Map.of("org", "acme")));
            ToolClient reloaded = registry.load("github");

            assertThat(created).hasValue(2);
            assertThat(createIssue(reloaded)).containsEntry("org", "acme");
        }

        @Test
        void shouldFailPermanentlyForUnknownTool() {
            assertThatThrownBy(() -> registry.load("jira"))
                    .isInstanceOfSatisfying(
                            ToolInvocationException.class,
                            e -> assertThat(e.isRetryable()).isFalse())
                    .hasMessage("Unknown tool: jira");
        }

        @Test
        void shouldWrapFactoryFailures() {
            registry.register(
                    ToolDefinition.simple(
                            "flaky",
                            config -> {
                                throw new IllegalStateException("no network");
                            }));

            assertThatThrownBy(() -> registry.load("flaky"))
                    .isInstanceOf(ToolInvocationException.class)
                    .hasMessage("Failed to create client for flaky: no network")
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        void shouldRejectNullClient() {
            registry.register(ToolDefinition.simple("empty", config -> null));

            assertThatThrownBy(() -> registry.load("empty"))
                    .isInstanceOf(ToolInvocationException.class)
                    .hasMessage("Client factory for empty returned null");
        }

        @Test
        void shouldPropagateMissingSecret() {
            registry.register(github(Map.of("token", "${secret:env://MISSING}")));

            assertThatThrownBy(() -> registry.load("github"))
                    .isInstanceOf(SecretNotFoundException.class);
            assertThat(created).hasValue(0);
        }
    }
}
