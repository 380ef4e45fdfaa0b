package io.stepflow.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stepflow.core.exception.TemplateException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ExpressionTemplateResolverTest {

    private ExpressionTemplateResolver resolver;
    private Map<String, Object> vars;

    @BeforeEach
    void setUp() {
        resolver = new ExpressionTemplateResolver();
        vars = new LinkedHashMap<>();
        vars.put("user", Map.of("name", "ada", "roles", List.of("admin", "dev")));
        vars.put("items", List.of(3, 1, 2));
        vars.put("n", 2);
        vars.put("title", "Hello World");
        vars.put("empty", "");
    }

    @Nested
    class Resolution {

        @Test
        void shouldReturnPlainTextUnchanged() {
            assertThat(resolver.resolve("no placeholders here", vars))
                    .isEqualTo("no placeholders here");
        }

        @Test
        void shouldKeepTypedValueForSingleExpression() {
            assertThat(resolver.resolve("{{ items }}", vars)).isEqualTo(List.of(3, 1, 2));
            assertThat(resolver.resolve("  {{ n * 3 }}  ", vars)).isEqualTo(6L);
        }

        @Test
        void shouldInterpolateMixedText() {
            assertThat(resolver.resolve("Hi {{ user.name }}, you have {{ n }} tasks", vars))
                    .isEqualTo("Hi ada, you have 2 tasks");
        }

        @Test
        @DisplayName("mixed text renders null as empty and collections as JSON")
        void shouldStringifyNullAndCollections() {
            assertThat(resolver.resolve("[{{ missing }}]", vars)).isEqualTo("[]");
            assertThat(resolver.resolve("roles={{ user.roles }}", vars))
                    .isEqualTo("roles=[\"admin\",\"dev\"]");
        }

        @Test
        void shouldResolveNestedMapsAndLists() {
            Map<String, Object> input =
                    Map.of(
                            "greeting", "Hi {{ user.name }}",
                            "list", List.of("{{ n }}", 7, true));

            Object resolved = resolver.resolve(input, vars);

            assertThat(resolved)
                    .isEqualTo(Map.of("greeting", "Hi ada", "list", List.of(2, 7, true)));
        }

        @Test
        void shouldLeaveNonStringScalarsAlone() {
            assertThat(resolver.resolve(42, vars)).isEqualTo(42);
            assertThat(resolver.resolve(null, vars)).isNull();
        }

        @Test
        void shouldEvaluateUndefinedVariableAsNull() {
            assertThat(resolver.resolve("{{ nope.deeper }}", vars)).isNull();
        }
    }

    @Nested
    class Operators {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "n + 3, 5",
            "n * 2.5, 5",
            "7 / 2, 3.5",
            "7 % 4, 3",
            "-n, -2",
        })
        void shouldComputeArithmetic(String expression, String expected) {
            Object result = resolver.evaluate(expression, vars);

            assertThat(String.valueOf(result)).isEqualTo(expected);
        }

        @Test
        void shouldNormalizeIntegralResultsToLong() {
            assertThat(resolver.evaluate("n * 2.5", vars)).isEqualTo(5L);
            assertThat(resolver.evaluate("7 / 2", vars)).isEqualTo(3.5);
        }

        @Test
        void shouldConcatenateListsAndStrings() {
            assertThat(resolver.evaluate("[1] + [2, 3]", vars)).isEqualTo(List.of(1L, 2L, 3L));
            assertThat(resolver.evaluate("'n=' + n", vars)).isEqualTo("n=2");
        }

        @Test
        void shouldRejectDivisionByZero() {
            assertThatThrownBy(() -> resolver.evaluate("n / 0", vars))
                    .isInstanceOf(TemplateException.class)
                    .hasMessageContaining("Division by zero");
        }

        @Test
        void shouldCompareLooselyAndStrictly() {
            assertThat(resolver.evaluate("n == '2'", vars)).isEqualTo(true);
            assertThat(resolver.evaluate("n === '2'", vars)).isEqualTo(false);
            assertThat(resolver.evaluate("n === 2", vars)).isEqualTo(true);
            assertThat(resolver.evaluate("n >= 2 and n < 3", vars)).isEqualTo(true);
        }

        @Test
        void shouldReturnOperandFromAndOr() {
            assertThat(resolver.evaluate("empty or 'fallback'", vars)).isEqualTo("fallback");
            assertThat(resolver.evaluate("title && n", vars)).isEqualTo(2);
            assertThat(resolver.evaluate("empty and n", vars)).isEqualTo("");
        }

        @Test
        void shouldSupportMembershipAndNegation() {
            assertThat(resolver.evaluate("'admin' in user.roles", vars)).isEqualTo(true);
            assertThat(resolver.evaluate("'root' not in user.roles", vars)).isEqualTo(true);
            assertThat(resolver.evaluate("!empty", vars)).isEqualTo(true);
        }

        @Test
        void shouldEvaluateTernaryAndIndexAccess() {
            assertThat(resolver.evaluate("n > 1 ? 'many' : 'one'", vars)).isEqualTo("many");
            assertThat(resolver.evaluate("items[0]", vars)).isEqualTo(3);
            assertThat(resolver.evaluate("user['name']", vars)).isEqualTo("ada");
        }

        @Test
        void shouldAcceptWrappedExpressionInEvaluate() {
            assertThat(resolver.evaluate("{{ n + 1 }}", vars)).isEqualTo(3L);
        }
    }

    @Nested
    class Filters {

        @Test
        void shouldChainStringFilters() {
            assertThat(resolver.resolve("{{ title | lower | replace(' ', '-') }}", vars))
                    .isEqualTo("hello-world");
            assertThat(resolver.resolve("{{ title | slugify }}", vars)).isEqualTo("hello-world");
            assertThat(resolver.resolve("{{ title | truncate(5) }}", vars))
                    .isEqualTo("Hello...");
        }

        @Test
        void shouldApplyArrayFilters() {
            assertThat(resolver.evaluate("items | sort", vars)).isEqualTo(List.of(1, 2, 3));
            assertThat(resolver.evaluate("items | sum", vars)).isEqualTo(6L);
            assertThat(resolver.evaluate("items | join('-')", vars)).isEqualTo("3-1-2");
            assertThat(resolver.evaluate("items | first", vars)).isEqualTo(3);
            assertThat(resolver.evaluate("[[1, 2], [3]] | flatten | length", vars))
                    .isEqualTo(3);
        }

        @Test
        void shouldApplyObjectFilters() {
            assertThat(resolver.evaluate("user | keys", vars))
                    .asInstanceOf(InstanceOfAssertFactories.LIST)
                    .containsExactlyInAnyOrder("name", "roles");
            assertThat(resolver.evaluate("user | pick('name')", vars))
                    .isEqualTo(Map.of("name", "ada"));
        }

        @Test
        @DisplayName("filters are lenient about missing input")
        void shouldTreatMissingInputLeniently() {
            assertThat(resolver.evaluate("missing | length", vars)).isEqualTo(0);
            assertThat(resolver.evaluate("missing | upper", vars)).isEqualTo("");
            assertThat(resolver.evaluate("missing | default('none')", vars)).isEqualTo("none");
        }

        @Test
        void shouldParseAndRenderJson() {
            assertThat(resolver.evaluate("'{\"a\": 1}' | parse_json", vars))
                    .isEqualTo(Map.of("a", 1));
            assertThat(resolver.evaluate("'not json' | parse_json", vars)).isNull();
        }

        @Test
        void shouldFormatDatesInUtc() {
            String expression = "'2026-03-01T23:30:00Z' | format_date('YYYY-MM-DD')";
            assertThat(resolver.evaluate(expression, vars)).isEqualTo("2026-03-01");
            assertThat(
                            resolver.evaluate(
                                    "'2026-03-10T00:00:00Z' | diff_days('2026-03-01T00:00:00Z')",
                                    vars))
                    .isEqualTo(9L);
        }

        @Test
        void shouldRejectUnknownFilter() {
            assertThatThrownBy(() -> resolver.evaluate("n | explode", vars))
                    .isInstanceOf(TemplateException.class)
                    .hasMessage("Unknown filter: explode");
        }

        @Test
        void shouldUseCustomFilterRegistry() {
            TemplateFilters filters =
                    TemplateFilters.standard().register("shout", (in, args) -> in + "!");
            ExpressionTemplateResolver custom = new ExpressionTemplateResolver(filters);

            assertThat(custom.resolve("{{ user.name | shout }}", vars)).isEqualTo("ada!");
        }
    }

    @Nested
    class Validation {

        @ParameterizedTest
        @ValueSource(strings = {"n + 1", "{{ user.name | upper }}", "a ? b : c", "x not in [1, 2]"})
        void shouldAcceptValidExpressions(String expression) {
            assertThatCode(() -> resolver.validate(expression)).doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "n +", "items[0", "a ? b"})
        void shouldRejectSyntaxErrors(String expression) {
            assertThatThrownBy(() -> resolver.validate(expression))
                    .isInstanceOf(TemplateException.class);
        }

        @Test
        void shouldRejectFunctionCalls() {
            assertThatThrownBy(() -> resolver.validate("user.name()"))
                    .isInstanceOf(TemplateException.class)
                    .hasMessageContaining("Function calls are not allowed");
        }
    }
}
