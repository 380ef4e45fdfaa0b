package io.stepflow.core.execution.builtin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.execution.ExecutionContext;
import io.stepflow.core.template.ExpressionTemplateResolver;
import io.stepflow.core.workflow.Workflow;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CodecOperationsTest {

    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2026-03-15T13:45:10.250Z"), ZoneOffset.UTC);
    private static final String AES_KEY =
            "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

    private BuiltinOperations builtins;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        builtins = new BuiltinOperations();
        CodecOperations.registerAll(builtins, CLOCK);
        context = new ExecutionContext(Workflow.builder().id("codec").build(), "run-1", Map.of());
    }

    private Object call(String action, Map<String, Object> inputs) {
        OperationContext operation =
                new OperationContext(
                        action,
                        inputs,
                        inputs,
                        context,
                        new ExpressionTemplateResolver(),
                        (name, raw, scope) -> {
                            throw new UnsupportedOperationException(name);
                        });
        return builtins.get(action).orElseThrow().execute(operation);
    }

    @Nested
    class Crypto {

        @Test
        void shouldHashWithSha256ByDefault() {
            Object digest = call("core.crypto", Map.of("operation", "hash", "data", "abc"));

            assertThat(digest)
                    .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        }

        @Test
        void shouldEncodeDigestAsBase64() {
            Object digest =
                    call(
                            "core.crypto",
                            Map.of(
                                    "operation", "hash",
                                    "algorithm", "md5",
                                    "data", "",
                                    "encoding", "base64"));

            assertThat(digest).isEqualTo("1B2M2Y8AsgTpgAmY7PhCfg==");
        }

        @Test
        void shouldRequireKeyForHmac() {
            assertThatThrownBy(
                            () -> call("core.crypto", Map.of("operation", "hmac", "data", "x")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("core.crypto: key required for hmac");
        }

        @Test
        void shouldProduceRandomBytesOfRequestedSize() {
            Object random = call("core.crypto", Map.of("operation", "random", "size", 8));

            assertThat(random).asString().hasSize(16).matches("[0-9a-f]+");
        }

        @ParameterizedTest
        @ValueSource(strings = {"aes-256-gcm", "aes-256-cbc"})
        void shouldDecryptWhatItEncrypted(String algorithm) {
            Object sealed =
                    call(
                            "core.crypto",
                            Map.of(
                                    "operation", "encrypt",
                                    "algorithm", algorithm,
                                    "key", AES_KEY,
                                    "data", "attack at dawn"));

            Map<String, Object> decrypt = new LinkedHashMap<>();
            decrypt.putAll(asMap(sealed));
            decrypt.put("operation", "decrypt");
            decrypt.put("algorithm", algorithm);
            decrypt.put("key", AES_KEY);

            assertThat(call("core.crypto", decrypt)).isEqualTo("attack at dawn");
        }

        @Test
        void shouldRejectTamperedCiphertext() {
            Map<String, Object> sealed =
                    new LinkedHashMap<>(
                            asMap(
                                    call(
                                            "core.crypto",
                                            Map.of(
                                                    "operation", "encrypt",
                                                    "key", AES_KEY,
                                                    "data", "payload"))));
            String tag = (String) sealed.get("authTag");
            sealed.put("authTag", (tag.charAt(0) == '0' ? "1" : "0") + tag.substring(1));
            sealed.put("operation", "decrypt");
            sealed.put("key", AES_KEY);

            assertThatThrownBy(() -> call("core.crypto", sealed))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("core.crypto: ");
        }

        private Map<String, Object> asMap(Object value) {
            return (Map<String, Object>) value;
        }
    }

    @Nested
    class DateTime {

        @Test
        void shouldShiftDatesByUnit() {
            assertThat(
                            call(
                                    "core.datetime",
                                    Map.of(
                                            "operation", "add",
                                            "date", "2026-01-31T00:00:00Z",
                                            "amount", 36,
                                            "unit", "hours")))
                    .isEqualTo("2026-02-01T12:00:00Z");
            assertThat(
                            call(
                                    "core.datetime",
                                    Map.of("operation", "subtract", "amount", 1, "unit", "weeks")))
                    .isEqualTo("2026-03-08T13:45:10.250Z");
        }

        @Test
        void shouldDiffInRequestedUnit() {
            Object diff =
                    call(
                            "core.datetime",
                            Map.of(
                                    "operation", "diff",
                                    "date", "2026-03-02T06:00:00Z",
                                    "date2", "2026-03-01T00:00:00Z",
                                    "unit", "days"));

            assertThat(diff).isEqualTo(1.25);
        }

        @Test
        void shouldComputeCalendarBoundariesInUtc() {
            assertThat(call("core.datetime", Map.of("operation", "start_of", "unit", "month")))
                    .isEqualTo("2026-03-01T00:00:00Z");
            assertThat(call("core.datetime", Map.of("operation", "end_of", "unit", "day")))
                    .isEqualTo("2026-03-15T23:59:59.999Z");
            assertThat(
                            call(
                                    "core.datetime",
                                    Map.of("operation", "format", "format", "unix_ms")))
                    .isEqualTo(CLOCK.millis());
        }

        @Test
        void shouldRejectUnreadableDate() {
            assertThatThrownBy(
                            () ->
                                    call(
                                            "core.datetime",
                                            Map.of("operation", "parse", "date", "yesterday")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Invalid date value: yesterday");
        }
    }

    @Nested
    class Parse {

        @Test
        void shouldParseCsvWithHeader() {
            Object rows =
                    call(
                            "core.parse",
                            Map.of("format", "csv", "data", "name, age\nada, 36\n\nbo,5\n"));

            assertThat(rows)
                    .isEqualTo(
                            List.of(
                                    Map.of("name", "ada", "age", "36"),
                                    Map.of("name", "bo", "age", "5")));
        }

        @Test
        void shouldParseCsvWithoutHeaderUsingDelimiter() {
            Object rows =
                    call(
                            "core.parse",
                            Map.of(
                                    "format", "csv",
                                    "data", "a;b\nc;d",
                                    "delimiter", ";",
                                    "header", false));

            assertThat(rows).isEqualTo(List.of(List.of("a", "b"), List.of("c", "d")));
        }

        @Test
        void shouldParseUrlParamsAndXml() {
            assertThat(call("core.parse", Map.of("format", "url_params", "data", "?q=a%20b&x")))
                    .isEqualTo(Map.of("q", "a b", "x", ""));
            assertThat(
                            call(
                                    "core.parse",
                                    Map.of(
                                            "format", "xml",
                                            "data", "<user><id>7</id><name> ada </name></user>")))
                    .isEqualTo(Map.of("id", "7", "name", "ada"));
        }

        @Test
        void shouldParseJsonAndYaml() {
            assertThat(call("core.parse", Map.of("format", "json", "data", "{\"a\": [1, 2]}")))
                    .asInstanceOf(InstanceOfAssertFactories.MAP)
                    .containsEntry("a", List.of(1, 2));
            assertThat(call("core.parse", Map.of("format", "yaml", "data", "a: 1\nb: text\n")))
                    .asInstanceOf(InstanceOfAssertFactories.MAP)
                    .containsEntry("a", 1)
                    .containsEntry("b", "text");
        }

        @Test
        void shouldRequireStringData() {
            assertThatThrownBy(() -> call("core.parse", Map.of("format", "json", "data", 5)))
                    .hasMessage("core.parse: data must be a string");
        }
    }

    @Nested
    class Compression {

        @ParameterizedTest
        @ValueSource(strings = {"gzip", "deflate"})
        void shouldDecompressWhatItCompressed(String algorithm) {
            String text = "stepflow ".repeat(50);
            Object packed = call("core.compress", Map.of("data", text, "algorithm", algorithm));

            Object unpacked =
                    call("core.decompress", Map.of("data", packed, "algorithm", algorithm));

            assertThat(unpacked).isEqualTo(text);
            assertThat((String) packed).hasSizeLessThan(text.length());
        }

        @Test
        void shouldRejectInvalidInput() {
            assertThatThrownBy(() -> call("core.compress", Map.of("data", "")))
                    .hasMessage("core.compress: data is required");
            assertThatThrownBy(() -> call("core.decompress", Map.of("data", "%%%")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("core.decompress: data is not base64");
            assertThatThrownBy(
                            () -> call("core.compress", Map.of("data", "x", "algorithm", "lz4")))
                    .hasMessage("core.compress: unknown algorithm \"lz4\"");
        }
    }
}
