package io.stepflow.serialization.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stepflow.core.checkpoint.Checkpoint;
import io.stepflow.core.checkpoint.CheckpointStatus;
import io.stepflow.core.checkpoint.ExecutionFilter;
import io.stepflow.core.checkpoint.ExecutionRecord;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.core.execution.ExecutionStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class JsonFileCheckpointStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir Path root;

    private JsonFileCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileCheckpointStore(root);
    }

    private static Checkpoint pending(String runId, int index, String stepId) {
        return Checkpoint.pending(runId, index, stepId, stepId, Map.of("index", index), T0);
    }

    @Nested
    class Checkpoints {

        @Test
        void shouldWriteOneFilePerStepIndex() {
            store.writeCheckpoint(pending("run-1", 0, "fetch"));
            store.writeCheckpoint(pending("run-1", 1, "label"));

            assertThat(root.resolve("run-1/checkpoints/000000.json")).isRegularFile();
            assertThat(root.resolve("run-1/checkpoints/000001.json")).isRegularFile();
        }

        @Test
        void shouldPreserveContentAcrossWriteAndRead() {
            Checkpoint done =
                    pending("run-1", 0, "fetch")
                            .completed(
                                    Map.of("items", List.of("a", "b"), "count", 2),
                                    1,
                                    T0.plusSeconds(2));
            store.writeCheckpoint(done);

            Checkpoint restored = store.listCheckpoints("run-1").get(0);

            assertThat(restored.stepName()).isEqualTo("fetch");
            assertThat(restored.status()).isEqualTo(CheckpointStatus.COMPLETED);
            assertThat(restored.inputs()).isEqualTo(Map.of("index", 0));
            assertThat(restored.outputs())
                    .isEqualTo(Map.of("items", List.of("a", "b"), "count", 2));
            assertThat(restored.retryCount()).isEqualTo(1);
            assertThat(restored.completedAt()).isEqualTo(T0.plusSeconds(2));
        }

        @Test
        void shouldOrderNumericallyAndUpsertByIndex() {
            for (int i = 11; i >= 0; i--) {
                store.writeCheckpoint(pending("run-1", i, "s" + i));
            }
            store.writeCheckpoint(pending("run-1", 3, "s3").failed("boom", 0, T0));

            List<Checkpoint> checkpoints = store.getCheckpoints("run-1");

            assertThat(checkpoints).hasSize(12);
            assertThat(checkpoints).extracting(Checkpoint::stepIndex).isSorted();
            assertThat(checkpoints.get(3).status()).isEqualTo(CheckpointStatus.FAILED);
            assertThat(checkpoints.get(3).error()).isEqualTo("boom");
        }

        @Test
        void shouldLeaveNoTemporaryFilesBehind() throws Exception {
            store.writeCheckpoint(pending("run-1", 0, "fetch"));
            store.writeCheckpoint(pending("run-1", 0, "fetch"));

            try (var files = Files.list(root.resolve("run-1/checkpoints"))) {
                assertThat(files.map(path -> path.getFileName().toString()))
                        .containsExactly("000000.json");
            }
        }

        @Test
        void shouldReturnEmptyListForUnknownRun() {
            assertThat(store.listCheckpoints("nothing-here")).isEmpty();
        }
    }

    @Nested
    class Executions {

        @Test
        void shouldWriteWireNamesAndReadRecordBack() throws Exception {
            ExecutionRecord record =
                    ExecutionRecord.started("run-1", "sync", Map.of("repo", "acme/api"), T0)
                            .finished(
                                    ExecutionStatus.COMPLETED,
                                    Map.of("labelled", 4),
                                    null,
                                    5,
                                    T0.plusSeconds(9));
            store.saveExecution(record);

            assertThat(Files.readString(root.resolve("run-1/execution.json")))
                    .contains("\"completed\"")
                    .contains("2026-03-01T09:00:00Z")
                    .doesNotContain("\"error\"");
            assertThat(store.getExecution("run-1")).contains(record);
        }

        @Test
        void shouldListNewestFirstAndApplyFilter() {
            store.saveExecution(ExecutionRecord.started("a", "sync", Map.of(), T0));
            store.saveExecution(
                    ExecutionRecord.started("b", "report", Map.of(), T0.plusSeconds(1)));
            store.saveExecution(ExecutionRecord.started("c", "sync", Map.of(), T0.plusSeconds(2)));

            assertThat(store.listExecutions(ExecutionFilter.ALL))
                    .extracting(ExecutionRecord::runId)
                    .containsExactly("c", "b", "a");
            assertThat(store.listExecutions(new ExecutionFilter("sync", null, 1)))
                    .extracting(ExecutionRecord::runId)
                    .containsExactly("c");
            assertThat(
                            store.listExecutions(
                                    new ExecutionFilter(null, ExecutionStatus.FAILED, null)))
                    .isEmpty();
        }

        @Test
        void shouldReturnEmptyWhenRootDoesNotExist() {
            JsonFileCheckpointStore fresh = new JsonFileCheckpointStore(root.resolve("absent"));

            assertThat(fresh.listExecutions(ExecutionFilter.ALL)).isEmpty();
            assertThat(fresh.getExecution("run-1")).isEmpty();
        }
    }

    @Test
    void shouldDeleteRunDirectory() {
        store.saveExecution(ExecutionRecord.started("run-1", "sync", Map.of(), T0));
        store.writeCheckpoint(pending("run-1", 0, "fetch"));

        assertThat(store.deleteRun("run-1")).isTrue();
        assertThat(store.deleteRun("run-1")).isFalse();
        assertThat(root.resolve("run-1")).doesNotExist();
    }

    @ParameterizedTest
    @ValueSource(strings = {"..", ".", "../escape", "a/b", "run 1", ""})
    void shouldRejectRunIdsUnsafeAsDirectoryNames(String runId) {
        assertThatThrownBy(() -> store.listCheckpoints(runId))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cannot be used as a directory name");
    }

    @Test
    void shouldWrapUnreadableFiles() throws Exception {
        Path dir = Files.createDirectories(root.resolve("run-1/checkpoints"));
        Files.writeString(dir.resolve("000000.json"), "{not json");

        assertThatThrownBy(() -> store.listCheckpoints("run-1"))
                .isInstanceOf(PersistenceException.class)
                .hasMessageStartingWith("Failed to read ");
    }
}
