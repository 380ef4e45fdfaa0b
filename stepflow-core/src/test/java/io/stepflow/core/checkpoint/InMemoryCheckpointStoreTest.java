package io.stepflow.core.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;

import io.stepflow.core.execution.ExecutionStatus;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryCheckpointStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private InMemoryCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryCheckpointStore();
    }

    private static Checkpoint pending(String runId, int index, String stepId) {
        return Checkpoint.pending(runId, index, stepId, stepId, Map.of("n", index), T0);
    }

    private static ExecutionRecord record(String runId, String workflowId, int minute) {
        return ExecutionRecord.started(runId, workflowId, Map.of(), T0.plusSeconds(60L * minute));
    }

    @Nested
    class Checkpoints {

        @Test
        void shouldReturnCheckpointsInStepIndexOrder() {
            store.writeCheckpoint(pending("run-1", 2, "c"));
            store.writeCheckpoint(pending("run-1", 0, "a"));
            store.writeCheckpoint(pending("run-1", 1, "b"));

            assertThat(store.listCheckpoints("run-1"))
                    .extracting(Checkpoint::stepId)
                    .containsExactly("a", "b", "c");
        }

        @Test
        void shouldReplaceCheckpointWithSameIndex() {
            Checkpoint first = pending("run-1", 0, "fetch");
            store.writeCheckpoint(first);

            store.writeCheckpoint(first.completed(Map.of("ok", true), 1, T0.plusSeconds(1)));

            assertThat(store.getCheckpoints("run-1"))
                    .singleElement()
                    .satisfies(
                            checkpoint -> {
                                assertThat(checkpoint.status())
                                        .isEqualTo(CheckpointStatus.COMPLETED);
                                assertThat(checkpoint.outputs()).isEqualTo(Map.of("ok", true));
                                assertThat(checkpoint.retryCount()).isEqualTo(1);
                                assertThat(checkpoint.inputs()).containsEntry("n", 0);
                            });
        }

        @Test
        void shouldReturnEmptyListForUnknownRun() {
            assertThat(store.listCheckpoints("missing")).isEmpty();
        }
    }

    @Nested
    class Executions {

        @Test
        void shouldListNewestFirstWithFilterAndLimit() {
            store.saveExecution(record("r1", "sync", 0));
            store.saveExecution(record("r2", "report", 1));
            store.saveExecution(record("r3", "sync", 2));
            store.saveExecution(
                    record("r4", "sync", 3)
                            .finished(
                                    ExecutionStatus.FAILED, null, "boom", 2, T0.plusSeconds(300)));

            assertThat(store.listExecutions(ExecutionFilter.ALL))
                    .extracting(ExecutionRecord::runId)
                    .containsExactly("r4", "r3", "r2", "r1");
            assertThat(store.listExecutions(ExecutionFilter.forWorkflow("sync")))
                    .extracting(ExecutionRecord::runId)
                    .containsExactly("r4", "r3", "r1");
            assertThat(store.listExecutions(new ExecutionFilter("sync", null, 2)))
                    .extracting(ExecutionRecord::runId)
                    .containsExactly("r4", "r3");
            assertThat(
                            store.listExecutions(
                                    new ExecutionFilter(null, ExecutionStatus.FAILED, null)))
                    .extracting(ExecutionRecord::error)
                    .containsExactly("boom");
        }

        @Test
        void shouldOverwriteRecordWhenRunFinishes() {
            ExecutionRecord started = record("r1", "sync", 0);
            store.saveExecution(started);

            store.saveExecution(
                    started.finished(
                            ExecutionStatus.COMPLETED, Map.of("count", 3), null, 4, T0));

            assertThat(store.getExecution("r1"))
                    .hasValueSatisfying(
                            record -> {
                                assertThat(record.status()).isEqualTo(ExecutionStatus.COMPLETED);
                                assertThat(record.outputs()).containsEntry("count", 3);
                                assertThat(record.totalSteps()).isEqualTo(4);
                            });
        }
    }

    @Test
    void shouldDeleteRecordAndCheckpoints() {
        store.saveExecution(record("r1", "sync", 0));
        store.writeCheckpoint(pending("r1", 0, "a"));

        assertThat(store.deleteRun("r1")).isTrue();
        assertThat(store.deleteRun("r1")).isFalse();
        assertThat(store.getExecution("r1")).isEmpty();
        assertThat(store.listCheckpoints("r1")).isEmpty();
    }
}
