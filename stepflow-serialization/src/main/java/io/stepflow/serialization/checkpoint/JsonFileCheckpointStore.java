package io.stepflow.serialization.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.stepflow.core.checkpoint.Checkpoint;
import io.stepflow.core.checkpoint.CheckpointStore;
import io.stepflow.core.checkpoint.ExecutionFilter;
import io.stepflow.core.checkpoint.ExecutionRecord;
import io.stepflow.core.exception.ValidationException;
import io.stepflow.serialization.WorkflowSerializer;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/// File-backed checkpoint store keeping one directory per run.
///
/// ### Layout
/// ```
/// <root>/
///   <runId>/
///     execution.json          run record
///     checkpoints/
///       000000.json           checkpoint for step index 0
///       000001.json
/// ```
///
/// Every file is written to a temporary sibling first and then moved into place, so readers
/// never observe a half-written document. Checkpoint file names are the zero-padded step
/// index, which gives {@link #listCheckpoints} its ordering and {@link #writeCheckpoint} its
/// upsert-by-`(runId, stepIndex)` behaviour.
///
/// ### Contracts
/// - **Precondition**: run ids contain only letters, digits, `.`, `_` and `-`
/// - **Postcondition**: a checkpoint written and re-read has the same `stepName`, `status`,
///   `inputs` and `outputs`
///
/// @implNote Thread-safe. Writes and deletes are serialized on the store; reads rely on the
/// atomic moves.
///
/// @see io.stepflow.core.checkpoint.InMemoryCheckpointStore for the in-memory variant
public class JsonFileCheckpointStore implements CheckpointStore {

    private static final Logger logger = Logger.getLogger(JsonFileCheckpointStore.class.getName());

    private static final Pattern SAFE_RUN_ID = Pattern.compile("^[A-Za-z0-9._-]+$");
    private static final String EXECUTION_FILE = "execution.json";
    private static final String CHECKPOINT_DIR = "checkpoints";

    private final Path root;
    private final ObjectMapper objectMapper;

    /// Creates a store under `root`, using the standard Stepflow mapper.
    ///
    /// @param root base directory, created on first write, not null
    public JsonFileCheckpointStore(Path root) {
        this(root, WorkflowSerializer.createMapper());
    }

    /// @param root base directory, created on first write, not null
    /// @param objectMapper mapper with the Stepflow module and `JavaTimeModule`, not null
    public JsonFileCheckpointStore(Path root, ObjectMapper objectMapper) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public synchronized void writeCheckpoint(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint must not be null");
        Path file =
                runDir(checkpoint.runId())
                        .resolve(CHECKPOINT_DIR)
                        .resolve(checkpointFileName(checkpoint.stepIndex()));
        writeJson(file, checkpoint);
    }

    @Override
    public List<Checkpoint> listCheckpoints(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        Path dir = runDir(runId).resolve(CHECKPOINT_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "[0-9]*.json")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new PersistenceException("Failed to list checkpoints of run " + runId, e);
        }
        files.sort(Comparator.comparingLong(JsonFileCheckpointStore::stepIndexOf));

        List<Checkpoint> checkpoints = new ArrayList<>(files.size());
        for (Path file : files) {
            checkpoints.add(readJson(file, Checkpoint.class));
        }
        return List.copyOf(checkpoints);
    }

    @Override
    public synchronized void saveExecution(ExecutionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        writeJson(runDir(record.runId()).resolve(EXECUTION_FILE), record);
    }

    @Override
    public Optional<ExecutionRecord> getExecution(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        Path file = runDir(runId).resolve(EXECUTION_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(readJson(file, ExecutionRecord.class));
    }

    @Override
    public List<ExecutionRecord> listExecutions(ExecutionFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<ExecutionRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> runs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path run : runs) {
                Path file = run.resolve(EXECUTION_FILE);
                if (Files.isRegularFile(file)) {
                    ExecutionRecord record = readJson(file, ExecutionRecord.class);
                    if (filter.matches(record)) {
                        records.add(record);
                    }
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to list runs under " + root, e);
        }
        Stream<ExecutionRecord> sorted =
                records.stream()
                        .sorted(Comparator.comparing(ExecutionRecord::startedAt).reversed());
        if (filter.limit() != null) {
            sorted = sorted.limit(filter.limit());
        }
        return sorted.toList();
    }

    @Override
    public synchronized boolean deleteRun(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        Path dir = runDir(runId);
        if (!Files.exists(dir)) {
            return false;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to delete run " + runId, e);
        }
        logger.fine("Deleted run directory " + dir);
        return true;
    }

    /// Returns the base directory of this store.
    public Path getRoot() {
        return root;
    }

    private Path runDir(String runId) {
        if (!SAFE_RUN_ID.matcher(runId).matches() || runId.equals(".") || runId.equals("..")) {
            throw new ValidationException(
                    "Run id '" + runId + "' cannot be used as a directory name");
        }
        return root.resolve(runId);
    }

    static String checkpointFileName(int stepIndex) {
        return String.format(Locale.ROOT, "%06d.json", stepIndex);
    }

    private static long stepIndexOf(Path file) {
        String name = file.getFileName().toString();
        return Long.parseLong(name.substring(0, name.length() - ".json".length()));
    }

    private void writeJson(Path target, Object value) {
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), ".tmp-", ".json");
            try {
                objectMapper.writeValue(temp.toFile(), value);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to write " + target, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(
                    temp,
                    target,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.fine("Atomic move not supported for " + target + ", replacing in place");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private <T> T readJson(Path file, Class<T> type) {
        try {
            return objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file, e);
        }
    }
}
