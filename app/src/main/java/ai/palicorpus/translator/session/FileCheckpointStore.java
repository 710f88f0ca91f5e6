package ai.palicorpus.translator.session;

import ai.palicorpus.translator.corpus.io.CorpusJson;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores one JSON checkpoint per scope under a directory ({@code <scope>.checkpoint.json}).
 *
 * <p>Read-modify-write cycles hold an OS lock on the directory's {@code checkpoints.lock} file, so two processes
 * cannot both take the session lock of a scope or of two nested scopes.
 */
public class FileCheckpointStore implements CheckpointStore {

    public static final Duration DEFAULT_STALE_AFTER = Duration.ofMinutes(30);

    private static final Logger LOGGER = LoggerFactory.getLogger(FileCheckpointStore.class);
    private static final String CHECKPOINT_SUFFIX = ".checkpoint.json";
    private static final String LOCK_FILE = "checkpoints.lock";
    // FileLock is held per JVM, so threads of one process are serialised here first.
    private static final Object PROCESS_MONITOR = new Object();

    private final Path directory;
    private final Duration staleAfter;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public FileCheckpointStore(Path directory) {
        this(directory, DEFAULT_STALE_AFTER, Clock.systemUTC());
    }

    public FileCheckpointStore(Path directory, Duration staleAfter, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.staleAfter = Objects.requireNonNull(staleAfter, "staleAfter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = CorpusJson.newMapper();
        this.writer = CorpusJson.prettyWriter(mapper);
    }

    public Path fileFor(String scope) {
        return directory.resolve(fileStem(scope) + CHECKPOINT_SUFFIX);
    }

    @Override
    public Optional<SessionCheckpoint> load(String scope) {
        return read(fileFor(scope));
    }

    @Override
    public SessionCheckpoint acquire(String scope, String owner) {
        return underFileLock(scope, current -> {
            Instant now = clock.instant();
            SessionCheckpoint checkpoint = current.orElseGet(() -> SessionCheckpoint.initial(scope, now));
            if (checkpoint.isLockedAgainst(owner, now, staleAfter)) {
                throw new SessionLockedException(scope, checkpoint.lockOwner(), checkpoint.lockHeartbeat());
            }
            for (SessionCheckpoint other : otherCheckpoints(scope)) {
                if (other.overlaps(scope) && other.isLockedAgainst(owner, now, staleAfter)) {
                    throw new SessionLockedException(other.scope(), other.lockOwner(), other.lockHeartbeat());
                }
            }
            if (checkpoint.lockOwner() != null && !checkpoint.lockOwner().equals(owner)) {
                LOGGER.warn("Taking over stale lock of scope {} held by {} since {}",
                        scope, checkpoint.lockOwner(), checkpoint.lockHeartbeat());
            }
            return checkpoint.lockedBy(owner, now);
        });
    }

    @Override
    public SessionCheckpoint save(SessionCheckpoint checkpoint, String owner) {
        return underFileLock(checkpoint.scope(), current -> {
            current.filter(stored -> stored.lockOwner() != null && !stored.lockOwner().equals(owner))
                    .ifPresent(stored -> {
                        throw new SessionLockedException(stored.scope(), stored.lockOwner(), stored.lockHeartbeat());
                    });
            return checkpoint;
        });
    }

    private SessionCheckpoint underFileLock(String scope, Function<Optional<SessionCheckpoint>, SessionCheckpoint> update) {
        Path file = fileFor(scope);
        synchronized (PROCESS_MONITOR) {
            try {
                Files.createDirectories(directory);
                try (FileChannel channel = FileChannel.open(directory.resolve(LOCK_FILE), StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE);
                     FileLock ignored = channel.lock()) {
                    Optional<SessionCheckpoint> current = read(file);
                    long revision = current.map(SessionCheckpoint::revision).orElse(0L);
                    SessionCheckpoint next = update.apply(current).withRevision(revision + 1);
                    write(file, next);
                    return next;
                }
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to update checkpoint " + file, ex);
            }
        }
    }

    private List<SessionCheckpoint> otherCheckpoints(String scope) {
        Path own = fileFor(scope);
        List<SessionCheckpoint> checkpoints = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (!file.equals(own) && file.getFileName().toString().endsWith(CHECKPOINT_SUFFIX)) {
                    read(file).ifPresent(checkpoints::add);
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list checkpoints in " + directory, ex);
        }
        return checkpoints;
    }

    private Optional<SessionCheckpoint> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            CheckpointDocument document = mapper.readValue(file.toFile(), CheckpointDocument.class);
            return Optional.of(document.toCheckpoint());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Checkpoint file " + file + " is corrupt: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read checkpoint " + file, ex);
        }
    }

    private void write(Path file, SessionCheckpoint checkpoint) throws IOException {
        Path partial = file.resolveSibling(file.getFileName() + ".partial");
        Files.writeString(partial, writer.writeValueAsString(CheckpointDocument.of(checkpoint)) + "\n",
                StandardCharsets.UTF_8);
        try {
            Files.move(partial, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(partial, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static String fileStem(String scope) {
        return scope.replace("/", "__").replaceAll("[^A-Za-z0-9._-]", "_");
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CheckpointDocument(int schemaVersion,
                              long revision,
                              String scope,
                              String lastCompletedLocation,
                              int lastCompletedBatchIndex,
                              int completedUnits,
                              int batchSize,
                              String timestamp,
                              String state,
                              String lockOwner,
                              String lockHeartbeat) {

        static CheckpointDocument of(SessionCheckpoint checkpoint) {
            return new CheckpointDocument(checkpoint.schemaVersion(), checkpoint.revision(), checkpoint.scope(),
                    checkpoint.lastCompletedLocation(), checkpoint.lastCompletedBatchIndex(),
                    checkpoint.completedUnits(), checkpoint.batchSize(), checkpoint.timestamp().toString(),
                    checkpoint.state().name(), checkpoint.lockOwner(),
                    checkpoint.lockHeartbeat() == null ? null : checkpoint.lockHeartbeat().toString());
        }

        SessionCheckpoint toCheckpoint() {
            if (schemaVersion > SessionCheckpoint.SCHEMA_VERSION) {
                throw new IllegalStateException("Checkpoint schema " + schemaVersion + " is newer than supported "
                        + SessionCheckpoint.SCHEMA_VERSION);
            }
            return new SessionCheckpoint(schemaVersion, revision, scope, lastCompletedLocation, lastCompletedBatchIndex,
                    completedUnits, batchSize, timestamp == null ? Instant.EPOCH : Instant.parse(timestamp),
                    SessionState.from(state), lockOwner,
                    lockHeartbeat == null ? null : Instant.parse(lockHeartbeat));
        }
    }
}
