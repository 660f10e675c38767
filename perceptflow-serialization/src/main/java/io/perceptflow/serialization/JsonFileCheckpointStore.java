package io.perceptflow.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.perceptflow.core.state.SessionSnapshot;
import io.perceptflow.core.storage.checkpoint.Checkpoint;
import io.perceptflow.core.storage.checkpoint.CheckpointStore;
import io.perceptflow.core.storage.checkpoint.CheckpointWriteException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Checkpoint store that keeps one JSON file per step on the local file system.
///
/// Layout:
/// ```
/// <root>/<sessionDir>/step-000001.json
/// <root>/<sessionDir>/step-000002.json
/// ```
///
/// The session directory is the session identifier with every byte outside
/// `[A-Za-z0-9._-]` written as `%XX` (UTF-8, upper-case hex). A leading `.` is escaped too,
/// so `..` or a hidden name can never be produced. Plain identifiers such as `s-1` map to
/// themselves.
///
/// Each file holds one {@link Checkpoint} as written by {@link CheckpointSerializer}. A
/// new store instance pointed at the same root sees every session written before, so
/// sessions can be inspected and resumed after a process restart.
///
/// ### Contracts
/// - a step file becomes visible only once fully written: the bytes go to a temporary file
///   in the session directory, are forced to disk, then moved into place
/// - writes of one session are serialized by a per-session lock; sessions do not contend
/// - step indices are checked against the files on disk and must strictly increase
///
/// @implNote Readers take no lock. Temporary files never match the step file pattern, so
/// a concurrent reader sees either the previous or the new history.
///
/// @see CheckpointStore for contract
public final class JsonFileCheckpointStore implements CheckpointStore {

    private static final Logger logger = Logger.getLogger(JsonFileCheckpointStore.class.getName());

    private static final Pattern STEP_FILE = Pattern.compile("step-(\\d{6,})\\.json");
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final Path root;
    private final ObjectMapper mapper;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /// Creates a store rooted at the given directory, creating it if needed.
    ///
    /// @param root checkpoint directory, not null
    /// @throws CheckpointWriteException if the directory cannot be created
    public JsonFileCheckpointStore(Path root) {
        this(root, CheckpointSerializer.createMapper());
    }

    JsonFileCheckpointStore(Path root, ObjectMapper mapper) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new CheckpointWriteException(
                    "Cannot create checkpoint directory " + root + ": " + e.getMessage(), e);
        }
    }

    /// Returns the root directory of this store.
    public Path root() {
        return root;
    }

    @Override
    public void put(String sessionId, int stepIndex, SessionSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Path dir = sessionDir(sessionId);

        Checkpoint checkpoint;
        try {
            checkpoint = new Checkpoint(sessionId, stepIndex, snapshot, Instant.now());
        } catch (IllegalArgumentException e) {
            throw new CheckpointWriteException(e.getMessage(), e);
        }

        ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
        lock.lock();
        try {
            Files.createDirectories(dir);
            int last = lastIndex(dir);
            if (stepIndex <= last) {
                throw new CheckpointWriteException(
                        "Checkpoint "
                                + stepIndex
                                + " out of sequence for session "
                                + sessionId
                                + ", must follow "
                                + last);
            }
            write(dir, stepFileName(stepIndex), mapper.writeValueAsBytes(checkpoint));
            logger.fine(() -> "Wrote checkpoint " + stepIndex + " for session " + sessionId);
        } catch (IOException e) {
            throw new CheckpointWriteException(
                    "Failed to write checkpoint "
                            + stepIndex
                            + " for session "
                            + sessionId
                            + ": "
                            + e.getMessage(),
                    e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Checkpoint> getHistory(String sessionId) {
        Path dir = sessionDir(sessionId);
        List<Checkpoint> history = new ArrayList<>();
        for (Path file : stepFiles(dir)) {
            history.add(read(file));
        }
        return List.copyOf(history);
    }

    @Override
    public Optional<Checkpoint> latest(String sessionId) {
        List<Path> files = stepFiles(sessionDir(sessionId));
        return files.isEmpty()
                ? Optional.empty()
                : Optional.of(read(files.get(files.size() - 1)));
    }

    @Override
    public List<String> sessions() {
        List<String> sessions = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                Optional<String> sessionId = decodeDirectoryName(dir.getFileName().toString());
                if (sessionId.isEmpty()) {
                    logger.fine(() -> "Ignoring foreign directory " + dir);
                } else if (!stepFiles(dir).isEmpty()) {
                    sessions.add(sessionId.get());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list sessions in " + root, e);
        }
        sessions.sort(Comparator.naturalOrder());
        return List.copyOf(sessions);
    }

    private Path sessionDir(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (sessionId.isEmpty()) {
            throw new IllegalArgumentException("sessionId must not be empty");
        }
        return root.resolve(directoryName(sessionId));
    }

    /// Maps a session identifier to the name of its directory under the root.
    static String directoryName(String sessionId) {
        byte[] bytes = sessionId.getBytes(StandardCharsets.UTF_8);
        StringBuilder name = new StringBuilder(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            if (isPlain(b) && !(i == 0 && b == '.')) {
                name.append((char) b);
            } else {
                name.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0F]);
            }
        }
        return name.toString();
    }

    /// Inverse of {@link #directoryName}; empty for names this store never writes.
    static Optional<String> decodeDirectoryName(String name) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '%' && i + 2 < name.length()) {
                int high = Character.digit(name.charAt(i + 1), 16);
                int low = Character.digit(name.charAt(i + 2), 16);
                if (high < 0 || low < 0) {
                    return Optional.empty();
                }
                bytes.write((high << 4) | low);
                i += 2;
            } else if (isPlain(c)) {
                bytes.write(c);
            } else {
                return Optional.empty();
            }
        }
        String sessionId = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        return !sessionId.isEmpty() && directoryName(sessionId).equals(name)
                ? Optional.of(sessionId)
                : Optional.empty();
    }

    private static boolean isPlain(int b) {
        return (b >= 'A' && b <= 'Z')
                || (b >= 'a' && b <= 'z')
                || (b >= '0' && b <= '9')
                || b == '.'
                || b == '_'
                || b == '-';
    }

    private void write(Path dir, String fileName, byte[] json) throws IOException {
        Path temp = Files.createTempFile(dir, ".step-", ".tmp");
        try {
            try (FileChannel channel =
                    FileChannel.open(
                            temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Path target = dir.resolve(fileName);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.fine("Atomic move not supported in " + dir + ", replacing in place");
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private Checkpoint read(Path file) {
        try {
            return mapper.readValue(file.toFile(), Checkpoint.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint " + file, e);
        }
    }

    private static int lastIndex(Path dir) {
        List<Path> files = stepFiles(dir);
        return files.isEmpty() ? 0 : indexOf(files.get(files.size() - 1));
    }

    private static List<Path> stepFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                if (STEP_FILE.matcher(entry.getFileName().toString()).matches()) {
                    files.add(entry);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list checkpoints in " + dir, e);
        }
        files.sort(Comparator.comparingInt(JsonFileCheckpointStore::indexOf));
        return files;
    }

    private static int indexOf(Path file) {
        Matcher matcher = STEP_FILE.matcher(file.getFileName().toString());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a step file: " + file);
        }
        return Integer.parseInt(matcher.group(1));
    }

    static String stepFileName(int stepIndex) {
        return String.format("step-%06d.json", stepIndex);
    }
}
