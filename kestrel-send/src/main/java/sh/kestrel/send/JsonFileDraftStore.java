// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.kestrel.core.error.DraftStoreException;

/**
 * Draft store backed by a JSON file.
 *
 * <p>Writes go to a sibling temp file which is then moved over the target, so a crash
 * mid-write leaves either the old or the new draft. A file that cannot be parsed is logged
 * and treated as absent.
 *
 * <p><strong>Thread Safety:</strong> methods are synchronized on the instance; two stores
 * pointing at the same file are not coordinated.
 *
 * @since 0.1.0
 */
public final class JsonFileDraftStore implements DraftStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileDraftStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path file;

    /**
     * @param file location of the draft; the parent directory is created on first save
     */
    public JsonFileDraftStore(final Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized Optional<SendDraft> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(file.toFile(), SendDraft.class));
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Ignoring unreadable send draft at {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void save(final SendDraft draft) {
        Objects.requireNonNull(draft, "draft");
        Path tmp = null;
        try {
            final Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            MAPPER.writeValue(tmp.toFile(), draft);
            move(tmp, file);
            LOG.debug("Saved send draft to {}", file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new DraftStoreException("Failed to save send draft to " + file, e);
        }
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new DraftStoreException("Failed to delete send draft at " + file, e);
        }
    }

    private static void move(final Path source, final Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(final @Nullable Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not delete temp draft file {}", path, e);
        }
    }
}
