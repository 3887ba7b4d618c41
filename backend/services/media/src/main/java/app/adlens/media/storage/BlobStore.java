package app.adlens.media.storage;

import app.adlens.media.domain.type.MediaKind;

import java.nio.file.Path;
import java.util.Optional;

public interface BlobStore {
    Path write(String key, MediaKind kind, String contentType, byte[] bytes);

    boolean exists(Path path);

    /**
     * Best-effort removal. Returns {@code false} when nothing was deleted.
     */
    boolean delete(Path path);

    Optional<byte[]> read(Path path);
}
