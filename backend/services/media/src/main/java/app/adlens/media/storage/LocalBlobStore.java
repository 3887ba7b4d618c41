package app.adlens.media.storage;

import app.adlens.media.config.MediaCacheProps;
import app.adlens.media.domain.type.MediaKind;
import app.adlens.media.service.exception.MediaStorageException;
import app.adlens.media.service.policy.MediaContentPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

@Component
public class LocalBlobStore implements BlobStore {
    private static final Logger log = LoggerFactory.getLogger(LocalBlobStore.class);

    private final Path imagesDir;
    private final Path videosDir;
    private final MediaContentPolicy policy;

    public LocalBlobStore(MediaCacheProps props, MediaContentPolicy policy) {
        this.imagesDir = props.imagesDir();
        this.videosDir = props.videosDir();
        this.policy = policy;
        try {
            Files.createDirectories(imagesDir);
            Files.createDirectories(videosDir);
        } catch (IOException e) {
            throw new MediaStorageException("Failed to create media cache directories under " + props.rootPath(), e);
        }
        log.info("Media blob store at {}", props.rootPath());
    }

    public Path pathFor(String key, MediaKind kind, String contentType) {
        Path dir = kind == MediaKind.video ? videosDir : imagesDir;
        return dir.resolve(key + policy.extensionFor(kind, contentType));
    }

    @Override
    public Path write(String key, MediaKind kind, String contentType, byte[] bytes) {
        Path target = pathFor(key, kind, contentType);
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), key + "-", ".tmp");
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {} bytes to {}", bytes.length, target);
            return target;
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new MediaStorageException("Failed to write media blob " + target, e);
        }
    }

    @Override
    public boolean exists(Path path) {
        return path != null && Files.isRegularFile(path);
    }

    @Override
    public boolean delete(Path path) {
        if (path == null) {
            return false;
        }
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete media blob {}", path, e);
            return false;
        }
    }

    @Override
    public Optional<byte[]> read(Path path) {
        if (path == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new MediaStorageException("Failed to read media blob " + path, e);
        }
    }
}
