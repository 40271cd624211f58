package com.verityngn.orchestrator.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Artifacts as files under a root directory; references are file: URIs.
 * Writes go to a temp file first and are moved into place, so readers never
 * see a half-written report.
 */
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    private final Path root;

    public FileSystemArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String put(byte[] bytes, String key) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".artifact", ".tmp");
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write artifact " + key, e);
        }
        log.debug("Stored artifact {} ({} bytes)", target, bytes.length);
        return target.toUri().toString();
    }

    @Override
    public byte[] get(String uri) {
        Path path;
        try {
            path = Path.of(URI.create(uri)).toAbsolutePath().normalize();
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            throw new ArtifactNotFoundException(uri);
        }
        if (!path.startsWith(root)) {
            throw new ArtifactNotFoundException(uri);
        }
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(uri);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read artifact " + uri, e);
        }
    }

    private Path resolve(String key) {
        Path target = root.resolve(key).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Artifact key escapes the store root: " + key);
        }
        return target;
    }
}
