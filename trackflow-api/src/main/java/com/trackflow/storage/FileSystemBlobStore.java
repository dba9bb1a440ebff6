package com.trackflow.storage;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Blob area rooted at a local or mounted directory.
 */
@Slf4j
public class FileSystemBlobStore implements BlobStore {

    private final String area;
    private final Path root;

    public FileSystemBlobStore(String area, Path root) {
        this.area = area;
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String area() {
        return area;
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean exists(String key) throws IOException {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public Optional<BlobInfo> stat(String key) throws IOException {
        Path path = resolve(key);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        return Optional.of(new BlobInfo(key, attrs.size(), attrs.lastModifiedTime().toInstant()));
    }

    @Override
    public InputStream open(String key) throws IOException {
        Path path = resolve(key);
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(area + ":" + key);
        }
        return Files.newInputStream(path);
    }

    @Override
    public byte[] readHead(String key, int maxBytes) throws IOException {
        try (InputStream in = open(key)) {
            return in.readNBytes(maxBytes);
        }
    }

    @Override
    public long put(String key, InputStream data) throws IOException {
        Path target = resolve(key);
        Path dir = target.getParent();
        if (!Files.exists(dir)) {
            Files.createDirectories(dir);
        }

        // Write beside the target and move, so readers never see a partial object
        Path temp = Files.createTempFile(dir, ".upload-", ".part");
        try {
            long written = Files.copy(data, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored {}:{} ({} bytes)", area, key, written);
            return written;
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public List<String> list(String prefix) throws IOException {
        Path start = prefix.endsWith("/") ? resolve(prefix.substring(0, prefix.length() - 1)) : resolve(prefix).getParent();
        if (start == null || !Files.isDirectory(start)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(start)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(this::toKey)
                    .filter(key -> key.startsWith(prefix))
                    .filter(key -> !key.substring(key.lastIndexOf('/') + 1).startsWith(".upload-"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    public boolean delete(String key) throws IOException {
        boolean deleted = Files.deleteIfExists(resolve(key));
        if (deleted) {
            log.info("Deleted {}:{}", area, key);
        }
        return deleted;
    }

    private Path resolve(String key) throws IOException {
        if (key == null || key.isBlank() || key.startsWith("/")) {
            throw new IOException("Invalid blob key: " + key);
        }
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IOException("Blob key escapes area " + area + ": " + key);
        }
        return path;
    }

    private String toKey(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
