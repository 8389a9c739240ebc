package io.github.hongjungwan.ledger.core.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.ledger.api.exception.BlobNotFoundException;
import io.github.hongjungwan.ledger.api.exception.StorageReadException;
import io.github.hongjungwan.ledger.api.exception.StorageWriteException;
import io.github.hongjungwan.ledger.spi.BlobStore;
import io.github.hongjungwan.ledger.spi.StoredBlob;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * 로컬 디렉토리 Blob 저장소. 본문은 이름 그대로, 속성은 {@code .attrs.json} 사이드카 파일로 저장.
 *
 * <p>임시 파일에 쓴 뒤 원자적 이동으로 교체하므로 읽는 쪽이 반쯤 쓰인 파일을 보지 않음.
 */
@Slf4j
public class FileSystemBlobStore implements BlobStore {

    private static final String ATTRIBUTE_SUFFIX = ".attrs.json";
    private static final TypeReference<Map<String, String>> ATTRIBUTE_TYPE = new TypeReference<>() {};

    private final Path root;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FileSystemBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new StorageWriteException("Cannot create blob directory: " + this.root, e);
        }
        log.info("File system blob store at {}", this.root);
    }

    @Override
    public void put(String name, byte[] content, Map<String, String> attributes) {
        Path blobPath = resolve(name);
        try {
            Files.createDirectories(blobPath.getParent());
            writeAtomically(blobPath, content);
            writeAtomically(attributePath(blobPath), objectMapper.writeValueAsBytes(attributes));
        } catch (IOException e) {
            throw new StorageWriteException("Failed to write blob: " + name, e);
        }
    }

    @Override
    public StoredBlob get(String name) {
        Path blobPath = resolve(name);
        if (!Files.exists(blobPath)) {
            throw new BlobNotFoundException(name);
        }
        try {
            byte[] content = Files.readAllBytes(blobPath);
            Path attrs = attributePath(blobPath);
            Map<String, String> attributes = Files.exists(attrs)
                    ? objectMapper.readValue(attrs.toFile(), ATTRIBUTE_TYPE)
                    : Map.of();
            return new StoredBlob(content, attributes);
        } catch (IOException e) {
            throw new StorageReadException("Failed to read blob: " + name, e);
        }
    }

    @Override
    public boolean exists(String name) {
        return Files.exists(resolve(name));
    }

    @Override
    public String getName() {
        return "filesystem";
    }

    /** 이름을 루트 하위 경로로 변환. 루트 밖을 가리키는 이름은 거부. */
    private Path resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Blob name must not be blank");
        }
        Path path = root.resolve(name).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Blob name escapes store root: " + name);
        }
        return path;
    }

    private static Path attributePath(Path blobPath) {
        return blobPath.resolveSibling(blobPath.getFileName() + ATTRIBUTE_SUFFIX);
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), ".tmp-", null);
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
