package io.github.hongjungwan.ledger.core.storage;

import io.github.hongjungwan.ledger.api.exception.BlobNotFoundException;
import io.github.hongjungwan.ledger.spi.BlobStore;
import io.github.hongjungwan.ledger.spi.StoredBlob;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 메모리 Blob 저장소. 테스트 및 로컬 개발용.
 */
public class InMemoryBlobStore implements BlobStore {

    private final Map<String, StoredBlob> blobs = new ConcurrentHashMap<>();

    @Override
    public void put(String name, byte[] content, Map<String, String> attributes) {
        blobs.put(name, new StoredBlob(content.clone(), attributes));
    }

    @Override
    public StoredBlob get(String name) {
        StoredBlob blob = blobs.get(name);
        if (blob == null) {
            throw new BlobNotFoundException(name);
        }
        return new StoredBlob(blob.content().clone(), blob.attributes());
    }

    @Override
    public boolean exists(String name) {
        return blobs.containsKey(name);
    }

    public int size() {
        return blobs.size();
    }

    @Override
    public String getName() {
        return "memory";
    }
}
