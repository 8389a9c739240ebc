package io.github.hongjungwan.ledger.spi;

import java.util.Map;

/**
 * Blob 저장소에서 읽은 내용과 속성.
 */
public record StoredBlob(byte[] content, Map<String, String> attributes) {

    public StoredBlob {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
