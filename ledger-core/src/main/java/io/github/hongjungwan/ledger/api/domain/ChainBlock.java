package io.github.hongjungwan.ledger.api.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 해시 체인 블록. blockNumber는 0부터 빈틈없이 증가.
 * 제네시스 블록(0)만 previousHash가 null.
 */
@Getter
@Builder
@JsonDeserialize(builder = ChainBlock.ChainBlockBuilder.class)
public class ChainBlock {

    private final UUID chainId;

    private final long blockNumber;

    /** 이전 블록 currentHash (제네시스는 null) */
    private final String previousHash;

    /** SHA256("{blockNumber}:{previousHash}:{merkleRoot}") */
    private final String currentHash;

    /** 블록에 포함된 해시 레코드 ID (삽입 순서 유지) */
    private final List<UUID> documentHashes;

    /** SHA256(concat(documentHashes)) */
    private final String merkleRoot;

    /** SHA256(currentHash) 서명 */
    private final byte[] signature;

    private final Instant timestamp;

    public List<UUID> getDocumentHashes() {
        return documentHashes == null ? List.of() : List.copyOf(documentHashes);
    }

    public byte[] getSignature() {
        return signature == null ? null : signature.clone();
    }

    @JsonIgnore
    public boolean isGenesis() {
        return blockNumber == 0;
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChainBlockBuilder {
    }
}
