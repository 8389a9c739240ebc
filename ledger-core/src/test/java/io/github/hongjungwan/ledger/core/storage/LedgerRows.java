package io.github.hongjungwan.ledger.core.storage;

import io.github.hongjungwan.ledger.api.domain.ChainBlock;
import io.github.hongjungwan.ledger.api.domain.HashRecord;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** 저장소 테스트용 행 생성 */
final class LedgerRows {

    private LedgerRows() {}

    static HashRecord record(String documentId, String fileHash, Instant timestamp) {
        return HashRecord.builder()
                .hashId(UUID.randomUUID())
                .documentId(documentId)
                .fileHash(fileHash)
                .contentHash("c-" + fileHash)
                .keyVersionRef("sign-key")
                .signature(new byte[]{1, 2, 3})
                .timestamp(timestamp)
                .userId("user-1")
                .fileSize(42)
                .mimeType("application/pdf")
                .metadataJson("{}")
                .build();
    }

    static ChainBlock block(long number) {
        return ChainBlock.builder()
                .chainId(UUID.randomUUID())
                .blockNumber(number)
                .previousHash(number == 0 ? null : "hash-" + (number - 1))
                .currentHash("hash-" + number)
                .documentHashes(List.of(UUID.randomUUID()))
                .merkleRoot("root-" + number)
                .signature(new byte[]{(byte) number})
                .timestamp(Instant.parse("2024-01-01T00:00:00Z").plusSeconds(number))
                .build();
    }
}
