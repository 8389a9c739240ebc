package io.github.hongjungwan.ledger.core.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.api.domain.ChainBlock;
import io.github.hongjungwan.ledger.api.domain.DocumentMetadata;
import io.github.hongjungwan.ledger.api.domain.HashRecord;
import io.github.hongjungwan.ledger.api.exception.KeySigningException;
import io.github.hongjungwan.ledger.api.exception.LedgerException;
import io.github.hongjungwan.ledger.api.exception.LedgerWriteException;
import io.github.hongjungwan.ledger.core.digest.DigestEngine;
import io.github.hongjungwan.ledger.spi.KeyService;
import io.github.hongjungwan.ledger.spi.LedgerStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 해시 레코드 생성과 블록 연결. 블록 추가는 프로세스 내 단일 writer로 직렬화.
 *
 * <p>최신 블록 조회부터 삽입까지 락 안에서 수행하므로 같은 프로세스에서 체인이 갈라지지 않음.
 * 다른 프로세스의 동시 기록은 저장소의 블록 번호 검사가 거부.
 */
@Slf4j
public class HashChainEngine {

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final LedgerStore ledgerStore;
    private final KeyService keyService;
    private final String signingKeyVersionRef;
    private final Clock clock;
    private final ReentrantLock writerLock = new ReentrantLock();

    public HashChainEngine(LedgerConfig config, LedgerStore ledgerStore, KeyService keyService) {
        this(config, ledgerStore, keyService, Clock.systemUTC());
    }

    public HashChainEngine(LedgerConfig config, LedgerStore ledgerStore, KeyService keyService, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.keyService = keyService;
        this.signingKeyVersionRef = config.resolveSigningKeyVersionRef();
        this.clock = clock;
    }

    /**
     * 서명된 해시 레코드를 기록하고 즉시 블록으로 묶음.
     * 블록 추가가 실패하면 레코드는 고아로 남고 예외가 전파됨.
     *
     * @return 생성된 hashId
     */
    public UUID createHashRecord(String documentId, byte[] content, String extractedText,
                                 String userId, DocumentMetadata metadata) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId must not be blank");
        }
        DocumentMetadata meta = metadata == null ? DocumentMetadata.empty() : metadata;

        String fileHash = DigestEngine.fileHash(content);
        String contentHash = DigestEngine.textHash(extractedText == null ? "" : extractedText);
        byte[] signature = sign(DigestEngine.recordSigningDigest(fileHash, contentHash, documentId));

        HashRecord record = HashRecord.builder()
                .hashId(UUID.randomUUID())
                .documentId(documentId)
                .fileHash(fileHash)
                .contentHash(contentHash)
                .keyVersionRef(signingKeyVersionRef)
                .signature(signature)
                .timestamp(clock.instant())
                .userId(userId)
                .fileSize(content.length)
                .mimeType(meta.getMimeType())
                .metadataJson(toJson(meta))
                .build();

        insert(() -> ledgerStore.insertHashRecords(List.of(record)), "hash record");
        log.info("Hash record created: document={}, hashId={}", documentId, record.getHashId());

        appendBlock(List.of(record.getHashId()));
        return record.getHashId();
    }

    /**
     * 해시 ID 목록을 새 블록으로 체인에 연결.
     *
     * @return 블록의 chainId
     */
    public UUID appendBlock(List<UUID> hashIds) {
        if (hashIds == null || hashIds.isEmpty()) {
            throw new IllegalArgumentException("A block must contain at least one hash record");
        }

        writerLock.lock();
        try {
            Optional<ChainBlock> latest = ledgerStore.findLatestBlock();
            long blockNumber = latest.map(block -> block.getBlockNumber() + 1).orElse(0L);
            String previousHash = latest.map(ChainBlock::getCurrentHash).orElse(null);

            String merkleRoot = DigestEngine.merkleRoot(hashIds);
            String currentHash = DigestEngine.blockHash(blockNumber, previousHash, merkleRoot);

            ChainBlock block = ChainBlock.builder()
                    .chainId(UUID.randomUUID())
                    .blockNumber(blockNumber)
                    .previousHash(previousHash)
                    .currentHash(currentHash)
                    .documentHashes(List.copyOf(hashIds))
                    .merkleRoot(merkleRoot)
                    .signature(sign(DigestEngine.blockSigningDigest(currentHash)))
                    .timestamp(clock.instant())
                    .build();

            insert(() -> ledgerStore.insertBlocks(List.of(block)), "chain block");
            log.info("Block appended: number={}, hash={}", blockNumber, currentHash);
            return block.getChainId();
        } finally {
            writerLock.unlock();
        }
    }

    private byte[] sign(byte[] digest) {
        try {
            return keyService.sign(signingKeyVersionRef, digest);
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KeySigningException("Signing failed", e);
        }
    }

    private void insert(Runnable write, String what) {
        try {
            write.run();
        } catch (LedgerException e) {
            log.error("Failed to insert {}: {}", what, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to insert {}", what, e);
            throw new LedgerWriteException("Failed to insert " + what, e);
        }
    }

    private static String toJson(DocumentMetadata metadata) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(metadata.toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable", e);
        }
    }
}
