package io.github.hongjungwan.ledger.core.chain;

import io.github.hongjungwan.ledger.api.config.LedgerConfig;
import io.github.hongjungwan.ledger.api.domain.ChainBlock;
import io.github.hongjungwan.ledger.api.domain.ChainVerificationReport;
import io.github.hongjungwan.ledger.api.domain.HashRecord;
import io.github.hongjungwan.ledger.api.exception.ChainCorruptionException;
import io.github.hongjungwan.ledger.core.digest.DigestEngine;
import io.github.hongjungwan.ledger.spi.KeyService;
import io.github.hongjungwan.ledger.spi.LedgerSnapshot;
import io.github.hongjungwan.ledger.spi.LedgerStore;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * 전체 체인 재검증. 블록 0부터 번호 연속성, 연결, 해시 재계산, 서명을 확인하고
 * 첫 번째 실패 블록에서 중단.
 */
@Slf4j
public class ChainVerifier {

    private final LedgerStore ledgerStore;
    private final KeyService keyService;
    private final String signingKeyVersionRef;

    public ChainVerifier(LedgerConfig config, LedgerStore ledgerStore, KeyService keyService) {
        this.ledgerStore = ledgerStore;
        this.keyService = keyService;
        this.signingKeyVersionRef = config.resolveSigningKeyVersionRef();
    }

    public ChainVerificationReport verifyChain() {
        return ledgerStore.readSnapshot(this::verify);
    }

    /**
     * @throws ChainCorruptionException 손상 블록이 있으면
     */
    public ChainVerificationReport requireValidChain() {
        ChainVerificationReport report = verifyChain();
        if (!report.isValid()) {
            throw new ChainCorruptionException(report.getFirstInvalidBlock(), report.getFailureReason());
        }
        return report;
    }

    private ChainVerificationReport verify(LedgerSnapshot snapshot) {
        List<ChainBlock> blocks = snapshot.allBlocks();
        List<UUID> orphans = findOrphans(snapshot.allHashRecords(), blocks);
        if (!orphans.isEmpty()) {
            log.warn("{} hash record(s) not linked to any block", orphans.size());
        }

        String previousHash = null;
        long checked = 0;
        for (int i = 0; i < blocks.size(); i++) {
            ChainBlock block = blocks.get(i);
            String failure = check(block, i, previousHash);
            if (failure != null) {
                log.warn("Chain verification failed at block {}: {}", block.getBlockNumber(), failure);
                return ChainVerificationReport.invalid(checked, block.getBlockNumber(), failure, orphans);
            }
            previousHash = block.getCurrentHash();
            checked++;
        }

        log.info("Chain verified: {} block(s)", checked);
        return ChainVerificationReport.valid(checked, orphans);
    }

    private String check(ChainBlock block, long expectedNumber, String expectedPrevious) {
        if (block.getBlockNumber() != expectedNumber) {
            return "expected block number " + expectedNumber;
        }
        if (block.isGenesis() && block.getPreviousHash() != null) {
            return "genesis block has a previous hash";
        }
        if (!Objects.equals(block.getPreviousHash(), expectedPrevious)) {
            return "previous hash does not link to block " + (expectedNumber - 1);
        }
        if (!DigestEngine.merkleRoot(block.getDocumentHashes()).equals(block.getMerkleRoot())) {
            return "merkle root mismatch";
        }
        String recomputed = DigestEngine.blockHash(block.getBlockNumber(), block.getPreviousHash(), block.getMerkleRoot());
        if (!recomputed.equals(block.getCurrentHash())) {
            return "current hash mismatch";
        }
        if (!keyService.verify(signingKeyVersionRef,
                DigestEngine.blockSigningDigest(block.getCurrentHash()), block.getSignature())) {
            return "invalid block signature";
        }
        return null;
    }

    private static List<UUID> findOrphans(List<HashRecord> records, List<ChainBlock> blocks) {
        Set<UUID> linked = new HashSet<>();
        for (ChainBlock block : blocks) {
            linked.addAll(block.getDocumentHashes());
        }
        return records.stream()
                .map(HashRecord::getHashId)
                .filter(hashId -> !linked.contains(hashId))
                .toList();
    }
}
